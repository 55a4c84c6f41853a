package com.sds.phucth.sessioncontext.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposeActionRequest {
    @NotBlank(message = "messageId is required")
    private String messageId;

    @NotBlank(message = "intent is required")
    private String intent;

    @NotNull(message = "data is required")
    private Map<String, Object> data;
}
