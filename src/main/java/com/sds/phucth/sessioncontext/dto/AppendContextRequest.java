package com.sds.phucth.sessioncontext.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppendContextRequest {
    @NotBlank(message = "source is required")
    @Size(max = 64, message = "source must be at most 64 characters")
    private String source;

    @NotNull(message = "output is required")
    private Map<String, Object> output;
}
