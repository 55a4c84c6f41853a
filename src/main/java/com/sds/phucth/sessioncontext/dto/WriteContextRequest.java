package com.sds.phucth.sessioncontext.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
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
public class WriteContextRequest {
    @NotBlank(message = "sessionId is required")
    @Size(max = 128, message = "sessionId must be at most 128 characters")
    private String sessionId;

    @NotBlank(message = "intent is required")
    private String intent;

    @NotNull(message = "data is required")
    private Map<String, Object> data;

    @Positive(message = "ttlSeconds must be positive")
    private Long ttlSeconds;  // optional, falls back to app.context.ttlSeconds
}
