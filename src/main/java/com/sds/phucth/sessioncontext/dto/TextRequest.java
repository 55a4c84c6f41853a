package com.sds.phucth.sessioncontext.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Free chat text for interpret and reply.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextRequest {
    @NotNull(message = "text is required")
    private String text;
}
