package com.sds.phucth.sessioncontext.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditActionRequest {
    @NotEmpty(message = "fields must contain at least one update")
    private Map<String, Object> fields;
}
