package com.sds.phucth.sessioncontext.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveRequest {
    @NotNull(message = "decision is required")
    private ApprovalDecision decision;
}
