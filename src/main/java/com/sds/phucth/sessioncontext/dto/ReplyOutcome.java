package com.sds.phucth.sessioncontext.dto;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ReplyOutcome {
    String sessionId;
    ApprovalDecision decision;
    ResolutionResult resolution;    // null when the text was not a decision
}
