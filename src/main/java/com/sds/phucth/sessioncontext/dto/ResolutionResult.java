package com.sds.phucth.sessioncontext.dto;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.experimental.FieldDefaults;

import java.util.Map;

@Data
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ResolutionResult {
    String sessionId;
    String messageId;
    String intent;
    ApprovalDecision decision;
    ResolutionOutcome outcome;
    ActionStatus status;
    Map<String, Object> payload;        // absent on reject
    String payloadFingerprint;
    DispatchResult dispatch;
    boolean contextRecorded;
    String message;                     // chat-visible
}
