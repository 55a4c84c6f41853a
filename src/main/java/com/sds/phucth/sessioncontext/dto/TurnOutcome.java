package com.sds.phucth.sessioncontext.dto;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class TurnOutcome {
    String sessionId;
    String messageId;
    String intent;
    HandlingMode mode;
    String summary;
    String payloadFingerprint;
    PendingAction pendingAction;
    ContextAck context;
}
