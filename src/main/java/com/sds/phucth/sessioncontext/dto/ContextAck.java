package com.sds.phucth.sessioncontext.dto;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.experimental.FieldDefaults;

import java.time.OffsetDateTime;

@Data
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ContextAck {
    String sessionId;
    String status;          // stored|appended|deleted
    String appendId;
    String source;
    Long revision;
    OffsetDateTime lastUpdated;
    OffsetDateTime expiresAt;
}
