package com.sds.phucth.sessioncontext.dto;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.experimental.FieldDefaults;

import java.time.OffsetDateTime;

@Data
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ContextSummary {
    String sessionId;
    String intent;
    OffsetDateTime createdAt;
    OffsetDateTime lastUpdated;
    OffsetDateTime expiresAt;
    long revision;
}
