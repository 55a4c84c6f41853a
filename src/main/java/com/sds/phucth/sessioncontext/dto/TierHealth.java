package com.sds.phucth.sessioncontext.dto;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.experimental.FieldDefaults;

import java.time.OffsetDateTime;

@Data
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class TierHealth {
    String status;          // healthy|degraded|unhealthy
    String durableStore;    // up|down
    String hotCache;        // up|down
    int pendingActions;
    OffsetDateTime checkedAt;
}
