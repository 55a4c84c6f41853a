package com.sds.phucth.sessioncontext.dto;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An AI-proposed action waiting for the user. Instances are immutable snapshots; every
 * transition produces a new one through {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class PendingAction {
    String sessionId;
    String messageId;
    String intent;
    Map<String, Object> proposedData;
    @Builder.Default
    Map<String, Object> editedData = Map.of();
    ActionStatus status;
    String proposalFingerprint;
    OffsetDateTime createdAt;
    OffsetDateTime updatedAt;

    /**
     * Edited fields laid over the proposal. Fields the user never touched keep the
     * proposed value.
     */
    public Map<String, Object> getFinalPayload() {
        Map<String, Object> merged = new LinkedHashMap<>(proposedData);
        merged.putAll(editedData);
        return Collections.unmodifiableMap(merged);
    }

    public boolean isOlderThan(OffsetDateTime cutoff) {
        return createdAt.isBefore(cutoff);
    }
}
