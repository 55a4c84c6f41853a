package com.sds.phucth.sessioncontext.services;

import com.sds.phucth.sessioncontext.dto.AppendEntry;
import com.sds.phucth.sessioncontext.dto.ContextRecord;
import com.sds.phucth.sessioncontext.dto.ContextSummary;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Storage of session context records. The durable implementation is the source of truth;
 * {@link CachedContextStore} decorates it with the hot cache.
 */
public interface ContextStore {

    Optional<ContextRecord> find(String sessionId);

    /**
     * Replaces intent and data of the record, creating it when absent.
     *
     * @param draft sessionId, intent, data, lastUpdated and expiresAt of the new state
     * @return the stored record including its append log and new revision
     */
    ContextRecord save(ContextRecord draft);

    /**
     * Adds one entry to the append log and refreshes the record's timestamps.
     *
     * @return the record revision after the append, or empty when the session has no record
     */
    Optional<Long> append(String sessionId, AppendEntry entry, OffsetDateTime expiresAt);

    /**
     * @return whether a record existed
     */
    boolean delete(String sessionId);

    Optional<Long> revision(String sessionId);

    List<ContextSummary> list(int page, int size);

    boolean ping();
}
