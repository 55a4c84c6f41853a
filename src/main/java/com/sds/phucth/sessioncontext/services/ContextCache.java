package com.sds.phucth.sessioncontext.services;

import com.sds.phucth.sessioncontext.dto.AppendEntry;
import com.sds.phucth.sessioncontext.dto.ContextRecord;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Hot tier in front of the durable store. Implementations may throw any runtime exception
 * when the backing cache is unreachable; callers treat that as a miss.
 */
public interface ContextCache {

    Optional<ContextRecord> get(String sessionId);

    /**
     * Replaces the cached copy of the record, append log included.
     */
    void put(ContextRecord record, Duration ttl);

    /**
     * Pushes one append onto an already cached record and refreshes its TTL. The entry is
     * pushed only when {@code revision} directly follows the cached revision. A revision at or
     * below it is already part of the cached copy and nothing is written. Any other revision
     * means appends arrived out of order and the cached copy is evicted.
     *
     * @return true when the cached copy holds the entry afterwards
     */
    boolean append(String sessionId, AppendEntry entry, long revision, OffsetDateTime expiresAt, Duration ttl);

    Optional<Long> revision(String sessionId);

    void evict(String sessionId);

    boolean ping();
}
