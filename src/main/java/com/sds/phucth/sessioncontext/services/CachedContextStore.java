package com.sds.phucth.sessioncontext.services;

import com.sds.phucth.sessioncontext.dto.AppendEntry;
import com.sds.phucth.sessioncontext.dto.ContextRecord;
import com.sds.phucth.sessioncontext.dto.ContextSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Two-tier context store. The durable store decides success; the hot cache is best effort
 * and every cache failure degrades to a durable-only path with a warning.
 *
 * <p>Writes invalidate the cached copy before touching the durable store and repopulate it
 * afterwards. Every repopulation is followed by a revision check against the durable store
 * and evicts on mismatch, so a slow writer can never leave an older copy cached.
 */
@Service
@Primary
@Slf4j
public class CachedContextStore implements ContextStore {

    private final ContextStore durable;
    private final ContextCache cache;
    private final Clock clock;

    public CachedContextStore(@Qualifier("durableContextStore") ContextStore durable, ContextCache cache, Clock clock) {
        this.durable = durable;
        this.cache = cache;
        this.clock = clock;
    }

    @Override
    public Optional<ContextRecord> find(String sessionId) {
        Optional<ContextRecord> hot = cacheCall("read", sessionId, () -> cache.get(sessionId), Optional.empty());
        if (hot.isPresent()) {
            log.debug("Cache hit for session {}", sessionId);
            return hot;
        }

        Optional<ContextRecord> stored = durable.find(sessionId);
        stored.ifPresent(this::repopulate);
        return stored;
    }

    @Override
    public ContextRecord save(ContextRecord draft) {
        String sessionId = draft.getSessionId();
        cacheRun("evict", sessionId, () -> cache.evict(sessionId));

        ContextRecord saved = durable.save(draft);
        repopulate(saved);
        return saved;
    }

    @Override
    public Optional<Long> append(String sessionId, AppendEntry entry, OffsetDateTime expiresAt) {
        Optional<Long> revision = durable.append(sessionId, entry, expiresAt);
        revision.ifPresent(rev -> {
            Duration ttl = ttlUntil(expiresAt);
            if (ttl.isZero() || ttl.isNegative()) {
                cacheRun("evict", sessionId, () -> cache.evict(sessionId));
                return;
            }
            boolean pushed = cacheCall("append", sessionId,
                    () -> cache.append(sessionId, entry, rev, expiresAt, ttl), false);
            // nothing cached means the next read repopulates from the durable store
            if (pushed) {
                reconcile(sessionId);
            }
        });
        return revision;
    }

    @Override
    public boolean delete(String sessionId) {
        boolean existed = durable.delete(sessionId);
        cacheRun("evict", sessionId, () -> cache.evict(sessionId));
        return existed;
    }

    @Override
    public Optional<Long> revision(String sessionId) {
        return durable.revision(sessionId);
    }

    @Override
    public List<ContextSummary> list(int page, int size) {
        return durable.list(page, size);
    }

    @Override
    public boolean ping() {
        return durable.ping();
    }

    public boolean cacheAvailable() {
        return cacheCall("ping", "-", cache::ping, false);
    }

    private void repopulate(ContextRecord record) {
        String sessionId = record.getSessionId();
        Duration ttl = ttlUntil(record.getExpiresAt());
        if (ttl.isZero() || ttl.isNegative()) {
            return;
        }
        if (cacheRun("repopulate", sessionId, () -> cache.put(record, ttl))) {
            reconcile(sessionId);
        }
    }

    private void reconcile(String sessionId) {
        Optional<Long> cached = cacheCall("reconcile", sessionId, () -> cache.revision(sessionId), Optional.empty());
        if (cached.isEmpty()) {
            return;
        }

        Optional<Long> current;
        try {
            current = durable.revision(sessionId);
        } catch (RuntimeException e) {
            log.warn("Could not verify cached revision for session {}, evicting: {}", sessionId, e.getMessage());
            cacheRun("evict", sessionId, () -> cache.evict(sessionId));
            return;
        }

        if (!cached.equals(current)) {
            log.debug("Cached revision {} for session {} is behind durable {}, evicting",
                    cached.get(), sessionId, current.orElse(null));
            cacheRun("evict", sessionId, () -> cache.evict(sessionId));
        }
    }

    private Duration ttlUntil(OffsetDateTime expiresAt) {
        return Duration.between(OffsetDateTime.now(clock), expiresAt);
    }

    private <T> T cacheCall(String operation, String sessionId, Supplier<T> call, T fallback) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            log.warn("Hot cache {} failed for session {}, continuing without cache: {}", operation, sessionId, e.getMessage());
            return fallback;
        }
    }

    private boolean cacheRun(String operation, String sessionId, Runnable call) {
        try {
            call.run();
            return true;
        } catch (RuntimeException e) {
            log.warn("Hot cache {} failed for session {}, continuing without cache: {}", operation, sessionId, e.getMessage());
            return false;
        }
    }
}
