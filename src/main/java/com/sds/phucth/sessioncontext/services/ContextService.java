package com.sds.phucth.sessioncontext.services;

import com.sds.phucth.sessioncontext.consts.ContextConstants;
import com.sds.phucth.sessioncontext.dto.AppendEntry;
import com.sds.phucth.sessioncontext.dto.ContextAck;
import com.sds.phucth.sessioncontext.dto.ContextRecord;
import com.sds.phucth.sessioncontext.dto.ContextSummary;
import com.sds.phucth.sessioncontext.exceptions.ContextNotFoundException;
import com.sds.phucth.sessioncontext.exceptions.InvalidPayloadException;
import com.sds.phucth.sessioncontext.exceptions.StorageUnavailableException;
import com.sds.phucth.sessioncontext.utils.CanonicalJson;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Session context operations used by the chat backend, the orchestrator and external
 * automation agents. Storage failures surface as {@link StorageUnavailableException};
 * hot cache trouble never does.
 */
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class ContextService {

    ContextStore contextStore;
    Clock clock;

    @Value("${app.context.ttlSeconds:86400}")
    @NonFinal
    long ttlSeconds;

    @Value("${app.context.maxTtlSeconds:604800}")
    @NonFinal
    long maxTtlSeconds;

    public ContextAck write(String sessionId, String intent, Map<String, Object> data) {
        return write(sessionId, intent, data, null);
    }

    /**
     * Stores intent and data for the session, replacing whatever was there. The append log
     * survives the write.
     *
     * @param ttlOverride optional hot cache lifetime in seconds, capped by {@code app.context.maxTtlSeconds}
     */
    public ContextAck write(String sessionId, String intent, Map<String, Object> data, Long ttlOverride) {
        requireSessionId(sessionId);
        requireText("intent", intent);
        requireJsonObject("data", data);

        OffsetDateTime now = now();
        ContextRecord draft = ContextRecord.builder()
                .sessionId(sessionId)
                .intent(intent)
                .data(new LinkedHashMap<>(data))
                .lastUpdated(now)
                .expiresAt(now.plus(resolveTtl(ttlOverride)))
                .build();

        ContextRecord saved = durable("write", sessionId, () -> contextStore.save(draft));
        log.info("Context stored for session {} (intent={}, revision={})", sessionId, intent, saved.getRevision());

        return ContextAck.builder()
                .sessionId(sessionId)
                .status("stored")
                .revision(saved.getRevision())
                .lastUpdated(saved.getLastUpdated())
                .expiresAt(saved.getExpiresAt())
                .build();
    }

    public ContextRecord read(String sessionId) {
        requireSessionId(sessionId);
        return durable("read", sessionId, () -> contextStore.find(sessionId))
                .orElseThrow(() -> new ContextNotFoundException(sessionId));
    }

    /**
     * Adds an entry to the session's append log and refreshes the record's lifetime to the
     * default TTL. A longer lifetime requested at write time is kept.
     *
     * @throws ContextNotFoundException when the session has no record
     */
    public ContextAck append(String sessionId, String source, Map<String, Object> output) {
        requireSessionId(sessionId);
        requireText("source", source);
        if (source.length() > ContextConstants.Limits.MAX_SOURCE_LENGTH) {
            throw new InvalidPayloadException("source", "must be at most " + ContextConstants.Limits.MAX_SOURCE_LENGTH + " characters");
        }
        requireJsonObject("output", output);

        ContextRecord current = durable("append", sessionId, () -> contextStore.find(sessionId))
                .orElseThrow(() -> new ContextNotFoundException(sessionId));
        OffsetDateTime now = now();
        OffsetDateTime expiresAt = later(current.getExpiresAt(), now.plusSeconds(ttlSeconds));
        AppendEntry entry = AppendEntry.builder()
                .id(UUID.randomUUID().toString())
                .source(source)
                .output(new LinkedHashMap<>(output))
                .appendedAt(now)
                .build();

        Optional<Long> revision = durable("append", sessionId, () -> contextStore.append(sessionId, entry, expiresAt));
        if (revision.isEmpty()) {
            throw new ContextNotFoundException(sessionId);
        }
        log.info("Appended {} output to session {} (entry={}, revision={})", source, sessionId, entry.getId(), revision.get());

        return ContextAck.builder()
                .sessionId(sessionId)
                .status("appended")
                .appendId(entry.getId())
                .source(source)
                .revision(revision.get())
                .lastUpdated(now)
                .expiresAt(expiresAt)
                .build();
    }

    /**
     * Removes the record from both tiers. Deleting an absent session is not an error.
     */
    public ContextAck delete(String sessionId) {
        requireSessionId(sessionId);
        boolean existed = durable("delete", sessionId, () -> contextStore.delete(sessionId));
        log.info("Context delete for session {} (existed={})", sessionId, existed);
        return ContextAck.builder()
                .sessionId(sessionId)
                .status(existed ? "deleted" : "absent")
                .build();
    }

    public List<ContextSummary> list(int page, int size) {
        if (page < 0) {
            throw new InvalidPayloadException("page", "must not be negative");
        }
        if (size < 1 || size > ContextConstants.Limits.MAX_PAGE_SIZE) {
            throw new InvalidPayloadException("size", "must be between 1 and " + ContextConstants.Limits.MAX_PAGE_SIZE);
        }
        return durable("list", "-", () -> contextStore.list(page, size));
    }

    public boolean storeAvailable() {
        try {
            return contextStore.ping();
        } catch (DataAccessException | TransactionException e) {
            log.warn("Durable store ping failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> T durable(String operation, String sessionId, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Durable store {} failed for session {}: {}", operation, sessionId, e.getMessage());
            throw new StorageUnavailableException(operation, e);
        }
    }

    private Duration resolveTtl(Long ttlOverride) {
        if (ttlOverride == null) {
            return Duration.ofSeconds(ttlSeconds);
        }
        if (ttlOverride <= 0) {
            throw new InvalidPayloadException("ttlSeconds", "must be positive");
        }
        return Duration.ofSeconds(Math.min(ttlOverride, maxTtlSeconds));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static OffsetDateTime later(OffsetDateTime existing, OffsetDateTime refreshed) {
        return existing != null && existing.isAfter(refreshed) ? existing : refreshed;
    }

    private static void requireSessionId(String sessionId) {
        requireText("sessionId", sessionId);
        if (sessionId.length() > ContextConstants.Limits.MAX_SESSION_ID_LENGTH) {
            throw new InvalidPayloadException("sessionId", "must be at most " + ContextConstants.Limits.MAX_SESSION_ID_LENGTH + " characters");
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidPayloadException(field, "is required");
        }
    }

    private static void requireJsonObject(String field, Map<String, Object> value) {
        if (value == null) {
            throw new InvalidPayloadException(field, "is required");
        }
        byte[] encoded;
        try {
            encoded = CanonicalJson.toCanonicalBytes(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException(field, "is not serializable as JSON");
        }
        if (encoded.length > ContextConstants.Limits.MAX_PAYLOAD_BYTES) {
            throw new InvalidPayloadException(field, "exceeds " + ContextConstants.Limits.MAX_PAYLOAD_BYTES + " bytes");
        }
    }
}
