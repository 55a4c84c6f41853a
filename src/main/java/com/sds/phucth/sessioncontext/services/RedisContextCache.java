package com.sds.phucth.sessioncontext.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sds.phucth.sessioncontext.consts.ContextConstants;
import com.sds.phucth.sessioncontext.dto.AppendEntry;
import com.sds.phucth.sessioncontext.dto.ContextRecord;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Redis layout per session, all three keys sharing one TTL:
 * <ul>
 *   <li>{@code ctx:record:{sid}} record JSON without its append log</li>
 *   <li>{@code ctx:appends:{sid}} list of append entry JSON in order</li>
 *   <li>{@code ctx:meta:{sid}} hash of revision, lastUpdated and expiresAt</li>
 * </ul>
 * Appends are pushed atomically so concurrent appenders never lose each other's entries.
 */
@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class RedisContextCache implements ContextCache {

    // KEYS: record, appends, meta. ARGV: entry json, revision, lastUpdated, expiresAt, ttl seconds
    // returns 1 pushed, 2 already part of the cached copy, 0 nothing cached, -1 revision gap (evicted)
    private static final RedisScript<Long> APPEND_SCRIPT = RedisScript.of("""
            if redis.call('EXISTS', KEYS[1]) == 0 then
              return 0
            end
            local current = tonumber(redis.call('HGET', KEYS[3], 'revision'))
            local revision = tonumber(ARGV[2])
            if current ~= nil and revision <= current then
              return 2
            end
            if current == nil or revision ~= current + 1 then
              redis.call('DEL', KEYS[1], KEYS[2], KEYS[3])
              return -1
            end
            redis.call('RPUSH', KEYS[2], ARGV[1])
            redis.call('HSET', KEYS[3], 'revision', ARGV[2], 'lastUpdated', ARGV[3], 'expiresAt', ARGV[4])
            redis.call('EXPIRE', KEYS[1], ARGV[5])
            redis.call('EXPIRE', KEYS[2], ARGV[5])
            redis.call('EXPIRE', KEYS[3], ARGV[5])
            return 1
            """, Long.class);

    StringRedisTemplate redis;
    ObjectMapper objectMapper;

    @Override
    public Optional<ContextRecord> get(String sessionId) {
        String recordKey = ContextConstants.KeyFormat.RECORD.formatted(sessionId);
        String appendsKey = ContextConstants.KeyFormat.APPENDS.formatted(sessionId);
        String metaKey = ContextConstants.KeyFormat.META.formatted(sessionId);

        List<Object> results = redis.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForValue().get(recordKey);
                ops.opsForList().range(appendsKey, 0, -1);
                ops.opsForHash().entries(metaKey);
                return ops.exec();
            }
        });

        if (results == null || results.size() < 3 || results.get(0) == null) {
            return Optional.empty();
        }
        Map<?, ?> meta = (Map<?, ?>) results.get(2);
        if (meta == null || meta.get(ContextConstants.MetaField.REVISION) == null) {
            // partially written or half expired, let the durable store answer
            return Optional.empty();
        }

        ContextRecord record = readJson((String) results.get(0), ContextRecord.class);
        List<AppendEntry> entries = new ArrayList<>();
        List<?> rawEntries = (List<?>) results.get(1);
        if (rawEntries != null) {
            for (Object raw : rawEntries) {
                entries.add(readJson((String) raw, AppendEntry.class));
            }
        }

        record.setAppends(entries);
        record.setRevision(Long.parseLong((String) meta.get(ContextConstants.MetaField.REVISION)));
        record.setLastUpdated(OffsetDateTime.parse((String) meta.get(ContextConstants.MetaField.LAST_UPDATED)));
        record.setExpiresAt(OffsetDateTime.parse((String) meta.get(ContextConstants.MetaField.EXPIRES_AT)));
        return Optional.of(record);
    }

    @Override
    public void put(ContextRecord record, Duration ttl) {
        String sessionId = record.getSessionId();
        String recordKey = ContextConstants.KeyFormat.RECORD.formatted(sessionId);
        String appendsKey = ContextConstants.KeyFormat.APPENDS.formatted(sessionId);
        String metaKey = ContextConstants.KeyFormat.META.formatted(sessionId);

        String header = writeJson(record.toBuilder().appends(null).build());
        List<String> entries = new ArrayList<>();
        for (AppendEntry entry : record.getAppends()) {
            entries.add(writeJson(entry));
        }
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put(ContextConstants.MetaField.REVISION, Long.toString(record.getRevision()));
        meta.put(ContextConstants.MetaField.LAST_UPDATED, record.getLastUpdated().toString());
        meta.put(ContextConstants.MetaField.EXPIRES_AT, record.getExpiresAt().toString());

        redis.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForValue().set(recordKey, header, ttl);
                ops.delete(appendsKey);
                if (!entries.isEmpty()) {
                    ops.opsForList().rightPushAll(appendsKey, entries);
                    ops.expire(appendsKey, ttl);
                }
                ops.delete(metaKey);
                ops.opsForHash().putAll(metaKey, meta);
                ops.expire(metaKey, ttl);
                return ops.exec();
            }
        });
        log.debug("Cached session {} at revision {} for {}s", sessionId, record.getRevision(), ttl.toSeconds());
    }

    @Override
    public boolean append(String sessionId, AppendEntry entry, long revision, OffsetDateTime expiresAt, Duration ttl) {
        List<String> keys = List.of(
                ContextConstants.KeyFormat.RECORD.formatted(sessionId),
                ContextConstants.KeyFormat.APPENDS.formatted(sessionId),
                ContextConstants.KeyFormat.META.formatted(sessionId));

        Long outcome = redis.execute(APPEND_SCRIPT, keys,
                writeJson(entry),
                Long.toString(revision),
                entry.getAppendedAt().toString(),
                expiresAt.toString(),
                Long.toString(Math.max(1, ttl.toSeconds())));
        if (outcome != null && outcome == -1L) {
            log.debug("Append revision {} for session {} does not follow the cached copy, evicted", revision, sessionId);
        }
        return outcome != null && outcome > 0;
    }

    @Override
    public Optional<Long> revision(String sessionId) {
        Object value = redis.opsForHash().get(ContextConstants.KeyFormat.META.formatted(sessionId),
                ContextConstants.MetaField.REVISION);
        return Optional.ofNullable(value).map(v -> Long.parseLong(v.toString()));
    }

    @Override
    public void evict(String sessionId) {
        redis.delete(List.of(
                ContextConstants.KeyFormat.RECORD.formatted(sessionId),
                ContextConstants.KeyFormat.APPENDS.formatted(sessionId),
                ContextConstants.KeyFormat.META.formatted(sessionId)));
    }

    @Override
    public boolean ping() {
        String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
        return "PONG".equalsIgnoreCase(pong);
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cache entry", e);
        }
    }

    private <T> T readJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt cache entry of type " + type.getSimpleName(), e);
        }
    }
}
