package com.sds.phucth.sessioncontext.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sds.phucth.sessioncontext.dto.AppendEntry;
import com.sds.phucth.sessioncontext.dto.ContextAck;
import com.sds.phucth.sessioncontext.dto.ContextRecord;
import com.sds.phucth.sessioncontext.exceptions.ContextNotFoundException;
import com.sds.phucth.sessioncontext.exceptions.ErrorCode;
import com.sds.phucth.sessioncontext.exceptions.InvalidPayloadException;
import com.sds.phucth.sessioncontext.exceptions.StorageUnavailableException;
import com.sds.phucth.sessioncontext.support.InMemoryContextCache;
import com.sds.phucth.sessioncontext.support.InMemoryContextStore;
import com.sds.phucth.sessioncontext.support.MutableClock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class ContextServiceTest {

    private MutableClock clock;
    private InMemoryContextStore durable;
    private InMemoryContextCache cache;
    private ContextService contextService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T10:00:00Z");
        durable = new InMemoryContextStore();
        cache = new InMemoryContextCache();
        contextService = new ContextService(new CachedContextStore(durable, cache, clock), clock);
        ReflectionTestUtils.setField(contextService, "ttlSeconds", 86400L);
        ReflectionTestUtils.setField(contextService, "maxTtlSeconds", 604800L);
    }

    @Nested
    @DisplayName("write and read")
    class WriteAndRead {

        @Test
        @DisplayName("Write then read returns the written data")
        void writeThenRead() {
            contextService.write("s1", "send_email", Map.of("recipient", "bob@x.com"));

            ContextRecord record = contextService.read("s1");

            assertThat(record.getIntent()).isEqualTo("send_email");
            assertThat(record.getData()).containsEntry("recipient", "bob@x.com");
            assertThat(record.getAppends()).isEmpty();
        }

        @Test
        @DisplayName("A rewrite replaces data, keeps createdAt and moves lastUpdated")
        void rewriteKeepsCreatedAt() {
            contextService.write("s1", "send_email", Map.of("a", 1));
            clock.advance(Duration.ofMinutes(5));

            ContextAck ack = contextService.write("s1", "schedule_meeting", Map.of("b", 2));
            ContextRecord record = contextService.read("s1");

            assertThat(ack.getStatus()).isEqualTo("stored");
            assertThat(ack.getRevision()).isEqualTo(2L);
            assertThat(record.getData()).isEqualTo(Map.of("b", 2));
            assertThat(record.getCreatedAt()).isEqualTo(OffsetDateTime.parse("2025-01-01T10:00:00Z"));
            assertThat(record.getLastUpdated()).isEqualTo(OffsetDateTime.parse("2025-01-01T10:05:00Z"));
        }

        @Test
        @DisplayName("expiresAt is lastUpdated plus the default TTL")
        void defaultTtl() {
            ContextAck ack = contextService.write("s1", "send_email", Map.of());

            assertThat(ack.getExpiresAt()).isEqualTo(ack.getLastUpdated().plusSeconds(86400));
        }

        @Test
        @DisplayName("A requested TTL is capped by the configured maximum")
        void ttlOverrideCapped() {
            ContextAck ack = contextService.write("s1", "send_email", Map.of(), 10_000_000L);

            assertThat(ack.getExpiresAt()).isEqualTo(ack.getLastUpdated().plusSeconds(604800));
        }

        @Test
        @DisplayName("Reading an unknown session is NotFound")
        void readMissing() {
            assertThatThrownBy(() -> contextService.read("ghost"))
                    .isInstanceOf(ContextNotFoundException.class)
                    .hasMessageContaining("ghost");
        }

        @Test
        @DisplayName("Cache-only eviction does not lose data")
        void cacheEvictionKeepsData() {
            contextService.write("s1", "send_email", Map.of("a", 1));
            cache.evictSilently("s1");

            assertThat(contextService.read("s1").getData()).isEqualTo(Map.of("a", 1));
        }
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("Appends accumulate in order and never replace data")
        void appendsAccumulate() {
            contextService.write("s1", "send_email", Map.of("a", 1));
            contextService.append("s1", "x", Map.of("v", 1));
            contextService.append("s1", "y", Map.of("v", 2));

            ContextRecord record = contextService.read("s1");

            assertThat(record.getData()).isEqualTo(Map.of("a", 1));
            assertThat(record.getAppends()).extracting(AppendEntry::getSource).containsExactly("x", "y");
            assertThat(record.getAppends()).extracting(AppendEntry::getOutput)
                    .containsExactly(Map.of("v", 1), Map.of("v", 2));
        }

        @Test
        @DisplayName("Append refreshes lastUpdated and expiry")
        void appendRefreshes() {
            contextService.write("s1", "send_email", Map.of("a", 1));
            clock.advance(Duration.ofHours(1));

            ContextAck ack = contextService.append("s1", "n8n", Map.of("ok", true));
            ContextRecord record = contextService.read("s1");

            assertThat(ack.getStatus()).isEqualTo("appended");
            assertThat(ack.getAppendId()).isNotBlank();
            assertThat(record.getLastUpdated()).isEqualTo(OffsetDateTime.parse("2025-01-01T11:00:00Z"));
            assertThat(record.getExpiresAt()).isEqualTo(OffsetDateTime.parse("2025-01-02T11:00:00Z"));
        }

        @Test
        @DisplayName("Append keeps a longer lifetime requested at write time")
        void appendKeepsLongerTtl() {
            ContextAck written = contextService.write("s1", "send_email", Map.of("a", 1), 604800L);
            clock.advance(Duration.ofHours(1));

            ContextAck ack = contextService.append("s1", "n8n", Map.of("ok", true));

            assertThat(ack.getExpiresAt()).isEqualTo(written.getExpiresAt());
            assertThat(contextService.read("s1").getExpiresAt()).isEqualTo(written.getExpiresAt());
        }

        @Test
        @DisplayName("Append to an unknown session is NotFound")
        void appendMissing() {
            assertThatThrownBy(() -> contextService.append("ghost", "n8n", Map.of()))
                    .isInstanceOf(ContextNotFoundException.class);
        }

        @Test
        @DisplayName("Concurrent appends on one session are all kept")
        void concurrentAppends() throws Exception {
            contextService.write("s1", "send_email", Map.of("a", 1));
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<ContextAck>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return contextService.append("s1", "worker", Map.of("n", n));
                }));
            }
            start.countDown();
            for (Future<ContextAck> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
            pool.shutdown();

            assertThat(contextService.read("s1").getAppends()).hasSize(20);
            cache.evictSilently("s1");
            assertThat(contextService.read("s1").getAppends()).hasSize(20);
        }
    }

    @Nested
    @DisplayName("failure handling")
    class Failures {

        @Test
        @DisplayName("Cache failure never fails a write or read")
        void cacheDown() {
            cache.setAvailable(false);

            contextService.write("s1", "send_email", Map.of("a", 1));
            contextService.append("s1", "n8n", Map.of("v", 1));

            assertThat(contextService.read("s1").getAppends()).hasSize(1);
        }

        @Test
        @DisplayName("Durable failure fails write and append with StorageUnavailable")
        void durableDown() {
            contextService.write("s1", "send_email", Map.of("a", 1));
            durable.setAvailable(false);

            assertThatThrownBy(() -> contextService.write("s1", "send_email", Map.of("a", 2)))
                    .isInstanceOf(StorageUnavailableException.class)
                    .hasMessageNotContaining("Connection refused")
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.STORAGE_UNAVAILABLE);
            assertThatThrownBy(() -> contextService.append("s1", "n8n", Map.of()))
                    .isInstanceOf(StorageUnavailableException.class);
        }

        @Test
        @DisplayName("Durable failure on a cache miss fails the read")
        void durableDownOnMiss() {
            durable.setAvailable(false);

            assertThatThrownBy(() -> contextService.read("s1"))
                    .isInstanceOf(StorageUnavailableException.class);
        }

        @Test
        @DisplayName("Invalid input is rejected before any storage call")
        void invalidInput() {
            durable.setAvailable(false);

            assertThatThrownBy(() -> contextService.write(" ", "send_email", Map.of()))
                    .isInstanceOf(InvalidPayloadException.class);
            assertThatThrownBy(() -> contextService.write("s1", "send_email", null))
                    .isInstanceOf(InvalidPayloadException.class);
            assertThatThrownBy(() -> contextService.write("s".repeat(129), "send_email", Map.of()))
                    .isInstanceOf(InvalidPayloadException.class);
            assertThatThrownBy(() -> contextService.append("s1", "", Map.of()))
                    .isInstanceOf(InvalidPayloadException.class);
            assertThatThrownBy(() -> contextService.list(0, 500))
                    .isInstanceOf(InvalidPayloadException.class);
        }
    }

    @Test
    @DisplayName("Delete is idempotent")
    void deleteIdempotent() {
        contextService.write("s1", "send_email", Map.of());

        assertThat(contextService.delete("s1").getStatus()).isEqualTo("deleted");
        assertThat(contextService.delete("s1").getStatus()).isEqualTo("absent");
        assertThatThrownBy(() -> contextService.read("s1")).isInstanceOf(ContextNotFoundException.class);
    }

    @Test
    @DisplayName("List is ordered by last update, newest first")
    void listNewestFirst() {
        contextService.write("s1", "a", Map.of());
        clock.advance(Duration.ofSeconds(1));
        contextService.write("s2", "b", Map.of());

        assertThat(contextService.list(0, 10)).extracting("sessionId").containsExactly("s2", "s1");
        assertThat(contextService.list(1, 1)).extracting("sessionId").containsExactly("s1");
    }
}
