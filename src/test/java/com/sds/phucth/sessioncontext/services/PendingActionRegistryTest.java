package com.sds.phucth.sessioncontext.services;

import static org.assertj.core.api.Assertions.assertThat;

import com.sds.phucth.sessioncontext.dto.ActionStatus;
import com.sds.phucth.sessioncontext.dto.PendingAction;
import java.time.OffsetDateTime;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PendingActionRegistryTest {

    private PendingActionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PendingActionRegistry();
    }

    private PendingAction action(String sessionId, String messageId) {
        OffsetDateTime now = OffsetDateTime.parse("2025-01-01T10:00:00Z");
        return PendingAction.builder()
                .sessionId(sessionId)
                .messageId(messageId)
                .intent("send_email")
                .proposedData(Map.of("subject", "hi"))
                .status(ActionStatus.PROPOSED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Test
    @DisplayName("Putting a second action for a session replaces the first and returns it")
    void putReplaces() {
        registry.put(action("s1", "m1"));

        assertThat(registry.put(action("s1", "m2"))).get()
                .extracting(PendingAction::getMessageId).isEqualTo("m1");
        assertThat(registry.find("s1")).get()
                .extracting(PendingAction::getMessageId).isEqualTo("m2");
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Sessions are independent")
    void sessionsIndependent() {
        registry.put(action("s1", "m1"));
        registry.put(action("s2", "m2"));

        registry.remove("s1");

        assertThat(registry.find("s1")).isEmpty();
        assertThat(registry.find("s2")).isPresent();
        assertThat(registry.snapshot()).hasSize(1);
    }

    @Test
    @DisplayName("Session lock is reentrant and returns the work result")
    void lockReentrant() {
        String result = registry.withSessionLock("s1",
                () -> registry.withSessionLock("s1", () -> "inner"));

        assertThat(result).isEqualTo("inner");
    }
}
