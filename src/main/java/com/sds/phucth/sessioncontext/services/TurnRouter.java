package com.sds.phucth.sessioncontext.services;

import com.sds.phucth.sessioncontext.dto.ClassifiedTurn;
import com.sds.phucth.sessioncontext.dto.ContextAck;
import com.sds.phucth.sessioncontext.dto.HandlingMode;
import com.sds.phucth.sessioncontext.dto.PendingAction;
import com.sds.phucth.sessioncontext.dto.TurnOutcome;
import com.sds.phucth.sessioncontext.exceptions.InvalidPayloadException;
import com.sds.phucth.sessioncontext.utils.CanonicalJson;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Routes a classified chat turn. The turn's data is copied once and that single copy feeds
 * the context record, the pending action and the rendered summary, so what the user sees
 * is exactly what would be sent.
 */
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class TurnRouter {

    ContextService contextService;
    ApprovalOrchestrator orchestrator;
    ActionSummaryRenderer renderer;

    @Value("${app.routing.approvalIntents:}")
    @NonFinal
    Set<String> approvalIntents;

    @Value("${app.routing.sequentialIntents:}")
    @NonFinal
    Set<String> sequentialIntents;

    public HandlingMode route(ClassifiedTurn turn) {
        String intent = turn.getIntent();
        if (contains(sequentialIntents, intent)) {
            return HandlingMode.SEQUENTIAL_BOTH_STAGES;
        }
        if (turn.isNeedsApproval() || contains(approvalIntents, intent)) {
            return HandlingMode.REQUIRES_APPROVAL;
        }
        return HandlingMode.DIRECT_EXECUTE;
    }

    public TurnOutcome handleTurn(String sessionId, ClassifiedTurn turn) {
        if (turn == null || turn.getData() == null) {
            throw new InvalidPayloadException("data", "is required");
        }
        HandlingMode mode = route(turn);
        Map<String, Object> payload = Collections.unmodifiableMap(new LinkedHashMap<>(turn.getData()));

        ContextAck context = contextService.write(sessionId, turn.getIntent(), payload);

        PendingAction pending = null;
        if (mode != HandlingMode.DIRECT_EXECUTE) {
            pending = orchestrator.propose(sessionId, turn.getMessageId(), turn.getIntent(), payload);
        }
        log.info("Turn {} in session {} routed as {}", turn.getMessageId(), sessionId, mode);

        return TurnOutcome.builder()
                .sessionId(sessionId)
                .messageId(turn.getMessageId())
                .intent(turn.getIntent())
                .mode(mode)
                .summary(renderer.render(turn.getIntent(), payload, mode))
                .payloadFingerprint(CanonicalJson.fingerprint(payload))
                .pendingAction(pending)
                .context(context)
                .build();
    }

    private static boolean contains(Set<String> intents, String intent) {
        return intents != null && intent != null && intents.contains(intent);
    }
}
