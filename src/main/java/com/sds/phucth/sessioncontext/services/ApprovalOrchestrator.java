package com.sds.phucth.sessioncontext.services;

import com.sds.phucth.sessioncontext.consts.ApprovalConstants;
import com.sds.phucth.sessioncontext.consts.ContextConstants;
import com.sds.phucth.sessioncontext.dto.ActionStatus;
import com.sds.phucth.sessioncontext.dto.ApprovalDecision;
import com.sds.phucth.sessioncontext.dto.DispatchResult;
import com.sds.phucth.sessioncontext.dto.PendingAction;
import com.sds.phucth.sessioncontext.dto.ReplyOutcome;
import com.sds.phucth.sessioncontext.dto.ResolutionOutcome;
import com.sds.phucth.sessioncontext.dto.ResolutionResult;
import com.sds.phucth.sessioncontext.exceptions.BaseException;
import com.sds.phucth.sessioncontext.exceptions.InvalidPayloadException;
import com.sds.phucth.sessioncontext.exceptions.PendingActionNotFoundException;
import com.sds.phucth.sessioncontext.utils.ApprovalPhrases;
import com.sds.phucth.sessioncontext.utils.CanonicalJson;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Human-in-the-loop gate between an AI-proposed action and its delivery.
 *
 * <p>A session holds at most one pending action. Resolution takes the action out of the
 * registry under the session lock before anything is sent, so concurrent approvals of the
 * same action dispatch it exactly once and the losers see nothing to approve.
 */
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class ApprovalOrchestrator {

    PendingActionRegistry registry;
    ActionDispatcher dispatcher;
    ContextService contextService;
    Clock clock;

    @Value("${app.approval.maxAgeSeconds:1800}")
    @NonFinal
    long maxAgeSeconds;

    /**
     * Registers a proposal for the session, superseding any earlier one.
     */
    public PendingAction propose(String sessionId, String messageId, String intent, Map<String, Object> data) {
        requireText("sessionId", sessionId);
        requireText("messageId", messageId);
        requireText("intent", intent);
        if (data == null) {
            throw new InvalidPayloadException("data", "is required");
        }

        OffsetDateTime now = now();
        PendingAction action = PendingAction.builder()
                .sessionId(sessionId)
                .messageId(messageId)
                .intent(intent)
                .proposedData(freeze(data))
                .status(ActionStatus.PROPOSED)
                .proposalFingerprint(CanonicalJson.fingerprint(data))
                .createdAt(now)
                .updatedAt(now)
                .build();

        registry.withSessionLock(sessionId, () -> registry.put(action))
                .ifPresent(previous -> log.info("Proposal {} supersedes {} for session {}",
                        messageId, previous.getMessageId(), sessionId));
        log.info("Action {} proposed for session {} (message {})", intent, sessionId, messageId);
        return action;
    }

    public PendingAction pending(String sessionId) {
        return registry.withSessionLock(sessionId, () -> current(sessionId))
                .orElseThrow(() -> new PendingActionNotFoundException(sessionId));
    }

    /**
     * Merges user edits over the pending proposal. Later edits of the same field win; the
     * original proposal is never modified.
     */
    public PendingAction edit(String sessionId, Map<String, Object> updates) {
        if (updates == null || updates.isEmpty()) {
            throw new InvalidPayloadException("fields", "must contain at least one update");
        }

        return registry.withSessionLock(sessionId, () -> {
            PendingAction current = current(sessionId)
                    .orElseThrow(() -> new PendingActionNotFoundException(sessionId));

            Map<String, Object> edited = new LinkedHashMap<>(current.getEditedData());
            edited.putAll(updates);
            PendingAction updated = current.toBuilder()
                    .editedData(freeze(edited))
                    .status(ActionStatus.EDITED)
                    .updatedAt(now())
                    .build();
            registry.put(updated);
            log.info("Pending action for session {} edited: {}", sessionId, updates.keySet());
            return updated;
        });
    }

    public ApprovalDecision interpret(String sessionId, String text) {
        ApprovalDecision decision = ApprovalPhrases.classify(text);
        log.debug("Reply in session {} interpreted as {}", sessionId, decision);
        return decision;
    }

    /**
     * Applies an approve or reject decision to the session's pending action. Approval sends
     * the final payload exactly once and records the outcome in the session context.
     *
     * @throws PendingActionNotFoundException when nothing is pending, in which case nothing is sent
     */
    public ResolutionResult resolve(String sessionId, ApprovalDecision decision) {
        if (decision == null || decision == ApprovalDecision.NONE) {
            throw new InvalidPayloadException("decision", "must be APPROVE or REJECT");
        }

        PendingAction decided = registry.withSessionLock(sessionId, () -> {
            PendingAction current = current(sessionId)
                    .orElseThrow(() -> new PendingActionNotFoundException(sessionId));
            registry.remove(sessionId);
            return current;
        });

        if (decision == ApprovalDecision.REJECT) {
            log.info("Action {} for session {} rejected, nothing sent", decided.getIntent(), sessionId);
            return ResolutionResult.builder()
                    .sessionId(sessionId)
                    .messageId(decided.getMessageId())
                    .intent(decided.getIntent())
                    .decision(decision)
                    .outcome(ResolutionOutcome.REJECTED)
                    .status(ActionStatus.REJECTED)
                    .contextRecorded(false)
                    .message(ApprovalConstants.Messages.REJECTED)
                    .build();
        }

        return dispatchApproved(decided);
    }

    /**
     * Interprets a chat reply and, when it is a decision, resolves the pending action.
     */
    public ReplyOutcome reply(String sessionId, String text) {
        ApprovalDecision decision = interpret(sessionId, text);
        ResolutionResult resolution = decision == ApprovalDecision.NONE ? null : resolve(sessionId, decision);
        return ReplyOutcome.builder()
                .sessionId(sessionId)
                .decision(decision)
                .resolution(resolution)
                .build();
    }

    /**
     * Drops the session's pending action without sending it, e.g. on conversation reset.
     */
    public Optional<PendingAction> discard(String sessionId) {
        Optional<PendingAction> removed = registry.withSessionLock(sessionId, () -> registry.remove(sessionId));
        removed.ifPresent(action -> log.info("Pending action {} for session {} discarded", action.getMessageId(), sessionId));
        return removed.map(action -> action.toBuilder().status(ActionStatus.EXPIRED).updatedAt(now()).build());
    }

    /**
     * Removes every pending action created before {@code maxAge} ago. Expired actions are
     * never sent.
     */
    public List<PendingAction> expireStale(Duration maxAge) {
        OffsetDateTime cutoff = now().minus(maxAge);
        List<PendingAction> expired = new ArrayList<>();
        for (PendingAction candidate : registry.snapshot()) {
            if (!candidate.isOlderThan(cutoff)) {
                continue;
            }
            String sessionId = candidate.getSessionId();
            registry.withSessionLock(sessionId, () -> {
                // re-read under the lock, a newer proposal may have replaced the candidate
                registry.find(sessionId)
                        .filter(action -> action.isOlderThan(cutoff))
                        .ifPresent(action -> {
                            registry.remove(sessionId);
                            expired.add(action.toBuilder().status(ActionStatus.EXPIRED).updatedAt(now()).build());
                        });
                return null;
            });
        }
        return expired;
    }

    @Scheduled(fixedDelayString = "${app.approval.sweepIntervalMs:60000}",
            initialDelayString = "${app.approval.sweepIntervalMs:60000}")
    public void sweepExpired() {
        List<PendingAction> expired = expireStale(Duration.ofSeconds(maxAgeSeconds));
        if (!expired.isEmpty()) {
            log.info("Expired {} pending action(s) older than {}s", expired.size(), maxAgeSeconds);
        }
    }

    public int pendingCount() {
        return registry.size();
    }

    private ResolutionResult dispatchApproved(PendingAction action) {
        String sessionId = action.getSessionId();
        Map<String, Object> payload = action.getFinalPayload();
        String fingerprint = CanonicalJson.fingerprint(payload);
        log.info("Action {} for session {} approved, dispatching", action.getIntent(), sessionId);

        DispatchResult dispatch = sendOnce(action, payload);
        boolean recorded = recordOutcome(action, payload, fingerprint, dispatch);

        return ResolutionResult.builder()
                .sessionId(sessionId)
                .messageId(action.getMessageId())
                .intent(action.getIntent())
                .decision(ApprovalDecision.APPROVE)
                .outcome(dispatch.isSuccess() ? ResolutionOutcome.DISPATCHED : ResolutionOutcome.DISPATCH_FAILED)
                .status(dispatch.isSuccess() ? ActionStatus.DISPATCHED : ActionStatus.APPROVED)
                .payload(payload)
                .payloadFingerprint(fingerprint)
                .dispatch(dispatch)
                .contextRecorded(recorded)
                .message(dispatch.isSuccess() ? ApprovalConstants.Messages.DISPATCHED : ApprovalConstants.Messages.DISPATCH_FAILED)
                .build();
    }

    private DispatchResult sendOnce(PendingAction action, Map<String, Object> payload) {
        try {
            return dispatcher.send(action.getSessionId(), action.getIntent(), payload);
        } catch (RuntimeException e) {
            log.error("Dispatcher failed unexpectedly for session {}", action.getSessionId(), e);
            return DispatchResult.failed(null, "Dispatch failed: " + e.getMessage(), 0);
        }
    }

    private boolean recordOutcome(PendingAction action, Map<String, Object> payload, String fingerprint, DispatchResult dispatch) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("status", dispatch.isSuccess() ? ApprovalConstants.AuditStatus.DISPATCHED : ApprovalConstants.AuditStatus.DISPATCH_FAILED);
        output.put("messageId", action.getMessageId());
        output.put("intent", action.getIntent());
        output.put("payload", payload);
        output.put("payloadFingerprint", fingerprint);
        output.put("proposalFingerprint", action.getProposalFingerprint());
        output.put("dispatch", dispatch.toAuditMap());
        output.put("decidedAt", now().toString());

        try {
            contextService.append(action.getSessionId(), ContextConstants.Source.ORCHESTRATOR, output);
            return true;
        } catch (BaseException e) {
            log.warn("Could not record {} outcome for session {}: {}", output.get("status"), action.getSessionId(), e.getMessage());
            return false;
        }
    }

    // caller holds the session lock
    private Optional<PendingAction> current(String sessionId) {
        Optional<PendingAction> found = registry.find(sessionId);
        if (found.isPresent() && found.get().isOlderThan(now().minusSeconds(maxAgeSeconds))) {
            registry.remove(sessionId);
            log.info("Pending action {} for session {} expired", found.get().getMessageId(), sessionId);
            return Optional.empty();
        }
        return found;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static Map<String, Object> freeze(Map<String, Object> data) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidPayloadException(field, "is required");
        }
    }
}
