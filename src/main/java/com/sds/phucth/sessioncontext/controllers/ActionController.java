package com.sds.phucth.sessioncontext.controllers;

import com.sds.phucth.sessioncontext.dto.ApprovalDecision;
import com.sds.phucth.sessioncontext.dto.EditActionRequest;
import com.sds.phucth.sessioncontext.dto.PendingAction;
import com.sds.phucth.sessioncontext.dto.ProposeActionRequest;
import com.sds.phucth.sessioncontext.dto.ReplyOutcome;
import com.sds.phucth.sessioncontext.dto.ResolutionResult;
import com.sds.phucth.sessioncontext.dto.ResolveRequest;
import com.sds.phucth.sessioncontext.dto.TextRequest;
import com.sds.phucth.sessioncontext.services.ApprovalOrchestrator;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/actions/{sessionId}")
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
@RequiredArgsConstructor
public class ActionController {
    ApprovalOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<PendingAction> propose(
            @PathVariable String sessionId,
            @RequestBody @Valid ProposeActionRequest request) {
        PendingAction action = orchestrator.propose(sessionId, request.getMessageId(), request.getIntent(), request.getData());
        return ResponseEntity.status(HttpStatus.CREATED).body(action);
    }

    @GetMapping
    public ResponseEntity<PendingAction> pending(@PathVariable String sessionId) {
        return ResponseEntity.ok(orchestrator.pending(sessionId));
    }

    @PatchMapping
    public ResponseEntity<PendingAction> edit(
            @PathVariable String sessionId,
            @RequestBody @Valid EditActionRequest request) {
        return ResponseEntity.ok(orchestrator.edit(sessionId, request.getFields()));
    }

    @PostMapping("/interpret")
    public ResponseEntity<Map<String, Object>> interpret(
            @PathVariable String sessionId,
            @RequestBody @Valid TextRequest request) {
        ApprovalDecision decision = orchestrator.interpret(sessionId, request.getText());
        return ResponseEntity.ok(Map.of("sessionId", sessionId, "decision", decision));
    }

    @PostMapping("/resolve")
    public ResponseEntity<ResolutionResult> resolve(
            @PathVariable String sessionId,
            @RequestBody @Valid ResolveRequest request) {
        return ResponseEntity.ok(orchestrator.resolve(sessionId, request.getDecision()));
    }

    @PostMapping("/reply")
    public ResponseEntity<ReplyOutcome> reply(
            @PathVariable String sessionId,
            @RequestBody @Valid TextRequest request) {
        return ResponseEntity.ok(orchestrator.reply(sessionId, request.getText()));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> discard(@PathVariable String sessionId) {
        Optional<PendingAction> discarded = orchestrator.discard(sessionId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", sessionId);
        body.put("discarded", discarded.isPresent());
        discarded.ifPresent(action -> body.put("messageId", action.getMessageId()));
        return ResponseEntity.ok(body);
    }
}
