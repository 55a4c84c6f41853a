package com.sds.phucth.sessioncontext.controllers;

import com.sds.phucth.sessioncontext.dto.AppendContextRequest;
import com.sds.phucth.sessioncontext.dto.ContextAck;
import com.sds.phucth.sessioncontext.dto.ContextRecord;
import com.sds.phucth.sessioncontext.dto.ContextSummary;
import com.sds.phucth.sessioncontext.dto.WriteContextRequest;
import com.sds.phucth.sessioncontext.services.ContextService;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
@RequiredArgsConstructor
public class ContextController {
    ContextService contextService;

    @PostMapping("/context")
    public ResponseEntity<ContextAck> write(@RequestBody @Valid WriteContextRequest request) {
        ContextAck ack = contextService.write(request.getSessionId(), request.getIntent(), request.getData(), request.getTtlSeconds());
        return ResponseEntity.ok(ack);
    }

    @GetMapping("/context/{sessionId}")
    public ResponseEntity<ContextRecord> read(@PathVariable String sessionId) {
        return ResponseEntity.ok(contextService.read(sessionId));
    }

    @PostMapping("/context/{sessionId}/appends")
    public ResponseEntity<ContextAck> append(
            @PathVariable String sessionId,
            @RequestBody @Valid AppendContextRequest request) {
        ContextAck ack = contextService.append(sessionId, request.getSource(), request.getOutput());
        return ResponseEntity.status(HttpStatus.CREATED).body(ack);
    }

    @DeleteMapping("/context/{sessionId}")
    public ResponseEntity<ContextAck> delete(@PathVariable String sessionId) {
        return ResponseEntity.ok(contextService.delete(sessionId));
    }

    @GetMapping("/contexts")
    public ResponseEntity<List<ContextSummary>> list(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(contextService.list(page, size));
    }
}
