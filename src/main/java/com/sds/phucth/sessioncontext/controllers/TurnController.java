package com.sds.phucth.sessioncontext.controllers;

import com.sds.phucth.sessioncontext.dto.ClassifiedTurn;
import com.sds.phucth.sessioncontext.dto.TurnOutcome;
import com.sds.phucth.sessioncontext.services.TurnRouter;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/turns")
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@RequiredArgsConstructor
public class TurnController {
    TurnRouter turnRouter;

    @PostMapping("/{sessionId}")
    public ResponseEntity<TurnOutcome> handle(
            @PathVariable String sessionId,
            @RequestBody @Valid ClassifiedTurn turn) {
        return ResponseEntity.ok(turnRouter.handleTurn(sessionId, turn));
    }
}
