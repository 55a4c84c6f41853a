package com.sds.phucth.sessioncontext.controllers;

import com.sds.phucth.sessioncontext.dto.TierHealth;
import com.sds.phucth.sessioncontext.services.ApprovalOrchestrator;
import com.sds.phucth.sessioncontext.services.CachedContextStore;
import com.sds.phucth.sessioncontext.services.ContextService;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Liveness of both storage tiers, behind the API token like every other call. A lost hot cache only degrades the service.
 */
@RestController
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@RequiredArgsConstructor
public class HealthController {
    ContextService contextService;
    CachedContextStore cachedContextStore;
    ApprovalOrchestrator orchestrator;
    Clock clock;

    @GetMapping("/api/health")
    public ResponseEntity<TierHealth> health() {
        boolean durableUp = contextService.storeAvailable();
        boolean cacheUp = cachedContextStore.cacheAvailable();

        String status = !durableUp ? "unhealthy" : cacheUp ? "healthy" : "degraded";
        TierHealth health = TierHealth.builder()
                .status(status)
                .durableStore(durableUp ? "up" : "down")
                .hotCache(cacheUp ? "up" : "down")
                .pendingActions(orchestrator.pendingCount())
                .checkedAt(OffsetDateTime.now(clock))
                .build();

        return ResponseEntity.status(durableUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}
