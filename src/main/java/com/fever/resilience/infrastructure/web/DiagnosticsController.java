package com.fever.resilience.infrastructure.web;

import com.fever.resilience.application.PerformanceReport;
import com.fever.resilience.application.SystemDiagnostics;
import com.fever.resilience.domain.model.SystemHealth;
import com.fever.resilience.infrastructure.web.dto.ClearCacheResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/diagnostics")
public class DiagnosticsController {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticsController.class);

    private final SystemDiagnostics diagnostics;

    public DiagnosticsController(SystemDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * 200 while healthy or degraded, 503 once the error rate is critical
     */
    @GetMapping("/health")
    public ResponseEntity<SystemHealth> health() {
        SystemHealth health = diagnostics.systemHealth();
        if (SystemHealth.CRITICAL.equals(health.overallHealth())) {
            logger.warn("Reporting critical system health: {} errors/min", health.errorRatePerMinute());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health);
        }
        return ResponseEntity.ok(health);
    }

    @GetMapping("/performance")
    public ResponseEntity<PerformanceReport> performance() {
        return ResponseEntity.ok(diagnostics.performanceReport());
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<ClearCacheResponse> clearCaches() {
        try {
            diagnostics.clearCaches();
            return ResponseEntity.ok(ClearCacheResponse.success());
        } catch (Exception e) {
            logger.error("Error clearing caches", e);
            return ResponseEntity.internalServerError()
                    .body(ClearCacheResponse.failed(e.getMessage()));
        }
    }
}
