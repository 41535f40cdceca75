package com.flightboard.board.controller.v1;

import com.flightboard.board.constants.HealthConstants;
import com.flightboard.board.health.CompositeHealthReport;
import com.flightboard.board.health.HealthAggregator;
import com.flightboard.board.health.HealthStatus;
import com.flightboard.board.health.ProbeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Composite and per-probe health for operators and orchestration checks.
 * HEALTHY and DEGRADED answer 200, UNHEALTHY and CRITICAL 503, ERROR 500.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/health")
public class HealthController {

    static final String STATUS_HEADER = "X-Health-Status";
    static final String DURATION_HEADER = "X-Health-Check-Duration";

    private static final Map<String, String> PROBE_ALIASES = Map.of(
            "cache", HealthConstants.CACHE_PERFORMANCE_PROBE,
            "system", HealthConstants.SYSTEM_RESOURCE_PROBE);

    private final HealthAggregator healthAggregator;

    @GetMapping
    public ResponseEntity<CompositeHealthReport> getHealth(
            @RequestParam(defaultValue = "false") boolean refresh) {
        CompositeHealthReport report = refresh ? healthAggregator.refresh() : healthAggregator.getReport();
        log.debug("GET /v1/health: status={}, duration={}ms", report.getOverallStatus(), report.getCheckDurationMs());

        return ResponseEntity.status(httpStatusOf(report.getOverallStatus()))
                .header(STATUS_HEADER, report.getOverallStatus().name())
                .header(DURATION_HEADER, report.getCheckDurationMs() + "ms")
                .body(report);
    }

    @GetMapping("/live")
    public ResponseEntity<Map<String, Object>> live() {
        return ResponseEntity.ok(Map.of("status", "UP", "timestamp", Instant.now()));
    }

    @GetMapping("/ready")
    public ResponseEntity<ProbeResult> ready() {
        return healthAggregator.checkProbe(HealthConstants.STORE_PROBE)
                .map(result -> ResponseEntity
                        .status(result.getStatus().isOperational() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                        .header(STATUS_HEADER, result.getStatus().name())
                        .body(result))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
    }

    @GetMapping("/{probe}")
    public ResponseEntity<ProbeResult> getProbe(@PathVariable String probe) {
        String name = PROBE_ALIASES.getOrDefault(probe, probe);
        log.debug("GET /v1/health/{}", name);

        return healthAggregator.checkProbe(name)
                .map(result -> ResponseEntity.status(httpStatusOf(result.getStatus()))
                        .header(STATUS_HEADER, result.getStatus().name())
                        .header(DURATION_HEADER, result.getResponseTimeMs() + "ms")
                        .body(result))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    static HttpStatus httpStatusOf(HealthStatus status) {
        return switch (status) {
            case HEALTHY, DEGRADED -> HttpStatus.OK;
            case UNHEALTHY, CRITICAL -> HttpStatus.SERVICE_UNAVAILABLE;
            case ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
