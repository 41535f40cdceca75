package com.flightboard.board.controller.v1;

import com.flightboard.board.dto.TrackEventRequest;
import com.flightboard.board.dto.TrackMetricRequest;
import com.flightboard.board.tracking.PerformanceSummary;
import com.flightboard.board.tracking.PerformanceTracker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/metrics")
public class MetricsController {

    private final PerformanceTracker performanceTracker;

    @PostMapping
    public ResponseEntity<Void> trackMetric(@Valid @RequestBody TrackMetricRequest request) {
        log.debug("POST /v1/metrics: name={}", request.getName());

        performanceTracker.trackMetric(request.getName(), request.getValue(), request.getTags());

        return ResponseEntity.accepted().build();
    }

    @PostMapping("/events")
    public ResponseEntity<Void> trackEvent(@Valid @RequestBody TrackEventRequest request) {
        log.debug("POST /v1/metrics/events: name={}", request.getName());

        performanceTracker.trackEvent(request.getName(), request.getTags());

        return ResponseEntity.accepted().build();
    }

    @GetMapping("/summary")
    public ResponseEntity<PerformanceSummary> getSummary() {
        return ResponseEntity.ok(performanceTracker.getSummary());
    }
}
