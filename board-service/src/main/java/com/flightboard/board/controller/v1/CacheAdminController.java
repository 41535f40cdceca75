package com.flightboard.board.controller.v1;

import com.flightboard.board.dto.CacheStatisticsResponse;
import com.flightboard.board.service.CacheAdminService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/admin/cache")
public class CacheAdminController {

    private final CacheAdminService cacheAdminService;

    @GetMapping("/statistics")
    public ResponseEntity<CacheStatisticsResponse> getStatistics() {
        log.debug("GET /v1/admin/cache/statistics");
        return ResponseEntity.ok(cacheAdminService.getStatistics());
    }

    @PostMapping("/statistics/reset")
    public ResponseEntity<Void> resetStatistics() {
        log.info("POST /v1/admin/cache/statistics/reset");

        cacheAdminService.resetStatistics();

        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> clearAll() {
        log.info("DELETE /v1/admin/cache");

        cacheAdminService.clearAll();

        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/pattern")
    public ResponseEntity<Map<String, Object>> clearByPattern(@RequestParam String pattern) {
        log.info("DELETE /v1/admin/cache/pattern: pattern={}", pattern);

        long removed = cacheAdminService.clearByPattern(pattern);

        return ResponseEntity.ok(Map.of("pattern", pattern, "removed", removed));
    }
}
