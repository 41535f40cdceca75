package com.flightboard.board.health.probe;

import com.flightboard.board.constants.HealthConstants;
import com.flightboard.board.exception.TransientDependencyException;
import com.flightboard.board.health.HealthProbe;
import com.flightboard.board.health.HealthStatus;
import com.flightboard.board.health.ProbeResult;
import com.flightboard.board.repository.FlightRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Persistent store connectivity plus the latency of one representative query.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class StoreHealthProbe implements HealthProbe {

    private static final String DEPENDENCY = "database";

    private final DataSource dataSource;
    private final FlightRepository flightRepository;

    @Override
    public String name() {
        return HealthConstants.STORE_PROBE;
    }

    @Override
    public ProbeResult check() {
        long start = System.nanoTime();
        Map<String, Object> metadata = new LinkedHashMap<>();

        try (Connection connection = dataSource.getConnection()) {
            metadata.put("provider", connection.getMetaData().getDatabaseProductName());
            if (!connection.isValid(HealthConstants.CONNECTION_VALIDATION_TIMEOUT_SECONDS)) {
                metadata.put("connected", false);
                return unhealthy(start, metadata, "Database connection is not valid");
            }

            long queryStart = System.nanoTime();
            long flightCount = flightRepository.count();
            long queryTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - queryStart);

            metadata.put("connected", true);
            metadata.put("queryTimeMs", queryTimeMs);
            metadata.put("flightCount", flightCount);

            ProbeResult.ProbeResultBuilder result = ProbeResult.builder()
                    .name(name())
                    .responseTimeMs(elapsedMs(start))
                    .metadata(metadata);
            if (queryTimeMs > HealthConstants.SLOW_QUERY_THRESHOLD_MS) {
                return result.status(HealthStatus.DEGRADED)
                        .message("Database is responding slowly")
                        .warning("Slow database queries: " + queryTimeMs + "ms")
                        .build();
            }
            return result.status(HealthStatus.HEALTHY)
                    .message("Database is responsive")
                    .build();
        } catch (SQLException | DataAccessException e) {
            TransientDependencyException failure =
                    new TransientDependencyException(DEPENDENCY, "connectivity check failed", e);
            log.warn("{}: {}", failure.getMessage(), e.getMessage());
            metadata.put("connected", false);
            return unhealthy(start, metadata, e.getMessage());
        }
    }

    private ProbeResult unhealthy(long start, Map<String, Object> metadata, String error) {
        return ProbeResult.builder()
                .name(name())
                .status(HealthStatus.UNHEALTHY)
                .responseTimeMs(elapsedMs(start))
                .metadata(metadata)
                .error(error)
                .message("Database is unreachable")
                .build();
    }

    private static long elapsedMs(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
}
