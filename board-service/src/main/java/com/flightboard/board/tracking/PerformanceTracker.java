package com.flightboard.board.tracking;

import com.flightboard.board.validator.MetricValidator;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Validated metric, event and operation tracking published to Micrometer. A local view of
 * everything tracked since startup backs {@link #getSummary()}.
 */
@Service
@Slf4j
public class PerformanceTracker {

    static final String OPERATION_TIMER = "board.operation.duration";

    private final MeterRegistry meterRegistry;
    private final Instant startTime = Instant.now();
    private final ConcurrentMap<String, Double> latestMetrics = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> eventCounts = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, OperationCounters> operations = new ConcurrentHashMap<>();

    public PerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void trackMetric(String name, double value, Map<String, String> tags) {
        MetricValidator.validateMetricName(name);
        MetricValidator.validateMetricValue(value);
        MetricValidator.validateTags(tags);

        publish("metric", name, () -> DistributionSummary.builder(name)
                .tags(toTags(tags))
                .register(meterRegistry)
                .record(value));
        latestMetrics.put(name, value);
        log.debug("Tracked metric: name={}, value={}, tags={}", name, value, tags);
    }

    public void trackEvent(String name, Map<String, String> tags) {
        MetricValidator.validateEventName(name);
        MetricValidator.validateTags(tags);

        publish("event", name, () -> meterRegistry.counter(name, toTags(tags)).increment());
        eventCounts.computeIfAbsent(name, k -> new LongAdder()).increment();
        log.debug("Tracked event: name={}, tags={}", name, tags);
    }

    public void trackEvent(String name) {
        trackEvent(name, Map.of());
    }

    /**
     * Times {@code action} under {@code operation}. Failures of the action are timed too and
     * rethrown; failures of the meter registry are only logged.
     */
    public <T> T trackOperation(String operation, Supplier<T> action) {
        MetricValidator.validateMetricName(operation);
        Timer.Sample sample = Timer.start(meterRegistry);
        long start = System.nanoTime();
        String result = "success";
        try {
            return action.get();
        } catch (RuntimeException e) {
            result = "error";
            throw e;
        } finally {
            String outcome = result;
            publish("operation", operation, () -> sample.stop(Timer.builder(OPERATION_TIMER)
                    .tag("operation", operation)
                    .tag("result", outcome)
                    .register(meterRegistry)));
            operations.computeIfAbsent(operation, k -> new OperationCounters())
                    .record((System.nanoTime() - start) / 1_000_000.0, "error".equals(result));
        }
    }

    public void trackOperation(String operation, Runnable action) {
        trackOperation(operation, () -> {
            action.run();
            return null;
        });
    }

    public PerformanceSummary getSummary() {
        Map<String, Long> events = new TreeMap<>();
        eventCounts.forEach((name, count) -> events.put(name, count.sum()));

        Map<String, OperationStats> operationStats = new TreeMap<>();
        operations.forEach((name, counters) -> operationStats.put(name, counters.toStats()));

        List<OperationStats> active = new ArrayList<>();
        long totalOperations = 0;
        for (OperationStats stats : operationStats.values()) {
            totalOperations += stats.getCount();
            if (stats.getCount() > 0) {
                active.add(stats);
            }
        }

        double overallAverage = active.stream().mapToDouble(OperationStats::getAverageMs).average().orElse(0.0);
        double healthScore = active.stream()
                .mapToDouble(PerformanceTracker::operationScore)
                .average()
                .orElse(100.0);

        return PerformanceSummary.builder()
                .startTime(startTime)
                .uptime(Duration.between(startTime, Instant.now()))
                .metrics(new TreeMap<>(latestMetrics))
                .events(events)
                .operations(operationStats)
                .totalOperations(totalOperations)
                .overallAverageMs(round(overallAverage, 2))
                .performanceHealthScore(round(healthScore, 1))
                .build();
    }

    // ========== Private ==========

    // A meter name already registered with another type or tag set makes Micrometer throw.
    private void publish(String kind, String name, Runnable sink) {
        try {
            sink.run();
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} {} to meter registry: {}", kind, name, e.getMessage());
        }
    }

    private static double operationScore(OperationStats stats) {
        double timeScore = Math.max(0.0, 100.0 - stats.getAverageMs() / 10.0);
        double consistencyScore = Math.max(0.0, 100.0 - (stats.getMaxMs() - stats.getMinMs()) / 20.0);
        return (timeScore + consistencyScore) / 2.0;
    }

    private static Iterable<Tag> toTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Tags.empty();
        }
        List<Tag> result = new ArrayList<>(tags.size());
        tags.forEach((key, value) -> result.add(Tag.of(key, value != null ? value : "")));
        return result;
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static final class OperationCounters {

        private final LongAdder count = new LongAdder();
        private final LongAdder failures = new LongAdder();
        private final DoubleAdder totalMs = new DoubleAdder();
        private final DoubleAccumulator minMs = new DoubleAccumulator(Math::min, Double.POSITIVE_INFINITY);
        private final DoubleAccumulator maxMs = new DoubleAccumulator(Math::max, 0.0);

        void record(double elapsedMs, boolean failed) {
            count.increment();
            if (failed) {
                failures.increment();
            }
            totalMs.add(elapsedMs);
            minMs.accumulate(elapsedMs);
            maxMs.accumulate(elapsedMs);
        }

        OperationStats toStats() {
            long n = count.sum();
            return OperationStats.builder()
                    .count(n)
                    .failures(failures.sum())
                    .averageMs(n > 0 ? round(totalMs.sum() / n, 2) : 0.0)
                    .minMs(n > 0 ? round(minMs.get(), 2) : 0.0)
                    .maxMs(n > 0 ? round(maxMs.get(), 2) : 0.0)
                    .build();
        }
    }
}
