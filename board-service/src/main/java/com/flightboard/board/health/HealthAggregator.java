package com.flightboard.board.health;

import com.flightboard.board.exception.ProbeTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs every registered probe in parallel and folds the results into one report.
 *
 * Each probe is joined against its own absolute deadline (dispatch time plus timeout), so
 * the wall clock of a full check is close to the longest single timeout. A late probe is
 * interrupted and reported as ERROR. Reports are memoized for {@code board.health.report-ttl};
 * callers arriving during a refresh wait for that refresh instead of starting another.
 */
@Service
@Slf4j
public class HealthAggregator {

    static final String TIMED_OUT = "timed out";
    static final String DEADLINE_EXCEEDED = "deadline exceeded";

    private final List<HealthProbe> probes;
    private final ExecutorService executor;
    private final Duration defaultTimeout;
    private final Duration reportTtl;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile CompositeHealthReport cachedReport;
    private volatile long cachedAtNanos;

    public HealthAggregator(
            List<HealthProbe> probes,
            @Qualifier("healthProbeExecutor") ExecutorService executor,
            @Value("${board.health.probe-timeout:PT5S}") Duration defaultTimeout,
            @Value("${board.health.report-ttl:PT30S}") Duration reportTtl) {
        this.probes = List.copyOf(probes);
        this.executor = executor;
        this.defaultTimeout = defaultTimeout;
        this.reportTtl = reportTtl;
        log.info("HealthAggregator initialized: probes={}, defaultTimeout={}, reportTtl={}",
                this.probes.stream().map(HealthProbe::name).toList(), defaultTimeout, reportTtl);
    }

    public CompositeHealthReport getReport() {
        return getReport(null);
    }

    /**
     * @param deadline upper bound for the whole check, or null for probe timeouts only
     */
    public CompositeHealthReport getReport(Duration deadline) {
        CompositeHealthReport report = freshReport();
        if (report != null) {
            return report;
        }

        refreshLock.lock();
        try {
            report = freshReport();
            if (report != null) {
                return report;
            }
            return computeAndCache(deadline);
        } finally {
            refreshLock.unlock();
        }
    }

    public CompositeHealthReport refresh() {
        refreshLock.lock();
        try {
            return computeAndCache(null);
        } finally {
            refreshLock.unlock();
        }
    }

    public Optional<ProbeResult> checkProbe(String name) {
        return probes.stream()
                .filter(probe -> probe.name().equals(name))
                .findFirst()
                .map(probe -> await(dispatch(probe), null));
    }

    public List<String> probeNames() {
        return probes.stream().map(HealthProbe::name).toList();
    }

    // ========== Aggregation ==========

    private CompositeHealthReport computeAndCache(Duration deadline) {
        CompositeHealthReport report = aggregate(deadline);
        boolean cutShort = report.getProbes().stream()
                .anyMatch(result -> DEADLINE_EXCEEDED.equals(result.getError()));
        if (!cutShort) {
            cachedReport = report;
            cachedAtNanos = System.nanoTime();
        }
        return report;
    }

    private CompositeHealthReport aggregate(Duration deadline) {
        Instant timestamp = Instant.now();
        long start = System.nanoTime();
        Long callerDeadline = deadline != null ? start + deadline.toNanos() : null;

        List<Dispatch> dispatches = probes.stream().map(this::dispatch).toList();
        List<ProbeResult> results = new ArrayList<>(dispatches.size());
        for (Dispatch dispatch : dispatches) {
            results.add(await(dispatch, callerDeadline));
        }

        HealthStatus overall = HealthStatus.worst(results.stream().map(ProbeResult::getStatus).toList());
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        if (overall.isOperational()) {
            log.debug("Health check completed: status={}, duration={}ms", overall, durationMs);
        } else {
            log.warn("Health check completed: status={}, duration={}ms", overall, durationMs);
        }

        return CompositeHealthReport.builder()
                .overallStatus(overall)
                .timestamp(timestamp)
                .checkDurationMs(durationMs)
                .probes(List.copyOf(results))
                .summary(summarize(results))
                .build();
    }

    static HealthSummary summarize(List<ProbeResult> results) {
        Set<String> issues = new LinkedHashSet<>();
        Set<String> warnings = new LinkedHashSet<>();
        Set<String> recommendations = new LinkedHashSet<>();

        for (ProbeResult result : results) {
            switch (result.getStatus()) {
                case UNHEALTHY, CRITICAL, ERROR -> issues.add(describeIssue(result));
                case DEGRADED -> {
                    if (result.getWarnings().isEmpty()) {
                        warnings.add(result.getName() + " is degraded");
                    }
                }
                default -> {
                }
            }
            warnings.addAll(result.getWarnings());
            recommendations.addAll(result.getRecommendations());
        }

        return HealthSummary.builder()
                .issues(issues)
                .warnings(warnings)
                .recommendations(recommendations)
                .build();
    }

    private static String describeIssue(ProbeResult result) {
        String detail = result.getError() != null ? result.getError() : result.getMessage();
        return detail != null
                ? result.getName() + " is " + result.getStatus() + ": " + detail
                : result.getName() + " is " + result.getStatus();
    }

    // ========== Dispatch ==========

    private Dispatch dispatch(HealthProbe probe) {
        Duration timeout = probe.timeout().orElse(defaultTimeout);
        long start = System.nanoTime();
        Future<ProbeResult> future;
        try {
            future = executor.submit(() -> runProbe(probe, start));
        } catch (RejectedExecutionException e) {
            log.error("Health probe {} rejected by executor: {}", probe.name(), e.getMessage());
            future = CompletableFuture.completedFuture(ProbeResult.error(probe.name(), 0, "probe executor unavailable"));
        }
        return new Dispatch(probe.name(), timeout, start, future);
    }

    private static ProbeResult runProbe(HealthProbe probe, long start) {
        try {
            ProbeResult result = probe.check();
            if (result == null) {
                return ProbeResult.error(probe.name(), elapsedMs(start), "probe returned no result");
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.error(probe.name(), elapsedMs(start), "interrupted");
        } catch (Exception e) {
            log.warn("Health probe {} failed: {}", probe.name(), e.getMessage());
            return ProbeResult.error(probe.name(), elapsedMs(start), e.getMessage() != null
                    ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private ProbeResult await(Dispatch dispatch, Long callerDeadline) {
        long probeDeadline = dispatch.start + dispatch.timeout.toNanos();
        boolean callerBound = callerDeadline != null && callerDeadline < probeDeadline;
        long deadline = callerBound ? callerDeadline : probeDeadline;

        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return dispatch.future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            dispatch.future.cancel(true);
            if (callerBound) {
                log.warn("Health probe {} cut off by caller deadline", dispatch.name);
                return ProbeResult.error(dispatch.name, elapsedMs(dispatch.start), DEADLINE_EXCEEDED);
            }
            ProbeTimeoutException timeout = new ProbeTimeoutException(dispatch.name, dispatch.timeout);
            log.warn("Health probe {} cancelled: {}", dispatch.name, timeout.getMessage());
            return ProbeResult.error(dispatch.name, dispatch.timeout.toMillis(), TIMED_OUT, timeout);
        } catch (InterruptedException e) {
            dispatch.future.cancel(true);
            Thread.currentThread().interrupt();
            return ProbeResult.error(dispatch.name, elapsedMs(dispatch.start), "interrupted");
        } catch (ExecutionException | CancellationException e) {
            log.warn("Health probe {} aborted: {}", dispatch.name, e.getMessage());
            return ProbeResult.error(dispatch.name, elapsedMs(dispatch.start), "aborted");
        }
    }

    private CompositeHealthReport freshReport() {
        CompositeHealthReport report = cachedReport;
        if (report != null && System.nanoTime() - cachedAtNanos < reportTtl.toNanos()) {
            return report;
        }
        return null;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record Dispatch(String name, Duration timeout, long start, Future<ProbeResult> future) {
    }
}
