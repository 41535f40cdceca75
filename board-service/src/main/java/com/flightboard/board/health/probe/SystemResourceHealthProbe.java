package com.flightboard.board.health.probe;

import com.flightboard.board.constants.HealthConstants;
import com.flightboard.board.health.HealthProbe;
import com.flightboard.board.health.HealthStatus;
import com.flightboard.board.health.ProbeResult;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Order(4)
@RequiredArgsConstructor
public class SystemResourceHealthProbe implements HealthProbe {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final SystemResourceSampler sampler;

    @Override
    public String name() {
        return HealthConstants.SYSTEM_RESOURCE_PROBE;
    }

    @Override
    public ProbeResult check() throws IOException, InterruptedException {
        long start = System.nanoTime();
        SystemResourceSample sample = sampler.sample();

        List<String> critical = new ArrayList<>();
        List<String> degraded = new ArrayList<>();
        double cpu = sample.getCpuPercent();
        long memory = sample.getUsedMemoryBytes();
        double disk = sample.getDiskUsagePercent();

        if (cpu > HealthConstants.CPU_CRITICAL_PERCENT) {
            critical.add(String.format("High CPU usage: %.1f%%", cpu));
        } else if (cpu > HealthConstants.CPU_DEGRADED_PERCENT) {
            degraded.add(String.format("Elevated CPU usage: %.1f%%", cpu));
        }

        if (memory > HealthConstants.MEMORY_CRITICAL_BYTES) {
            critical.add(String.format("High memory usage: %.1f MB", memory / BYTES_PER_MB));
        } else if (memory > HealthConstants.MEMORY_DEGRADED_BYTES) {
            degraded.add(String.format("Elevated memory usage: %.1f MB", memory / BYTES_PER_MB));
        }

        if (disk > HealthConstants.DISK_CRITICAL_PERCENT) {
            critical.add(String.format("Critical disk usage: %.1f%%", disk));
        } else if (disk > HealthConstants.DISK_DEGRADED_PERCENT) {
            degraded.add(String.format("High disk usage: %.1f%%", disk));
        }

        HealthStatus status = !critical.isEmpty() ? HealthStatus.CRITICAL
                : !degraded.isEmpty() ? HealthStatus.DEGRADED
                : HealthStatus.HEALTHY;

        ProbeResult.ProbeResultBuilder result = ProbeResult.builder()
                .name(name())
                .status(status)
                .responseTimeMs((System.nanoTime() - start) / 1_000_000)
                .metadata(metadata(sample))
                .message(status == HealthStatus.HEALTHY ? "System resources are within limits"
                        : String.join("; ", critical.isEmpty() ? degraded : critical));
        critical.forEach(result::warning);
        degraded.forEach(result::warning);
        return result.build();
    }

    private static Map<String, Object> metadata(SystemResourceSample sample) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("cpuPercent", sample.getCpuPercent());
        metadata.put("usedMemoryMb", Math.round(sample.getUsedMemoryBytes() / BYTES_PER_MB * 100) / 100.0);
        metadata.put("heapUsedMb", Math.round(sample.getHeapUsedBytes() / BYTES_PER_MB * 100) / 100.0);
        metadata.put("nonHeapUsedMb", Math.round(sample.getNonHeapUsedBytes() / BYTES_PER_MB * 100) / 100.0);
        metadata.put("diskUsagePercent", sample.getDiskUsagePercent());
        metadata.put("liveThreads", sample.getLiveThreads());
        metadata.put("peakThreads", sample.getPeakThreads());
        metadata.put("daemonThreads", sample.getDaemonThreads());
        metadata.put("availableProcessors", sample.getAvailableProcessors());
        return metadata;
    }
}
