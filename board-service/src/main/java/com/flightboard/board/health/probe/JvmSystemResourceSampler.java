package com.flightboard.board.health.probe;

import com.flightboard.board.constants.HealthConstants;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Samples the running JVM through the platform MXBeans. CPU is the process CPU time consumed
 * over a fixed window, divided by wall time and processor count.
 */
@Component
public class JvmSystemResourceSampler implements SystemResourceSampler {

    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final ThreadMXBean threadBean = ManagementFactory.getThreadMXBean();
    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public SystemResourceSample sample() throws IOException, InterruptedException {
        FileStore store = Files.getFileStore(Path.of("").toAbsolutePath());
        long total = store.getTotalSpace();
        long usable = store.getUsableSpace();

        return SystemResourceSample.builder()
                .cpuPercent(sampleCpuPercent())
                .heapUsedBytes(memoryBean.getHeapMemoryUsage().getUsed())
                .nonHeapUsedBytes(memoryBean.getNonHeapMemoryUsage().getUsed())
                .heapMaxBytes(memoryBean.getHeapMemoryUsage().getMax())
                .diskTotalBytes(total)
                .diskUsableBytes(usable)
                .diskUsagePercent(total > 0 ? round((total - usable) * 100.0 / total) : 0.0)
                .liveThreads(threadBean.getThreadCount())
                .peakThreads(threadBean.getPeakThreadCount())
                .daemonThreads(threadBean.getDaemonThreadCount())
                .availableProcessors(osBean.getAvailableProcessors())
                .build();
    }

    private double sampleCpuPercent() throws InterruptedException {
        if (!(osBean instanceof com.sun.management.OperatingSystemMXBean)) {
            // no process CPU time on this JVM; fall back to the load average share
            double load = osBean.getSystemLoadAverage();
            return load < 0 ? 0.0 : round(Math.min(100.0, load * 100.0 / osBean.getAvailableProcessors()));
        }
        com.sun.management.OperatingSystemMXBean processBean = (com.sun.management.OperatingSystemMXBean) osBean;

        long cpuStart = processBean.getProcessCpuTime();
        long wallStart = System.nanoTime();
        Thread.sleep(HealthConstants.CPU_SAMPLE_WINDOW.toMillis());
        long cpuUsed = processBean.getProcessCpuTime() - cpuStart;
        long wallElapsed = System.nanoTime() - wallStart;

        if (cpuStart < 0 || wallElapsed <= 0) {
            return 0.0;
        }
        return round(cpuUsed * 100.0 / ((double) wallElapsed * osBean.getAvailableProcessors()));
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
