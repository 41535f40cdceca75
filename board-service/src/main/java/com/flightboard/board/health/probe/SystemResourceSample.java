package com.flightboard.board.health.probe;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SystemResourceSample {

    double cpuPercent;
    long heapUsedBytes;
    long nonHeapUsedBytes;
    long heapMaxBytes;
    double diskUsagePercent;
    long diskTotalBytes;
    long diskUsableBytes;
    int liveThreads;
    int peakThreads;
    int daemonThreads;
    int availableProcessors;

    public long getUsedMemoryBytes() {
        return heapUsedBytes + nonHeapUsedBytes;
    }
}
