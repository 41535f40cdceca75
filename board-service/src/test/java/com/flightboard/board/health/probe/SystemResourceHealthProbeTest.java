package com.flightboard.board.health.probe;

import com.flightboard.board.health.HealthStatus;
import com.flightboard.board.health.ProbeResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("SystemResourceHealthProbe")
class SystemResourceHealthProbeTest {

    private static final long MB = 1024L * 1024L;

    @Mock
    private SystemResourceSampler sampler;

    private ProbeResult check(double cpu, long memoryBytes, double disk) throws Exception {
        when(sampler.sample()).thenReturn(SystemResourceSample.builder()
                .cpuPercent(cpu)
                .heapUsedBytes(memoryBytes)
                .diskUsagePercent(disk)
                .availableProcessors(4)
                .build());
        return new SystemResourceHealthProbe(sampler).check();
    }

    @Test
    @DisplayName("is healthy within all limits")
    void healthy() throws Exception {
        ProbeResult result = check(20.0, 256 * MB, 40.0);

        assertThat(result.getName()).isEqualTo("system-resources");
        assertThat(result.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("is degraded at elevated CPU")
    void degradedCpu() throws Exception {
        ProbeResult result = check(80.0, 256 * MB, 40.0);

        assertThat(result.getStatus()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(result.getWarnings()).singleElement().asString().startsWith("Elevated CPU usage");
    }

    @Test
    @DisplayName("is degraded at high disk usage")
    void degradedDisk() throws Exception {
        ProbeResult result = check(10.0, 256 * MB, 90.0);

        assertThat(result.getStatus()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(result.getWarnings()).singleElement().asString().startsWith("High disk usage");
    }

    @Test
    @DisplayName("is critical when any resource crosses its critical threshold")
    void critical() throws Exception {
        ProbeResult result = check(95.0, 1_600_000_000L, 50.0);

        assertThat(result.getStatus()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(result.getWarnings()).hasSize(2);
        assertThat(result.getWarnings().get(0)).startsWith("High CPU usage");
        assertThat(result.getWarnings().get(1)).startsWith("Elevated memory usage");
    }

    @Test
    @DisplayName("is critical on memory above 2 GB")
    void criticalMemory() throws Exception {
        assertThat(check(10.0, 2_100_000_000L, 10.0).getStatus()).isEqualTo(HealthStatus.CRITICAL);
    }

    @Test
    @DisplayName("propagates sampling failures to the aggregator")
    void propagatesFailures() throws Exception {
        when(sampler.sample()).thenThrow(new java.io.IOException("no file store"));

        assertThatThrownBy(() -> new SystemResourceHealthProbe(sampler).check())
                .isInstanceOf(java.io.IOException.class);
    }
}
