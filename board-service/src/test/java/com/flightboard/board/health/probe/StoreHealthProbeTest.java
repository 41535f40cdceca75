package com.flightboard.board.health.probe;

import com.flightboard.board.health.HealthStatus;
import com.flightboard.board.health.ProbeResult;
import com.flightboard.board.repository.FlightRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("StoreHealthProbe")
class StoreHealthProbeTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private DatabaseMetaData metaData;

    @Mock
    private FlightRepository flightRepository;

    private StoreHealthProbe probe;

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getDatabaseProductName()).thenReturn("PostgreSQL");
        when(connection.isValid(anyInt())).thenReturn(true);
        when(flightRepository.count()).thenReturn(42L);

        probe = new StoreHealthProbe(dataSource, flightRepository);
    }

    @Test
    @DisplayName("is healthy when the store answers quickly")
    void healthy() {
        ProbeResult result = probe.check();

        assertThat(result.getName()).isEqualTo("database");
        assertThat(result.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(result.getMetadata())
                .containsEntry("provider", "PostgreSQL")
                .containsEntry("connected", true)
                .containsEntry("flightCount", 42L);
    }

    @Test
    @DisplayName("is degraded when the query is slow")
    void degradedWhenSlow() {
        when(flightRepository.count()).thenAnswer(inv -> {
            Thread.sleep(1_100);
            return 42L;
        });

        ProbeResult result = probe.check();

        assertThat(result.getStatus()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(result.getWarnings()).singleElement().asString().startsWith("Slow database queries:");
    }

    @Test
    @DisplayName("is unhealthy when the connection is invalid")
    void unhealthyWhenInvalid() throws SQLException {
        when(connection.isValid(anyInt())).thenReturn(false);

        ProbeResult result = probe.check();

        assertThat(result.getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(result.getMetadata()).containsEntry("connected", false);
    }

    @Test
    @DisplayName("is unhealthy when no connection can be obtained")
    void unhealthyWhenUnreachable() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        ProbeResult result = probe.check();

        assertThat(result.getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(result.getError()).isEqualTo("Connection refused");
    }

    @Test
    @DisplayName("is unhealthy when the query fails")
    void unhealthyWhenQueryFails() {
        when(flightRepository.count()).thenThrow(new DataAccessResourceFailureException("relation missing"));

        assertThat(probe.check().getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    }
}
