package com.flightboard.board.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightboard.board.cache.CacheValueCodec;
import com.flightboard.board.cache.LocalOnlyCacheGateway;
import com.flightboard.board.cache.tier.LocalCacheTier;
import com.flightboard.board.dto.FlightEntry;
import com.flightboard.board.enums.FlightStatus;
import com.flightboard.board.exception.FlightBoardValidationException;
import com.flightboard.board.statistics.CacheStatisticsTracker;
import com.flightboard.board.tracking.PerformanceTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CachedFlightService")
class CachedFlightServiceTest {

    private static final LocalDateTime DEPARTURE = LocalDateTime.of(2026, 3, 14, 9, 30);

    @Mock
    private FlightService flightService;

    private SimpleMeterRegistry registry;
    private CacheStatisticsTracker statisticsTracker;
    private CachedFlightService cachedFlightService;

    private FlightEntry flight;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        statisticsTracker = new CacheStatisticsTracker();
        LocalOnlyCacheGateway gateway = new LocalOnlyCacheGateway(
                new LocalCacheTier(1_000, Duration.ofMinutes(5)),
                statisticsTracker,
                new CacheValueCodec(new ObjectMapper().findAndRegisterModules()));
        cachedFlightService = new CachedFlightService(flightService, gateway, new PerformanceTracker(registry));

        flight = FlightEntry.builder()
                .id(1L)
                .flightNumber("AI101")
                .airline("AI")
                .origin("DEL")
                .destination("BLR")
                .scheduledDeparture(DEPARTURE)
                .scheduledArrival(DEPARTURE.plusHours(3))
                .status("DELAYED")
                .delayMinutes(20)
                .build();
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("loads a flight once and serves it from cache afterwards")
        void cachesFlightById() {
            when(flightService.getFlightById(1L)).thenReturn(flight);

            FlightEntry first = cachedFlightService.getFlightById(1L);
            FlightEntry second = cachedFlightService.getFlightById(1L);

            assertThat(first).isEqualTo(flight);
            assertThat(second).isEqualTo(flight);
            verify(flightService, times(1)).getFlightById(1L);
            assertThat(statisticsTracker.getSnapshot().getMemory().getHits()).isEqualTo(1);
        }

        @Test
        @DisplayName("caches status lists under a normalized key")
        void cachesStatusLists() {
            when(flightService.getFlightsByStatus(FlightStatus.DELAYED)).thenReturn(List.of(flight));

            cachedFlightService.getFlightsByStatus("delayed");
            List<FlightEntry> again = cachedFlightService.getFlightsByStatus("DELAYED");

            assertThat(again).containsExactly(flight);
            verify(flightService, times(1)).getFlightsByStatus(FlightStatus.DELAYED);
        }

        @Test
        @DisplayName("rejects an unknown status without loading")
        void rejectsUnknownStatus() {
            assertThatThrownBy(() -> cachedFlightService.getFlightsByStatus("hovering"))
                    .isInstanceOf(FlightBoardValidationException.class);
            verify(flightService, never()).getFlightsByStatus(any());
        }

        @Test
        @DisplayName("times reads as operations")
        void timesReads() {
            when(flightService.getFlightsByDepartureDate(any())).thenReturn(List.of());

            cachedFlightService.getFlightsByDepartureDate(LocalDate.of(2026, 3, 14));

            assertThat(registry.get("board.operation.duration")
                    .tag("operation", "flights.by-departure-date").timer().count()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("writes")
    class Writes {

        @Test
        @DisplayName("status update drops the flight and every cached list")
        void statusUpdateInvalidates() {
            when(flightService.getFlightById(1L)).thenReturn(flight);
            when(flightService.getFlightsByStatus(FlightStatus.DELAYED)).thenReturn(List.of(flight));
            FlightEntry boarding = FlightEntry.builder().id(1L).flightNumber("AI101").status("BOARDING").build();
            when(flightService.updateFlightStatus(1L, "boarding")).thenReturn(boarding);

            cachedFlightService.getFlightById(1L);
            cachedFlightService.getFlightsByStatus("DELAYED");
            cachedFlightService.updateFlightStatus(1L, "boarding");
            cachedFlightService.getFlightById(1L);
            cachedFlightService.getFlightsByStatus("DELAYED");

            verify(flightService, times(2)).getFlightById(1L);
            verify(flightService, times(2)).getFlightsByStatus(FlightStatus.DELAYED);
            assertThat(registry.get("flight.status.updated").tag("status", "BOARDING").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("create drops cached lists and tracks an event")
        void createInvalidatesLists() {
            when(flightService.getFlightsByArrivalDate(any())).thenReturn(List.of());
            when(flightService.createFlight(any())).thenReturn(flight);

            cachedFlightService.getFlightsByArrivalDate(LocalDate.of(2026, 3, 14));
            cachedFlightService.createFlight(flight);
            cachedFlightService.getFlightsByArrivalDate(LocalDate.of(2026, 3, 14));

            verify(flightService, times(2)).getFlightsByArrivalDate(eq(LocalDate.of(2026, 3, 14)));
            assertThat(registry.get("flight.created").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("delete drops the cached flight")
        void deleteInvalidatesFlight() {
            when(flightService.getFlightById(1L)).thenReturn(flight);

            cachedFlightService.getFlightById(1L);
            cachedFlightService.deleteFlight(1L);
            cachedFlightService.getFlightById(1L);

            verify(flightService).deleteFlight(1L);
            verify(flightService, times(2)).getFlightById(1L);
        }
    }
}
