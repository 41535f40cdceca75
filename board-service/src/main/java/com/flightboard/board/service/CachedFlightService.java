package com.flightboard.board.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flightboard.board.cache.CacheGateway;
import com.flightboard.board.constants.CacheConstants;
import com.flightboard.board.dto.FlightEntry;
import com.flightboard.board.enums.FlightStatus;
import com.flightboard.board.tracking.PerformanceTracker;
import com.flightboard.board.validator.FlightValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Cache-aside layer over {@link FlightService}. Reads go through the cache gateway; every
 * write drops the affected flight key and all cached flight lists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CachedFlightService {

    private static final TypeReference<List<FlightEntry>> FLIGHT_LIST = new TypeReference<>() {
    };

    private final FlightService flightService;
    private final CacheGateway cacheGateway;
    private final PerformanceTracker performanceTracker;

    // ========== Queries ==========

    public FlightEntry getFlightById(Long id) {
        FlightValidator.validateFlightId(id);
        return performanceTracker.trackOperation("flights.get-by-id", () ->
                cacheGateway.getOrSet(flightKey(id), FlightEntry.class, CacheConstants.FLIGHT_TTL,
                        () -> flightService.getFlightById(id)));
    }

    public List<FlightEntry> getFlightsByStatus(String status) {
        FlightStatus parsed = FlightStatus.parse(status);
        String key = String.format(CacheConstants.FLIGHTS_BY_STATUS_KEY, parsed.cacheSegment());
        return performanceTracker.trackOperation("flights.by-status", () ->
                cacheGateway.getOrSet(key, FLIGHT_LIST, CacheConstants.FLIGHT_LIST_TTL,
                        () -> flightService.getFlightsByStatus(parsed)));
    }

    public List<FlightEntry> getFlightsByDepartureDate(LocalDate date) {
        FlightValidator.validateDate(date);
        String key = String.format(CacheConstants.FLIGHTS_BY_DEPARTURE_KEY, date);
        return performanceTracker.trackOperation("flights.by-departure-date", () ->
                cacheGateway.getOrSet(key, FLIGHT_LIST, CacheConstants.FLIGHT_LIST_TTL,
                        () -> flightService.getFlightsByDepartureDate(date)));
    }

    public List<FlightEntry> getFlightsByArrivalDate(LocalDate date) {
        FlightValidator.validateDate(date);
        String key = String.format(CacheConstants.FLIGHTS_BY_ARRIVAL_KEY, date);
        return performanceTracker.trackOperation("flights.by-arrival-date", () ->
                cacheGateway.getOrSet(key, FLIGHT_LIST, CacheConstants.FLIGHT_LIST_TTL,
                        () -> flightService.getFlightsByArrivalDate(date)));
    }

    // ========== Commands ==========

    public FlightEntry createFlight(FlightEntry request) {
        FlightEntry created = performanceTracker.trackOperation("flights.create",
                () -> flightService.createFlight(request));
        invalidateLists();
        performanceTracker.trackEvent("flight.created");
        log.info("Flight created: id={}, cache invalidated", created.getId());
        return created;
    }

    public FlightEntry updateFlight(Long id, FlightEntry request) {
        FlightEntry updated = performanceTracker.trackOperation("flights.update",
                () -> flightService.updateFlight(id, request));
        invalidate(id);
        performanceTracker.trackEvent("flight.updated");
        log.info("Flight updated: id={}, cache invalidated", id);
        return updated;
    }

    public FlightEntry updateFlightStatus(Long id, String status) {
        FlightEntry updated = performanceTracker.trackOperation("flights.update-status",
                () -> flightService.updateFlightStatus(id, status));
        invalidate(id);
        performanceTracker.trackEvent("flight.status.updated", Map.of("status", updated.getStatus()));
        log.info("Flight status updated: id={}, status={}, cache invalidated", id, updated.getStatus());
        return updated;
    }

    public void deleteFlight(Long id) {
        performanceTracker.trackOperation("flights.delete", () -> flightService.deleteFlight(id));
        invalidate(id);
        performanceTracker.trackEvent("flight.deleted");
        log.info("Flight deleted: id={}, cache invalidated", id);
    }

    // ========== Private ==========

    private void invalidate(Long id) {
        cacheGateway.remove(flightKey(id));
        invalidateLists();
    }

    private void invalidateLists() {
        long removed = cacheGateway.removeByPattern(CacheConstants.FLIGHT_LISTS_PATTERN);
        log.debug("Invalidated {} cached flight lists", removed);
    }

    private static String flightKey(Long id) {
        return String.format(CacheConstants.FLIGHT_KEY, id);
    }
}
