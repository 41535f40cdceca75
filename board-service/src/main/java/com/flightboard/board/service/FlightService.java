package com.flightboard.board.service;

import com.flightboard.board.constants.ValidationMessages;
import com.flightboard.board.dto.FlightEntry;
import com.flightboard.board.enums.FlightStatus;
import com.flightboard.board.exception.FlightBoardValidationException;
import com.flightboard.board.exception.FlightNotFoundException;
import com.flightboard.board.mapper.FlightMapper;
import com.flightboard.board.model.Flight;
import com.flightboard.board.repository.FlightRepository;
import com.flightboard.board.validator.FlightValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Flight persistence without caching. Callers normally go through {@link CachedFlightService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlightService {

    private final FlightRepository flightRepository;

    // ========== CRUD Operations ==========

    @Transactional
    public FlightEntry createFlight(FlightEntry request) {
        FlightValidator.validateFlightEntry(request);

        Flight flight = FlightMapper.toEntity(request);
        if (flightRepository.existsByFlightNumberAndScheduledDeparture(
                flight.getFlightNumber(), flight.getScheduledDeparture())) {
            throw new FlightBoardValidationException("Flight already exists: " + flight.getFlightNumber()
                    + " departing " + flight.getScheduledDeparture());
        }

        Flight saved = flightRepository.save(flight);
        log.info("Created flight: id={}, number={}, route={}->{}",
                saved.getId(), saved.getFlightNumber(), saved.getOrigin(), saved.getDestination());
        return FlightMapper.toEntry(saved);
    }

    @Transactional
    public FlightEntry updateFlight(Long id, FlightEntry request) {
        FlightValidator.validateFlightId(id);
        FlightValidator.validateFlightEntry(request);

        Flight flight = findFlightOrThrow(id);
        FlightMapper.updateEntity(flight, request);

        Flight saved = flightRepository.save(flight);
        log.info("Updated flight: id={}", id);
        return FlightMapper.toEntry(saved);
    }

    @Transactional
    public FlightEntry updateFlightStatus(Long id, String status) {
        FlightValidator.validateFlightId(id);
        FlightStatus newStatus = FlightStatus.parse(status);

        Flight flight = findFlightOrThrow(id);
        FlightStatus previous = flight.getStatus();
        flight.setStatus(newStatus);

        Flight saved = flightRepository.save(flight);
        log.info("Updated flight status: id={}, {} -> {}", id, previous, newStatus);
        return FlightMapper.toEntry(saved);
    }

    @Transactional
    public void deleteFlight(Long id) {
        FlightValidator.validateFlightId(id);

        Flight flight = findFlightOrThrow(id);
        flightRepository.delete(flight);
        log.info("Deleted flight: id={}", id);
    }

    // ========== Query Operations ==========

    @Transactional(readOnly = true)
    public FlightEntry getFlightById(Long id) {
        FlightValidator.validateFlightId(id);
        return FlightMapper.toEntry(findFlightOrThrow(id));
    }

    @Transactional(readOnly = true)
    public List<FlightEntry> getFlightsByStatus(FlightStatus status) {
        if (status == null) {
            throw new FlightBoardValidationException(ValidationMessages.STATUS_REQUIRED);
        }
        return FlightMapper.toEntryList(flightRepository.findByStatusOrderByScheduledDepartureAsc(status));
    }

    @Transactional(readOnly = true)
    public List<FlightEntry> getFlightsByDepartureDate(LocalDate date) {
        FlightValidator.validateDate(date);
        return FlightMapper.toEntryList(flightRepository.findByScheduledDepartureBetweenOrderByScheduledDepartureAsc(
                startOfDay(date), endOfDay(date)));
    }

    @Transactional(readOnly = true)
    public List<FlightEntry> getFlightsByArrivalDate(LocalDate date) {
        FlightValidator.validateDate(date);
        return FlightMapper.toEntryList(flightRepository.findByScheduledArrivalBetweenOrderByScheduledArrivalAsc(
                startOfDay(date), endOfDay(date)));
    }

    // ========== Private ==========

    private Flight findFlightOrThrow(Long id) {
        return flightRepository.findById(id)
                .orElseThrow(() -> new FlightNotFoundException(id));
    }

    private static LocalDateTime startOfDay(LocalDate date) {
        return date.atStartOfDay();
    }

    private static LocalDateTime endOfDay(LocalDate date) {
        return date.plusDays(1).atStartOfDay().minusNanos(1);
    }
}
