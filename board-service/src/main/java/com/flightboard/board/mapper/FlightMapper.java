package com.flightboard.board.mapper;

import com.flightboard.board.dto.FlightEntry;
import com.flightboard.board.enums.FlightStatus;
import com.flightboard.board.model.Flight;
import com.flightboard.board.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

public final class FlightMapper {

    private FlightMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static FlightEntry toEntry(Flight flight) {
        if (flight == null) {
            return null;
        }

        return FlightEntry.builder()
                .id(flight.getId())
                .flightNumber(flight.getFlightNumber())
                .airline(flight.getAirline())
                .origin(flight.getOrigin())
                .destination(flight.getDestination())
                .scheduledDeparture(flight.getScheduledDeparture())
                .scheduledArrival(flight.getScheduledArrival())
                .status(flight.getStatus() != null ? flight.getStatus().name() : null)
                .gate(flight.getGate())
                .terminal(flight.getTerminal())
                .delayMinutes(flight.getDelayMinutes())
                .createdAt(flight.getCreatedAt())
                .updatedAt(flight.getUpdatedAt())
                .build();
    }

    public static List<FlightEntry> toEntryList(List<Flight> flights) {
        if (flights == null || flights.isEmpty()) {
            return new ArrayList<>();
        }

        List<FlightEntry> result = new ArrayList<>(flights.size());
        for (Flight flight : flights) {
            result.add(toEntry(flight));
        }
        return result;
    }

    public static Flight toEntity(FlightEntry entry) {
        if (entry == null) {
            return null;
        }

        return Flight.builder()
                .flightNumber(StringUtils.normalizeCode(entry.getFlightNumber()))
                .airline(StringUtils.normalizeCode(entry.getAirline()))
                .origin(StringUtils.normalizeCode(entry.getOrigin()))
                .destination(StringUtils.normalizeCode(entry.getDestination()))
                .scheduledDeparture(entry.getScheduledDeparture())
                .scheduledArrival(entry.getScheduledArrival())
                .status(entry.getStatus() != null ? FlightStatus.parse(entry.getStatus()) : FlightStatus.SCHEDULED)
                .gate(StringUtils.trimToNull(entry.getGate()))
                .terminal(StringUtils.trimToNull(entry.getTerminal()))
                .delayMinutes(entry.getDelayMinutes() != null ? entry.getDelayMinutes() : 0)
                .build();
    }

    public static void updateEntity(Flight flight, FlightEntry entry) {
        if (flight == null || entry == null) {
            return;
        }

        flight.setFlightNumber(StringUtils.normalizeCode(entry.getFlightNumber()));
        flight.setAirline(StringUtils.normalizeCode(entry.getAirline()));
        flight.setOrigin(StringUtils.normalizeCode(entry.getOrigin()));
        flight.setDestination(StringUtils.normalizeCode(entry.getDestination()));
        flight.setScheduledDeparture(entry.getScheduledDeparture());
        flight.setScheduledArrival(entry.getScheduledArrival());
        flight.setGate(StringUtils.trimToNull(entry.getGate()));
        flight.setTerminal(StringUtils.trimToNull(entry.getTerminal()));
        if (entry.getStatus() != null) {
            flight.setStatus(FlightStatus.parse(entry.getStatus()));
        }
        if (entry.getDelayMinutes() != null) {
            flight.setDelayMinutes(entry.getDelayMinutes());
        }
    }
}
