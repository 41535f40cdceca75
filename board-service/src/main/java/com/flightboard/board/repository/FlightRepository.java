package com.flightboard.board.repository;

import com.flightboard.board.enums.FlightStatus;
import com.flightboard.board.model.Flight;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface FlightRepository extends JpaRepository<Flight, Long> {

    List<Flight> findByStatusOrderByScheduledDepartureAsc(FlightStatus status);

    List<Flight> findByScheduledDepartureBetweenOrderByScheduledDepartureAsc(LocalDateTime start, LocalDateTime end);

    List<Flight> findByScheduledArrivalBetweenOrderByScheduledArrivalAsc(LocalDateTime start, LocalDateTime end);

    boolean existsByFlightNumberAndScheduledDeparture(String flightNumber, LocalDateTime scheduledDeparture);
}
