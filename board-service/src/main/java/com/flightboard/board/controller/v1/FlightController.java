package com.flightboard.board.controller.v1;

import com.flightboard.board.dto.FlightEntry;
import com.flightboard.board.dto.FlightStatusRequest;
import com.flightboard.board.service.CachedFlightService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/flights")
public class FlightController {

    private final CachedFlightService flightService;

    @PostMapping
    public ResponseEntity<FlightEntry> create(@Valid @RequestBody FlightEntry entry) {
        log.info("POST /v1/flights: number={}, route={}->{}",
                entry.getFlightNumber(), entry.getOrigin(), entry.getDestination());

        FlightEntry created = flightService.createFlight(entry);

        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    public ResponseEntity<FlightEntry> getById(@PathVariable Long id) {
        log.debug("GET /v1/flights/{}", id);
        return ResponseEntity.ok(flightService.getFlightById(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<FlightEntry> update(
            @PathVariable Long id,
            @Valid @RequestBody FlightEntry entry) {
        log.info("PUT /v1/flights/{}", id);
        return ResponseEntity.ok(flightService.updateFlight(id, entry));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<FlightEntry> updateStatus(
            @PathVariable Long id,
            @Valid @RequestBody FlightStatusRequest request) {
        log.info("PATCH /v1/flights/{}/status: status={}", id, request.getStatus());
        return ResponseEntity.ok(flightService.updateFlightStatus(id, request.getStatus()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        log.info("DELETE /v1/flights/{}", id);

        flightService.deleteFlight(id);

        return ResponseEntity.noContent().build();
    }

    @GetMapping("/status/{status}")
    public ResponseEntity<List<FlightEntry>> getByStatus(@PathVariable String status) {
        log.debug("GET /v1/flights/status/{}", status);
        return ResponseEntity.ok(flightService.getFlightsByStatus(status));
    }

    @GetMapping("/departures/{date}")
    public ResponseEntity<List<FlightEntry>> getByDepartureDate(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.debug("GET /v1/flights/departures/{}", date);
        return ResponseEntity.ok(flightService.getFlightsByDepartureDate(date));
    }

    @GetMapping("/arrivals/{date}")
    public ResponseEntity<List<FlightEntry>> getByArrivalDate(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.debug("GET /v1/flights/arrivals/{}", date);
        return ResponseEntity.ok(flightService.getFlightsByArrivalDate(date));
    }
}
