package com.flightboard.board.model;

import com.flightboard.board.enums.FlightStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Entity
@Table(name = "flights", indexes = {
        @Index(name = "idx_flight_number", columnList = "flight_number"),
        @Index(name = "idx_scheduled_departure", columnList = "scheduled_departure"),
        @Index(name = "idx_scheduled_arrival", columnList = "scheduled_arrival"),
        @Index(name = "idx_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Flight {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    Long id;

    @Column(name = "flight_number", nullable = false, length = 10)
    String flightNumber;

    @Column(name = "airline", nullable = false, length = 3)
    String airline;

    @Column(name = "origin", nullable = false, length = 3)
    String origin;

    @Column(name = "destination", nullable = false, length = 3)
    String destination;

    @Column(name = "scheduled_departure", nullable = false)
    LocalDateTime scheduledDeparture;

    @Column(name = "scheduled_arrival", nullable = false)
    LocalDateTime scheduledArrival;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "VARCHAR(20)")
    @Builder.Default
    FlightStatus status = FlightStatus.SCHEDULED;

    @Column(name = "gate", length = 10)
    String gate;

    @Column(name = "terminal", length = 20)
    String terminal;

    @Column(name = "delay_minutes", nullable = false)
    @Builder.Default
    Integer delayMinutes = 0;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
