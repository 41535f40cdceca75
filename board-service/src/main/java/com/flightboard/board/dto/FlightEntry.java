package com.flightboard.board.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flightboard.board.constants.ValidationMessages;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlightEntry {

    Long id;

    @NotBlank(message = ValidationMessages.FLIGHT_NUMBER_REQUIRED)
    @Size(max = 10)
    String flightNumber;

    @NotBlank(message = ValidationMessages.AIRLINE_REQUIRED)
    @Size(max = 3)
    String airline;

    @NotBlank(message = ValidationMessages.ORIGIN_REQUIRED)
    @Size(max = 3)
    String origin;

    @NotBlank(message = ValidationMessages.DESTINATION_REQUIRED)
    @Size(max = 3)
    String destination;

    @NotNull(message = ValidationMessages.DEPARTURE_TIME_REQUIRED)
    LocalDateTime scheduledDeparture;

    @NotNull(message = ValidationMessages.ARRIVAL_TIME_REQUIRED)
    LocalDateTime scheduledArrival;

    String status;

    @Size(max = 10)
    String gate;

    @Size(max = 20)
    String terminal;

    @Min(value = 0, message = ValidationMessages.DELAY_NON_NEGATIVE)
    Integer delayMinutes;

    LocalDateTime createdAt;

    LocalDateTime updatedAt;
}
