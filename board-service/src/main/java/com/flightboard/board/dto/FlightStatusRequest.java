package com.flightboard.board.dto;

import com.flightboard.board.constants.ValidationMessages;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightStatusRequest {

    @NotBlank(message = ValidationMessages.STATUS_REQUIRED)
    String status;
}
