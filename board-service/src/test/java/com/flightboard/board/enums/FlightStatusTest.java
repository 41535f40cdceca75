package com.flightboard.board.enums;

import com.flightboard.board.exception.FlightBoardValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FlightStatus")
class FlightStatusTest {

    @Test
    @DisplayName("parses case-insensitively with dashes or underscores")
    void parsesLeniently() {
        assertThat(FlightStatus.parse("delayed")).isEqualTo(FlightStatus.DELAYED);
        assertThat(FlightStatus.parse(" In-Flight ")).isEqualTo(FlightStatus.IN_FLIGHT);
        assertThat(FlightStatus.parse("IN_FLIGHT")).isEqualTo(FlightStatus.IN_FLIGHT);
    }

    @Test
    @DisplayName("rejects blank and unknown statuses")
    void rejectsInvalid() {
        assertThatThrownBy(() -> FlightStatus.parse(" "))
                .isInstanceOf(FlightBoardValidationException.class)
                .hasMessageContaining("required");
        assertThatThrownBy(() -> FlightStatus.parse("teleported"))
                .isInstanceOf(FlightBoardValidationException.class)
                .hasMessageContaining("teleported");
    }

    @Test
    @DisplayName("uses the lower-case name as cache key segment")
    void cacheSegment() {
        assertThat(FlightStatus.IN_FLIGHT.cacheSegment()).isEqualTo("in_flight");
    }
}
