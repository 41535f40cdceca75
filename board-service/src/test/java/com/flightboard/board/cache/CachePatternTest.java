package com.flightboard.board.cache;

import com.flightboard.board.exception.FlightBoardValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CachePattern")
class CachePatternTest {

    @Test
    @DisplayName("star matches any suffix including empty")
    void starMatchesSuffix() {
        CachePattern pattern = CachePattern.of("flights:*");

        assertThat(pattern.matches("flights:status:delayed")).isTrue();
        assertThat(pattern.matches("flights:")).isTrue();
        assertThat(pattern.matches("flight:42")).isFalse();
    }

    @Test
    @DisplayName("question mark matches exactly one character")
    void questionMarkMatchesOne() {
        CachePattern pattern = CachePattern.of("flight:?");

        assertThat(pattern.matches("flight:7")).isTrue();
        assertThat(pattern.matches("flight:")).isFalse();
        assertThat(pattern.matches("flight:42")).isFalse();
    }

    @Test
    @DisplayName("character class matches one listed character")
    void characterClass() {
        CachePattern pattern = CachePattern.of("flight:[1-3]");

        assertThat(pattern.matches("flight:2")).isTrue();
        assertThat(pattern.matches("flight:4")).isFalse();
    }

    @Test
    @DisplayName("dots are literal")
    void dotsAreLiteral() {
        CachePattern pattern = CachePattern.of("board.metrics*");

        assertThat(pattern.matches("board.metrics.latency")).isTrue();
        assertThat(pattern.matches("boardXmetrics")).isFalse();
    }

    @Test
    @DisplayName("null keys never match")
    void nullNeverMatches() {
        assertThat(CachePattern.of("flights:*").matches(null)).isFalse();
    }

    @Test
    @DisplayName("keeps the glob verbatim")
    void keepsGlob() {
        assertThat(CachePattern.of("flights:*").glob()).isEqualTo("flights:*");
    }

    @Test
    @DisplayName("rejects invalid globs")
    void rejectsInvalid() {
        assertThatThrownBy(() -> CachePattern.of("*"))
                .isInstanceOf(FlightBoardValidationException.class);
    }

    @Test
    @DisplayName("rejects a descending range before compiling it")
    void rejectsDescendingRange() {
        assertThatThrownBy(() -> CachePattern.of("flights:[z-a]"))
                .isInstanceOf(FlightBoardValidationException.class);
    }

    @Test
    @DisplayName("range endpoints stay literal inside a class")
    void escapedRangeEndpoints() {
        CachePattern pattern = CachePattern.of("flight:[*-a]");

        assertThat(pattern.matches("flight:5")).isTrue();
        assertThat(pattern.matches("flight:z")).isFalse();
    }
}
