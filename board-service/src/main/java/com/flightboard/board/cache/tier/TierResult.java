package com.flightboard.board.cache.tier;

import com.flightboard.board.exception.TransientDependencyException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one call against one tier. Failures are values, so the gateway's fallback
 * is ordinary control flow rather than exception handling.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TierResult {

    public enum Outcome {
        HIT,
        MISS,
        DONE,
        FAILED
    }

    private static final TierResult MISS = new TierResult(Outcome.MISS, null, 0, null);

    Outcome outcome;
    String value;
    long affected;
    TransientDependencyException failure;

    public static TierResult hit(String value) {
        return new TierResult(Outcome.HIT, value, 1, null);
    }

    public static TierResult miss() {
        return MISS;
    }

    public static TierResult done(long affected) {
        return new TierResult(Outcome.DONE, null, affected, null);
    }

    public static TierResult failed(TransientDependencyException failure) {
        return new TierResult(Outcome.FAILED, null, 0, failure);
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
