package com.claimstrategy.common.model;

import com.claimstrategy.common.exception.InvalidCaseStrengthException;

/**
 * Case-strength score on the integer scale {@code [0, 10]}.
 *
 * <p>{@link #of(int)} rejects out-of-range scores; {@link #clamped(int)} pulls them
 * back into range. The analysis entry point uses the clamping path and is expected
 * to log the adjustment, so an out-of-range score is never dropped silently.
 */
public record CaseStrength(int value) {

    public static final int MIN = 0;
    public static final int MAX = 10;

    public CaseStrength {
        if (value < MIN || value > MAX) {
            throw new InvalidCaseStrengthException(value);
        }
    }

    public static CaseStrength of(int value) {
        return new CaseStrength(value);
    }

    public static CaseStrength clamped(int value) {
        return new CaseStrength(Math.max(MIN, Math.min(MAX, value)));
    }

    public static boolean inRange(int value) {
        return value >= MIN && value <= MAX;
    }

    /** Score as a fraction of the maximum, in [0.0, 1.0]. */
    public double fraction() {
        return value / (double) MAX;
    }

    /** Strong cases unlock the summary-judgment path. */
    public boolean isStrong() {
        return value > 7;
    }
}
