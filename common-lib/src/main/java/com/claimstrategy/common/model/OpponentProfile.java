package com.claimstrategy.common.model;

import com.claimstrategy.common.exception.InvalidProbabilityException;

/**
 * Behavioral signal about the respondent, currently its historical settlement rate.
 */
public record OpponentProfile(double settlementRate) {

    public static final double UNKNOWN_SETTLEMENT_RATE = 0.5;

    public OpponentProfile {
        if (Double.isNaN(settlementRate) || settlementRate < 0.0 || settlementRate > 1.0) {
            throw new InvalidProbabilityException("opponentSettlementRate", settlementRate);
        }
    }

    public static OpponentProfile unknown() {
        return new OpponentProfile(UNKNOWN_SETTLEMENT_RATE);
    }

    /** @param settlementRate nullable; {@code null} means no profile is available */
    public static OpponentProfile ofNullable(Double settlementRate) {
        return settlementRate == null ? unknown() : new OpponentProfile(settlementRate);
    }
}
