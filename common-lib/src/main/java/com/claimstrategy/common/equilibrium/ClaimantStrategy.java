package com.claimstrategy.common.equilibrium;

import com.fasterxml.jackson.annotation.JsonValue;

/** Claimant-side strategies. Declaration order breaks payoff ties. */
public enum ClaimantStrategy {
    AGGRESSIVE_LITIGATION("aggressive-litigation"),
    MODERATE_APPROACH("moderate-approach"),
    SETTLEMENT_FOCUSED("settlement-focused");

    private final String id;

    ClaimantStrategy(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
