package com.claimstrategy.common.equilibrium;

import com.fasterxml.jackson.annotation.JsonValue;

/** Respondent-side strategies, inferred from the opponent's settlement history. */
public enum OpponentStrategy {
    FIGHT_TO_TRIAL("fight-to-trial"),
    NEGOTIATE("negotiate"),
    SETTLE_QUICK("settle-quick");

    private final String id;

    OpponentStrategy(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
