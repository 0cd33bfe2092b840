package com.claimstrategy.common.scenario;

/**
 * The seven canonical terminal outcomes of a claim.
 *
 * <p>Declaration order is significant: the expected-value ranking breaks ties by it.
 */
public enum ScenarioType {
    DEFAULT_JUDGMENT    ("Default Judgment",          "Defendant fails to respond - automatic win"),
    EARLY_SETTLEMENT    ("Early Settlement",          "Settle before discovery - quick but cheap"),
    MID_SETTLEMENT      ("Post-Discovery Settlement", "Settle after discovery - good value"),
    LATE_SETTLEMENT     ("Pre-Trial Settlement",      "Settle week before trial - near full value"),
    TRIAL_WIN           ("Trial Victory",             "Win at trial - full damages + fees"),
    TRIAL_LOSS          ("Trial Loss",                "Lose at trial - nothing recovered"),
    SUMMARY_JUDGMENT_WIN("Summary Judgment Win",      "Win on MSJ - quick full victory");

    private final String label;
    private final String description;

    ScenarioType(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public boolean isSettlement() {
        return this == EARLY_SETTLEMENT || this == MID_SETTLEMENT || this == LATE_SETTLEMENT;
    }

    /** Every outcome except a trial loss returns value to the claimant. */
    public boolean recoversValue() {
        return this != TRIAL_LOSS;
    }
}
