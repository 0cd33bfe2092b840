package com.claimstrategy.common.valuation;

import com.claimstrategy.common.scenario.Scenario;

/**
 * A scenario annotated with its economics.
 *
 * @param scenario      the valued scenario
 * @param netValue      {@code value - cost}
 * @param expectedValue {@code netValue x baseProbability}
 * @param roi           {@code netValue / cost}; {@link Double#POSITIVE_INFINITY} when cost is zero
 * @param valuePerDay   {@code netValue / durationDays}; {@link Double#POSITIVE_INFINITY} when duration is zero
 */
public record ScenarioValuation(
    Scenario scenario,
    double netValue,
    double expectedValue,
    double roi,
    double valuePerDay
) {
    public boolean hasUndefinedRoi() {
        return Double.isInfinite(roi);
    }
}
