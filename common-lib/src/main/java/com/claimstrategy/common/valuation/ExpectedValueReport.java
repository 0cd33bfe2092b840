package com.claimstrategy.common.valuation;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link ExpectedValueEvaluator}.
 *
 * @param ranked                  valuations sorted by expected value, highest first
 * @param optimal                 head of {@code ranked}
 * @param totalExpectedValue      sum of all expected values
 * @param probabilityWeightedDays duration weighted by base probability
 * @param bestRoi                 highest finite ROI, floored at 0
 * @param bestValuePerDay         highest finite value per day, floored at 0
 */
public record ExpectedValueReport(
    List<ScenarioValuation> ranked,
    ScenarioValuation optimal,
    double totalExpectedValue,
    double probabilityWeightedDays,
    double bestRoi,
    double bestValuePerDay
) {
    public ExpectedValueReport {
        ranked = List.copyOf(ranked);
    }

    /** Highest-ranked settlement scenario, used for timing guidance. */
    public Optional<ScenarioValuation> bestSettlement() {
        return ranked.stream()
            .filter(v -> v.scenario().type().isSettlement())
            .findFirst();
    }
}
