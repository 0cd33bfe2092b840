package com.claimstrategy.common.valuation;

import com.claimstrategy.common.exception.EmptyInputException;
import com.claimstrategy.common.scenario.Scenario;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks scenarios by probability-weighted net value.
 *
 * <h3>Per scenario</h3>
 * <pre>
 *   netValue      = value - cost
 *   expectedValue = netValue x baseProbability
 *   roi           = netValue / cost          (cost 0  → +∞)
 *   valuePerDay   = netValue / durationDays  (0 days → +∞)
 * </pre>
 *
 * <p>Division by zero never throws: the undefined ratio is reported as
 * {@link Double#POSITIVE_INFINITY} so one odd scenario cannot block the ranking.
 *
 * <p>The ranking is a total order. {@link List#sort} is stable, so scenarios with
 * equal expected value keep their catalog declaration order.
 */
public final class ExpectedValueEvaluator {

    private static final Comparator<ScenarioValuation> BY_EXPECTED_VALUE_DESC =
        Comparator.comparingDouble(ScenarioValuation::expectedValue).reversed();

    public ExpectedValueReport evaluate(List<Scenario> scenarios) {
        if (scenarios == null || scenarios.isEmpty()) {
            throw new EmptyInputException("expected value ranking");
        }

        List<ScenarioValuation> ranked = new ArrayList<>(scenarios.size());
        for (Scenario scenario : scenarios) {
            ranked.add(value(scenario));
        }
        ranked.sort(BY_EXPECTED_VALUE_DESC);

        double totalExpectedValue = 0.0;
        double totalProbability   = 0.0;
        double weightedDays       = 0.0;
        double bestRoi            = 0.0;
        double bestValuePerDay    = 0.0;
        for (ScenarioValuation v : ranked) {
            double p = v.scenario().baseProbability();
            totalExpectedValue += v.expectedValue();
            totalProbability   += p;
            weightedDays       += v.scenario().durationDays() * p;
            if (Double.isFinite(v.roi()))         bestRoi = Math.max(bestRoi, v.roi());
            if (Double.isFinite(v.valuePerDay())) bestValuePerDay = Math.max(bestValuePerDay, v.valuePerDay());
        }
        double probabilityWeightedDays = totalProbability > 0.0 ? weightedDays / totalProbability : 0.0;

        return new ExpectedValueReport(ranked, ranked.get(0), totalExpectedValue,
            probabilityWeightedDays, bestRoi, bestValuePerDay);
    }

    static ScenarioValuation value(Scenario scenario) {
        double netValue      = scenario.value() - scenario.cost();
        double expectedValue = netValue * scenario.baseProbability();
        double roi           = safeRatio(netValue, scenario.cost());
        double valuePerDay   = safeRatio(netValue, scenario.durationDays());
        return new ScenarioValuation(scenario, netValue, expectedValue, roi, valuePerDay);
    }

    private static double safeRatio(double numerator, double denominator) {
        return denominator == 0.0 ? Double.POSITIVE_INFINITY : numerator / denominator;
    }
}
