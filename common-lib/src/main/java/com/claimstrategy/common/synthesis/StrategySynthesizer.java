package com.claimstrategy.common.synthesis;

import com.claimstrategy.common.equilibrium.EquilibriumResult;
import com.claimstrategy.common.scenario.ScenarioType;
import com.claimstrategy.common.simulation.SimulationResult;
import com.claimstrategy.common.simulation.SimulationStatistics;
import com.claimstrategy.common.valuation.ExpectedValueReport;
import com.claimstrategy.common.valuation.ScenarioValuation;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Merges the expected-value ranking, the best response and the simulated
 * distribution into one {@link Recommendation}.
 *
 * <h3>Anchors</h3>
 * <pre>
 *   demandAnchor    = p75
 *   targetSettlement = median
 *   acceptanceFloor = p25
 * </pre>
 *
 * <h3>Bottom line (by win rate)</h3>
 * <pre>
 *   &gt; 0.85 → extremely strong   &gt; 0.70 → strong
 *   &gt; 0.55 → moderate           otherwise → weaker
 * </pre>
 *
 * <p>Pure aggregation: no I/O, no randomness. Missing inputs fail fast.
 */
public final class StrategySynthesizer {

    private static final double PRESS_HARD_WIN_RATE = 0.7;
    private static final String FALLBACK_TIMING = "Mid-case settlement recommended";

    public Recommendation synthesize(ExpectedValueReport evReport,
                                     EquilibriumResult equilibrium,
                                     SimulationResult simulation) {
        Objects.requireNonNull(evReport, "evReport");
        Objects.requireNonNull(equilibrium, "equilibrium");
        Objects.requireNonNull(simulation, "simulation");

        SimulationStatistics stats = simulation.statistics();
        ScenarioValuation optimal = evReport.optimal();

        Recommendation.DemandStrategy demand = new Recommendation.DemandStrategy(
            Math.round(stats.percentile75()),
            Math.round(stats.median()),
            Math.round(stats.percentile25()),
            "Demand at 75th percentile, accept above 25th percentile");

        Recommendation.TimingGuidance timing = new Recommendation.TimingGuidance(
            evReport.bestSettlement()
                .map(v -> v.scenario().type().description())
                .orElse(FALLBACK_TIMING),
            Math.round(stats.avgTimeDays()),
            Math.round(stats.avgCost()));

        Recommendation.RiskAssessment risk = new Recommendation.RiskAssessment(
            Math.round(stats.percentile90()),
            Math.round(stats.median()),
            Math.round(stats.percentile10()),
            VolatilityBand.of(stats.stdDev()));

        return new Recommendation(
            optimal.scenario().label(),
            equilibrium.claimantStrategy(),
            equilibrium.opponentStrategy(),
            equilibrium.reasoning(),
            Math.round(optimal.expectedValue()),
            stats.winRate(),
            outcomeShares(stats),
            demand,
            timing,
            tactics(equilibrium, stats),
            risk,
            bottomLine(stats.winRate()));
    }

    static List<String> tactics(EquilibriumResult equilibrium, SimulationStatistics stats) {
        List<String> tactics = new ArrayList<>();
        tactics.add("Use " + equilibrium.claimantStrategy().id() + " approach");
        tactics.add("Start high: demand $" + money(stats.percentile75()));
        tactics.add("Show trial readiness but signal settlement willingness");
        tactics.add(stats.winRate() > PRESS_HARD_WIN_RATE
            ? "Press hard - high win probability"
            : "Be flexible - moderate win probability");
        tactics.add("Don't accept below $" + money(stats.percentile25()));
        return tactics;
    }

    static Map<ScenarioType, Double> outcomeShares(SimulationStatistics stats) {
        Map<ScenarioType, Double> shares = new EnumMap<>(ScenarioType.class);
        for (ScenarioType type : ScenarioType.values()) {
            shares.put(type, stats.share(type));
        }
        return shares;
    }

    static String bottomLine(double winRate) {
        if (winRate > 0.85) return "Extremely strong case. Press hard and don't settle cheap.";
        if (winRate > 0.70) return "Strong case. Negotiate from position of strength.";
        if (winRate > 0.55) return "Moderate case. Balance aggression with settlement flexibility.";
        return "Weaker case. Focus on settlement with reasonable expectations.";
    }

    private static String money(double amount) {
        return String.format(Locale.US, "%,d", Math.round(amount));
    }
}
