package com.claimstrategy.common.equilibrium;

import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable 3x3 claimant payoff table, keyed by (claimant strategy, opponent strategy).
 */
public final class PayoffMatrix {

    private final Map<ClaimantStrategy, Map<OpponentStrategy, Double>> cells;

    private PayoffMatrix(Map<ClaimantStrategy, Map<OpponentStrategy, Double>> cells) {
        this.cells = cells;
    }

    /**
     * Seeds every cell with {@code baseValue x multiplier(claimant, opponent)},
     * rounded to the nearest whole unit.
     */
    public static PayoffMatrix seededFrom(double baseValue) {
        Map<ClaimantStrategy, Map<OpponentStrategy, Double>> cells = new EnumMap<>(ClaimantStrategy.class);
        for (ClaimantStrategy ours : ClaimantStrategy.values()) {
            Map<OpponentStrategy, Double> row = new EnumMap<>(OpponentStrategy.class);
            for (OpponentStrategy theirs : OpponentStrategy.values()) {
                row.put(theirs, (double) Math.round(baseValue * multiplier(ours, theirs)));
            }
            cells.put(ours, row);
        }
        return new PayoffMatrix(cells);
    }

    /**
     * <pre>
     *   aggressive-litigation x settle-quick   → 1.20  (they cave, we get more)
     *   settlement-focused    x fight-to-trial → 0.70  (we want out, they fight)
     *   moderate-approach     x anything       → 0.95
     *   otherwise                              → 1.00
     * </pre>
     */
    public static double multiplier(ClaimantStrategy ours, OpponentStrategy theirs) {
        if (ours == ClaimantStrategy.AGGRESSIVE_LITIGATION && theirs == OpponentStrategy.SETTLE_QUICK) {
            return 1.2;
        }
        if (ours == ClaimantStrategy.SETTLEMENT_FOCUSED && theirs == OpponentStrategy.FIGHT_TO_TRIAL) {
            return 0.7;
        }
        if (ours == ClaimantStrategy.MODERATE_APPROACH) {
            return 0.95;
        }
        return 1.0;
    }

    public double payoff(ClaimantStrategy ours, OpponentStrategy theirs) {
        return cells.get(ours).get(theirs);
    }

    /** Claimant strategy with the highest payoff in the opponent's column; first declared wins ties. */
    public ClaimantStrategy bestResponseTo(OpponentStrategy theirs) {
        ClaimantStrategy best = null;
        double bestPayoff = Double.NEGATIVE_INFINITY;
        for (ClaimantStrategy ours : ClaimantStrategy.values()) {
            double payoff = payoff(ours, theirs);
            if (best == null || payoff > bestPayoff) {
                best = ours;
                bestPayoff = payoff;
            }
        }
        return best;
    }

    @Override
    public String toString() {
        return "PayoffMatrix" + cells;
    }
}
