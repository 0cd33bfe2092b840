package com.claimstrategy.common.equilibrium;

import com.claimstrategy.common.model.OpponentProfile;
import com.claimstrategy.common.valuation.ExpectedValueReport;

import java.util.Map;

/**
 * Picks the claimant's strategy against the opponent's inferred behavior.
 *
 * <h3>Opponent classification</h3>
 * <pre>
 *   settlementRate &gt; 0.7 → SETTLE_QUICK
 *   settlementRate &lt; 0.3 → FIGHT_TO_TRIAL
 *   otherwise            → NEGOTIATE   (unknown profile = 0.5)
 * </pre>
 *
 * <p>This is a single best response to one fixed opponent strategy, not a Nash
 * equilibrium: the opponent is never allowed to respond in turn. A mutual fixed
 * point would need iterated best responses or an exact solve of the matrix game.
 *
 * <p>Stateless; the payoff matrix is built and discarded per call.
 */
public final class BestResponseSelector {

    private static final double SETTLE_QUICK_ABOVE   = 0.7;
    private static final double FIGHT_TO_TRIAL_BELOW = 0.3;

    private static final Map<ClaimantStrategy, Map<OpponentStrategy, String>> EXPLANATIONS = Map.of(
        ClaimantStrategy.AGGRESSIVE_LITIGATION, Map.of(
            OpponentStrategy.SETTLE_QUICK,   "Press hard - they cave easily. Maximize settlement value.",
            OpponentStrategy.NEGOTIATE,      "Strong position - they want to talk. Negotiate from strength.",
            OpponentStrategy.FIGHT_TO_TRIAL, "Prepare for battle - they won't back down easily."),
        ClaimantStrategy.MODERATE_APPROACH, Map.of(
            OpponentStrategy.SETTLE_QUICK,   "Match their pace - settle quickly but fairly.",
            OpponentStrategy.NEGOTIATE,      "Perfect match - productive negotiations likely.",
            OpponentStrategy.FIGHT_TO_TRIAL, "Prepare for trial but keep settlement door open."),
        ClaimantStrategy.SETTLEMENT_FOCUSED, Map.of(
            OpponentStrategy.SETTLE_QUICK,   "Quick resolution - both sides want out.",
            OpponentStrategy.NEGOTIATE,      "We want settlement - negotiate aggressively.",
            OpponentStrategy.FIGHT_TO_TRIAL, "Mismatch - may need to get more aggressive.")
    );

    public EquilibriumResult select(ExpectedValueReport report, OpponentProfile opponent) {
        OpponentStrategy theirs = classifyOpponent(opponent);
        PayoffMatrix matrix = PayoffMatrix.seededFrom(report.optimal().expectedValue());
        ClaimantStrategy ours = matrix.bestResponseTo(theirs);
        return new EquilibriumResult(ours, theirs, explain(ours, theirs), matrix);
    }

    public static OpponentStrategy classifyOpponent(OpponentProfile opponent) {
        double rate = opponent != null ? opponent.settlementRate() : OpponentProfile.UNKNOWN_SETTLEMENT_RATE;
        if (rate > SETTLE_QUICK_ABOVE)   return OpponentStrategy.SETTLE_QUICK;
        if (rate < FIGHT_TO_TRIAL_BELOW) return OpponentStrategy.FIGHT_TO_TRIAL;
        return OpponentStrategy.NEGOTIATE;
    }

    static String explain(ClaimantStrategy ours, OpponentStrategy theirs) {
        return EXPLANATIONS.get(ours).get(theirs);
    }
}
