package com.claimstrategy.common.simulation;

import com.claimstrategy.common.scenario.ScenarioType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tunable constants of the Monte Carlo branch mapping.
 *
 * <p>The defaults are hand-tuned rates with no empirical citation; callers with
 * better data should override them rather than treat them as ground truth.
 *
 * <h3>Branch mapping</h3>
 * <pre>
 *   r &lt; defaultThreshold          → DEFAULT_JUDGMENT
 *   r &lt; earlySettlementThreshold  → EARLY_SETTLEMENT
 *   r &lt; midSettlementThreshold    → MID_SETTLEMENT
 *   otherwise roll t:
 *     strong case and t &lt; summaryJudgmentThreshold → SUMMARY_JUDGMENT_WIN
 *     t &lt; lateSettlementThreshold                  → LATE_SETTLEMENT
 *     otherwise roll w: w &lt; cs/10 x maxTrialWinProbability → TRIAL_WIN, else TRIAL_LOSS
 * </pre>
 */
public record SimulationParameters(
    double defaultThreshold,
    double earlySettlementThreshold,
    double midSettlementThreshold,
    double summaryJudgmentThreshold,
    double lateSettlementThreshold,
    double maxTrialWinProbability,
    Map<ScenarioType, BranchProfile> branches
) {
    public SimulationParameters {
        if (!(0.0 <= defaultThreshold
              && defaultThreshold <= earlySettlementThreshold
              && earlySettlementThreshold <= midSettlementThreshold
              && midSettlementThreshold <= 1.0)) {
            throw new IllegalArgumentException("primary thresholds must be ascending within [0, 1]");
        }
        if (!(0.0 <= summaryJudgmentThreshold && summaryJudgmentThreshold <= lateSettlementThreshold
              && lateSettlementThreshold <= 1.0)) {
            throw new IllegalArgumentException("secondary thresholds must be ascending within [0, 1]");
        }
        if (maxTrialWinProbability < 0.0 || maxTrialWinProbability > 1.0) {
            throw new IllegalArgumentException("maxTrialWinProbability must lie in [0, 1]");
        }
        EnumMap<ScenarioType, BranchProfile> copy = new EnumMap<>(ScenarioType.class);
        copy.putAll(branches);
        for (ScenarioType type : ScenarioType.values()) {
            if (!copy.containsKey(type)) {
                throw new IllegalArgumentException("missing branch profile for " + type);
            }
        }
        branches = Map.copyOf(copy);
    }

    public static SimulationParameters defaults() {
        Map<ScenarioType, BranchProfile> branches = new EnumMap<>(ScenarioType.class);
        branches.put(ScenarioType.DEFAULT_JUDGMENT,     new BranchProfile(5_000,  60, 15,  1_000,   200));
        branches.put(ScenarioType.EARLY_SETTLEMENT,     new BranchProfile(5_000,  90, 20,  2_500,   500));
        branches.put(ScenarioType.MID_SETTLEMENT,       new BranchProfile(8_000, 240, 40,  8_000, 1_500));
        branches.put(ScenarioType.SUMMARY_JUDGMENT_WIN, new BranchProfile(10_000, 180, 30,  5_000, 1_000));
        branches.put(ScenarioType.LATE_SETTLEMENT,      new BranchProfile(10_000, 330, 45, 12_000, 2_000));
        branches.put(ScenarioType.TRIAL_WIN,            new BranchProfile(15_000, 365, 60, 15_000, 3_000));
        branches.put(ScenarioType.TRIAL_LOSS,           new BranchProfile(0,      365, 60, 15_000, 3_000));
        return new SimulationParameters(0.15, 0.40, 0.75, 0.30, 0.55, 0.75, branches);
    }

    public BranchProfile branch(ScenarioType type) {
        return branches.get(type);
    }
}
