package com.claimstrategy.common.simulation;

import com.claimstrategy.common.model.CaseStrength;
import com.claimstrategy.common.model.DamagesRange;
import com.claimstrategy.common.scenario.ScenarioCatalog;
import com.claimstrategy.common.scenario.ScenarioType;
import com.claimstrategy.common.stats.OutcomeStatistics;

import java.util.random.RandomGenerator;

/**
 * Samples single case outcomes for one claim.
 *
 * <p>Holds no random state of its own: every draw comes from the generator passed
 * in, so a sampler can be shared by workers that each own their stream.
 */
public final class TrialSampler {

    private final DamagesRange damages;
    private final CaseStrength strength;
    private final SimulationParameters params;

    public TrialSampler(DamagesRange damages, CaseStrength strength, SimulationParameters params) {
        this.damages = damages;
        this.strength = strength;
        this.params = params;
    }

    /** {@code cs/10 x maxTrialWinProbability}: 0 at strength 0, the configured max at 10. */
    public double trialWinProbability() {
        return strength.fraction() * params.maxTrialWinProbability();
    }

    public ScenarioType pickBranch(RandomGenerator random) {
        double roll = random.nextDouble();
        if (roll < params.defaultThreshold())         return ScenarioType.DEFAULT_JUDGMENT;
        if (roll < params.earlySettlementThreshold()) return ScenarioType.EARLY_SETTLEMENT;
        if (roll < params.midSettlementThreshold())   return ScenarioType.MID_SETTLEMENT;

        double trialRoll = random.nextDouble();
        if (strength.isStrong() && trialRoll < params.summaryJudgmentThreshold()) {
            return ScenarioType.SUMMARY_JUDGMENT_WIN;
        }
        if (trialRoll < params.lateSettlementThreshold()) return ScenarioType.LATE_SETTLEMENT;

        return random.nextDouble() < trialWinProbability()
            ? ScenarioType.TRIAL_WIN
            : ScenarioType.TRIAL_LOSS;
    }

    public SimulationTrial sample(RandomGenerator random) {
        ScenarioType type = pickBranch(random);
        BranchProfile branch = params.branch(type);

        double value = type == ScenarioType.TRIAL_LOSS
            ? 0.0
            : OutcomeStatistics.sampleNormal(random, ScenarioCatalog.value(type, damages), branch.valueStdDev());
        double days = OutcomeStatistics.sampleNormal(random, branch.meanDays(), branch.daysStdDev());
        double cost = OutcomeStatistics.sampleNormal(random, branch.meanCost(), branch.costStdDev());
        return new SimulationTrial(type, value, days, cost);
    }
}
