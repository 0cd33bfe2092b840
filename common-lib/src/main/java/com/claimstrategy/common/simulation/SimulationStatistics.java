package com.claimstrategy.common.simulation;

import com.claimstrategy.common.scenario.ScenarioType;

import java.util.Map;

/**
 * Distribution summary of a Monte Carlo run over the simulated recovery values,
 * with duration and cost averages for auxiliary reporting.
 *
 * <p>{@code winRate} is the share of trials whose outcome is anything but
 * {@link ScenarioType#TRIAL_LOSS}.
 */
public record SimulationStatistics(
    int    trialCount,
    double mean,
    double median,
    double stdDev,
    double min,
    double max,
    double percentile10,
    double percentile25,
    double percentile50,
    double percentile75,
    double percentile90,
    double winRate,
    double avgTimeDays,
    double avgCost,
    Map<ScenarioType, Integer> outcomeCounts
) {
    public SimulationStatistics {
        outcomeCounts = Map.copyOf(outcomeCounts);
    }

    public int count(ScenarioType type) {
        return outcomeCounts.getOrDefault(type, 0);
    }

    public double share(ScenarioType type) {
        return trialCount == 0 ? 0.0 : count(type) / (double) trialCount;
    }
}
