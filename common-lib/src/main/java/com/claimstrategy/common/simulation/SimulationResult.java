package com.claimstrategy.common.simulation;

import com.claimstrategy.common.stats.OutcomeStatistics;

import java.util.List;

/**
 * Result of one Monte Carlo run.
 *
 * <p>Keeps an ascending copy of the value distribution so arbitrary percentiles
 * can be read after aggregation. {@link #trials()} is empty unless the run was
 * asked to retain raw trial records.
 */
public final class SimulationResult {

    private final List<SimulationTrial> trials;
    private final SimulationStatistics statistics;
    private final double[] sortedValues;

    SimulationResult(List<SimulationTrial> trials, SimulationStatistics statistics, double[] sortedValues) {
        this.trials = trials;
        this.statistics = statistics;
        this.sortedValues = sortedValues;
    }

    public List<SimulationTrial> trials() {
        return trials;
    }

    public SimulationStatistics statistics() {
        return statistics;
    }

    /** Nearest-rank percentile of the simulated values, {@code p} in [0, 100]. */
    public double percentile(double p) {
        return OutcomeStatistics.percentileOfSorted(sortedValues, p);
    }
}
