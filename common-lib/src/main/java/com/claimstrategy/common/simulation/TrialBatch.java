package com.claimstrategy.common.simulation;

import com.claimstrategy.common.scenario.ScenarioType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcomes of one partition of trials.
 *
 * <p>Mutable while its worker fills it; never shared between workers. Raw
 * {@link SimulationTrial} records are kept only when retention is requested,
 * the value/time/cost columns are always kept for aggregation.
 */
public final class TrialBatch {

    private final double[] values;
    private final double[] times;
    private final double[] costs;
    private final int[] counts = new int[ScenarioType.values().length];
    private final List<SimulationTrial> trials;
    private int size;

    public TrialBatch(int capacity, boolean retainTrials) {
        this.values = new double[capacity];
        this.times  = new double[capacity];
        this.costs  = new double[capacity];
        this.trials = retainTrials ? new ArrayList<>(capacity) : null;
    }

    public void record(SimulationTrial trial) {
        values[size] = trial.value();
        times[size]  = trial.timeDays();
        costs[size]  = trial.cost();
        counts[trial.scenarioType().ordinal()]++;
        if (trials != null) trials.add(trial);
        size++;
    }

    public int size() {
        return size;
    }

    /**
     * Concatenates batches in list order. Merging in worker-index order keeps
     * floating-point sums identical between runs with the same seed.
     */
    public static TrialBatch merge(List<TrialBatch> batches) {
        if (batches.size() == 1) return batches.get(0);
        int total = 0;
        boolean retain = true;
        for (TrialBatch b : batches) {
            total += b.size;
            retain &= b.trials != null;
        }
        TrialBatch merged = new TrialBatch(total, retain);
        for (TrialBatch b : batches) {
            System.arraycopy(b.values, 0, merged.values, merged.size, b.size);
            System.arraycopy(b.times,  0, merged.times,  merged.size, b.size);
            System.arraycopy(b.costs,  0, merged.costs,  merged.size, b.size);
            for (int i = 0; i < merged.counts.length; i++) merged.counts[i] += b.counts[i];
            if (retain) merged.trials.addAll(b.trials);
            merged.size += b.size;
        }
        return merged;
    }

    double[] values() {
        return Arrays.copyOf(values, size);
    }

    double[] times() {
        return Arrays.copyOf(times, size);
    }

    double[] costs() {
        return Arrays.copyOf(costs, size);
    }

    Map<ScenarioType, Integer> outcomeCounts() {
        Map<ScenarioType, Integer> out = new EnumMap<>(ScenarioType.class);
        for (ScenarioType type : ScenarioType.values()) {
            out.put(type, counts[type.ordinal()]);
        }
        return Collections.unmodifiableMap(out);
    }

    List<SimulationTrial> trials() {
        return trials == null ? List.of() : List.copyOf(trials);
    }
}
