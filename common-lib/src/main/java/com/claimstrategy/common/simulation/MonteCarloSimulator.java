package com.claimstrategy.common.simulation;

import com.claimstrategy.common.exception.InvalidTrialCountException;
import com.claimstrategy.common.model.CaseStrength;
import com.claimstrategy.common.model.DamagesRange;
import com.claimstrategy.common.scenario.ScenarioType;
import com.claimstrategy.common.stats.OutcomeStatistics;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Runs independent case simulations and aggregates them into a distribution.
 *
 * <p>Two-step contract so trials can be partitioned:
 * <ol>
 *   <li>{@link #runBatch} fills one {@link TrialBatch} from one random stream.
 *       Batches share no mutable state.</li>
 *   <li>{@link #summarize} merges batches in the given order and computes the
 *       statistics in a single pass.</li>
 * </ol>
 * {@link #run} does both sequentially on the caller's thread.
 *
 * <p>All aggregates are order-independent, so how trials are partitioned does not
 * change the percentiles; a fixed seed and partitioning reproduce a run exactly.
 */
public final class MonteCarloSimulator {

    public static final int DEFAULT_TRIALS = 10_000;

    private final SimulationParameters params;

    public MonteCarloSimulator(SimulationParameters params) {
        this.params = params;
    }

    public MonteCarloSimulator() {
        this(SimulationParameters.defaults());
    }

    public SimulationParameters parameters() {
        return params;
    }

    public TrialSampler samplerFor(DamagesRange damages, CaseStrength strength) {
        return new TrialSampler(damages, strength, params);
    }

    public SimulationResult run(DamagesRange damages, CaseStrength strength, int trials,
                                RandomGenerator random, boolean retainTrials) {
        requirePositive(trials);
        TrialBatch batch = runBatch(samplerFor(damages, strength), trials, random, retainTrials);
        return summarize(List.of(batch));
    }

    public TrialBatch runBatch(TrialSampler sampler, int trials, RandomGenerator random, boolean retainTrials) {
        TrialBatch batch = new TrialBatch(trials, retainTrials);
        for (int i = 0; i < trials; i++) {
            batch.record(sampler.sample(random));
        }
        return batch;
    }

    public SimulationResult summarize(List<TrialBatch> batches) {
        TrialBatch all = TrialBatch.merge(batches);

        double[] values = all.values();
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double[] times = all.times();
        double[] costs = all.costs();

        Map<ScenarioType, Integer> counts = all.outcomeCounts();
        int n = all.size();
        double winRate = n == 0 ? 0.0 : (n - counts.get(ScenarioType.TRIAL_LOSS)) / (double) n;

        SimulationStatistics statistics = new SimulationStatistics(
            n,
            OutcomeStatistics.mean(values),
            OutcomeStatistics.median(sorted),
            OutcomeStatistics.stdDev(values),
            OutcomeStatistics.min(values),
            OutcomeStatistics.max(values),
            OutcomeStatistics.percentileOfSorted(sorted, 10),
            OutcomeStatistics.percentileOfSorted(sorted, 25),
            OutcomeStatistics.percentileOfSorted(sorted, 50),
            OutcomeStatistics.percentileOfSorted(sorted, 75),
            OutcomeStatistics.percentileOfSorted(sorted, 90),
            winRate,
            OutcomeStatistics.mean(times),
            OutcomeStatistics.mean(costs),
            counts);

        return new SimulationResult(all.trials(), statistics, sorted);
    }

    /**
     * Splits {@code trials} into at most {@code workers} near-equal partition sizes;
     * the first {@code trials % workers} partitions take one extra trial.
     */
    public static int[] partition(int trials, int workers) {
        requirePositive(trials);
        int effective = Math.max(1, Math.min(workers, trials));
        int[] sizes = new int[effective];
        int base = trials / effective;
        int extra = trials % effective;
        for (int i = 0; i < effective; i++) {
            sizes[i] = base + (i < extra ? 1 : 0);
        }
        return sizes;
    }

    public static void requirePositive(long trials) {
        if (trials < 1) {
            throw new InvalidTrialCountException(trials);
        }
    }
}
