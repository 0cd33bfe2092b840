package com.claimstrategy.common.simulation;

import com.claimstrategy.common.exception.InvalidTrialCountException;
import com.claimstrategy.common.model.CaseStrength;
import com.claimstrategy.common.model.DamagesRange;
import com.claimstrategy.common.scenario.ScenarioType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

class MonteCarloSimulatorTest {

    private static final DamagesRange DAMAGES = DamagesRange.of(30_000, 50_000, 75_000);

    private final MonteCarloSimulator simulator = new MonteCarloSimulator();

    private SimulationResult run(int strength, int trials, long seed) {
        return simulator.run(DAMAGES, CaseStrength.of(strength), trials, new SplittableRandom(seed), false);
    }

    @Nested
    @DisplayName("branch probabilities")
    class Branches {

        @Test
        @DisplayName("strength 0 → trial-win probability 0 and no trial victories")
        void zeroStrength() {
            TrialSampler sampler = simulator.samplerFor(DAMAGES, CaseStrength.of(0));
            assertEquals(0.0, sampler.trialWinProbability(), 1e-12);

            SimulationStatistics stats = run(0, 5_000, 7L).statistics();
            assertEquals(0, stats.count(ScenarioType.TRIAL_WIN));
            assertEquals(0, stats.count(ScenarioType.SUMMARY_JUDGMENT_WIN));
        }

        @Test
        @DisplayName("strength 10 → trial-win probability equals the configured max")
        void maxStrength() {
            TrialSampler sampler = simulator.samplerFor(DAMAGES, CaseStrength.of(10));
            assertEquals(0.75, sampler.trialWinProbability(), 1e-12);
        }

        @Test
        @DisplayName("strength 8 → win rate near 0.955")
        void strongWinRate() {
            assertEquals(0.955, run(8, 10_000, 42L).statistics().winRate(), 0.02);
        }

        @Test
        @DisplayName("strength 0 → win rate near 0.8875 (settlements count as wins)")
        void weakWinRate() {
            assertEquals(0.8875, run(0, 10_000, 42L).statistics().winRate(), 0.02);
        }

        @Test
        @DisplayName("summary judgment only appears for strength above 7")
        void summaryJudgmentGate() {
            assertEquals(0, run(7, 5_000, 3L).statistics().count(ScenarioType.SUMMARY_JUDGMENT_WIN));
            assertTrue(run(8, 5_000, 3L).statistics().count(ScenarioType.SUMMARY_JUDGMENT_WIN) > 0);
        }

        @Test
        @DisplayName("default judgment share near 0.15")
        void defaultShare() {
            assertEquals(0.15, run(5, 10_000, 11L).statistics().share(ScenarioType.DEFAULT_JUDGMENT), 0.02);
        }
    }

    @Nested
    @DisplayName("distribution")
    class Distribution {

        @Test
        @DisplayName("percentiles are ordered")
        void ordered() {
            SimulationStatistics s = run(8, 10_000, 42L).statistics();
            assertTrue(s.min() <= s.percentile10());
            assertTrue(s.percentile10() <= s.percentile25());
            assertTrue(s.percentile25() < s.percentile50());
            assertTrue(s.percentile50() < s.percentile75());
            assertTrue(s.percentile75() <= s.percentile90());
            assertTrue(s.percentile90() <= s.max());
            assertEquals(s.percentile50(), run(8, 10_000, 42L).percentile(50));
        }

        @Test
        @DisplayName("no sampled amount is negative")
        void nonNegative() {
            SimulationResult result = simulator.run(DAMAGES, CaseStrength.of(2), 2_000, new SplittableRandom(5L), true);
            for (SimulationTrial trial : result.trials()) {
                assertTrue(trial.value() >= 0.0);
                assertTrue(trial.timeDays() >= 0.0);
                assertTrue(trial.cost() >= 0.0);
            }
        }

        @Test
        @DisplayName("trial losses are worth exactly zero")
        void lossesAreZero() {
            SimulationResult result = simulator.run(DAMAGES, CaseStrength.of(3), 3_000, new SplittableRandom(9L), true);
            result.trials().stream()
                .filter(t -> t.scenarioType() == ScenarioType.TRIAL_LOSS)
                .forEach(t -> assertEquals(0.0, t.value()));
        }

        @Test
        @DisplayName("outcome counts add up to the trial count")
        void countsAddUp() {
            SimulationStatistics s = run(6, 4_321, 1L).statistics();
            int total = s.outcomeCounts().values().stream().mapToInt(Integer::intValue).sum();
            assertEquals(4_321, total);
            assertEquals(4_321, s.trialCount());
        }

        @Test
        @DisplayName("one trial is a valid run")
        void singleTrial() {
            SimulationStatistics s = run(5, 1, 1L).statistics();
            assertEquals(1, s.trialCount());
            assertEquals(s.min(), s.max());
            assertEquals(0.0, s.stdDev());
        }
    }

    @Nested
    @DisplayName("reproducibility")
    class Reproducibility {

        @Test
        @DisplayName("same seed → identical statistics")
        void sameSeed() {
            assertEquals(run(8, 5_000, 42L).statistics(), run(8, 5_000, 42L).statistics());
        }

        @Test
        @DisplayName("different seeds → different samples")
        void differentSeed() {
            assertNotEquals(run(8, 5_000, 42L).statistics().mean(), run(8, 5_000, 43L).statistics().mean());
        }

        @Test
        @DisplayName("worker 0 stream matches the master seed")
        void workerZeroStream() {
            SimulationResult direct = run(8, 2_000, 99L);
            SimulationResult viaStream = simulator.run(DAMAGES, CaseStrength.of(8), 2_000,
                RandomStreams.forWorker(99L, 0), false);
            assertEquals(direct.statistics(), viaStream.statistics());
        }

        @Test
        @DisplayName("worker streams are not shifted copies of each other")
        void workerStreamsIndependent() {
            RandomGenerator first = RandomStreams.forWorker(42L, 0);
            RandomGenerator second = RandomStreams.forWorker(42L, 1);
            Set<Double> firstDraws = new HashSet<>();
            for (int i = 0; i < 1_000; i++) firstDraws.add(first.nextDouble());
            int shared = 0;
            for (int i = 0; i < 1_000; i++) {
                if (firstDraws.contains(second.nextDouble())) shared++;
            }
            assertEquals(0, shared);
        }

        @Test
        @DisplayName("batches from different workers share almost no trials")
        void workerBatchesDistinct() {
            TrialSampler sampler = simulator.samplerFor(DAMAGES, CaseStrength.of(8));
            List<RandomGenerator> streams = RandomStreams.forWorkers(42L, 3);
            Set<SimulationTrial> seen = new HashSet<>(
                simulator.runBatch(sampler, 5_000, streams.get(0), true).trials());

            for (int worker = 1; worker < streams.size(); worker++) {
                List<SimulationTrial> trials = simulator.runBatch(sampler, 5_000, streams.get(worker), true).trials();
                long duplicates = trials.stream().filter(seen::contains).count();
                assertTrue(duplicates < 5, "worker " + worker + " repeated " + duplicates + " trials");
                seen.addAll(trials);
            }
        }

        @Test
        @DisplayName("forWorkers matches forWorker index by index")
        void forWorkersMatchesForWorker() {
            List<RandomGenerator> streams = RandomStreams.forWorkers(7L, 4);
            for (int i = 0; i < 4; i++) {
                assertEquals(RandomStreams.forWorker(7L, i).nextLong(), streams.get(i).nextLong());
            }
        }

        @Test
        @DisplayName("partitioned batches merged in order are reproducible")
        void partitionedRun() {
            assertEquals(partitioned(77L, 4).statistics(), partitioned(77L, 4).statistics());
            assertEquals(6_000, partitioned(77L, 4).statistics().trialCount());
        }

        private SimulationResult partitioned(long seed, int workers) {
            TrialSampler sampler = simulator.samplerFor(DAMAGES, CaseStrength.of(8));
            int[] sizes = MonteCarloSimulator.partition(6_000, workers);
            List<RandomGenerator> streams = RandomStreams.forWorkers(seed, sizes.length);
            List<TrialBatch> batches = new ArrayList<>();
            for (int i = 0; i < sizes.length; i++) {
                batches.add(simulator.runBatch(sampler, sizes[i], streams.get(i), false));
            }
            return simulator.summarize(batches);
        }
    }

    @Nested
    @DisplayName("partition()")
    class Partition {

        @Test
        @DisplayName("remainder goes to the first partitions")
        void remainder() {
            assertArrayEquals(new int[]{4, 3, 3}, MonteCarloSimulator.partition(10, 3));
        }

        @Test
        @DisplayName("never more partitions than trials")
        void fewTrials() {
            assertArrayEquals(new int[]{1, 1}, MonteCarloSimulator.partition(2, 8));
        }

        @Test
        @DisplayName("non-positive worker count falls back to one partition")
        void zeroWorkers() {
            assertArrayEquals(new int[]{5}, MonteCarloSimulator.partition(5, 0));
        }
    }

    @Test
    @DisplayName("raw trials retained only on request")
    void retention() {
        assertTrue(run(5, 100, 1L).trials().isEmpty());
        assertEquals(100, simulator.run(DAMAGES, CaseStrength.of(5), 100, new SplittableRandom(1L), true)
            .trials().size());
    }

    @Test
    @DisplayName("zero or negative trials → InvalidTrialCountException")
    void invalidTrials() {
        assertThrows(InvalidTrialCountException.class, () -> run(5, 0, 1L));
        assertThrows(InvalidTrialCountException.class, () -> run(5, -10, 1L));
        assertThrows(InvalidTrialCountException.class, () -> MonteCarloSimulator.partition(0, 2));
    }

    @Test
    @DisplayName("thresholds out of order are rejected")
    void invalidParameters() {
        SimulationParameters d = SimulationParameters.defaults();
        assertThrows(IllegalArgumentException.class, () -> new SimulationParameters(
            0.5, 0.40, 0.75, 0.30, 0.55, 0.75, d.branches()));
        assertThrows(IllegalArgumentException.class, () -> new SimulationParameters(
            0.15, 0.40, 0.75, 0.30, 0.55, 1.5, d.branches()));
    }
}
