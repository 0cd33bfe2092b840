package com.claimstrategy.engine.simulation;

import com.claimstrategy.common.model.CaseStrength;
import com.claimstrategy.common.model.DamagesRange;
import com.claimstrategy.common.simulation.MonteCarloSimulator;
import com.claimstrategy.common.simulation.SimulationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

class ParallelTrialRunnerTest {

    private static final DamagesRange DAMAGES = DamagesRange.of(30_000, 50_000, 75_000);

    private final MonteCarloSimulator simulator = new MonteCarloSimulator();
    private Scheduler scheduler;
    private ParallelTrialRunner runner;

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newParallel("runner-test", 3);
        runner = new ParallelTrialRunner(scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    @DisplayName("one worker runs inline on the master seed")
    void singleWorker() {
        SimulationResult viaRunner = runner.run(simulator, DAMAGES, CaseStrength.of(6), 4_000, 21L, 1, false);
        SimulationResult direct = simulator.run(DAMAGES, CaseStrength.of(6), 4_000, new SplittableRandom(21L), false);
        assertEquals(direct.statistics(), viaRunner.statistics());
    }

    @Test
    @DisplayName("partitioned run keeps every trial and is repeatable")
    void partitioned() {
        SimulationResult a = runner.run(simulator, DAMAGES, CaseStrength.of(6), 10_001, 21L, 3, true);
        SimulationResult b = runner.run(simulator, DAMAGES, CaseStrength.of(6), 10_001, 21L, 3, true);

        assertEquals(10_001, a.statistics().trialCount());
        assertEquals(10_001, a.trials().size());
        assertEquals(a.statistics(), b.statistics());
        assertEquals(a.trials(), b.trials());
    }

    @Test
    @DisplayName("more workers than trials collapses to one partition per trial")
    void moreWorkersThanTrials() {
        SimulationResult result = runner.run(simulator, DAMAGES, CaseStrength.of(6), 2, 21L, 8, false);
        assertEquals(2, result.statistics().trialCount());
    }
}
