package com.claimstrategy.engine.simulation;

import com.claimstrategy.common.model.CaseStrength;
import com.claimstrategy.common.model.DamagesRange;
import com.claimstrategy.common.simulation.MonteCarloSimulator;
import com.claimstrategy.common.simulation.RandomStreams;
import com.claimstrategy.common.simulation.SimulationResult;
import com.claimstrategy.common.simulation.TrialBatch;
import com.claimstrategy.common.simulation.TrialSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Partitions Monte Carlo trials across workers and joins them for one aggregation pass.
 *
 * <p>Worker {@code i} owns the random stream {@link RandomStreams#forWorkers(long, int)}{@code .get(i)}
 * and its own {@link TrialBatch}; nothing mutable is shared. Batches are collected
 * with {@code flatMapSequential}, so they merge in worker order regardless of
 * completion order, and a fixed seed with a fixed worker count reproduces the run.
 *
 * <p>A single partition runs inline on the caller's thread.
 */
@Component
public class ParallelTrialRunner {

    private static final Logger log = LoggerFactory.getLogger(ParallelTrialRunner.class);

    private final Scheduler scheduler;

    public ParallelTrialRunner(Scheduler simulationScheduler) {
        this.scheduler = simulationScheduler;
    }

    public SimulationResult run(MonteCarloSimulator simulator, DamagesRange damages, CaseStrength strength,
                                int trials, long seed, int parallelism, boolean retainTrials) {
        int[] partitions = MonteCarloSimulator.partition(trials, parallelism);
        TrialSampler sampler = simulator.samplerFor(damages, strength);

        if (partitions.length == 1) {
            TrialBatch batch = simulator.runBatch(sampler, trials, RandomStreams.forWorker(seed, 0), retainTrials);
            return simulator.summarize(List.of(batch));
        }

        log.debug("[ParallelTrialRunner] trials={} workers={}", trials, partitions.length);
        List<RandomGenerator> streams = RandomStreams.forWorkers(seed, partitions.length);
        List<TrialBatch> batches = Flux.range(0, partitions.length)
            .flatMapSequential(worker -> Mono.fromCallable(() ->
                    simulator.runBatch(sampler, partitions[worker],
                        streams.get(worker), retainTrials))
                .subscribeOn(scheduler))
            .collectList()
            .block();

        return simulator.summarize(batches);
    }
}
