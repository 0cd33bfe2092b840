package com.claimstrategy.common.simulation;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Seeded random sources for simulation workers.
 *
 * <p>Worker 0 draws from {@code new SplittableRandom(masterSeed)} itself, so a
 * single-worker run matches a plain seeded run. Worker {@code i > 0} takes the
 * {@code i}-th {@link SplittableRandom#split()} of a fresh root seeded with the
 * master seed. Split streams carry their own seed and gamma, so no worker's stream
 * is a shifted copy of another's.
 */
public final class RandomStreams {

    private RandomStreams() {}

    public static RandomGenerator forWorker(long masterSeed, int workerIndex) {
        if (workerIndex < 0) {
            throw new IllegalArgumentException("workerIndex must be >= 0 but was " + workerIndex);
        }
        SplittableRandom root = new SplittableRandom(masterSeed);
        if (workerIndex == 0) return root;
        SplittableRandom stream = root.split();
        for (int i = 1; i < workerIndex; i++) {
            stream = root.split();
        }
        return stream;
    }

    /** Streams for workers {@code 0..workers-1}; element {@code i} equals {@link #forWorker(long, int)}. */
    public static List<RandomGenerator> forWorkers(long masterSeed, int workers) {
        List<RandomGenerator> streams = new ArrayList<>(workers);
        streams.add(new SplittableRandom(masterSeed));
        SplittableRandom root = new SplittableRandom(masterSeed);
        for (int i = 1; i < workers; i++) {
            streams.add(root.split());
        }
        return streams;
    }

    /** Fresh master seed for callers that did not supply one. */
    public static long randomSeed() {
        return new SplittableRandom().nextLong();
    }
}
