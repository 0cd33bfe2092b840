package com.claimstrategy.common.stats;

import com.claimstrategy.common.exception.EmptyInputException;

import java.util.Arrays;
import java.util.random.RandomGenerator;

/**
 * Pure calculation utilities over simulated outcome samples.
 *
 * <p>Every aggregate is order-independent, so samples merged from parallel
 * workers produce the same figures as a sequential run. Inputs are never
 * mutated; sorting always happens on a copy.
 */
public final class OutcomeStatistics {

    private OutcomeStatistics() {}

    // ── Mean ────────────────────────────────────────────────────────────────

    public static double mean(double[] xs) {
        requireNonEmpty(xs, "mean");
        double sum = 0.0;
        for (double x : xs) sum += x;
        return sum / xs.length;
    }

    // ── Median ──────────────────────────────────────────────────────────────

    /**
     * @return middle value of the sorted sample; average of the two middle
     *         values for even-sized samples
     */
    public static double median(double[] xs) {
        requireNonEmpty(xs, "median");
        double[] sorted = sortedCopy(xs);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1
            ? sorted[mid]
            : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    // ── Standard deviation (population) ─────────────────────────────────────

    public static double stdDev(double[] xs) {
        double mean = mean(xs);
        double variance = 0.0;
        for (double x : xs) {
            double diff = x - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / xs.length);
    }

    // ── Percentile (nearest rank) ───────────────────────────────────────────

    /**
     * Nearest-rank percentile: {@code sorted[max(0, ceil(p/100 * n) - 1)]}.
     *
     * @param xs sample, left untouched
     * @param p  percentile in [0, 100]
     */
    public static double percentile(double[] xs, double p) {
        requireNonEmpty(xs, "percentile");
        return percentileOfSorted(sortedCopy(xs), p);
    }

    /**
     * Same as {@link #percentile(double[], double)} for callers that already hold
     * an ascending sample and need several ranks from it.
     */
    public static double percentileOfSorted(double[] sortedAscending, double p) {
        requireNonEmpty(sortedAscending, "percentile");
        if (Double.isNaN(p) || p < 0.0 || p > 100.0) {
            throw new IllegalArgumentException("percentile must lie in [0, 100] but was " + p);
        }
        int index = (int) Math.ceil((p / 100.0) * sortedAscending.length) - 1;
        return sortedAscending[Math.max(0, index)];
    }

    // ── Extremes ────────────────────────────────────────────────────────────

    public static double min(double[] xs) {
        requireNonEmpty(xs, "min");
        double min = xs[0];
        for (double x : xs) if (x < min) min = x;
        return min;
    }

    public static double max(double[] xs) {
        requireNonEmpty(xs, "max");
        double max = xs[0];
        for (double x : xs) if (x > max) max = x;
        return max;
    }

    // ── Sampling ────────────────────────────────────────────────────────────

    /**
     * Draws from N(mean, stdDev) with the Box–Muller transform and clamps the
     * result at zero, since amounts and durations cannot be negative.
     * Never throws.
     */
    public static double sampleNormal(RandomGenerator random, double mean, double stdDev) {
        // 1 - u keeps u1 in (0, 1] so the log stays finite
        double u1 = 1.0 - random.nextDouble();
        double u2 = random.nextDouble();
        double z = Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
        return Math.max(0.0, mean + z * stdDev);
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    static double[] sortedCopy(double[] xs) {
        double[] sorted = Arrays.copyOf(xs, xs.length);
        Arrays.sort(sorted);
        return sorted;
    }

    private static void requireNonEmpty(double[] xs, String operation) {
        if (xs == null || xs.length == 0) {
            throw new EmptyInputException(operation);
        }
    }
}
