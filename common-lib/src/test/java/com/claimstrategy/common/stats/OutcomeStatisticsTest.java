package com.claimstrategy.common.stats;

import com.claimstrategy.common.exception.EmptyInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeStatisticsTest {

    private static final double EPS = 1e-9;

    @Nested
    @DisplayName("central tendency")
    class CentralTendency {

        @Test
        @DisplayName("mean of 1..4 → 2.5")
        void mean() {
            assertEquals(2.5, OutcomeStatistics.mean(new double[]{1, 2, 3, 4}), EPS);
        }

        @Test
        @DisplayName("odd-sized median → middle value")
        void medianOdd() {
            assertEquals(3.0, OutcomeStatistics.median(new double[]{5, 1, 3}), EPS);
        }

        @Test
        @DisplayName("even-sized median → average of the middle pair")
        void medianEven() {
            assertEquals(2.5, OutcomeStatistics.median(new double[]{4, 1, 3, 2}), EPS);
        }

        @Test
        @DisplayName("median does not reorder the caller's array")
        void medianLeavesInputAlone() {
            double[] xs = {9, 1, 5};
            OutcomeStatistics.median(xs);
            assertArrayEquals(new double[]{9, 1, 5}, xs);
        }
    }

    @Nested
    @DisplayName("spread")
    class Spread {

        @Test
        @DisplayName("population standard deviation")
        void stdDev() {
            double[] xs = {2, 4, 4, 4, 5, 5, 7, 9};
            assertEquals(2.0, OutcomeStatistics.stdDev(xs), EPS);
        }

        @Test
        @DisplayName("constant sample → zero deviation")
        void stdDevConstant() {
            assertEquals(0.0, OutcomeStatistics.stdDev(new double[]{7, 7, 7}), EPS);
        }

        @Test
        @DisplayName("min / max")
        void extremes() {
            double[] xs = {3, -1, 8, 2};
            assertEquals(-1.0, OutcomeStatistics.min(xs), EPS);
            assertEquals(8.0, OutcomeStatistics.max(xs), EPS);
        }
    }

    @Nested
    @DisplayName("percentile() — nearest rank")
    class Percentile {

        private final double[] hundred = new double[100];
        {
            // descending on purpose so sorting is exercised
            for (int i = 0; i < 100; i++) hundred[i] = 100 - i;
        }

        @Test
        @DisplayName("p50 of 1..100 → 50")
        void median() {
            assertEquals(50.0, OutcomeStatistics.percentile(hundred, 50), EPS);
        }

        @Test
        @DisplayName("p25 / p75 / p100 of 1..100")
        void quartiles() {
            assertEquals(25.0, OutcomeStatistics.percentile(hundred, 25), EPS);
            assertEquals(75.0, OutcomeStatistics.percentile(hundred, 75), EPS);
            assertEquals(100.0, OutcomeStatistics.percentile(hundred, 100), EPS);
        }

        @Test
        @DisplayName("p0 clamps to the smallest value")
        void zero() {
            assertEquals(1.0, OutcomeStatistics.percentile(hundred, 0), EPS);
        }

        @Test
        @DisplayName("rank rounds up: p10 of five values → 1st value")
        void roundsUp() {
            assertEquals(10.0, OutcomeStatistics.percentile(new double[]{50, 40, 30, 20, 10}, 10), EPS);
            assertEquals(20.0, OutcomeStatistics.percentile(new double[]{50, 40, 30, 20, 10}, 21), EPS);
        }

        @Test
        @DisplayName("caller's array is untouched")
        void noMutation() {
            double[] xs = {3, 1, 2};
            OutcomeStatistics.percentile(xs, 50);
            assertArrayEquals(new double[]{3, 1, 2}, xs);
        }

        @Test
        @DisplayName("p outside [0, 100] → IllegalArgumentException")
        void outOfRange() {
            assertThrows(IllegalArgumentException.class, () -> OutcomeStatistics.percentile(hundred, 101));
            assertThrows(IllegalArgumentException.class, () -> OutcomeStatistics.percentile(hundred, -0.5));
        }
    }

    @Nested
    @DisplayName("empty input")
    class Empty {

        @Test
        @DisplayName("every aggregate rejects an empty sample")
        void allThrow() {
            double[] none = new double[0];
            assertThrows(EmptyInputException.class, () -> OutcomeStatistics.mean(none));
            assertThrows(EmptyInputException.class, () -> OutcomeStatistics.median(none));
            assertThrows(EmptyInputException.class, () -> OutcomeStatistics.stdDev(none));
            assertThrows(EmptyInputException.class, () -> OutcomeStatistics.percentile(none, 50));
            assertThrows(EmptyInputException.class, () -> OutcomeStatistics.min(none));
            assertThrows(EmptyInputException.class, () -> OutcomeStatistics.max(none));
        }
    }

    @Nested
    @DisplayName("sampleNormal()")
    class SampleNormal {

        @Test
        @DisplayName("never negative, even with a mean at zero")
        void clampedAtZero() {
            SplittableRandom random = new SplittableRandom(7);
            for (int i = 0; i < 5_000; i++) {
                assertTrue(OutcomeStatistics.sampleNormal(random, 0.0, 1_000.0) >= 0.0);
            }
        }

        @Test
        @DisplayName("zero deviation returns the mean")
        void zeroDeviation() {
            assertEquals(42.0, OutcomeStatistics.sampleNormal(new SplittableRandom(1), 42.0, 0.0), EPS);
        }

        @Test
        @DisplayName("sample mean converges on the requested mean")
        void converges() {
            SplittableRandom random = new SplittableRandom(99);
            double[] xs = new double[20_000];
            for (int i = 0; i < xs.length; i++) {
                xs[i] = OutcomeStatistics.sampleNormal(random, 50_000, 5_000);
            }
            assertEquals(50_000, OutcomeStatistics.mean(xs), 200);
            assertEquals(5_000, OutcomeStatistics.stdDev(xs), 200);
        }

        @Test
        @DisplayName("same seed → same draws")
        void deterministic() {
            SplittableRandom a = new SplittableRandom(3);
            SplittableRandom b = new SplittableRandom(3);
            for (int i = 0; i < 100; i++) {
                assertEquals(OutcomeStatistics.sampleNormal(a, 10, 3), OutcomeStatistics.sampleNormal(b, 10, 3));
            }
        }
    }
}
