package org.puneet.hypotest.statistical;

import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

import java.util.Arrays;
import java.util.Objects;

/**
 * Pooled-sample ranking for rank-based tests.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public final class RankUtils {

    private RankUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Ranks the pooled observations of two samples. Ranks are 1-based, tied values share
     * the average of the ranks they span, and the returned array lists the ranks of
     * {@code sample1} first followed by those of {@code sample2}. Neither input is modified.
     *
     * @param sample1 first sample
     * @param sample2 second sample
     * @return pooled ranks with the tie-correction term {@code Σ(t³ - t)}
     */
    public static RankResult rank(double[] sample1, double[] sample2) {
        Objects.requireNonNull(sample1, "Sample 1 cannot be null");
        Objects.requireNonNull(sample2, "Sample 2 cannot be null");

        double[] pooled = new double[sample1.length + sample2.length];
        System.arraycopy(sample1, 0, pooled, 0, sample1.length);
        System.arraycopy(sample2, 0, pooled, sample1.length, sample2.length);
        // -0.0 and 0.0 are one value; NaturalRanking would order them apart
        for (int i = 0; i < pooled.length; i++) {
            pooled[i] += 0.0;
        }

        NaturalRanking ranking = new NaturalRanking(NaNStrategy.FAILED, TiesStrategy.AVERAGE);
        double[] ranks = ranking.rank(pooled);

        return new RankResult(ranks, tieCorrection(pooled), sample1.length);
    }

    /**
     * Computes {@code Σ(t³ - t)} over every group of tied values.
     *
     * @param values observations (copied before sorting)
     * @return the tie-correction term, zero when all values are distinct
     */
    public static double tieCorrection(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double correction = 0;
        int i = 0;
        while (i < sorted.length) {
            int j = i + 1;
            while (j < sorted.length && sorted[j] == sorted[i]) {
                j++;
            }
            long t = j - i;
            if (t > 1) {
                correction += (double) (t * t * t - t);
            }
            i = j;
        }
        return correction;
    }

    /**
     * Ranks of a pooled sample together with its tie correction.
     */
    public static final class RankResult {
        private final double[] ranks;
        private final double tieCorrection;
        private final int firstSampleSize;

        RankResult(double[] ranks, double tieCorrection, int firstSampleSize) {
            this.ranks = ranks;
            this.tieCorrection = tieCorrection;
            this.firstSampleSize = firstSampleSize;
        }

        /** @return a copy of the pooled ranks, sample 1 first */
        public double[] getRanks() {
            return ranks.clone();
        }

        public double getTieCorrection() {
            return tieCorrection;
        }

        public boolean hasTies() {
            return tieCorrection > 0;
        }

        /**
         * Sums the ranks in {@code [from, to)} of the pooled array.
         */
        public double rankSum(int from, int to) {
            double sum = 0;
            for (int i = from; i < to; i++) {
                sum += ranks[i];
            }
            return sum;
        }

        /** @return sum of the ranks that belong to sample 1 */
        public double firstSampleRankSum() {
            return rankSum(0, firstSampleSize);
        }
    }
}
