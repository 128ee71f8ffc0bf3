package org.puneet.hypotest.statistical;

import org.puneet.hypotest.distribution.Distributions;
import org.puneet.hypotest.exceptions.StatisticalValidationException;
import org.puneet.hypotest.util.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Power analysis for the two-sided, two-sample t-test with equal group sizes.
 *
 * <p>For {@code n} observations per group and standardized effect size {@code d}, the test has
 * {@code 2n - 2} degrees of freedom and the statistic follows a noncentral t distribution with
 * noncentrality {@code d * sqrt(n / 2)} under the alternative.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public final class PowerAnalysis {

    private static final Logger logger = LoggerFactory.getLogger(PowerAnalysis.class);

    /** Smallest per-group size with a defined t-test */
    public static final int MIN_SAMPLE_SIZE = 2;

    private PowerAnalysis() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static PowerAnalysisResult powerAnalysis(double effectSize, int sampleSizePerGroup)
            throws StatisticalValidationException {
        return powerAnalysis(effectSize, sampleSizePerGroup, EngineConfig.SIGNIFICANCE_LEVEL);
    }

    /**
     * Computes {@code 1 - NCT(t_crit) + NCT(-t_crit)} where {@code t_crit} is the two-tailed
     * critical value at alpha.
     *
     * @param effectSize Cohen's d, any finite value
     * @param sampleSizePerGroup observations in each group, at least two
     * @param alpha significance level in (0, 1)
     * @return power, degrees of freedom, noncentrality and critical value
     * @throws StatisticalValidationException on invalid parameters or a non-converging series
     */
    public static PowerAnalysisResult powerAnalysis(double effectSize, int sampleSizePerGroup, double alpha)
            throws StatisticalValidationException {
        requireEffectSize(effectSize);
        if (sampleSizePerGroup < MIN_SAMPLE_SIZE) {
            throw StatisticalValidationException.insufficientData(
                sampleSizePerGroup, MIN_SAMPLE_SIZE, "power analysis (per group)");
        }
        SampleChecks.requireAlpha(alpha);

        Point point = evaluate(effectSize, sampleSizePerGroup, alpha);
        logger.debug("Power analysis: d={}, n={}, alpha={}, power={}",
            effectSize, sampleSizePerGroup, alpha, String.format("%.4f", point.power));
        return new PowerAnalysisResult(effectSize, sampleSizePerGroup, point.power, alpha,
            point.degreesOfFreedom, point.noncentrality, point.criticalValue);
    }

    public static int requiredSampleSize(double effectSize, double targetPower)
            throws StatisticalValidationException {
        return requiredSampleSize(effectSize, targetPower, EngineConfig.SIGNIFICANCE_LEVEL);
    }

    /**
     * Smallest per-group size whose power reaches {@code targetPower}.
     *
     * <p>Power is increasing in n for a non-zero effect, so the search doubles n until the
     * target is bracketed and then bisects. Returns {@value #MIN_SAMPLE_SIZE} when the
     * smallest design already reaches the target.</p>
     *
     * @param effectSize Cohen's d, any finite value
     * @param targetPower desired power in (0, 1)
     * @param alpha significance level in (0, 1)
     * @return required observations per group
     * @throws StatisticalValidationException on invalid parameters, or CONVERGENCE_FAILURE when
     *         the target cannot be reached within the configured sample size or iteration cap
     */
    public static int requiredSampleSize(double effectSize, double targetPower, double alpha)
            throws StatisticalValidationException {
        requireEffectSize(effectSize);
        if (!(targetPower > 0 && targetPower < 1)) {
            throw StatisticalValidationException.invalidParameter("targetPower", targetPower,
                "must lie strictly between 0 and 1");
        }
        SampleChecks.requireAlpha(alpha);

        if (power(effectSize, MIN_SAMPLE_SIZE, alpha) >= targetPower) {
            return MIN_SAMPLE_SIZE;
        }
        if (effectSize == 0) {
            // power stays at alpha for every n
            StatisticalValidationException ex = StatisticalValidationException.convergenceFailure(
                "required sample size search", 0, null);
            ex.addContext("reason", "zero effect size cannot exceed power alpha");
            ex.addContext("targetPower", targetPower);
            throw ex;
        }

        int iterations = 0;
        int low = MIN_SAMPLE_SIZE;
        int high = MIN_SAMPLE_SIZE * 2;
        while (power(effectSize, high, alpha) < targetPower) {
            if (high >= EngineConfig.MAX_SAMPLE_SIZE || ++iterations >= EngineConfig.MAX_ITERATIONS) {
                throw unreachable(effectSize, targetPower, iterations);
            }
            low = high;
            high = (int) Math.min((long) high * 2, EngineConfig.MAX_SAMPLE_SIZE);
        }

        // power(low) < target <= power(high)
        while (high - low > 1) {
            if (++iterations >= EngineConfig.MAX_ITERATIONS) {
                throw unreachable(effectSize, targetPower, iterations);
            }
            int mid = low + (high - low) / 2;
            if (power(effectSize, mid, alpha) >= targetPower) {
                high = mid;
            } else {
                low = mid;
            }
        }

        logger.debug("Required sample size: d={}, target={}, alpha={} -> n={} ({} iterations)",
            effectSize, targetPower, alpha, high, iterations);
        return high;
    }

    public static PowerAnalysisResult requiredSampleSizeAnalysis(double effectSize, double targetPower)
            throws StatisticalValidationException {
        return requiredSampleSizeAnalysis(effectSize, targetPower, EngineConfig.SIGNIFICANCE_LEVEL);
    }

    /**
     * Runs {@link #requiredSampleSize(double, double, double)} and reports the power achieved at
     * the returned size.
     */
    public static PowerAnalysisResult requiredSampleSizeAnalysis(double effectSize, double targetPower,
                                                                 double alpha)
            throws StatisticalValidationException {
        int required = requiredSampleSize(effectSize, targetPower, alpha);
        Point point = evaluate(effectSize, required, alpha);
        return new PowerAnalysisResult(effectSize, required, point.power, alpha, required, targetPower,
            point.degreesOfFreedom, point.noncentrality, point.criticalValue);
    }

    private static double power(double effectSize, int n, double alpha) throws StatisticalValidationException {
        return evaluate(effectSize, n, alpha).power;
    }

    private static Point evaluate(double effectSize, int n, double alpha) throws StatisticalValidationException {
        double df = 2.0 * n - 2.0;
        double ncp = effectSize * Math.sqrt(n / 2.0);
        double criticalValue = Distributions.studentTInverseCdf(1.0 - alpha / 2.0, df);
        double power = 1.0 - Distributions.noncentralTCdf(criticalValue, df, ncp)
            + Distributions.noncentralTCdf(-criticalValue, df, ncp);
        return new Point(Math.max(0.0, Math.min(1.0, power)), df, ncp, criticalValue);
    }

    private static void requireEffectSize(double effectSize) throws StatisticalValidationException {
        if (!Double.isFinite(effectSize)) {
            throw StatisticalValidationException.invalidParameter("effectSize", effectSize, "must be finite");
        }
    }

    private static StatisticalValidationException unreachable(double effectSize, double targetPower,
                                                              int iterations) {
        StatisticalValidationException ex = StatisticalValidationException.convergenceFailure(
            "required sample size search", iterations, null);
        ex.addContext("effectSize", effectSize);
        ex.addContext("targetPower", targetPower);
        ex.addContext("maxSampleSize", EngineConfig.MAX_SAMPLE_SIZE);
        return ex;
    }

    private static final class Point {
        final double power;
        final double degreesOfFreedom;
        final double noncentrality;
        final double criticalValue;

        Point(double power, double degreesOfFreedom, double noncentrality, double criticalValue) {
            this.power = power;
            this.degreesOfFreedom = degreesOfFreedom;
            this.noncentrality = noncentrality;
            this.criticalValue = criticalValue;
        }
    }
}
