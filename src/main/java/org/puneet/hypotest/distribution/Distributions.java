package org.puneet.hypotest.distribution;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.exception.NoBracketingException;
import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.special.Gamma;
import org.puneet.hypotest.exceptions.StatisticalValidationException;
import org.puneet.hypotest.util.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cumulative distribution functions, survival functions and quantiles for the reference
 * distributions used by the hypothesis tests: standard normal, Student's t, chi-square,
 * Fisher-Snedecor F and the noncentral t.
 *
 * <p>All functions are pure and thread-safe. Parameters are validated strictly: a
 * non-positive degrees of freedom, a NaN or an infinite argument raises
 * {@link StatisticalValidationException.StatisticalErrorType#INVALID_PARAMETER}; nothing is
 * clamped silently. Iterative routines are bounded by {@link EngineConfig#MAX_ITERATIONS} and
 * raise {@link StatisticalValidationException.StatisticalErrorType#CONVERGENCE_FAILURE} when
 * the bound is exhausted.</p>
 *
 * <p>Survival functions ({@code 1 - CDF}) are evaluated directly from the complementary
 * special function so that small upper-tail probabilities keep their precision.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class Distributions {

    private static final Logger logger = LoggerFactory.getLogger(Distributions.class);

    /** Convergence epsilon for the incomplete beta and gamma functions */
    private static final double SPECIAL_FUNCTION_EPSILON = 1e-15;

    /** Iteration cap for the incomplete beta and gamma continued fractions and series */
    private static final int SPECIAL_FUNCTION_MAX_ITERATIONS = 100_000;

    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double SQRT_2_PI = Math.sqrt(2.0 * Math.PI);
    private static final double SQRT_2_OVER_PI = Math.sqrt(2.0 / Math.PI);
    private static final double LN_SQRT_PI = 0.5 * Math.log(Math.PI);

    /** Above this many degrees of freedom the noncentral t is replaced by its normal approximation */
    private static final double NONCENTRAL_T_NORMAL_DF = 4e5;

    /** ncp^2 beyond which exp(-ncp^2/2) underflows; 2 * ln 2 * 1021 */
    private static final double NONCENTRAL_T_MAX_NCP_SQUARED = 2.0 * Math.log(2.0) * 1021.0;

    /** Poisson weight below which a term no longer affects the mode-centred sum */
    private static final double NONCENTRAL_T_NEGLIGIBLE_WEIGHT = 1e-18;

    private Distributions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    // ===================================================================================
    // STANDARD NORMAL
    // ===================================================================================

    /**
     * Standard normal CDF, {@code Φ(x)}.
     *
     * @param x evaluation point
     * @return P(Z &lt;= x)
     * @throws StatisticalValidationException if x is NaN or infinite
     */
    public static double normalCdf(double x) throws StatisticalValidationException {
        requireFinite("x", x);
        return normalCdf0(x);
    }

    /**
     * Standard normal upper tail, {@code 1 - Φ(x)}.
     *
     * @param x evaluation point
     * @return P(Z &gt; x)
     * @throws StatisticalValidationException if x is NaN or infinite
     */
    public static double normalSurvival(double x) throws StatisticalValidationException {
        requireFinite("x", x);
        return normalCdf0(-x);
    }

    /**
     * Standard normal quantile. The inverse complementary error function gives the starting
     * point; one Newton step against {@link #normalCdf(double)} polishes it.
     *
     * @param p probability in the open interval (0, 1)
     * @return x such that Φ(x) = p
     * @throws StatisticalValidationException if p is outside (0, 1)
     */
    public static double normalInverseCdf(double p) throws StatisticalValidationException {
        requireProbability("p", p);

        double x = p < 0.5
            ? -SQRT_2 * Erf.erfcInv(2.0 * p)
            : SQRT_2 * Erf.erfcInv(2.0 * (1.0 - p));

        double density = normalDensity(x);
        if (density > 0 && Double.isFinite(x)) {
            x -= (normalCdf0(x) - p) / density;
        }
        return x;
    }

    // ===================================================================================
    // STUDENT'S T
    // ===================================================================================

    /**
     * Student's t CDF through the regularized incomplete beta function:
     * {@code P(T > |x|) = I(df / (df + x^2); df/2, 1/2) / 2}.
     *
     * @param x evaluation point
     * @param df degrees of freedom, may be fractional
     * @return P(T &lt;= x)
     * @throws StatisticalValidationException on invalid parameters or non-convergence
     */
    public static double studentTCdf(double x, double df) throws StatisticalValidationException {
        requireFinite("x", x);
        requireDegreesOfFreedom("df", df);
        try {
            return tCdf(x, df);
        } catch (MaxCountExceededException e) {
            throw convergence("Student t CDF", e);
        }
    }

    /**
     * Student's t upper tail, {@code P(T > x)}.
     *
     * @param x evaluation point
     * @param df degrees of freedom
     * @return P(T &gt; x)
     * @throws StatisticalValidationException on invalid parameters or non-convergence
     */
    public static double studentTSurvival(double x, double df) throws StatisticalValidationException {
        requireFinite("x", x);
        requireDegreesOfFreedom("df", df);
        try {
            return tCdf(-x, df);
        } catch (MaxCountExceededException e) {
            throw convergence("Student t survival", e);
        }
    }

    /**
     * Student's t quantile by bracketing and Brent root finding.
     *
     * @param p probability in (0, 1)
     * @param df degrees of freedom
     * @return x such that P(T &lt;= x) = p
     * @throws StatisticalValidationException on invalid parameters or non-convergence
     */
    public static double studentTInverseCdf(double p, double df) throws StatisticalValidationException {
        requireProbability("p", p);
        requireDegreesOfFreedom("df", df);

        if (p == 0.5) {
            return 0.0;
        }
        if (p < 0.5) {
            return -studentTInverseCdf(1.0 - p, df);
        }
        return invert("Student t quantile", x -> tCdf(x, df), p, 0.0, 1.0);
    }

    // ===================================================================================
    // CHI-SQUARE
    // ===================================================================================

    /**
     * Chi-square CDF, the regularized lower incomplete gamma {@code P(df/2, x/2)}.
     *
     * @param x evaluation point; non-positive values give 0
     * @param df degrees of freedom, may be fractional
     * @return P(X &lt;= x)
     * @throws StatisticalValidationException on invalid parameters or non-convergence
     */
    public static double chiSquareCdf(double x, double df) throws StatisticalValidationException {
        requireFinite("x", x);
        requireDegreesOfFreedom("df", df);
        try {
            return chiSquareCdf0(x, df);
        } catch (MaxCountExceededException e) {
            throw convergence("chi-square CDF", e);
        }
    }

    /**
     * Chi-square upper tail, the regularized upper incomplete gamma {@code Q(df/2, x/2)}.
     *
     * @param x evaluation point; non-positive values give 1
     * @param df degrees of freedom
     * @return P(X &gt; x)
     * @throws StatisticalValidationException on invalid parameters or non-convergence
     */
    public static double chiSquareSurvival(double x, double df) throws StatisticalValidationException {
        requireFinite("x", x);
        requireDegreesOfFreedom("df", df);
        if (x <= 0) {
            return 1.0;
        }
        try {
            return Gamma.regularizedGammaQ(df / 2.0, x / 2.0,
                SPECIAL_FUNCTION_EPSILON, SPECIAL_FUNCTION_MAX_ITERATIONS);
        } catch (MaxCountExceededException e) {
            throw convergence("chi-square survival", e);
        }
    }

    /**
     * Chi-square quantile.
     *
     * @param p probability in (0, 1)
     * @param df degrees of freedom
     * @return x such that P(X &lt;= x) = p
     * @throws StatisticalValidationException on invalid parameters or non-convergence
     */
    public static double chiSquareInverseCdf(double p, double df) throws StatisticalValidationException {
        requireProbability("p", p);
        requireDegreesOfFreedom("df", df);
        return invert("chi-square quantile", x -> chiSquareCdf0(x, df), p, 0.0, Math.max(1.0, df));
    }

    // ===================================================================================
    // F
    // ===================================================================================

    /**
     * F CDF: {@code I(df1 x / (df1 x + df2); df1/2, df2/2)}.
     *
     * @param x evaluation point; non-positive values give 0
     * @param df1 numerator degrees of freedom
     * @param df2 denominator degrees of freedom
     * @return P(F &lt;= x)
     * @throws StatisticalValidationException on invalid parameters or non-convergence
     */
    public static double fCdf(double x, double df1, double df2) throws StatisticalValidationException {
        requireFinite("x", x);
        requireDegreesOfFreedom("df1", df1);
        requireDegreesOfFreedom("df2", df2);
        try {
            return fCdf0(x, df1, df2);
        } catch (MaxCountExceededException e) {
            throw convergence("F CDF", e);
        }
    }

    /**
     * F upper tail: {@code I(df2 / (df2 + df1 x); df2/2, df1/2)}.
     *
     * @param x evaluation point; non-positive values give 1
     * @param df1 numerator degrees of freedom
     * @param df2 denominator degrees of freedom
     * @return P(F &gt; x)
     * @throws StatisticalValidationException on invalid parameters or non-convergence
     */
    public static double fSurvival(double x, double df1, double df2) throws StatisticalValidationException {
        requireFinite("x", x);
        requireDegreesOfFreedom("df1", df1);
        requireDegreesOfFreedom("df2", df2);
        if (x <= 0) {
            return 1.0;
        }
        try {
            return regularizedBeta(df2 / (df2 + df1 * x), df2 / 2.0, df1 / 2.0);
        } catch (MaxCountExceededException e) {
            throw convergence("F survival", e);
        }
    }

    /**
     * F quantile.
     *
     * @param p probability in (0, 1)
     * @param df1 numerator degrees of freedom
     * @param df2 denominator degrees of freedom
     * @return x such that P(F &lt;= x) = p
     * @throws StatisticalValidationException on invalid parameters or non-convergence
     */
    public static double fInverseCdf(double p, double df1, double df2) throws StatisticalValidationException {
        requireProbability("p", p);
        requireDegreesOfFreedom("df1", df1);
        requireDegreesOfFreedom("df2", df2);
        return invert("F quantile", x -> fCdf0(x, df1, df2), p, 0.0, 1.0);
    }

    // ===================================================================================
    // NONCENTRAL T
    // ===================================================================================

    /**
     * Noncentral t CDF by Lenth's series (Applied Statistics algorithm AS 243): a Poisson
     * mixture of incomplete beta functions summed until the remaining Poisson mass bounds
     * the error below {@link EngineConfig#TOLERANCE}.
     *
     * <p>With {@code ncp == 0} the result is exactly {@link #studentTCdf(double, double)}.
     * For more than 4e5 degrees of freedom the normal approximation
     * {@code Φ((x(1 - 1/4df) - ncp) / sqrt(1 + x^2/2df))} is used. An ncp whose leading Poisson
     * weight underflows is summed outward from the Poisson mode instead.</p>
     *
     * @param x evaluation point
     * @param df degrees of freedom
     * @param ncp noncentrality parameter
     * @return P(T' &lt;= x)
     * @throws StatisticalValidationException on invalid parameters or when the series exceeds
     *         the iteration cap
     */
    public static double noncentralTCdf(double x, double df, double ncp) throws StatisticalValidationException {
        requireFinite("x", x);
        requireDegreesOfFreedom("df", df);
        requireFinite("ncp", ncp);
        try {
            return noncentralTCdf0(x, df, ncp);
        } catch (MaxCountExceededException e) {
            throw convergence("noncentral t CDF", e);
        }
    }

    private static double noncentralTCdf0(double t, double df, double ncp) throws StatisticalValidationException {
        if (ncp == 0.0) {
            return tCdf(t, df);
        }

        final double tt;
        final double del;
        final boolean negdel;
        if (t >= 0) {
            negdel = false;
            tt = t;
            del = ncp;
        } else {
            // Lower tail below -t for a large positive shift is zero to double precision
            if (ncp > 40) {
                return 0.0;
            }
            negdel = true;
            tt = -t;
            del = -ncp;
        }

        if (df > NONCENTRAL_T_NORMAL_DF) {
            double s = 1.0 / (4.0 * df);
            double z = (tt * (1.0 - s) - del) / Math.sqrt(1.0 + tt * tt * 2.0 * s);
            return negdel ? normalCdf0(-z) : normalCdf0(z);
        }

        // t^2 / (t^2 + df), written so a huge |t| gives 1 rather than NaN
        double x = 1.0 / (1.0 + df / (t * t));

        boolean largeShift = del * del > NONCENTRAL_T_MAX_NCP_SQUARED;
        if (largeShift && del < 0) {
            // P(T' > tt) <= Φ(del) for tt >= 0
            return negdel ? 0.0 : 1.0;
        }

        double tnc;
        if (x > 0 && largeShift) {
            tnc = noncentralTModeSeries(x, 0.5 * df, del);
        } else if (x > 0) {
            double lambda = del * del;
            double p = 0.5 * Math.exp(-0.5 * lambda);
            if (p == 0.0) {
                return negdel ? 1.0 : 0.0;
            }
            double q = SQRT_2_OVER_PI * p * del;
            double s = 0.5 - p;
            if (s < 1e-7) {
                s = -0.5 * Math.expm1(-0.5 * lambda);
            }
            double a = 0.5;
            double b = 0.5 * df;
            double rxb = Math.pow(1.0 - x, b);
            double albeta = LN_SQRT_PI + Gamma.logGamma(b) - Gamma.logGamma(0.5 + b);
            double xodd = regularizedBeta(x, a, b);
            double godd = 2.0 * rxb * Math.exp(a * Math.log(x) - albeta);
            tnc = b * x;
            double xeven = (tnc < Math.ulp(1.0)) ? tnc : 1.0 - rxb;
            double geven = tnc * rxb;
            tnc = p * xodd + q * xeven;

            boolean converged = false;
            for (int it = 1; it <= EngineConfig.MAX_ITERATIONS; it++) {
                a += 1.0;
                xodd -= godd;
                xeven -= geven;
                godd *= x * (a + b - 1.0) / a;
                geven *= x * (a + b - 0.5) / (a + 0.5);
                p *= lambda / (2 * it);
                q *= lambda / (2 * it + 1);
                tnc += p * xodd + q * xeven;
                s -= p;
                // Poisson mass exhausted (s may dip just below zero through rounding)
                if (s < -1e-10 || (s <= 0 && it > 1)) {
                    converged = true;
                    break;
                }
                double errbd = 2.0 * s * (xodd - godd);
                if (Math.abs(errbd) < EngineConfig.TOLERANCE) {
                    converged = true;
                    break;
                }
            }
            if (!converged) {
                throw StatisticalValidationException.convergenceFailure(
                    "noncentral t series", EngineConfig.MAX_ITERATIONS, null);
            }
        } else {
            tnc = 0.0;
        }

        tnc += normalCdf0(-del);
        tnc = Math.min(tnc, 1.0);
        return negdel ? 1.0 - tnc : tnc;
    }

    /**
     * Lenth's series summed outward from the Poisson mode (Benton and Krishnamoorthy), for a
     * positive shift whose weight {@code exp(-ncp^2/2)} underflows. Weights are evaluated in log
     * space at the mode and carried to neighbouring terms by their ratios; the incomplete beta
     * values follow {@code I_x(a+1, b) = I_x(a, b) - x^a (1-x)^b / (a B(a, b))}.
     *
     * @param x {@code t^2 / (t^2 + df)}, in (0, 1]
     * @param b half the degrees of freedom
     * @param del positive noncentrality
     * @return the series without the {@code Φ(-del)} term
     */
    private static double noncentralTModeSeries(double x, double b, double del) {
        double halfLambda = 0.5 * del * del;
        int mode = (int) Math.floor(halfLambda);
        double logX = Math.log(x);
        double log1mX = Math.log1p(-x);

        double logPoisson = -halfLambda + mode * Math.log(halfLambda);
        double pMode = 0.5 * Math.exp(logPoisson - Gamma.logGamma(mode + 1.0));
        double qMode = 0.5 * Math.exp(logPoisson + Math.log(del) - 0.5 * Math.log(2.0)
            - Gamma.logGamma(mode + 1.5));

        double xoddMode = regularizedBeta(x, mode + 0.5, b);
        double xevenMode = regularizedBeta(x, mode + 1.0, b);
        double goddMode = betaStep(mode + 0.5, b, logX, log1mX);
        double gevenMode = betaStep(mode + 1.0, b, logX, log1mX);

        double sum = pMode * xoddMode + qMode * xevenMode;
        // Poisson mass further than 12 standard deviations from the mode is below 1e-30
        int window = (int) Math.ceil(12.0 * Math.sqrt(halfLambda) + 12.0);

        double p = pMode;
        double q = qMode;
        double xodd = xoddMode;
        double xeven = xevenMode;
        double godd = goddMode;
        double geven = gevenMode;
        for (int j = mode + 1; j <= mode + window; j++) {
            xodd = Math.max(0.0, xodd - godd);
            xeven = Math.max(0.0, xeven - geven);
            godd *= x * (j - 0.5 + b) / (j + 0.5);
            geven *= x * (j + b) / (j + 1.0);
            p *= halfLambda / j;
            q *= halfLambda / (j + 0.5);
            sum += p * xodd + q * xeven;
            if (p + q < NONCENTRAL_T_NEGLIGIBLE_WEIGHT) {
                break;
            }
        }

        p = pMode;
        q = qMode;
        xodd = xoddMode;
        xeven = xevenMode;
        godd = goddMode;
        geven = gevenMode;
        for (int j = mode - 1; j >= 0 && j >= mode - window; j--) {
            double aOdd = j + 1.5;
            godd *= aOdd / (x * (aOdd + b - 1.0));
            xodd = Math.min(1.0, xodd + godd);
            double aEven = j + 2.0;
            geven *= aEven / (x * (aEven + b - 1.0));
            xeven = Math.min(1.0, xeven + geven);
            p *= (j + 1.0) / halfLambda;
            q *= (j + 1.5) / halfLambda;
            sum += p * xodd + q * xeven;
            if (p + q < NONCENTRAL_T_NEGLIGIBLE_WEIGHT) {
                break;
            }
        }
        return sum;
    }

    /** {@code x^a (1-x)^b / (a B(a, b))} */
    private static double betaStep(double a, double b, double logX, double log1mX) {
        double logBeta = Gamma.logGamma(a) + Gamma.logGamma(b) - Gamma.logGamma(a + b);
        return Math.exp(a * logX + b * log1mX - Math.log(a) - logBeta);
    }

    // ===================================================================================
    // INTERNALS
    // ===================================================================================

    private static double normalCdf0(double x) {
        return 0.5 * Erf.erfc(-x / SQRT_2);
    }

    private static double normalDensity(double x) {
        return Math.exp(-0.5 * x * x) / SQRT_2_PI;
    }

    private static double tCdf(double x, double df) {
        if (x == 0.0) {
            return 0.5;
        }
        double tail = 0.5 * regularizedBeta(df / (df + x * x), df / 2.0, 0.5);
        return x > 0 ? 1.0 - tail : tail;
    }

    private static double chiSquareCdf0(double x, double df) {
        if (x <= 0) {
            return 0.0;
        }
        return Gamma.regularizedGammaP(df / 2.0, x / 2.0,
            SPECIAL_FUNCTION_EPSILON, SPECIAL_FUNCTION_MAX_ITERATIONS);
    }

    private static double fCdf0(double x, double df1, double df2) {
        if (x <= 0) {
            return 0.0;
        }
        double product = df1 * x;
        return regularizedBeta(product / (product + df2), df1 / 2.0, df2 / 2.0);
    }

    private static double regularizedBeta(double x, double a, double b) {
        return Beta.regularizedBeta(x, a, b, SPECIAL_FUNCTION_EPSILON, SPECIAL_FUNCTION_MAX_ITERATIONS);
    }

    /**
     * Inverts a continuous increasing CDF. The upper end of the bracket doubles until it
     * covers {@code p}; Brent's method then finds the root of {@code cdf(x) - p}.
     */
    private static double invert(String routine, UnivariateFunction cdf, double p,
                                 double lower, double initialUpper) throws StatisticalValidationException {
        int maxIterations = EngineConfig.MAX_ITERATIONS;
        UnivariateFunction objective = x -> cdf.value(x) - p;

        try {
            double upper = initialUpper;
            int expansions = 0;
            while (objective.value(upper) < 0) {
                lower = upper;
                upper *= 2.0;
                if (++expansions > maxIterations || Double.isInfinite(upper)) {
                    throw StatisticalValidationException.convergenceFailure(
                        routine + " bracketing", maxIterations, null);
                }
            }

            BrentSolver solver = new BrentSolver(1e-15, EngineConfig.TOLERANCE, 1e-16);
            double root = solver.solve(maxIterations, objective, lower, upper);
            logger.trace("{}: p={} -> x={} after {} evaluations", routine, p, root, solver.getEvaluations());
            return root;

        } catch (MaxCountExceededException | NoBracketingException e) {
            throw convergence(routine, e);
        }
    }

    private static StatisticalValidationException convergence(String routine, RuntimeException cause) {
        int iterations = cause instanceof MaxCountExceededException
            ? ((MaxCountExceededException) cause).getMax().intValue()
            : EngineConfig.MAX_ITERATIONS;
        return StatisticalValidationException.convergenceFailure(routine, iterations, cause);
    }

    private static void requireFinite(String name, double value) throws StatisticalValidationException {
        if (!Double.isFinite(value)) {
            throw StatisticalValidationException.invalidParameter(name, value, "must be a finite number");
        }
    }

    private static void requireDegreesOfFreedom(String name, double df) throws StatisticalValidationException {
        if (!Double.isFinite(df) || df <= 0) {
            throw StatisticalValidationException.invalidParameter(name, df, "degrees of freedom must be positive and finite");
        }
    }

    private static void requireProbability(String name, double p) throws StatisticalValidationException {
        if (!(p > 0.0 && p < 1.0)) {
            throw StatisticalValidationException.invalidParameter(name, p, "probability must lie strictly between 0 and 1");
        }
    }
}
