package org.puneet.hypotest.unit;

import org.apache.commons.math3.analysis.integration.IterativeLegendreGaussIntegrator;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.junit.jupiter.api.Test;
import org.puneet.hypotest.distribution.Distributions;
import org.puneet.hypotest.exceptions.StatisticalValidationException;
import org.puneet.hypotest.exceptions.StatisticalValidationException.StatisticalErrorType;

import static org.junit.jupiter.api.Assertions.*;

class DistributionsTest {

    private static final double[] POINTS = {-4.0, -2.5, -1.0, -0.3, 0.0, 0.7, 1.5, 3.0, 6.0};

    @Test
    void testNormalCdfMatchesReference() throws Exception {
        NormalDistribution reference = new NormalDistribution();
        for (double x : POINTS) {
            assertEquals(reference.cumulativeProbability(x), Distributions.normalCdf(x), 1e-12);
        }
        assertEquals(0.5, Distributions.normalCdf(0.0), 1e-15);
        assertEquals(0.9750021048517795, Distributions.normalCdf(1.96), 1e-12);
    }

    @Test
    void testNormalSurvivalIsComplement() throws Exception {
        for (double x : POINTS) {
            assertEquals(1.0, Distributions.normalCdf(x) + Distributions.normalSurvival(x), 1e-14);
        }
        assertTrue(Distributions.normalSurvival(10.0) > 0.0, "upper tail should not cancel to zero");
    }

    @Test
    void testNormalInverseCdf() throws Exception {
        assertEquals(1.959963984540054, Distributions.normalInverseCdf(0.975), 1e-9);
        assertEquals(-1.6448536269514722, Distributions.normalInverseCdf(0.05), 1e-9);
        assertEquals(0.0, Distributions.normalInverseCdf(0.5), 1e-12);
        for (double p : new double[] {1e-8, 0.01, 0.3, 0.77, 0.999}) {
            assertEquals(p, Distributions.normalCdf(Distributions.normalInverseCdf(p)), 1e-12);
        }
    }

    @Test
    void testStudentTCdfMatchesReference() throws Exception {
        for (double df : new double[] {1.0, 2.5, 6.0, 30.0, 250.0}) {
            TDistribution reference = new TDistribution(df);
            for (double x : POINTS) {
                assertEquals(reference.cumulativeProbability(x), Distributions.studentTCdf(x, df), 1e-9,
                    "df=" + df + ", x=" + x);
            }
        }
    }

    @Test
    void testStudentTStableForLargeDegreesOfFreedom() throws Exception {
        for (double df : new double[] {1e4, 1e5, 1e7}) {
            TDistribution reference = new TDistribution(df);
            for (double x : POINTS) {
                assertEquals(reference.cumulativeProbability(x), Distributions.studentTCdf(x, df), 1e-9,
                    "df=" + df + ", x=" + x);
            }
            for (double p : new double[] {0.001, 0.05, 0.5, 0.975, 0.9999}) {
                assertEquals(reference.inverseCumulativeProbability(p), Distributions.studentTInverseCdf(p, df), 1e-6,
                    "df=" + df + ", p=" + p);
            }
        }
        assertEquals(1.959963984540054, Distributions.studentTInverseCdf(0.975, 1e7), 1e-5);
    }

    @Test
    void testStudentTSurvivalSymmetry() throws Exception {
        for (double x : POINTS) {
            assertEquals(Distributions.studentTCdf(-x, 7.3), Distributions.studentTSurvival(x, 7.3), 1e-14);
        }
    }

    @Test
    void testStudentTInverseCdf() throws Exception {
        assertEquals(2.228138851986273, Distributions.studentTInverseCdf(0.975, 10), 1e-7);
        assertEquals(12.706204736174698, Distributions.studentTInverseCdf(0.975, 1), 1e-6);
        assertEquals(0.0, Distributions.studentTInverseCdf(0.5, 4), 0.0);
        assertEquals(-Distributions.studentTInverseCdf(0.9, 5.5), Distributions.studentTInverseCdf(0.1, 5.5), 1e-10);

        TDistribution reference = new TDistribution(3.7);
        for (double p : new double[] {0.01, 0.2, 0.6, 0.95, 0.999}) {
            assertEquals(reference.inverseCumulativeProbability(p), Distributions.studentTInverseCdf(p, 3.7), 1e-6);
        }
    }

    @Test
    void testChiSquareCdfMatchesReference() throws Exception {
        for (double df : new double[] {1.0, 2.0, 4.5, 10.0, 60.0}) {
            ChiSquaredDistribution reference = new ChiSquaredDistribution(df);
            for (double x : new double[] {0.01, 0.5, 1.0, 3.84, 10.0, 40.0, 90.0}) {
                assertEquals(reference.cumulativeProbability(x), Distributions.chiSquareCdf(x, df), 1e-10,
                    "df=" + df + ", x=" + x);
                assertEquals(1.0, Distributions.chiSquareCdf(x, df) + Distributions.chiSquareSurvival(x, df), 1e-12);
            }
        }
    }

    @Test
    void testChiSquareBoundaries() throws Exception {
        assertEquals(0.0, Distributions.chiSquareCdf(0.0, 3), 0.0);
        assertEquals(0.0, Distributions.chiSquareCdf(-2.0, 3), 0.0);
        assertEquals(1.0, Distributions.chiSquareSurvival(0.0, 3), 0.0);
    }

    @Test
    void testChiSquareInverseCdf() throws Exception {
        assertEquals(3.841458820694124, Distributions.chiSquareInverseCdf(0.95, 1), 1e-6);
        assertEquals(5.991464547107979, Distributions.chiSquareInverseCdf(0.95, 2), 1e-6);
        assertEquals(0.95, Distributions.chiSquareCdf(Distributions.chiSquareInverseCdf(0.95, 17), 17), 1e-9);
    }

    @Test
    void testFCdfMatchesReference() throws Exception {
        double[][] dfs = {{1, 1}, {2, 12}, {3, 20}, {7.5, 4.2}, {30, 100}};
        for (double[] df : dfs) {
            FDistribution reference = new FDistribution(df[0], df[1]);
            for (double x : new double[] {0.05, 0.5, 1.0, 2.0, 3.885, 10.0}) {
                assertEquals(reference.cumulativeProbability(x), Distributions.fCdf(x, df[0], df[1]), 1e-9);
                assertEquals(1.0, Distributions.fCdf(x, df[0], df[1]) + Distributions.fSurvival(x, df[0], df[1]), 1e-12);
            }
        }
        assertEquals(0.0, Distributions.fCdf(0.0, 2, 5), 0.0);
        assertEquals(1.0, Distributions.fSurvival(-1.0, 2, 5), 0.0);
    }

    @Test
    void testFInverseCdf() throws Exception {
        assertEquals(3.885293834652391, Distributions.fInverseCdf(0.95, 2, 12), 1e-6);
        assertEquals(0.5, Distributions.fCdf(Distributions.fInverseCdf(0.5, 5, 9), 5, 9), 1e-9);
    }

    @Test
    void testNoncentralTReducesToCentralT() throws Exception {
        for (double df : new double[] {1.0, 3.0, 9.5, 40.0}) {
            for (double x : POINTS) {
                assertEquals(Distributions.studentTCdf(x, df), Distributions.noncentralTCdf(x, df, 0.0), 1e-9);
            }
        }
    }

    @Test
    void testNoncentralTMatchesNumericalIntegration() throws Exception {
        double[][] cases = {
            {10, 1.5, -1.0}, {10, 1.5, 0.5}, {10, 1.5, 2.0}, {10, 1.5, 3.5},
            {4, -1.0, -2.0}, {4, -1.0, 0.0}, {4, 2.5, 1.0}, {30, 3.0, 2.04}
        };
        for (double[] c : cases) {
            double df = c[0];
            double ncp = c[1];
            double x = c[2];
            assertEquals(integratedNoncentralT(x, df, ncp), Distributions.noncentralTCdf(x, df, ncp), 1e-6,
                "df=" + df + ", ncp=" + ncp + ", x=" + x);
        }
    }

    @Test
    void testNoncentralTLargeNoncentrality() throws Exception {
        assertEquals(0.423308216048, Distributions.noncentralTCdf(37, 50, 37.5), 1e-9);
        assertEquals(0.403096084955, Distributions.noncentralTCdf(37, 50, 37.7), 1e-9);
        assertEquals(0.529745500268, Distributions.noncentralTCdf(40, 10, 38), 1e-9);
        assertEquals(0.978774254069, Distributions.noncentralTCdf(45, 200, 40), 1e-9);
        assertEquals(integratedNoncentralT(37, 50, 37.7), Distributions.noncentralTCdf(37, 50, 37.7), 1e-6);

        assertEquals(0.0, Distributions.noncentralTCdf(1.0, 50, 40), 1e-15);
        assertEquals(0.0, Distributions.noncentralTCdf(-1.0, 50, 39), 1e-15);
        assertEquals(1.0, Distributions.noncentralTCdf(1.0, 50, -40), 1e-15);
        assertEquals(1.0, Distributions.noncentralTCdf(1e200, 50, 3.0), 1e-9);
        assertEquals(1.0, Distributions.noncentralTCdf(1e200, 50, 45.0), 1e-9);
    }

    @Test
    void testNoncentralTDecreasesWithNoncentrality() throws Exception {
        double previous = 1.0;
        for (double ncp = -2.0; ncp <= 6.0; ncp += 0.5) {
            double value = Distributions.noncentralTCdf(2.0, 12, ncp);
            assertTrue(value < previous, "CDF should fall as ncp grows, ncp=" + ncp);
            previous = value;
        }
    }

    @Test
    void testNoncentralTLargeDegreesOfFreedomApproachesShiftedNormal() throws Exception {
        assertEquals(Distributions.normalCdf(1.0 - 2.0), Distributions.noncentralTCdf(1.0, 1e6, 2.0), 1e-5);
    }

    @Test
    void testInvalidParametersAreRejected() {
        assertInvalid(() -> Distributions.normalCdf(Double.NaN));
        assertInvalid(() -> Distributions.normalSurvival(Double.POSITIVE_INFINITY));
        assertInvalid(() -> Distributions.normalInverseCdf(0.0));
        assertInvalid(() -> Distributions.normalInverseCdf(1.0));
        assertInvalid(() -> Distributions.studentTCdf(1.0, 0.0));
        assertInvalid(() -> Distributions.studentTCdf(1.0, -3.0));
        assertInvalid(() -> Distributions.studentTInverseCdf(1.5, 3.0));
        assertInvalid(() -> Distributions.chiSquareCdf(1.0, Double.NaN));
        assertInvalid(() -> Distributions.chiSquareInverseCdf(0.95, 0.0));
        assertInvalid(() -> Distributions.fCdf(1.0, 2.0, 0.0));
        assertInvalid(() -> Distributions.fInverseCdf(-0.1, 2.0, 3.0));
        assertInvalid(() -> Distributions.noncentralTCdf(1.0, 5.0, Double.NaN));
    }

    private static void assertInvalid(org.junit.jupiter.api.function.Executable call) {
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class, call);
        assertEquals(StatisticalErrorType.INVALID_PARAMETER, ex.getErrorType());
    }

    /**
     * P(T' &lt;= x) = E[Φ(x sqrt(V/df) - ncp)] with V ~ χ²(df).
     */
    private static double integratedNoncentralT(double x, double df, double ncp) {
        NormalDistribution normal = new NormalDistribution();
        ChiSquaredDistribution chiSquare = new ChiSquaredDistribution(df);
        IterativeLegendreGaussIntegrator integrator = new IterativeLegendreGaussIntegrator(16, 1e-10, 1e-12);
        double upper = df + 40 * Math.sqrt(2 * df) + 50;
        return integrator.integrate(10_000_000,
            v -> normal.cumulativeProbability(x * Math.sqrt(v / df) - ncp) * chiSquare.density(v), 0.0, upper);
    }
}
