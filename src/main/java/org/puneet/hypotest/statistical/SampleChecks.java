package org.puneet.hypotest.statistical;

import org.puneet.hypotest.exceptions.StatisticalValidationException;

/**
 * Input checks shared by the test modules.
 */
final class SampleChecks {

    private SampleChecks() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static void requireSample(double[] sample, String name, int minSize, String testName)
            throws StatisticalValidationException {
        if (sample == null) {
            throw StatisticalValidationException.insufficientData(0, minSize, testName + " (" + name + ")");
        }
        if (sample.length < minSize) {
            throw StatisticalValidationException.insufficientData(sample.length, minSize, testName + " (" + name + ")");
        }
        for (int i = 0; i < sample.length; i++) {
            if (!Double.isFinite(sample[i])) {
                throw StatisticalValidationException.invalidParameter(
                    name + "[" + i + "]", sample[i], "observations must be finite");
            }
        }
    }

    static void requireAlpha(double alpha) throws StatisticalValidationException {
        if (!(alpha > 0 && alpha < 1)) {
            throw StatisticalValidationException.invalidParameter("alpha", alpha, "must lie strictly between 0 and 1");
        }
    }
}
