package org.puneet.hypotest.statistical;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Locale;

/**
 * Builds the human-readable interpretation attached to every result. Pure formatting:
 * the same inputs always give the same sentence.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public final class ResultInterpreter {

    private static final int MIN_P_VALUE_DIGITS = 4;

    /** Enough digits to round-trip any double */
    private static final int MAX_P_VALUE_DIGITS = 17;

    private ResultInterpreter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Formats the decision sentence, e.g.
     * {@code "Reject the null hypothesis at α=0.05: p=0.004659 < 0.05."}
     *
     * @param pValue two-tailed p-value
     * @param alpha significance threshold
     * @return decision sentence
     */
    public static String interpret(double pValue, double alpha) {
        boolean reject = pValue < alpha;
        String threshold = formatAlpha(alpha);
        return String.format(Locale.ROOT, "%s the null hypothesis at α=%s: p=%s %s %s.",
            reject ? "Reject" : "Fail to reject",
            threshold,
            formatPValue(pValue, alpha),
            reject ? "<" : ">=",
            threshold);
    }

    /**
     * Formats the decision sentence followed by one sentence per warning.
     *
     * @param pValue two-tailed p-value
     * @param alpha significance threshold
     * @param warnings warnings attached to the result
     * @return decision sentence with warnings appended
     */
    public static String interpret(double pValue, double alpha, Collection<ResultWarning> warnings) {
        StringBuilder sb = new StringBuilder(interpret(pValue, alpha));
        for (ResultWarning warning : warnings) {
            sb.append(' ').append(warning.getMessage());
        }
        return sb.toString();
    }

    /**
     * Summarises a power analysis, e.g.
     * {@code "Power of 0.8074 at n=26 per group (d=0.8, α=0.05)."}
     */
    public static String describePower(double power, int sampleSizePerGroup, double effectSize, double alpha) {
        return String.format(Locale.ROOT, "Power of %.4f at n=%d per group (d=%s, α=%s).",
            power, sampleSizePerGroup, plain(effectSize), formatAlpha(alpha));
    }

    /**
     * Renders alpha as a plain decimal with trailing zeros removed.
     */
    public static String formatAlpha(double alpha) {
        return plain(alpha);
    }

    /**
     * Renders a p-value with four significant digits.
     */
    public static String formatPValue(double pValue) {
        return formatWithDigits(pValue, MIN_P_VALUE_DIGITS);
    }

    /**
     * Renders a p-value with at least four significant digits, adding digits until the shown
     * value lies on the same side of {@code alpha} as the p-value itself.
     */
    public static String formatPValue(double pValue, double alpha) {
        boolean reject = pValue < alpha;
        for (int digits = MIN_P_VALUE_DIGITS; digits < MAX_P_VALUE_DIGITS; digits++) {
            String text = formatWithDigits(pValue, digits);
            if ((Double.parseDouble(text) < alpha) == reject) {
                return text;
            }
        }
        return formatWithDigits(pValue, MAX_P_VALUE_DIGITS);
    }

    private static String formatWithDigits(double pValue, int digits) {
        if (pValue == 0.0) {
            return "0";
        }
        return String.format(Locale.ROOT, "%." + digits + "g", pValue);
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
