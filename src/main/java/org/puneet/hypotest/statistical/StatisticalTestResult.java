package org.puneet.hypotest.statistical;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.*;

/**
 * Immutable outcome of a hypothesis test: statistic, degrees of freedom, two-tailed
 * p-value, the decision at the chosen significance level and its interpretation.
 *
 * <p>Degrees of freedom hold one value for the t-test (fractional for Welch's test) and
 * the Mann-Whitney test, two values for ANOVA (between, within) and the chi-square test
 * (rows - 1, columns - 1). Intermediate quantities such as means, sums of squares or the
 * critical value are kept in an ordered parameter map.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
@JsonPropertyOrder({"test_name", "test_type", "statistic", "degrees_of_freedom", "p_value", "alpha",
    "is_significant", "null_hypothesis", "alternative_hypothesis", "interpretation",
    "parameters", "warnings", "executed_at"})
public final class StatisticalTestResult {

    private final String testName;
    private final TestType testType;
    private final double statistic;
    private final double[] degreesOfFreedom;
    private final double pValue;
    private final double alpha;
    private final boolean significant;
    private final String nullHypothesis;
    private final String alternativeHypothesis;
    private final String interpretation;
    private final Map<String, Double> parameters;
    private final Set<ResultWarning> warnings;
    private final Instant executedAt;

    /**
     * Creates a result. Missing hypothesis labels fall back to the defaults of the test type.
     *
     * @param testName human-readable test identifier
     * @param testType test family
     * @param statistic computed test statistic
     * @param degreesOfFreedom one or two degrees of freedom
     * @param pValue two-tailed p-value in [0, 1]
     * @param alpha significance level in (0, 1)
     * @param nullHypothesis null hypothesis label, may be null
     * @param alternativeHypothesis alternative hypothesis label, may be null
     * @param parameters intermediate quantities, may be null
     * @param warnings non-fatal warnings, may be null
     * @throws IllegalArgumentException if the p-value, alpha or degrees of freedom are malformed
     */
    public StatisticalTestResult(String testName, TestType testType, double statistic,
                                 double[] degreesOfFreedom, double pValue, double alpha,
                                 String nullHypothesis, String alternativeHypothesis,
                                 Map<String, Double> parameters, Collection<ResultWarning> warnings) {
        this(testName, testType, statistic, degreesOfFreedom, pValue, alpha, nullHypothesis,
            alternativeHypothesis, parameters, warnings, Instant.now());
    }

    private StatisticalTestResult(String testName, TestType testType, double statistic,
                                  double[] degreesOfFreedom, double pValue, double alpha,
                                  String nullHypothesis, String alternativeHypothesis,
                                  Map<String, Double> parameters, Collection<ResultWarning> warnings,
                                  Instant executedAt) {
        validateParameters(pValue, alpha, degreesOfFreedom);

        this.testName = Objects.requireNonNull(testName, "Test name cannot be null");
        this.testType = Objects.requireNonNull(testType, "Test type cannot be null");
        this.statistic = statistic;
        this.degreesOfFreedom = degreesOfFreedom.clone();
        this.pValue = pValue;
        this.alpha = alpha;
        this.significant = pValue < alpha;
        this.nullHypothesis = nullHypothesis != null ? nullHypothesis : testType.getDefaultNullHypothesis();
        this.alternativeHypothesis = alternativeHypothesis != null
            ? alternativeHypothesis : testType.getDefaultAlternativeHypothesis();
        this.parameters = parameters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Collections.emptyMap();
        EnumSet<ResultWarning> warningSet = EnumSet.noneOf(ResultWarning.class);
        if (warnings != null) {
            warningSet.addAll(warnings);
        }
        this.warnings = Collections.unmodifiableSet(warningSet);
        this.interpretation = ResultInterpreter.interpret(pValue, alpha, this.warnings);
        this.executedAt = executedAt;
    }

    /**
     * Returns a copy with caller-supplied hypothesis labels. A null label keeps the current one.
     *
     * @param nullHypothesis new null hypothesis label
     * @param alternativeHypothesis new alternative hypothesis label
     * @return relabelled result
     */
    public StatisticalTestResult withHypotheses(String nullHypothesis, String alternativeHypothesis) {
        return new StatisticalTestResult(testName, testType, statistic, degreesOfFreedom, pValue, alpha,
            nullHypothesis != null ? nullHypothesis : this.nullHypothesis,
            alternativeHypothesis != null ? alternativeHypothesis : this.alternativeHypothesis,
            parameters, warnings, executedAt);
    }

    @JsonProperty("test_name")
    public String getTestName() { return testName; }

    @JsonProperty("test_type")
    public TestType getTestType() { return testType; }

    @JsonProperty("statistic")
    public double getStatistic() { return statistic; }

    @JsonProperty("degrees_of_freedom")
    public double[] getDegreesOfFreedom() { return degreesOfFreedom.clone(); }

    @JsonProperty("p_value")
    public double getPValue() { return pValue; }

    @JsonProperty("alpha")
    public double getAlpha() { return alpha; }

    @JsonProperty("is_significant")
    public boolean isSignificant() { return significant; }

    @JsonProperty("null_hypothesis")
    public String getNullHypothesis() { return nullHypothesis; }

    @JsonProperty("alternative_hypothesis")
    public String getAlternativeHypothesis() { return alternativeHypothesis; }

    @JsonProperty("interpretation")
    public String getInterpretation() { return interpretation; }

    @JsonProperty("parameters")
    public Map<String, Double> getParameters() { return parameters; }

    @JsonProperty("warnings")
    public Set<ResultWarning> getWarnings() { return warnings; }

    @JsonProperty("executed_at")
    public Instant getExecutedAt() { return executedAt; }

    public boolean hasWarning(ResultWarning warning) {
        return warnings.contains(warning);
    }

    /**
     * Looks up an intermediate quantity.
     *
     * @param name parameter name, e.g. "Mean1" or "SSB"
     * @return the value, or NaN when the test did not record it
     */
    public double getParameter(String name) {
        return parameters.getOrDefault(name, Double.NaN);
    }

    private static void validateParameters(double pValue, double alpha, double[] degreesOfFreedom) {
        if (Double.isNaN(pValue) || pValue < 0 || pValue > 1) {
            throw new IllegalArgumentException("P-value must be between 0 and 1");
        }
        if (!(alpha > 0 && alpha < 1)) {
            throw new IllegalArgumentException("Significance level must be between 0 and 1");
        }
        if (degreesOfFreedom == null || degreesOfFreedom.length < 1 || degreesOfFreedom.length > 2) {
            throw new IllegalArgumentException("One or two degrees of freedom required");
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s: statistic=%.4f, df=%s, p-value=%s, significant=%s",
            testName, statistic, Arrays.toString(degreesOfFreedom),
            ResultInterpreter.formatPValue(pValue), significant);
    }
}
