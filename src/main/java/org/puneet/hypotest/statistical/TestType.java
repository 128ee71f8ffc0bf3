package org.puneet.hypotest.statistical;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Families of tests produced by the engine, each with the hypothesis labels used when the
 * caller does not supply its own.
 */
public enum TestType {
    T_TEST("TTest", "μ₁ = μ₂ (means are equal)", "μ₁ ≠ μ₂ (means are different)"),
    ANOVA("ANOVA", "All group means are equal", "At least one group mean is different"),
    CHI_SQUARE("ChiSquare", "Variables are independent", "Variables are associated"),
    MANN_WHITNEY("MannWhitney", "Distributions are identical", "Distributions are different"),
    POWER_ANALYSIS("PowerAnalysis", "Effect size is zero", "Effect size equals the assumed value");

    private final String label;
    private final String defaultNullHypothesis;
    private final String defaultAlternativeHypothesis;

    TestType(String label, String defaultNullHypothesis, String defaultAlternativeHypothesis) {
        this.label = label;
        this.defaultNullHypothesis = defaultNullHypothesis;
        this.defaultAlternativeHypothesis = defaultAlternativeHypothesis;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getDefaultNullHypothesis() {
        return defaultNullHypothesis;
    }

    public String getDefaultAlternativeHypothesis() {
        return defaultAlternativeHypothesis;
    }
}
