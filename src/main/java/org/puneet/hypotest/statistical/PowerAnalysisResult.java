package org.puneet.hypotest.statistical;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Locale;

/**
 * Immutable outcome of a two-sample t-test power analysis.
 *
 * <p>When the analysis was driven by a target power, {@link #getRequiredSampleSize()} and
 * {@link #getTargetPower()} are populated and {@link #getPower()} is the power actually
 * achieved at the required sample size.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"test_type", "effect_size", "sample_size_per_group", "power", "significance_level",
    "required_sample_size", "target_power", "degrees_of_freedom", "noncentrality", "critical_value",
    "summary", "calculated_at"})
public final class PowerAnalysisResult {

    private final double effectSize;
    private final int sampleSizePerGroup;
    private final double power;
    private final double significanceLevel;
    private final Integer requiredSampleSize;
    private final Double targetPower;
    private final double degreesOfFreedom;
    private final double noncentrality;
    private final double criticalValue;
    private final Instant calculatedAt;

    /**
     * Creates a result for a power computed from a given sample size.
     */
    public PowerAnalysisResult(double effectSize, int sampleSizePerGroup, double power,
                               double significanceLevel, double degreesOfFreedom,
                               double noncentrality, double criticalValue) {
        this(effectSize, sampleSizePerGroup, power, significanceLevel, null, null,
            degreesOfFreedom, noncentrality, criticalValue);
    }

    /**
     * Creates a result, optionally carrying the sample size required for a target power.
     *
     * @throws IllegalArgumentException if power or significance level lie outside their ranges
     */
    public PowerAnalysisResult(double effectSize, int sampleSizePerGroup, double power,
                               double significanceLevel, Integer requiredSampleSize, Double targetPower,
                               double degreesOfFreedom, double noncentrality, double criticalValue) {
        if (Double.isNaN(power) || power < 0 || power > 1) {
            throw new IllegalArgumentException("Power must be between 0 and 1");
        }
        if (!(significanceLevel > 0 && significanceLevel < 1)) {
            throw new IllegalArgumentException("Significance level must be between 0 and 1");
        }
        this.effectSize = effectSize;
        this.sampleSizePerGroup = sampleSizePerGroup;
        this.power = power;
        this.significanceLevel = significanceLevel;
        this.requiredSampleSize = requiredSampleSize;
        this.targetPower = targetPower;
        this.degreesOfFreedom = degreesOfFreedom;
        this.noncentrality = noncentrality;
        this.criticalValue = criticalValue;
        this.calculatedAt = Instant.now();
    }

    @JsonProperty("test_type")
    public TestType getTestType() { return TestType.POWER_ANALYSIS; }

    @JsonProperty("effect_size")
    public double getEffectSize() { return effectSize; }

    @JsonProperty("sample_size_per_group")
    public int getSampleSizePerGroup() { return sampleSizePerGroup; }

    @JsonProperty("power")
    public double getPower() { return power; }

    @JsonProperty("significance_level")
    public double getSignificanceLevel() { return significanceLevel; }

    /** @return the smallest per-group size reaching the target power, or null */
    @JsonProperty("required_sample_size")
    public Integer getRequiredSampleSize() { return requiredSampleSize; }

    @JsonProperty("target_power")
    public Double getTargetPower() { return targetPower; }

    @JsonProperty("degrees_of_freedom")
    public double getDegreesOfFreedom() { return degreesOfFreedom; }

    @JsonProperty("noncentrality")
    public double getNoncentrality() { return noncentrality; }

    @JsonProperty("critical_value")
    public double getCriticalValue() { return criticalValue; }

    @JsonProperty("calculated_at")
    public Instant getCalculatedAt() { return calculatedAt; }

    @JsonIgnore
    public boolean hasRequiredSampleSize() {
        return requiredSampleSize != null;
    }

    @JsonProperty("summary")
    public String getSummary() {
        return ResultInterpreter.describePower(power, sampleSizePerGroup, effectSize, significanceLevel);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "PowerAnalysis[d=%s, n=%d, power=%.4f, alpha=%s%s]",
            effectSize, sampleSizePerGroup, power, significanceLevel,
            requiredSampleSize != null ? ", required=" + requiredSampleSize : "");
    }
}
