package org.puneet.hypotest.statistical;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Non-fatal conditions that reduce the quality of an approximation without blocking the
 * p-value computation.
 */
public enum ResultWarning {
    LOW_EXPECTED_FREQUENCY("LowExpectedFrequencyWarning",
        "At least one expected cell frequency is below the reliability threshold; the chi-square approximation may be inaccurate.");

    private final String label;
    private final String message;

    ResultWarning(String label, String message) {
        this.label = label;
        this.message = message;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getMessage() {
        return message;
    }
}
