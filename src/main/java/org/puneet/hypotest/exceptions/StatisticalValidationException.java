package org.puneet.hypotest.exceptions;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Exception raised by the hypothesis engine when a test or distribution routine cannot
 * produce a result. Every failure is reported immediately at the point of detection;
 * no partial result accompanies it.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class StatisticalValidationException extends Exception implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Types of statistical failures
     */
    public enum StatisticalErrorType {
        INVALID_PARAMETER("STAT001", "Invalid distribution or test parameter"),
        INSUFFICIENT_DATA("STAT002", "Insufficient observations for the requested test"),
        DEGENERATE_TABLE("STAT003", "Contingency table has a zero row or column total"),
        CONVERGENCE_FAILURE("STAT004", "Iterative routine did not converge within its iteration cap");

        private final String code;
        private final String description;

        StatisticalErrorType(String code, String description) {
            this.code = code;
            this.description = description;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }
    }

    private final StatisticalErrorType errorType;
    private final LocalDateTime timestamp;
    private final Map<String, Object> statisticalContext;

    /**
     * Constructs a new StatisticalValidationException with error type and message.
     *
     * @param errorType The type of statistical error
     * @param message The detailed error message
     * @throws NullPointerException if errorType is null
     */
    public StatisticalValidationException(StatisticalErrorType errorType, String message) {
        this(errorType, message, null);
    }

    /**
     * Constructs a new StatisticalValidationException with error type, message, and cause.
     *
     * @param errorType The type of statistical error
     * @param message The detailed error message
     * @param cause The underlying cause
     * @throws NullPointerException if errorType is null
     */
    public StatisticalValidationException(StatisticalErrorType errorType,
                                          String message, Throwable cause) {
        super(formatMessage(Objects.requireNonNull(errorType, "Error type cannot be null"), message), cause);
        this.errorType = errorType;
        this.timestamp = LocalDateTime.now();
        this.statisticalContext = new LinkedHashMap<>();
    }

    /**
     * Creates an exception for a malformed parameter (non-positive degrees of freedom,
     * NaN or infinite input, probability outside its range).
     *
     * @param parameterName name of the offending parameter
     * @param value the rejected value
     * @param requirement what the parameter must satisfy
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException invalidParameter(
            String parameterName, Object value, String requirement) {

        String message = String.format("%s = %s is invalid (%s)", parameterName, value, requirement);

        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.INVALID_PARAMETER, message);
        ex.addContext("parameter", parameterName);
        ex.addContext("value", value);
        return ex;
    }

    /**
     * Creates an exception for a sample or group that is too small for a test.
     *
     * @param actualSize The actual number of observations (or groups)
     * @param requiredSize The required minimum
     * @param testName The statistical test requiring the data
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException insufficientData(
            int actualSize, int requiredSize, String testName) {

        String message = String.format(
                "%d provided, %s requires at least %d", actualSize, testName, requiredSize);

        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.INSUFFICIENT_DATA, message);
        ex.addContext("actualSize", actualSize);
        ex.addContext("requiredSize", requiredSize);
        ex.addContext("testName", testName);
        return ex;
    }

    /**
     * Creates an exception for a contingency table whose expected frequencies are undefined.
     *
     * @param dimension "row" or "column"
     * @param index zero-based index of the empty row or column
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException degenerateTable(String dimension, int index) {
        String message = String.format("%s %d sums to zero", dimension, index);

        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.DEGENERATE_TABLE, message);
        ex.addContext("dimension", dimension);
        ex.addContext("index", index);
        return ex;
    }

    /**
     * Creates an exception for an iterative routine that hit its iteration cap.
     *
     * @param routine name of the numerical routine
     * @param iterations the cap that was exhausted
     * @param cause underlying library exception, may be null
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException convergenceFailure(
            String routine, int iterations, Throwable cause) {

        String message = String.format("%s did not converge after %d iterations", routine, iterations);

        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.CONVERGENCE_FAILURE, message, cause);
        ex.addContext("routine", routine);
        ex.addContext("iterations", iterations);
        return ex;
    }

    private static String formatMessage(StatisticalErrorType errorType, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorType.getCode()).append("] ");
        sb.append(errorType.getDescription());

        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }

    /**
     * Adds statistical context information.
     *
     * @param key The context key
     * @param value The context value
     */
    public void addContext(String key, Object value) {
        if (key != null) {
            statisticalContext.put(key, value);
        }
    }

    public StatisticalErrorType getErrorType() {
        return errorType;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    /**
     * Gets the statistical context.
     *
     * @return An unmodifiable map of statistical context
     */
    public Map<String, Object> getStatisticalContext() {
        return Collections.unmodifiableMap(statisticalContext);
    }

    /**
     * Gets a detailed message for logging.
     *
     * @return A detailed string representation
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("StatisticalValidationException Details:\n");
        sb.append("  Error Type: ").append(errorType.getCode()).append(" - ")
          .append(errorType.getDescription()).append("\n");
        sb.append("  Message: ").append(getMessage()).append("\n");
        sb.append("  Timestamp: ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("\n");

        if (!statisticalContext.isEmpty()) {
            sb.append("  Statistical Context:\n");
            statisticalContext.forEach((key, value) ->
                    sb.append("    ").append(key).append(": ").append(value).append("\n"));
        }

        if (getCause() != null) {
            sb.append("  Cause: ").append(getCause().getClass().getName())
              .append(" - ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("StatisticalValidationException[type=%s, timestamp=%s]: %s",
                errorType.name(),
                timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                getMessage());
    }
}
