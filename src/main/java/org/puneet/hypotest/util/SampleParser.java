package org.puneet.hypotest.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.puneet.hypotest.exceptions.StatisticalValidationException;
import org.puneet.hypotest.exceptions.StatisticalValidationException.StatisticalErrorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the textual sample encodings accepted by the command line and the test runner.
 *
 * <ul>
 *   <li>a single sample: {@code "1.5, 2, 3"}</li>
 *   <li>two samples separated by a pipe: {@code "1,2,3|4,5,6"}</li>
 *   <li>groups or table rows as a JSON array of arrays: {@code "[[1,2],[3,4]]"}</li>
 * </ul>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-06
 */
public final class SampleParser {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private SampleParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Parses a comma-separated list of numbers.
     *
     * @param text comma-separated numbers, whitespace allowed
     * @return the values in order
     * @throws StatisticalValidationException if the text is blank or holds a non-numeric entry
     */
    public static double[] parseSample(String text) throws StatisticalValidationException {
        if (text == null || text.isBlank()) {
            throw StatisticalValidationException.invalidParameter("sample", text, "must not be blank");
        }
        String[] tokens = text.split(",");
        double[] values = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i].trim();
            try {
                values[i] = Double.parseDouble(token);
            } catch (NumberFormatException e) {
                throw new StatisticalValidationException(StatisticalErrorType.INVALID_PARAMETER,
                    String.format("'%s' at position %d is not a number", token, i), e);
            }
        }
        return values;
    }

    /**
     * Parses two samples separated by {@code |}.
     *
     * @return a two-element array {sample1, sample2}
     * @throws StatisticalValidationException unless there are exactly two parseable samples
     */
    public static double[][] parseTwoSamples(String text) throws StatisticalValidationException {
        if (text == null) {
            throw StatisticalValidationException.invalidParameter("samples", null, "must not be null");
        }
        String[] parts = text.split("\\|", -1);
        if (parts.length != 2) {
            throw StatisticalValidationException.invalidParameter("samples", text,
                "expected two samples separated by '|'");
        }
        return new double[][] {parseSample(parts[0]), parseSample(parts[1])};
    }

    /**
     * Parses a JSON array of numeric arrays. Rows may differ in length; tests that need a
     * rectangular shape validate it themselves.
     *
     * @throws StatisticalValidationException if the text is not a JSON array of number arrays
     */
    public static double[][] parseNestedArrays(String json) throws StatisticalValidationException {
        if (json == null || json.isBlank()) {
            throw StatisticalValidationException.invalidParameter("data", json, "must not be blank");
        }
        try {
            double[][] rows = MAPPER.readValue(json, double[][].class);
            if (rows == null) {
                throw StatisticalValidationException.invalidParameter("data", json, "must be a JSON array");
            }
            for (int i = 0; i < rows.length; i++) {
                if (rows[i] == null) {
                    throw StatisticalValidationException.invalidParameter("data[" + i + "]", null,
                        "must be an array of numbers");
                }
            }
            return rows;
        } catch (JsonProcessingException e) {
            throw new StatisticalValidationException(StatisticalErrorType.INVALID_PARAMETER,
                "malformed JSON array of arrays: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a JSON array of arrays into a list of groups.
     *
     * @see #parseNestedArrays(String)
     */
    public static List<double[]> parseGroups(String json) throws StatisticalValidationException {
        double[][] rows = parseNestedArrays(json);
        List<double[]> groups = new ArrayList<>(rows.length);
        for (double[] row : rows) {
            groups.add(row);
        }
        return groups;
    }
}
