package org.puneet.hypotest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.puneet.hypotest.exceptions.StatisticalValidationException;
import org.puneet.hypotest.statistical.NonparametricTests;
import org.puneet.hypotest.statistical.ParametricTests;
import org.puneet.hypotest.statistical.StatisticalTestResult;
import org.puneet.hypotest.util.SampleParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Runs a hypothesis test named by a string identifier on textually encoded data and attaches
 * caller-supplied hypothesis labels to the result.
 *
 * <table>
 *   <caption>Supported test types</caption>
 *   <tr><th>type</th><th>data</th></tr>
 *   <tr><td>t-test</td><td>{@code "1,2,3|4,5,6"} (Welch)</td></tr>
 *   <tr><td>pooled-t-test</td><td>{@code "1,2,3|4,5,6"}</td></tr>
 *   <tr><td>anova</td><td>{@code "[[1,2,3],[4,5,6],[7,8,9]]"}</td></tr>
 *   <tr><td>chi-square</td><td>{@code "[[10,20],[30,40]]"}</td></tr>
 *   <tr><td>mann-whitney</td><td>{@code "1,2,3|4,5,6"}</td></tr>
 * </table>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-06
 */
public final class HypothesisTestRunner {
    private static final Logger logger = LoggerFactory.getLogger(HypothesisTestRunner.class);

    public static final List<String> SUPPORTED_TYPES = Collections.unmodifiableList(
        Arrays.asList("t-test", "pooled-t-test", "anova", "chi-square", "mann-whitney"));

    private static final ObjectMapper MAPPER = createMapper();

    private HypothesisTestRunner() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Parses the data for the given test type, runs the test and relabels its hypotheses.
     *
     * @param testType one of {@link #SUPPORTED_TYPES}, case-insensitive
     * @param data encoded samples, groups or table
     * @param nullHypothesis null hypothesis label, null keeps the default
     * @param alternativeHypothesis alternative hypothesis label, null keeps the default
     * @param alpha significance level in (0, 1)
     * @return the test result
     * @throws StatisticalValidationException for an unknown test type, malformed data, or any
     *         error raised by the test itself
     */
    public static StatisticalTestResult run(String testType, String data, String nullHypothesis,
                                            String alternativeHypothesis, double alpha)
            throws StatisticalValidationException {
        if (testType == null) {
            throw StatisticalValidationException.invalidParameter("testType", null,
                "must be one of " + SUPPORTED_TYPES);
        }

        String type = testType.trim().toLowerCase(Locale.ROOT);
        logger.debug("Running {} at alpha={}", type, alpha);

        StatisticalTestResult result;
        switch (type) {
            case "t-test": {
                double[][] samples = SampleParser.parseTwoSamples(data);
                result = ParametricTests.tTest(samples[0], samples[1], false, alpha);
                break;
            }
            case "pooled-t-test": {
                double[][] samples = SampleParser.parseTwoSamples(data);
                result = ParametricTests.tTest(samples[0], samples[1], true, alpha);
                break;
            }
            case "anova":
                result = ParametricTests.anova(SampleParser.parseGroups(data), alpha);
                break;
            case "chi-square":
                result = NonparametricTests.chiSquareTest(SampleParser.parseNestedArrays(data), alpha);
                break;
            case "mann-whitney": {
                double[][] samples = SampleParser.parseTwoSamples(data);
                result = NonparametricTests.mannWhitneyTest(samples[0], samples[1], alpha);
                break;
            }
            default:
                throw StatisticalValidationException.invalidParameter("testType", testType,
                    "must be one of " + SUPPORTED_TYPES);
        }

        return result.withHypotheses(nullHypothesis, alternativeHypothesis);
    }

    /**
     * Renders a test or power analysis result as indented JSON with ISO-8601 timestamps.
     */
    public static String toJson(Object result) throws JsonProcessingException {
        return MAPPER.writeValueAsString(result);
    }

    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
