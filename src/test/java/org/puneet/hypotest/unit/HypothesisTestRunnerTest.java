package org.puneet.hypotest.unit;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.puneet.hypotest.HypothesisTestRunner;
import org.puneet.hypotest.exceptions.StatisticalValidationException;
import org.puneet.hypotest.exceptions.StatisticalValidationException.StatisticalErrorType;
import org.puneet.hypotest.statistical.NonparametricTests;
import org.puneet.hypotest.statistical.ParametricTests;
import org.puneet.hypotest.statistical.PowerAnalysis;
import org.puneet.hypotest.statistical.StatisticalTestResult;
import org.puneet.hypotest.statistical.TestType;

import static org.junit.jupiter.api.Assertions.*;

class HypothesisTestRunnerTest {

    @Test
    void testDispatchByType() throws Exception {
        assertEquals(ParametricTests.WELCH_TEST_NAME,
            HypothesisTestRunner.run("t-test", "10,12,9,11|15,14,16,13", null, null, 0.05).getTestName());
        assertEquals(ParametricTests.POOLED_TEST_NAME,
            HypothesisTestRunner.run("pooled-t-test", "10,12,9,11|15,14,16,13", null, null, 0.05).getTestName());
        assertEquals(ParametricTests.ANOVA_TEST_NAME,
            HypothesisTestRunner.run("ANOVA", "[[1,2,3],[4,5,6],[7,8,9]]", null, null, 0.05).getTestName());
        assertEquals(NonparametricTests.CHI_SQUARE_TEST_NAME,
            HypothesisTestRunner.run("chi-square", "[[10,20],[30,40]]", null, null, 0.05).getTestName());
        assertEquals(NonparametricTests.MANN_WHITNEY_TEST_NAME,
            HypothesisTestRunner.run(" Mann-Whitney ", "1,2,3|4,5,6", null, null, 0.05).getTestName());
    }

    @Test
    void testHypothesisLabelsAreApplied() throws Exception {
        StatisticalTestResult result = HypothesisTestRunner.run("t-test", "10,12,9,11|15,14,16,13",
            "Treatment has no effect", "Treatment changes the mean", 0.01);
        assertEquals("Treatment has no effect", result.getNullHypothesis());
        assertEquals("Treatment changes the mean", result.getAlternativeHypothesis());
        assertEquals(0.01, result.getAlpha());
        assertTrue(result.isSignificant());
    }

    @Test
    void testDefaultLabelsKeptWhenAbsent() throws Exception {
        StatisticalTestResult result = HypothesisTestRunner.run("chi-square", "[[10,10],[10,10]]", null, null, 0.05);
        assertEquals(TestType.CHI_SQUARE.getDefaultNullHypothesis(), result.getNullHypothesis());
    }

    @Test
    void testUnknownTypeAndBadData() {
        assertError(StatisticalErrorType.INVALID_PARAMETER,
            () -> HypothesisTestRunner.run("z-test", "1,2|3,4", null, null, 0.05));
        assertError(StatisticalErrorType.INVALID_PARAMETER,
            () -> HypothesisTestRunner.run(null, "1,2|3,4", null, null, 0.05));
        assertError(StatisticalErrorType.INVALID_PARAMETER,
            () -> HypothesisTestRunner.run("t-test", "1,2,3", null, null, 0.05));
        assertError(StatisticalErrorType.INSUFFICIENT_DATA,
            () -> HypothesisTestRunner.run("anova", "[[1,2,3]]", null, null, 0.05));
        assertError(StatisticalErrorType.DEGENERATE_TABLE,
            () -> HypothesisTestRunner.run("chi-square", "[[0,0],[1,2]]", null, null, 0.05));
    }

    @Test
    void testTestResultJson() throws Exception {
        StatisticalTestResult result = HypothesisTestRunner.run("chi-square", "[[1,2],[3,4]]", null, null, 0.05);
        JsonNode json = HypothesisTestRunner.getMapper().readTree(HypothesisTestRunner.toJson(result));

        assertEquals("Chi-square test of independence", json.get("test_name").asText());
        assertEquals("ChiSquare", json.get("test_type").asText());
        assertEquals(2, json.get("degrees_of_freedom").size());
        assertEquals(result.getPValue(), json.get("p_value").asDouble(), 0.0);
        assertFalse(json.get("is_significant").asBoolean());
        assertEquals("LowExpectedFrequencyWarning", json.get("warnings").get(0).asText());
        assertTrue(json.get("parameters").has("CramersV"));
        assertTrue(json.get("executed_at").isTextual());
    }

    @Test
    void testPowerResultJson() throws Exception {
        JsonNode json = HypothesisTestRunner.getMapper().readTree(
            HypothesisTestRunner.toJson(PowerAnalysis.requiredSampleSizeAnalysis(0.8, 0.8)));
        assertEquals("PowerAnalysis", json.get("test_type").asText());
        assertEquals(26, json.get("required_sample_size").asInt());
        assertEquals(0.8, json.get("target_power").asDouble(), 0.0);
        assertTrue(json.get("summary").asText().startsWith("Power of 0.8075"));

        JsonNode plain = HypothesisTestRunner.getMapper().readTree(
            HypothesisTestRunner.toJson(PowerAnalysis.powerAnalysis(0.5, 20)));
        assertFalse(plain.has("required_sample_size"));
        assertFalse(plain.has("target_power"));
    }

    private static void assertError(StatisticalErrorType expected, org.junit.jupiter.api.function.Executable call) {
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class, call);
        assertEquals(expected, ex.getErrorType());
    }
}
