package org.puneet.hypotest.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Centralized configuration for the hypothesis engine.
 * Values are read once from {@code engine.properties} on the classpath; any key that is
 * missing or unparsable falls back to its built-in default.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    private static final String CONFIG_FILE = "engine.properties";

    private static final Properties config = loadConfiguration();

    // ===================================================================================
    // HYPOTHESIS TESTING
    // ===================================================================================

    /** Significance level used when the caller does not pass one (α = 0.05) */
    public static final double SIGNIFICANCE_LEVEL =
        getDouble("engine.significance-level", 0.05);

    /** Expected cell frequency below which a chi-square result carries a warning */
    public static final double MIN_EXPECTED_FREQUENCY =
        getDouble("engine.min-expected-frequency", 5.0);

    /**
     * Both Mann-Whitney samples at or below this size (and no ties) switch to the exact
     * permutation distribution. Zero keeps the normal approximation for every size.
     */
    public static final int MANN_WHITNEY_EXACT_THRESHOLD =
        getInt("engine.mann-whitney.exact-threshold", 0);

    // ===================================================================================
    // NUMERICAL ROUTINES
    // ===================================================================================

    /** Hard iteration cap for series expansions, root finders and sample-size search */
    public static final int MAX_ITERATIONS = getInt("engine.max-iterations", 1000);

    /** Convergence tolerance for iterative routines */
    public static final double TOLERANCE = getDouble("engine.tolerance", 1e-12);

    /** Upper bound for the required-sample-size search */
    public static final int MAX_SAMPLE_SIZE = getInt("engine.max-sample-size", 10_000_000);

    // ===================================================================================
    // BATCH EXECUTION
    // ===================================================================================

    /** Thread pool size for batch test execution */
    public static final int BATCH_THREADS = getInt("engine.batch.threads",
        Math.max(1, Runtime.getRuntime().availableProcessors() / 2));

    private EngineConfig() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    private static Properties loadConfiguration() {
        Properties props = new Properties();

        try (InputStream inputStream = EngineConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                logger.warn("Configuration file {} not found in classpath, using defaults", CONFIG_FILE);
                return props;
            }

            props.load(inputStream);
            logger.debug("Loaded configuration from {}", CONFIG_FILE);

        } catch (IOException e) {
            logger.warn("Failed to read {}, using defaults: {}", CONFIG_FILE, e.getMessage());
        }

        return props;
    }

    private static double getDouble(String key, double defaultValue) {
        String value = config.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid numeric value '{}' for {}, using default {}", value, key, defaultValue);
            return defaultValue;
        }
    }

    private static int getInt(String key, int defaultValue) {
        String value = config.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value '{}' for {}, using default {}", value, key, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Gets a raw property value from the configuration.
     *
     * @param key the property key
     * @param defaultValue the default value if key not found
     * @return the property value
     */
    public static String getProperty(String key, String defaultValue) {
        return config.getProperty(key, defaultValue);
    }

    /**
     * Summarises the active configuration.
     *
     * @return one-line description of the effective settings
     */
    public static String describe() {
        return String.format("alpha=%s, maxIterations=%d, tolerance=%s, minExpected=%s, exactThreshold=%d, batchThreads=%d",
            SIGNIFICANCE_LEVEL, MAX_ITERATIONS, TOLERANCE, MIN_EXPECTED_FREQUENCY,
            MANN_WHITNEY_EXACT_THRESHOLD, BATCH_THREADS);
    }
}
