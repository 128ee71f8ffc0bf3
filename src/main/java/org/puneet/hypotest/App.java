package org.puneet.hypotest;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.puneet.hypotest.exceptions.StatisticalValidationException;
import org.puneet.hypotest.statistical.PowerAnalysis;
import org.puneet.hypotest.statistical.PowerAnalysisResult;
import org.puneet.hypotest.statistical.StatisticalTestResult;
import org.puneet.hypotest.util.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Command line entry point. Prints the result as JSON on standard output.
 *
 * <pre>
 *   App &lt;test-type&gt; &lt;data&gt; [alpha]
 *   App power &lt;effect-size&gt; &lt;n-per-group&gt; [alpha]
 *   App sample-size &lt;effect-size&gt; &lt;target-power&gt; [alpha]
 * </pre>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-06
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Executes one command.
     *
     * @return process exit code
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length < 2 || args.length > 4) {
            printUsage(err);
            return EXIT_USAGE;
        }

        String command = args[0];
        try {
            Object result;
            if ("power".equalsIgnoreCase(command)) {
                if (args.length < 3) {
                    printUsage(err);
                    return EXIT_USAGE;
                }
                double effectSize = Double.parseDouble(args[1]);
                int n = Integer.parseInt(args[2]);
                result = PowerAnalysis.powerAnalysis(effectSize, n, alphaArgument(args, 3));
            } else if ("sample-size".equalsIgnoreCase(command)) {
                if (args.length < 3) {
                    printUsage(err);
                    return EXIT_USAGE;
                }
                double effectSize = Double.parseDouble(args[1]);
                double target = Double.parseDouble(args[2]);
                result = PowerAnalysis.requiredSampleSizeAnalysis(effectSize, target, alphaArgument(args, 3));
            } else {
                if (args.length > 3) {
                    printUsage(err);
                    return EXIT_USAGE;
                }
                result = HypothesisTestRunner.run(command, args[1], null, null, alphaArgument(args, 2));
            }

            logResult(result);
            out.println(HypothesisTestRunner.toJson(result));
            return EXIT_OK;

        } catch (NumberFormatException e) {
            err.println("Invalid number: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        } catch (StatisticalValidationException e) {
            logger.error("Hypothesis test failed: {}", e.getDetailedMessage());
            err.println(e.getMessage());
            return EXIT_ERROR;
        } catch (JsonProcessingException e) {
            logger.error("Failed to render result as JSON", e);
            err.println("Failed to render result: " + e.getOriginalMessage());
            return EXIT_ERROR;
        }
    }

    private static double alphaArgument(String[] args, int index) {
        return args.length > index ? Double.parseDouble(args[index]) : EngineConfig.SIGNIFICANCE_LEVEL;
    }

    private static void logResult(Object result) {
        if (result instanceof StatisticalTestResult) {
            StatisticalTestResult test = (StatisticalTestResult) result;
            logger.info("{}: statistic={}, p={}, significant={}",
                test.getTestName(), test.getStatistic(), test.getPValue(), test.isSignificant());
        } else if (result instanceof PowerAnalysisResult) {
            logger.info(((PowerAnalysisResult) result).getSummary());
        }
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage:");
        err.println("  App <test-type> <data> [alpha]");
        err.println("      test-type: " + String.join(", ", HypothesisTestRunner.SUPPORTED_TYPES));
        err.println("      data: \"1,2,3|4,5,6\" for two samples, \"[[1,2],[3,4]]\" for groups or tables");
        err.println("  App power <effect-size> <n-per-group> [alpha]");
        err.println("  App sample-size <effect-size> <target-power> [alpha]");
    }
}
