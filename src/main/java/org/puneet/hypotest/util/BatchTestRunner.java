package org.puneet.hypotest.util;

import org.puneet.hypotest.exceptions.StatisticalValidationException;
import org.puneet.hypotest.statistical.StatisticalTestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a named batch of hypothesis tests in parallel on a fixed thread pool.
 *
 * <p>Each task is isolated: a failing task records its exception in its own
 * {@link Outcome} and never cancels the others. Outcomes are returned in the iteration
 * order of the submitted map.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-06
 */
public class BatchTestRunner implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BatchTestRunner.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    /**
     * A single test invocation.
     */
    @FunctionalInterface
    public interface TestTask {
        StatisticalTestResult execute() throws StatisticalValidationException;
    }

    /**
     * Result or failure of one task.
     */
    public static final class Outcome {
        private final String name;
        private final StatisticalTestResult result;
        private final Exception error;

        private Outcome(String name, StatisticalTestResult result, Exception error) {
            this.name = name;
            this.result = result;
            this.error = error;
        }

        public String getName() { return name; }
        public StatisticalTestResult getResult() { return result; }
        public Exception getError() { return error; }

        public boolean isSuccess() {
            return error == null;
        }

        @Override
        public String toString() {
            return isSuccess()
                ? String.format("Outcome[%s: %s]", name, result)
                : String.format("Outcome[%s failed: %s]", name, error.getMessage());
        }
    }

    private final ExecutorService executorService;
    private final int threads;

    public BatchTestRunner() {
        this(EngineConfig.BATCH_THREADS);
    }

    public BatchTestRunner(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive");
        }
        this.threads = threads;
        this.executorService = Executors.newFixedThreadPool(threads);
    }

    /**
     * Runs every task and waits for all of them to finish.
     *
     * @param tasks tasks keyed by a caller-chosen name
     * @return outcome per name, in the order of {@code tasks}
     * @throws IllegalArgumentException if tasks is null or holds a null task
     */
    public Map<String, Outcome> runAll(Map<String, TestTask> tasks) {
        if (tasks == null) {
            throw new IllegalArgumentException("Tasks cannot be null");
        }
        if (tasks.isEmpty()) {
            return Collections.emptyMap();
        }
        tasks.forEach((name, task) -> {
            if (task == null) {
                throw new IllegalArgumentException("Task '" + name + "' cannot be null");
            }
        });

        final int total = tasks.size();
        final AtomicInteger completed = new AtomicInteger(0);
        logger.info("Starting batch of {} hypothesis tests on {} threads", total, threads);

        List<CompletableFuture<Outcome>> futures = new ArrayList<>(total);
        for (Map.Entry<String, TestTask> entry : tasks.entrySet()) {
            String name = entry.getKey();
            TestTask task = entry.getValue();
            futures.add(CompletableFuture.supplyAsync(() -> {
                Outcome outcome = execute(name, task);
                logger.debug("Batch progress: {}/{}", completed.incrementAndGet(), total);
                return outcome;
            }, executorService));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<String, Outcome> outcomes = new LinkedHashMap<>();
        int failures = 0;
        for (CompletableFuture<Outcome> future : futures) {
            Outcome outcome = future.join();
            outcomes.put(outcome.getName(), outcome);
            if (!outcome.isSuccess()) {
                failures++;
            }
        }

        logger.info("Batch completed: {} succeeded, {} failed", total - failures, failures);
        return outcomes;
    }

    private static Outcome execute(String name, TestTask task) {
        try {
            return new Outcome(name, task.execute(), null);
        } catch (StatisticalValidationException e) {
            logger.warn("Test '{}' rejected its input: {}", name, e.getMessage());
            return new Outcome(name, null, e);
        } catch (RuntimeException e) {
            logger.warn("Test '{}' failed unexpectedly", name, e);
            return new Outcome(name, null, e);
        }
    }

    /**
     * Shuts down the thread pool, waiting for running tasks.
     */
    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Batch executor did not terminate in {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
