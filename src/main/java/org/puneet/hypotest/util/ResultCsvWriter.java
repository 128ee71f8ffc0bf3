package org.puneet.hypotest.util;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.puneet.hypotest.statistical.ResultWarning;
import org.puneet.hypotest.statistical.StatisticalTestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Appends hypothesis test results to a CSV file, one row per result.
 *
 * <p>The header is written only when the file is new or empty, so repeated runs accumulate
 * rows in the same file. Writes are serialized with a lock; one instance may be shared by
 * the threads of a batch run.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-06
 */
public class ResultCsvWriter {
    private static final Logger logger = LoggerFactory.getLogger(ResultCsvWriter.class);

    public static final String[] HEADERS = {
        "TestName", "TestType", "Statistic", "DF1", "DF2", "PValue", "Alpha",
        "Significant", "Warnings", "Interpretation"
    };

    private static final CSVFormat RESULT_FORMAT = CSVFormat.DEFAULT
        .withHeader(HEADERS)
        .withRecordSeparator("\n");

    private static final CSVFormat APPEND_FORMAT = RESULT_FORMAT.withSkipHeaderRecord();

    private final Path outputFile;
    private final ReentrantLock lock = new ReentrantLock();
    private int recordCount;

    public ResultCsvWriter(Path outputFile) {
        if (outputFile == null) {
            throw new IllegalArgumentException("Output file cannot be null");
        }
        this.outputFile = outputFile;
    }

    public void writeResult(StatisticalTestResult result) throws IOException {
        writeResults(Collections.singletonList(result));
    }

    /**
     * Appends the results, creating the file and its parent directories when needed.
     *
     * @param results results to append, in order
     * @throws IOException if the file cannot be written
     */
    public void writeResults(Collection<StatisticalTestResult> results) throws IOException {
        if (results == null || results.isEmpty()) {
            logger.debug("No results to write to {}", outputFile);
            return;
        }
        lock.lock();
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean needsHeader = !Files.exists(outputFile) || Files.size(outputFile) == 0;
            CSVFormat format = needsHeader ? RESULT_FORMAT : APPEND_FORMAT;

            try (BufferedWriter writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8,
                     StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                for (StatisticalTestResult result : results) {
                    printer.printRecord(toRecord(result));
                }
            }
            recordCount += results.size();
            logger.info("Wrote {} result(s) to {}", results.size(), outputFile);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes a header and the results to any appendable, such as standard output. The
     * appendable is flushed but left open.
     */
    public static void write(Appendable out, Collection<StatisticalTestResult> results) throws IOException {
        CSVPrinter printer = new CSVPrinter(out, RESULT_FORMAT);
        for (StatisticalTestResult result : results) {
            printer.printRecord(toRecord(result));
        }
        printer.flush();
    }

    /**
     * Converts a result to its CSV row. DF2 is empty for single-df results and warnings are
     * joined with semicolons.
     */
    public static List<String> toRecord(StatisticalTestResult result) {
        double[] df = result.getDegreesOfFreedom();
        String warnings = result.getWarnings().stream()
            .map(ResultWarning::getLabel)
            .collect(Collectors.joining(";"));
        return Arrays.asList(
            result.getTestName(),
            result.getTestType().getLabel(),
            String.valueOf(result.getStatistic()),
            String.valueOf(df[0]),
            df.length > 1 ? String.valueOf(df[1]) : "",
            String.valueOf(result.getPValue()),
            String.valueOf(result.getAlpha()),
            String.valueOf(result.isSignificant()),
            warnings,
            result.getInterpretation());
    }

    public Path getOutputFile() {
        return outputFile;
    }

    public int getRecordCount() {
        lock.lock();
        try {
            return recordCount;
        } finally {
            lock.unlock();
        }
    }
}
