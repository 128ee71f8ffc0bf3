package org.puneet.hypotest.statistical;

import org.puneet.hypotest.exceptions.StatisticalValidationException;
import org.puneet.hypotest.exceptions.StatisticalValidationException.StatisticalErrorType;

import java.util.Arrays;

/**
 * Immutable two-way table of observed counts.
 *
 * <p>A valid table is rectangular with at least two rows and two columns, holds finite
 * non-negative counts, and has no row or column summing to zero, so every expected
 * frequency {@code R_i * C_j / N} is strictly positive.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public final class ContingencyTable {

    private static final int MIN_DIMENSION = 2;

    private final double[][] counts;
    private final double[] rowSums;
    private final double[] columnSums;
    private final double grandTotal;

    private ContingencyTable(double[][] counts, double[] rowSums, double[] columnSums, double grandTotal) {
        this.counts = counts;
        this.rowSums = rowSums;
        this.columnSums = columnSums;
        this.grandTotal = grandTotal;
    }

    /**
     * Validates and copies a grid of counts.
     *
     * @param table observed counts, row-major
     * @return the table
     * @throws StatisticalValidationException if the grid is too small, ragged, holds a negative
     *         or non-finite count, has a zero row or column total, or its totals or expected
     *         frequencies overflow or underflow
     */
    public static ContingencyTable of(double[][] table) throws StatisticalValidationException {
        if (table == null || table.length < MIN_DIMENSION) {
            throw StatisticalValidationException.insufficientData(
                table == null ? 0 : table.length, MIN_DIMENSION, "chi-square test (rows)");
        }
        if (table[0] == null || table[0].length < MIN_DIMENSION) {
            throw StatisticalValidationException.insufficientData(
                table[0] == null ? 0 : table[0].length, MIN_DIMENSION, "chi-square test (columns)");
        }

        int rows = table.length;
        int cols = table[0].length;
        double[][] counts = new double[rows][];
        double[] rowSums = new double[rows];
        double[] columnSums = new double[cols];
        double grandTotal = 0;

        for (int i = 0; i < rows; i++) {
            if (table[i] == null || table[i].length != cols) {
                throw new StatisticalValidationException(StatisticalErrorType.INVALID_PARAMETER,
                    String.format("row %d has %d columns, expected %d", i,
                        table[i] == null ? 0 : table[i].length, cols));
            }
            counts[i] = table[i].clone();
            for (int j = 0; j < cols; j++) {
                double value = counts[i][j];
                if (!Double.isFinite(value) || value < 0) {
                    throw StatisticalValidationException.invalidParameter(
                        "table[" + i + "][" + j + "]", value, "counts must be finite and non-negative");
                }
                rowSums[i] += value;
                columnSums[j] += value;
                grandTotal += value;
            }
        }

        for (int i = 0; i < rows; i++) {
            if (rowSums[i] == 0) {
                throw StatisticalValidationException.degenerateTable("row", i);
            }
        }
        for (int j = 0; j < cols; j++) {
            if (columnSums[j] == 0) {
                throw StatisticalValidationException.degenerateTable("column", j);
            }
        }
        if (!Double.isFinite(grandTotal)) {
            throw StatisticalValidationException.invalidParameter("grandTotal", grandTotal,
                "table total overflows; rescale the counts");
        }

        ContingencyTable contingencyTable = new ContingencyTable(counts, rowSums, columnSums, grandTotal);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                double expected = contingencyTable.getExpected(i, j);
                if (!(expected > 0) || !Double.isFinite(expected)) {
                    throw StatisticalValidationException.invalidParameter(
                        "expected[" + i + "][" + j + "]", expected,
                        "expected frequency is not representable; rescale the counts");
                }
            }
        }
        return contingencyTable;
    }

    public int getRows() {
        return counts.length;
    }

    public int getColumns() {
        return columnSums.length;
    }

    public double getObserved(int row, int column) {
        return counts[row][column];
    }

    /** @return expected frequency under independence, {@code R_i * C_j / N} */
    public double getExpected(int row, int column) {
        return rowSums[row] * (columnSums[column] / grandTotal);
    }

    public double[] getRowSums() {
        return rowSums.clone();
    }

    public double[] getColumnSums() {
        return columnSums.clone();
    }

    public double getGrandTotal() {
        return grandTotal;
    }

    /** @return the full grid of expected frequencies */
    public double[][] expectedFrequencies() {
        double[][] expected = new double[getRows()][getColumns()];
        for (int i = 0; i < expected.length; i++) {
            for (int j = 0; j < expected[i].length; j++) {
                expected[i][j] = getExpected(i, j);
            }
        }
        return expected;
    }

    /** @return {@code (rows - 1) * (columns - 1)} */
    public int degreesOfFreedom() {
        return (getRows() - 1) * (getColumns() - 1);
    }

    @Override
    public String toString() {
        return "ContingencyTable" + Arrays.deepToString(counts);
    }
}
