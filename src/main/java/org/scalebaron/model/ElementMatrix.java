package org.scalebaron.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable 2-D intensity map for one sample and one element.
 *
 * <p>Values are stored row-major as {@code [row][column]}. Missing-value sentinels are normalized
 * to {@link Double#NaN} on construction: NaN, infinities and negative intensities all count as
 * absent pixels, matching how blank and error cells come out of the laser-ablation exports.
 * Ragged input rows are padded with NaN to the widest row.
 *
 * <p>The backing array is copied on the way in and never handed out, so a matrix cannot change
 * after it is loaded.
 */
public final class ElementMatrix {

    private final double[][] values;
    private final int rows;
    private final int cols;
    private final UnitType unit;

    /**
     * Creates a matrix from parsed cell values.
     *
     * @param values cell values as {@code [row][column]}; copied
     * @param unit unit tag of the values
     */
    public ElementMatrix(double[][] values, UnitType unit) {
        Objects.requireNonNull(values, "values");
        this.unit = Objects.requireNonNull(unit, "unit");
        this.rows = values.length;
        int width = 0;
        for (double[] row : values) {
            if (row != null) {
                width = Math.max(width, row.length);
            }
        }
        this.cols = width;
        this.values = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            double[] src = values[r];
            for (int c = 0; c < cols; c++) {
                double v = (src != null && c < src.length) ? src[c] : Double.NaN;
                this.values[r][c] = isValid(v) ? v : Double.NaN;
            }
        }
    }

    /**
     * @return true if {@code v} is a usable intensity (finite and not negative)
     */
    public static boolean isValid(double v) {
        return Double.isFinite(v) && v >= 0;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public UnitType getUnit() {
        return unit;
    }

    /**
     * @return the value at (row, col), NaN for an absent pixel
     */
    public double get(int row, int col) {
        return values[row][col];
    }

    /**
     * @return number of valid (non-NaN) pixels
     */
    public int countValid() {
        int n = 0;
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isNaN(v)) {
                    n++;
                }
            }
        }
        return n;
    }

    /**
     * Returns all valid pixel values in row-major order. The returned array is a fresh copy.
     */
    public double[] validValues() {
        double[] out = new double[countValid()];
        int i = 0;
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isNaN(v)) {
                    out[i++] = v;
                }
            }
        }
        return out;
    }

    /**
     * @return a deep copy of the cell values, absent pixels as NaN
     */
    public double[][] toArray() {
        double[][] copy = new double[rows][];
        for (int r = 0; r < rows; r++) {
            copy[r] = Arrays.copyOf(values[r], cols);
        }
        return copy;
    }

    @Override
    public String toString() {
        return "ElementMatrix[" + rows + "x" + cols + ", " + unit.getSuffix() + "]";
    }
}
