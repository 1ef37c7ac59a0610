package org.scalebaron.scale;

/**
 * Maps a raw intensity to a colormap position in [0, 1].
 *
 * <p>Absent pixels (NaN) map to NaN so renderers can paint them with the background color.
 */
@FunctionalInterface
public interface Normalization {

    double normalize(double value);

    /**
     * Applies the normalization to every cell of a matrix.
     *
     * @param values cell values, {@code [row][column]}
     * @return a new array of colormap positions
     */
    default double[][] normalizeAll(double[][] values) {
        double[][] out = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            out[r] = new double[values[r].length];
            for (int c = 0; c < values[r].length; c++) {
                out[r][c] = normalize(values[r][c]);
            }
        }
        return out;
    }
}
