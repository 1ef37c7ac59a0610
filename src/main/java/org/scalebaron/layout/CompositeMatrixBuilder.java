package org.scalebaron.layout;

import org.scalebaron.model.LayoutPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Assembles the matrices of one element into a single numeric grid following a {@link LayoutPlan}.
 *
 * <p>Every cell is padded with NaN (bottom and right) to the largest matrix height and width.
 * Adjacent cells are separated by one NaN row/column and empty cells are all NaN, so the result
 * can be opened in a matrix viewer and each sample selected by polygon. Pixel sizes are not
 * encoded.
 */
public class CompositeMatrixBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CompositeMatrixBuilder.class);

    /**
     * @param plan the grid; {@code cells.size()} must equal {@code plan.cellOrder().size()}
     * @param cells cell matrices in plan order, {@code [row][column]}
     * @return the composite grid
     */
    public double[][] build(LayoutPlan plan, List<double[][]> cells) {
        if (cells.size() != plan.cellOrder().size()) {
            throw new IllegalArgumentException("Expected " + plan.cellOrder().size()
                    + " cell matrices, got " + cells.size());
        }
        int cellHeight = 0;
        int cellWidth = 0;
        for (double[][] cell : cells) {
            cellHeight = Math.max(cellHeight, cell.length);
            for (double[] row : cell) {
                cellWidth = Math.max(cellWidth, row.length);
            }
        }

        int height = plan.rows() * cellHeight + (plan.rows() - 1);
        int width = plan.cols() * cellWidth + (plan.cols() - 1);
        double[][] out = new double[height][width];
        for (double[] row : out) {
            Arrays.fill(row, Double.NaN);
        }

        for (int i = 0; i < cells.size(); i++) {
            int top = plan.rowOf(i) * (cellHeight + 1);
            int left = plan.colOf(i) * (cellWidth + 1);
            double[][] cell = cells.get(i);
            for (int r = 0; r < cell.length; r++) {
                System.arraycopy(cell[r], 0, out[top + r], left, cell[r].length);
            }
        }
        logger.debug("Built composite matrix {} x {} from {} cell(s) in a {} x {} grid",
                height, width, cells.size(), plan.rows(), plan.cols());
        return out;
    }
}
