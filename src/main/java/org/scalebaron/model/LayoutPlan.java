package org.scalebaron.model;

import java.util.List;

/**
 * Grid arrangement of a composite.
 *
 * <p>Cells are filled row-major: left to right, top to bottom. {@code cellOrder.get(i)} is the
 * name of the sample drawn in cell {@code i}; cells past {@code cellOrder.size()} are empty.
 *
 * @param rows grid rows
 * @param cols grid columns
 * @param cellOrder sample names in cell order
 */
public record LayoutPlan(int rows, int cols, List<String> cellOrder) {

    public LayoutPlan {
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Layout must have at least one row and column: " + rows + "x" + cols);
        }
        cellOrder = List.copyOf(cellOrder);
        if (cellOrder.size() > rows * cols) {
            throw new IllegalArgumentException(cellOrder.size() + " samples do not fit a " + rows + "x" + cols + " grid");
        }
    }

    public int emptyCells() {
        return rows * cols - cellOrder.size();
    }

    /**
     * @return cols / rows
     */
    public double aspectRatio() {
        return cols / (double) rows;
    }

    /**
     * @return grid row of cell {@code index}
     */
    public int rowOf(int index) {
        return index / cols;
    }

    /**
     * @return grid column of cell {@code index}
     */
    public int colOf(int index) {
        return index % cols;
    }
}
