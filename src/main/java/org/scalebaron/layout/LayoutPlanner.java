package org.scalebaron.layout;

import org.scalebaron.exceptions.EmptyDataException;
import org.scalebaron.exceptions.LayoutOverflowException;
import org.scalebaron.model.LayoutPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * LayoutPlanner
 *
 * <p>Chooses the row x column grid of a composite.
 *
 * <p><b>Automatic mode</b> tries every row count from 1 to N with {@code cols = ceil(N / rows)} and
 * keeps the grid with the fewest empty cells. Ties go to the grid whose aspect ratio
 * ({@code cols / rows}) is closest to the target, measured as {@code |ln(aspect / target)|} so a
 * grid twice as wide as the target and one twice as tall count the same. Remaining ties go to
 * fewer rows. For 10 samples this picks 2 x 5 over the 1 x 10 strip.
 *
 * <p><b>User rows</b> fix the row count: {@code cols = ceil(N / rows)}. Asking for more rows than
 * samples either clamps to N rows (auto-fallback, the default) or fails with
 * {@link LayoutOverflowException}.
 *
 * <p>Cells are always assigned row-major in the order the samples are given, so excluding a sample
 * shortens the list without reordering the others.
 */
public class LayoutPlanner {
    private static final Logger logger = LoggerFactory.getLogger(LayoutPlanner.class);

    /** Slightly landscape, the shape that fits a page or slide best. */
    public static final double DEFAULT_TARGET_ASPECT = 1.3;

    private final double targetAspect;
    private final boolean autoFallback;

    public LayoutPlanner() {
        this(DEFAULT_TARGET_ASPECT, true);
    }

    /**
     * @param targetAspect preferred cols/rows ratio used to break ties, must be positive
     * @param autoFallback whether an impossible user row count is clamped instead of rejected
     */
    public LayoutPlanner(double targetAspect, boolean autoFallback) {
        if (!(targetAspect > 0) || Double.isInfinite(targetAspect)) {
            throw new IllegalArgumentException("Target aspect ratio must be positive: " + targetAspect);
        }
        this.targetAspect = targetAspect;
        this.autoFallback = autoFallback;
    }

    /**
     * Plans a grid for the given samples.
     *
     * @param samples included sample names in display order
     * @param userRows requested row count, or null for automatic
     * @return the plan, cells in the order of {@code samples}
     * @throws EmptyDataException if there are no samples
     * @throws LayoutOverflowException if {@code userRows} is below 1, or above the sample count
     *                                 while auto-fallback is disabled
     */
    public LayoutPlan plan(List<String> samples, Integer userRows) {
        int n = samples.size();
        if (n == 0) {
            throw new EmptyDataException("No samples to lay out");
        }
        int rows;
        if (userRows != null) {
            rows = checkUserRows(userRows, n);
        } else {
            rows = bestRows(n);
        }
        int cols = ceilDiv(n, rows);
        logger.debug("Layout for {} sample(s): {} x {} ({} empty)", n, rows, cols, rows * cols - n);
        return new LayoutPlan(rows, cols, samples);
    }

    /**
     * Plans a grid for {@code sampleCount} anonymous cells labelled "1".."N".
     */
    public LayoutPlan plan(int sampleCount, Integer userRows) {
        List<String> labels = new ArrayList<>(Math.max(sampleCount, 0));
        for (int i = 1; i <= sampleCount; i++) {
            labels.add(Integer.toString(i));
        }
        return plan(labels, userRows);
    }

    /**
     * @return the automatic row count for {@code n} samples
     */
    public int bestRows(int n) {
        if (n <= 1) {
            return 1;
        }
        int bestRows = 1;
        int bestEmpty = Integer.MAX_VALUE;
        double bestAspectDistance = Double.MAX_VALUE;
        for (int rows = 1; rows <= n; rows++) {
            int cols = ceilDiv(n, rows);
            int empty = rows * cols - n;
            double aspectDistance = Math.abs(Math.log((cols / (double) rows) / targetAspect));
            if (empty < bestEmpty || (empty == bestEmpty && aspectDistance < bestAspectDistance)) {
                bestRows = rows;
                bestEmpty = empty;
                bestAspectDistance = aspectDistance;
            }
        }
        return bestRows;
    }

    public double getTargetAspect() {
        return targetAspect;
    }

    public boolean isAutoFallback() {
        return autoFallback;
    }

    private int checkUserRows(int userRows, int n) {
        if (userRows < 1) {
            throw new LayoutOverflowException(userRows, n);
        }
        if (userRows > n) {
            if (!autoFallback) {
                throw new LayoutOverflowException(userRows, n);
            }
            logger.info("Requested {} rows for {} sample(s) - using {} rows", userRows, n, n);
            return n;
        }
        return userRows;
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }
}
