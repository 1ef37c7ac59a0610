package org.scalebaron.statistics;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.scalebaron.exceptions.EmptyDataException;
import org.scalebaron.model.ElementMatrix;
import org.scalebaron.model.StatisticsRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * StatisticsEngine
 *
 * <p>Descriptive statistics over the valid pixels of a matrix:
 * <ul>
 *   <li>25th, 50th, 75th and 99th percentiles using linear interpolation between order
 *       statistics ({@link Percentile.EstimationType#R_7}).</li>
 *   <li>Interquartile range {@code p75 - p25} and arithmetic mean.</li>
 * </ul>
 *
 * <p>Absent pixels (NaN) are excluded from every statistic. The engine is stateless and does not
 * touch the matrix it is given.
 */
public class StatisticsEngine {
    private static final Logger logger = LoggerFactory.getLogger(StatisticsEngine.class);

    /**
     * Computes the statistics record for a matrix.
     *
     * @param matrix the matrix to summarize
     * @return statistics over the valid pixels
     * @throws EmptyDataException if the matrix has no valid pixels
     */
    public StatisticsRecord compute(ElementMatrix matrix) {
        double[] values = matrix.validValues();
        if (values.length == 0) {
            throw new EmptyDataException("Matrix " + matrix + " contains no valid pixels");
        }

        // setData sorts once for all four percentiles
        Percentile percentile = newPercentile();
        percentile.setData(values);
        double p25 = percentile.evaluate(25);
        double p50 = percentile.evaluate(50);
        double p75 = percentile.evaluate(75);
        double p99 = percentile.evaluate(99);
        double mean = new Mean().evaluate(values);

        logger.debug("Computed statistics over {} valid pixels: p50={}, p99={}", values.length, p50, p99);
        return new StatisticsRecord(p25, p50, p75, p99, p75 - p25, mean, values.length);
    }

    /**
     * Percentile with linear interpolation between the two closest ranks.
     *
     * @param values values without NaN, in any order; must not be empty
     * @param percentile percentile in [0, 100]
     * @return the interpolated value
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            throw new EmptyDataException("Cannot take a percentile of an empty array");
        }
        if (percentile < 0 || percentile > 100 || Double.isNaN(percentile)) {
            throw new IllegalArgumentException("Percentile must be within [0, 100]: " + percentile);
        }
        if (percentile == 0) {
            return StatUtils.min(values);
        }
        return newPercentile().evaluate(values, percentile);
    }

    private static Percentile newPercentile() {
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7);
    }
}
