package org.scalebaron.model;

/**
 * Descriptive statistics of the valid pixels of one matrix.
 *
 * @param p25 25th percentile
 * @param p50 median
 * @param p75 75th percentile
 * @param p99 99th percentile, the default display ceiling
 * @param iqr {@code p75 - p25}
 * @param mean arithmetic mean
 * @param validPixels number of pixels the statistics were computed over
 */
public record StatisticsRecord(double p25, double p50, double p75, double p99,
                               double iqr, double mean, int validPixels) {
}
