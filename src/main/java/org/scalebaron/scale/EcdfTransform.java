package org.scalebaron.scale;

import java.util.Arrays;

/**
 * Rank-based transform: a value's colormap position is the empirical cumulative distribution of
 * the pooled reference pixels at that value. Reference pixels above the scale maximum are folded
 * onto it, so the maximum maps to 1.
 *
 * <p>Frequent intensity ranges get more of the colormap than a linear scale would give them.
 */
public class EcdfTransform implements IntensityTransform {

    public static final String NAME = "ecdf";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double getMinimum() {
        return 0;
    }

    @Override
    public Normalization createNormalization(double scaleMax, double[] referenceValues) {
        if (!(scaleMax > 0)) {
            return IntensityTransform.flat();
        }
        double[] sorted = Arrays.stream(referenceValues)
                .filter(v -> !Double.isNaN(v))
                .map(v -> Math.min(Math.max(v, 0), scaleMax))
                .sorted()
                .toArray();
        if (sorted.length == 0) {
            return new LinearTransform().createNormalization(scaleMax, referenceValues);
        }
        return value -> {
            if (Double.isNaN(value)) {
                return Double.NaN;
            }
            double v = Math.min(Math.max(value, 0), scaleMax);
            return cumulative(sorted, v);
        };
    }

    /**
     * Fraction of {@code sorted} that is less than or equal to {@code value}.
     */
    static double cumulative(double[] sorted, double value) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo / (double) sorted.length;
    }
}
