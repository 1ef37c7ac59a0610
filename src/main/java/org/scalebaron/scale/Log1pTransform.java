package org.scalebaron.scale;

/**
 * Pseudo-log transform based on {@code log1p}.
 *
 * <p>The colormap spans {@code [log1p(vmin), log1p(scaleMax)]}. The lower bound defaults to 1 so
 * single-count pixels sit at the bottom of the scale and zeros clamp to it.
 */
public class Log1pTransform implements IntensityTransform {

    public static final String NAME = "log";

    private final double vmin;

    public Log1pTransform() {
        this(1.0);
    }

    /**
     * @param vmin lower end of the displayed range, must be >= 0
     */
    public Log1pTransform(double vmin) {
        if (!(vmin >= 0) || Double.isInfinite(vmin)) {
            throw new IllegalArgumentException("Log transform minimum must be finite and >= 0: " + vmin);
        }
        this.vmin = vmin;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double getMinimum() {
        return vmin;
    }

    @Override
    public Normalization createNormalization(double scaleMax, double[] referenceValues) {
        double low = Math.log1p(vmin);
        double high = Math.log1p(Math.max(scaleMax, vmin));
        double span = high - low;
        if (!(span > 0)) {
            return IntensityTransform.flat();
        }
        return value -> {
            if (Double.isNaN(value)) {
                return Double.NaN;
            }
            double clamped = Math.max(value, vmin);
            return IntensityTransform.clampUnit((Math.log1p(clamped) - low) / span);
        };
    }
}
