package org.scalebaron.scale;

/**
 * Identity transform: {@code value / scaleMax}, clamped to [0, 1].
 *
 * <p>Also the fallback returned by {@link TransformRegistry} for unknown names.
 */
public class LinearTransform implements IntensityTransform {

    public static final String NAME = "linear";

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
        return value -> Double.isNaN(value) ? Double.NaN : IntensityTransform.clampUnit(value / scaleMax);
    }
}
