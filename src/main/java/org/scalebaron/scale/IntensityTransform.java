package org.scalebaron.scale;

/**
 * Pluggable display transform applied before colormap lookup.
 *
 * <p>A transform turns the shared scale maximum of an element (and, for rank-based transforms, the
 * pooled pixel values of the included samples) into a {@link Normalization}. Values that end up
 * below the transform's minimum are clamped to it, values above the scale maximum saturate at 1.
 *
 * <p>Implementations are registered by name with {@link TransformRegistry} and must be stateless;
 * all per-element state lives in the returned normalization.
 *
 * @see TransformRegistry
 * @see org.scalebaron.model.ScaleMode#getTransformName()
 */
public interface IntensityTransform {

    /**
     * @return registry name, e.g. "linear", "log", "ecdf"
     */
    String getName();

    /**
     * Lower bound of the transform's input domain. Raw values below it render as the colormap's
     * first color.
     */
    double getMinimum();

    /**
     * Builds the normalization for one element.
     *
     * @param scaleMax shared display maximum; zero when every valid pixel of the element is zero,
     *                 in which case valid pixels map to 0 (see {@link #flat()})
     * @param referenceValues valid pixel values pooled over the included samples; transforms that
     *                        do not need them may ignore the argument. May be empty but not null
     * @return the normalization to apply to every sample of the element
     */
    Normalization createNormalization(double scaleMax, double[] referenceValues);

    /**
     * Normalization for a degenerate range: valid pixels map to the bottom of the colormap and
     * absent pixels stay NaN.
     */
    static Normalization flat() {
        return value -> Double.isNaN(value) ? Double.NaN : 0.0;
    }

    static double clampUnit(double fraction) {
        if (fraction < 0) {
            return 0;
        }
        return Math.min(fraction, 1.0);
    }
}
