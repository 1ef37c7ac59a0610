package org.scalebaron.model;

import java.util.Objects;

/**
 * A specimen taking part in a batch.
 *
 * <p>Samples are values: toggling inclusion or assigning a pixel size produces a new instance.
 *
 * @param name sample identifier as it appears in the matrix file names
 * @param included whether the sample participates in scaling and compositing
 * @param pixelSize custom pixel edge length in microns, or null to use the batch default
 */
public record Sample(String name, boolean included, Double pixelSize) {

    public Sample {
        Objects.requireNonNull(name, "name");
        if (pixelSize != null && !(pixelSize > 0 && Double.isFinite(pixelSize))) {
            throw new IllegalArgumentException("Pixel size for " + name + " must be positive, got " + pixelSize);
        }
    }

    /**
     * @return an included sample with no custom pixel size
     */
    public static Sample of(String name) {
        return new Sample(name, true, null);
    }

    public Sample withIncluded(boolean include) {
        return new Sample(name, include, pixelSize);
    }

    public Sample withPixelSize(Double size) {
        return new Sample(name, included, size);
    }

    /**
     * @param defaultPixelSize batch-wide pixel size
     * @return the custom pixel size if set, otherwise {@code defaultPixelSize}
     */
    public double effectivePixelSize(double defaultPixelSize) {
        return pixelSize != null ? pixelSize : defaultPixelSize;
    }
}
