package org.scalebaron.scale;

import org.scalebaron.utilities.MinorFunctions;

/**
 * Spatial scale bar and color-bar label helpers.
 *
 * <p>Every sample in a composite shares one physical scale-bar length (1000 µm by default); the
 * number of matrix pixels it spans depends on each sample's pixel size.
 */
public class ScaleBarCalculator {

    public static final double DEFAULT_SCALE_BAR_MICRONS = 1000.0;

    private final double scaleBarMicrons;

    public ScaleBarCalculator() {
        this(DEFAULT_SCALE_BAR_MICRONS);
    }

    public ScaleBarCalculator(double scaleBarMicrons) {
        if (!(scaleBarMicrons > 0) || Double.isInfinite(scaleBarMicrons)) {
            throw new IllegalArgumentException("Scale bar length must be positive: " + scaleBarMicrons);
        }
        this.scaleBarMicrons = scaleBarMicrons;
    }

    public double getScaleBarMicrons() {
        return scaleBarMicrons;
    }

    /**
     * @param pixelSizeMicrons edge length of one matrix pixel in microns
     * @return scale bar length in matrix pixels, at least 1
     */
    public int barLengthPixels(double pixelSizeMicrons) {
        if (!(pixelSizeMicrons > 0) || Double.isInfinite(pixelSizeMicrons)) {
            throw new IllegalArgumentException("Pixel size must be positive: " + pixelSizeMicrons);
        }
        return Math.max(1, (int) Math.round(scaleBarMicrons / pixelSizeMicrons));
    }

    /**
     * Text for the scale bar, e.g. "1000 µm" or "1.5 mm" for lengths of a millimetre and more
     * that are not whole thousands.
     */
    public String barLabel() {
        if (scaleBarMicrons >= 1000 && scaleBarMicrons % 1000 != 0) {
            return MinorFunctions.formatSignificant(scaleBarMicrons / 1000.0, 3) + " mm";
        }
        return MinorFunctions.formatSignificant(scaleBarMicrons, 4) + " µm";
    }

    /**
     * Color-bar maximum label rounded to three significant figures, with the unit name.
     */
    public static String colorBarLabel(double scaleMax, String unitName) {
        return MinorFunctions.formatSignificant(scaleMax, 3) + " " + unitName;
    }
}
