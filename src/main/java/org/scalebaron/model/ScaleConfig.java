package org.scalebaron.model;

import java.util.Objects;

/**
 * Scale setting for one element, applied to every included sample of that element.
 *
 * @param mode scale mode
 * @param value user ceiling; required for {@link ScaleMode#USER_FIXED}, optional override for
 *              {@link ScaleMode#LOG} and {@link ScaleMode#ECDF}, ignored for auto-percentile
 */
public record ScaleConfig(ScaleMode mode, Double value) {

    public static final ScaleConfig AUTO = new ScaleConfig(ScaleMode.AUTO_PERCENTILE, null);

    public ScaleConfig {
        Objects.requireNonNull(mode, "mode");
    }

    public static ScaleConfig fixed(double value) {
        return new ScaleConfig(ScaleMode.USER_FIXED, value);
    }

    public static ScaleConfig log() {
        return new ScaleConfig(ScaleMode.LOG, null);
    }

    public static ScaleConfig ecdf() {
        return new ScaleConfig(ScaleMode.ECDF, null);
    }
}
