package org.scalebaron.model;

/**
 * How the shared display maximum of an element is chosen.
 */
public enum ScaleMode {
    /** Maximum of the included samples' 99th percentiles. */
    AUTO_PERCENTILE("linear"),
    /** A user-supplied ceiling. */
    USER_FIXED("linear"),
    /** Percentile ceiling rendered through a log1p transform. */
    LOG("log"),
    /** Percentile ceiling rendered through a rank-based (ECDF) transform. */
    ECDF("ecdf");

    private final String transformName;

    ScaleMode(String transformName) {
        this.transformName = transformName;
    }

    /**
     * @return name of the intensity transform registered for this mode
     */
    public String getTransformName() {
        return transformName;
    }
}
