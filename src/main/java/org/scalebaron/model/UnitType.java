package org.scalebaron.model;

/**
 * Unit tag attached to every element matrix.
 *
 * <p>ppm and CPS matrices of the same element are processed as separate columns and are
 * never mixed on one color scale. RAW is used for exports that carry no unit suffix in their
 * file name (plain counts).
 */
public enum UnitType {
    PPM("ppm", "ppm"),
    CPS("CPS", "CPS"),
    RAW("raw", "counts");

    private final String suffix;
    private final String displayName;

    UnitType(String suffix, String displayName) {
        this.suffix = suffix;
        this.displayName = displayName;
    }

    /**
     * @return the token used in file and folder names, e.g. "ppm" in {@code Fe_ppm}
     */
    public String getSuffix() {
        return suffix;
    }

    /**
     * @return label for color bars and statistics tables
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Looks up a unit from its file-name suffix, case-sensitive for CPS as written by the
     * acquisition software but lenient for ppm/raw.
     *
     * @param suffix suffix token such as "ppm", "CPS" or "raw"
     * @return the matching unit, or null if the token is not a known unit
     */
    public static UnitType fromSuffix(String suffix) {
        if (suffix == null) {
            return null;
        }
        for (UnitType unit : values()) {
            if (unit.suffix.equalsIgnoreCase(suffix.trim())) {
                return unit;
            }
        }
        return null;
    }
}
