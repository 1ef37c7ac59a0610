package org.scalebaron.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies one processing column: an element label together with its unit tag.
 *
 * <p>Keys sort the way the progress table lists them: ppm first, then CPS, then raw, and within
 * each unit by the element's letter prefix followed by its numeric mass ({@code Ca44 < Fe56 < Fe57
 * < Mo98}).
 *
 * @param element chemical symbol/label, e.g. "Fe56" or "TotalMo"
 * @param unit unit tag of the matrices in this column
 */
public record ElementKey(String element, UnitType unit) implements Comparable<ElementKey> {

    private static final Pattern MASS_SUFFIX = Pattern.compile("(\\D+)(\\d+)$");

    /** Orders element labels by letter prefix, then numeric mass. */
    public static final Comparator<String> ELEMENT_ORDER = (a, b) -> {
        Matcher ma = MASS_SUFFIX.matcher(a);
        Matcher mb = MASS_SUFFIX.matcher(b);
        String prefixA = ma.find() ? ma.group(1) : a;
        String prefixB = mb.find() ? mb.group(1) : b;
        int cmp = prefixA.compareTo(prefixB);
        if (cmp != 0) {
            return cmp;
        }
        int massA = massOf(a);
        int massB = massOf(b);
        cmp = Integer.compare(massA, massB);
        return cmp != 0 ? cmp : a.compareTo(b);
    };

    public ElementKey {
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(unit, "unit");
        if (element.isBlank()) {
            throw new IllegalArgumentException("Element label cannot be blank");
        }
    }

    /**
     * @return folder/file stem for this column, e.g. {@code Fe56_ppm}
     */
    public String outputName() {
        return element + "_" + unit.getSuffix();
    }

    @Override
    public int compareTo(ElementKey other) {
        int cmp = Integer.compare(unit.ordinal(), other.unit.ordinal());
        return cmp != 0 ? cmp : ELEMENT_ORDER.compare(element, other.element);
    }

    @Override
    public String toString() {
        return element + " (" + unit.getSuffix() + ")";
    }

    private static int massOf(String label) {
        Matcher m = MASS_SUFFIX.matcher(label);
        return m.find() ? Integer.parseInt(m.group(2)) : 0;
    }
}
