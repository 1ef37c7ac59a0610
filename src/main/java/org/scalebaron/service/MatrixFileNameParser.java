package org.scalebaron.service;

import org.scalebaron.model.ElementKey;
import org.scalebaron.model.UnitType;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts sample, element and unit from matrix file names.
 *
 * <p>Recognized names:
 * <ul>
 *   <li>{@code {sample}[ _]{element}_{ppm|CPS} matrix.xlsx} : quantified or CPS exports</li>
 *   <li>{@code {sample} {element} matrix.xlsx} : raw counts without a unit suffix</li>
 * </ul>
 * where element is one or two letters followed by one to three digits ({@code Mo98}, {@code Ca44})
 * or a summed channel {@code Total<Name>} ({@code TotalMo}). The sample part is matched lazily so
 * sample names may themselves contain spaces and underscores.
 */
public class MatrixFileNameParser {

    private static final String ELEMENT = "[A-Za-z]{1,2}\\d{1,3}|Total[A-Za-z]+";
    private static final Pattern WITH_UNIT =
            Pattern.compile("(.+?)[ _](" + ELEMENT + ")_(ppm|CPS) matrix\\.xlsx");
    private static final Pattern RAW =
            Pattern.compile("(.+?) (" + ELEMENT + ") matrix\\.xlsx");

    /** Glob that selects candidate files in an input folder. */
    public static final String MATRIX_GLOB = "* matrix.xlsx";

    /**
     * @param sample sample name
     * @param element element column
     */
    public record ParsedName(String sample, ElementKey element) {
    }

    public Optional<ParsedName> parse(Path file) {
        return parse(file.getFileName().toString());
    }

    /**
     * @param fileName bare file name
     * @return the parsed parts, or empty if the name does not follow either convention
     */
    public Optional<ParsedName> parse(String fileName) {
        Matcher m = WITH_UNIT.matcher(fileName);
        if (m.matches()) {
            UnitType unit = "CPS".equals(m.group(3)) ? UnitType.CPS : UnitType.PPM;
            return Optional.of(new ParsedName(m.group(1), new ElementKey(m.group(2), unit)));
        }
        m = RAW.matcher(fileName);
        if (m.matches()) {
            return Optional.of(new ParsedName(m.group(1), new ElementKey(m.group(2), UnitType.RAW)));
        }
        return Optional.empty();
    }

    /**
     * Builds the file name a pair is expected under, the inverse of {@link #parse(String)}.
     */
    public static String fileNameFor(String sample, ElementKey element) {
        if (element.unit() == UnitType.RAW) {
            return sample + " " + element.element() + " matrix.xlsx";
        }
        return sample + " " + element.element() + "_" + element.unit().getSuffix() + " matrix.xlsx";
    }
}
