package org.scalebaron.utilities;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * MinorFunctions
 *
 * <p>Miscellaneous small utilities:
 *   - Significant-figure rounding and formatting for statistics tables and labels.
 *   - Delimited-text splitting/escaping shared by the CSV readers and writers.
 *   - Filename sanitizing.
 *   - Anything too small to justify its own class.
 */
public class MinorFunctions {

    private static final Pattern ILLEGAL_FILENAME_CHARS = Pattern.compile("[/\\\\:*?\"<>|\\n\\r]");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n|\\r|\\n");

    private MinorFunctions() {
    }

    /**
     * Rounds to {@code digits} significant figures (half-up). NaN and infinities pass through.
     */
    public static double roundSignificant(double value, int digits) {
        if (!Double.isFinite(value) || value == 0) {
            return value;
        }
        return BigDecimal.valueOf(value).round(new MathContext(digits, RoundingMode.HALF_UP)).doubleValue();
    }

    /**
     * Formats to {@code digits} significant figures without exponent or trailing zeros,
     * e.g. {@code formatSignificant(1234.5, 3) -> "1230"}, {@code formatSignificant(0.012345, 3) -> "0.0123"}.
     */
    public static String formatSignificant(double value, int digits) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        if (value == 0) {
            return "0";
        }
        return BigDecimal.valueOf(value)
                .round(new MathContext(digits, RoundingMode.HALF_UP))
                .stripTrailingZeros()
                .toPlainString();
    }

    /**
     * Splits one line of comma-separated text. Double-quoted fields may contain commas, and a
     * doubled quote inside a quoted field is a literal quote. Fields are trimmed.
     */
    public static List<String> splitCsvLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
            } else if (ch == ',') {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        fields.add(current.toString().trim());
        return fields;
    }

    /**
     * Prepares a field for the single-line CSV tables: line breaks become spaces, and the field is
     * quoted if it contains a comma or quote.
     */
    public static String escapeCsv(String field) {
        if (field == null) {
            return "";
        }
        String flat = LINE_BREAKS.matcher(field).replaceAll(" ");
        if (flat.contains(",") || flat.contains("\"")) {
            return "\"" + flat.replace("\"", "\"\"") + "\"";
        }
        return flat;
    }

    /**
     * Strips characters that are not allowed in file names on any platform.
     */
    public static String sanitizeForFilename(String name) {
        if (name == null) {
            return "";
        }
        return ILLEGAL_FILENAME_CHARS.matcher(name).replaceAll("_").trim();
    }
}
