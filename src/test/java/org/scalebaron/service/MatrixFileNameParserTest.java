package org.scalebaron.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.scalebaron.model.ElementKey;
import org.scalebaron.model.UnitType;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MatrixFileNameParser.
 */
class MatrixFileNameParserTest {

    private final MatrixFileNameParser parser = new MatrixFileNameParser();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Sample1 Fe56_ppm matrix.xlsx    | Sample1      | Fe56     | PPM",
            "Sample1_Fe56_ppm matrix.xlsx    | Sample1      | Fe56     | PPM",
            "Rock A_2 Mo98_CPS matrix.xlsx   | Rock A_2     | Mo98     | CPS",
            "S-12 TotalMo_ppm matrix.xlsx    | S-12         | TotalMo  | PPM",
            "Thin section 3 Ca44 matrix.xlsx | Thin section 3 | Ca44   | RAW"
    })
    void testParse_recognizedNames(String fileName, String sample, String element, UnitType unit) {
        MatrixFileNameParser.ParsedName parsed = parser.parse(fileName).orElseThrow();
        assertEquals(sample, parsed.sample());
        assertEquals(new ElementKey(element, unit), parsed.element());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Sample1 Fe56_ppm.xlsx",
            "Sample1 Fe56_ppm matrix.csv",
            "Fe56_ppm matrix.xlsx",
            "Sample1 Iron_ppm matrix.xlsx",
            "notes.txt"
    })
    void testParse_rejectsOtherNames(String fileName) {
        assertTrue(parser.parse(fileName).isEmpty(), fileName);
    }

    @Test
    void testFileNameFor_isInverseOfParse() {
        ElementKey cps = new ElementKey("Zn66", UnitType.CPS);
        ElementKey raw = new ElementKey("Cu63", UnitType.RAW);

        assertEquals("S 1 Zn66_CPS matrix.xlsx", MatrixFileNameParser.fileNameFor("S 1", cps));
        assertEquals(cps, parser.parse(MatrixFileNameParser.fileNameFor("S 1", cps)).orElseThrow().element());
        assertEquals(raw, parser.parse(MatrixFileNameParser.fileNameFor("S1", raw)).orElseThrow().element());
    }
}
