package org.scalebaron.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class ElementKeyTest {

    @Test
    void testOrdering_unitThenPrefixThenMass() {
        TreeSet<ElementKey> keys = new TreeSet<>(List.of(
                new ElementKey("Mo98", UnitType.PPM),
                new ElementKey("Fe57", UnitType.CPS),
                new ElementKey("Fe57", UnitType.PPM),
                new ElementKey("Ca44", UnitType.PPM),
                new ElementKey("Fe56", UnitType.PPM),
                new ElementKey("Ca44", UnitType.RAW)));

        List<String> ordered = new ArrayList<>();
        keys.forEach(k -> ordered.add(k.outputName()));

        assertEquals(List.of("Ca44_ppm", "Fe56_ppm", "Fe57_ppm", "Mo98_ppm", "Fe57_CPS", "Ca44_raw"), ordered);
    }

    @Test
    void testOrdering_massIsNumericNotLexical() {
        assertTrue(ElementKey.ELEMENT_ORDER.compare("Sn118", "Sn120") < 0);
        assertTrue(ElementKey.ELEMENT_ORDER.compare("Fe9", "Fe56") < 0);
    }

    @Test
    void testOutputName() {
        assertEquals("Fe56_ppm", new ElementKey("Fe56", UnitType.PPM).outputName());
        assertEquals("TotalMo_CPS", new ElementKey("TotalMo", UnitType.CPS).outputName());
    }

    @Test
    void testBlankElementRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ElementKey("  ", UnitType.PPM));
        assertThrows(NullPointerException.class, () -> new ElementKey("Fe56", null));
    }

    @Test
    void testUnitFromSuffix() {
        assertEquals(UnitType.CPS, UnitType.fromSuffix("CPS"));
        assertEquals(UnitType.PPM, UnitType.fromSuffix(" PPM "));
        assertNull(UnitType.fromSuffix("wt"));
        assertNull(UnitType.fromSuffix(null));
    }
}
