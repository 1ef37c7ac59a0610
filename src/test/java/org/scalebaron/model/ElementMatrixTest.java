package org.scalebaron.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ElementMatrixTest {

    @Test
    void testSentinelsBecomeNaN() {
        ElementMatrix m = new ElementMatrix(new double[][]{
                {1.0, Double.NaN, -1.0},
                {Double.POSITIVE_INFINITY, 0.0, 5.0}
        }, UnitType.PPM);

        assertEquals(3, m.countValid());
        assertTrue(Double.isNaN(m.get(0, 2)));
        assertTrue(Double.isNaN(m.get(1, 0)));
        assertEquals(0.0, m.get(1, 1));
        assertArrayEquals(new double[]{1.0, 0.0, 5.0}, m.validValues());
    }

    @Test
    void testRaggedRowsArePadded() {
        ElementMatrix m = new ElementMatrix(new double[][]{{1, 2, 3}, {4}}, UnitType.CPS);

        assertEquals(2, m.getRows());
        assertEquals(3, m.getCols());
        assertTrue(Double.isNaN(m.get(1, 1)));
        assertTrue(Double.isNaN(m.get(1, 2)));
    }

    @Test
    void testInputIsCopied() {
        double[][] raw = {{1, 2}, {3, 4}};
        ElementMatrix m = new ElementMatrix(raw, UnitType.PPM);
        raw[0][0] = 99;
        m.toArray()[1][1] = 99;

        assertEquals(1.0, m.get(0, 0));
        assertEquals(4.0, m.get(1, 1));
    }
}
