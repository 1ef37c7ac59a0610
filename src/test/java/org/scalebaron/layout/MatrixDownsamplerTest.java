package org.scalebaron.layout;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatrixDownsamplerTest {

    @Test
    void testDownsample_blockMeanIgnoresNaN() {
        double[][] values = {
                {1, 3, 10, 10},
                {5, Double.NaN, 10, 10},
                {Double.NaN, Double.NaN, 0, 4},
                {Double.NaN, Double.NaN, 4, 0}
        };
        double[][] out = new MatrixDownsampler(2).downsample(values);

        assertEquals(2, out.length);
        assertEquals(2, out[0].length);
        assertEquals(3.0, out[0][0], 1e-12);
        assertEquals(10.0, out[0][1], 1e-12);
        assertTrue(Double.isNaN(out[1][0]));
        assertEquals(2.0, out[1][1], 1e-12);
    }

    @Test
    void testDownsample_smallMatrixIsCopied() {
        double[][] values = {{1, 2}, {3, 4}};
        double[][] out = new MatrixDownsampler().downsample(values);
        assertNotSame(values, out);
        assertNotSame(values[0], out[0]);
        assertArrayEquals(values[1], out[1]);
    }

    @Test
    void testDownsample_usesWholeBlockFactor() {
        double[][] values = new double[1200][700];
        double[][] out = new MatrixDownsampler(512).downsample(values);
        assertEquals(600, out.length);
        assertEquals(350, out[0].length);
    }
}
