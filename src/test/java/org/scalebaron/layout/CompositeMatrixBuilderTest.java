package org.scalebaron.layout;

import org.junit.jupiter.api.Test;
import org.scalebaron.model.LayoutPlan;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompositeMatrixBuilderTest {

    @Test
    void testBuild_padsCellsAndSeparatesWithNaN() {
        LayoutPlan plan = new LayoutPlan(2, 2, List.of("A", "B", "C"));
        double[][] a = {{1, 1}, {1, 1}};
        double[][] b = {{2}};
        double[][] c = {{3, 3}};

        double[][] out = new CompositeMatrixBuilder().build(plan, List.of(a, b, c));

        // 2 rows of 2x2 cells plus one separator each way
        assertEquals(5, out.length);
        assertEquals(5, out[0].length);
        assertEquals(1.0, out[0][0]);
        assertEquals(1.0, out[1][1]);
        assertTrue(Double.isNaN(out[0][2]), "separator column");
        assertEquals(2.0, out[0][3]);
        assertTrue(Double.isNaN(out[0][4]), "padding of the smaller cell");
        assertTrue(Double.isNaN(out[2][0]), "separator row");
        assertEquals(3.0, out[3][0]);
        assertEquals(3.0, out[3][1]);
        assertTrue(Double.isNaN(out[4][0]));
        assertTrue(Double.isNaN(out[3][3]), "empty grid cell");
    }

    @Test
    void testBuild_rejectsCellCountMismatch() {
        LayoutPlan plan = new LayoutPlan(1, 2, List.of("A", "B"));
        assertThrows(IllegalArgumentException.class,
                () -> new CompositeMatrixBuilder().build(plan, List.<double[][]>of(new double[][]{{1}})));
    }
}
