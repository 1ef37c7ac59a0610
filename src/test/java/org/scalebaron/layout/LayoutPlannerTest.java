package org.scalebaron.layout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.scalebaron.exceptions.EmptyDataException;
import org.scalebaron.exceptions.LayoutOverflowException;
import org.scalebaron.model.LayoutPlan;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LayoutPlanner.
 */
class LayoutPlannerTest {

    private final LayoutPlanner planner = new LayoutPlanner();

    private static int minimalEmptyCells(int n) {
        int best = Integer.MAX_VALUE;
        for (int rows = 1; rows <= n; rows++) {
            int cols = (n + rows - 1) / rows;
            best = Math.min(best, rows * cols - n);
        }
        return best;
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5, 7, 8, 10, 11, 12, 13, 17, 24, 30})
    @DisplayName("Automatic layout never wastes more cells than necessary")
    void testAuto_minimizesEmptyCells(int n) {
        LayoutPlan plan = planner.plan(n, null);
        assertTrue(plan.rows() * plan.cols() >= n);
        assertEquals(minimalEmptyCells(n), plan.emptyCells(), "Layout " + plan.rows() + "x" + plan.cols());
    }

    @Test
    void testAuto_sevenSamples() {
        LayoutPlan plan = planner.plan(7, null);
        // 2x4 leaves 1 cell empty and 3x3 leaves 2, but a single row leaves none
        assertEquals(0, plan.emptyCells());
        assertEquals(plan, planner.plan(7, null), "Choice must be deterministic");
    }

    @Test
    void testAuto_tenSamplesIsNotAStrip() {
        LayoutPlan plan = planner.plan(10, null);
        assertEquals(2, plan.rows());
        assertEquals(5, plan.cols());
    }

    @ParameterizedTest
    @CsvSource({
            "4, 2, 2",
            "6, 2, 3",
            "12, 3, 4",
            "20, 4, 5"
    })
    void testAuto_prefersTargetAspect(int n, int rows, int cols) {
        LayoutPlan plan = planner.plan(n, null);
        assertEquals(rows, plan.rows());
        assertEquals(cols, plan.cols());
    }

    @Test
    void testUserRows_computesColumns() {
        LayoutPlan plan = planner.plan(7, 3);
        assertEquals(3, plan.rows());
        assertEquals(3, plan.cols());
        assertEquals(2, plan.emptyCells());
    }

    @Test
    void testUserRows_overflowClampsWithFallback() {
        LayoutPlan plan = planner.plan(3, 5);
        assertEquals(3, plan.rows());
        assertEquals(1, plan.cols());
    }

    @Test
    void testUserRows_overflowFailsWithoutFallback() {
        LayoutPlanner strict = new LayoutPlanner(LayoutPlanner.DEFAULT_TARGET_ASPECT, false);
        LayoutOverflowException e = assertThrows(LayoutOverflowException.class, () -> strict.plan(3, 5));
        assertEquals(5, e.getRequestedRows());
        assertEquals(3, e.getSampleCount());
    }

    @Test
    void testUserRows_belowOneAlwaysFails() {
        assertThrows(LayoutOverflowException.class, () -> planner.plan(3, 0));
    }

    @Test
    void testPlan_noSamples() {
        assertThrows(EmptyDataException.class, () -> planner.plan(List.of(), null));
    }

    @Test
    @DisplayName("Cells keep sample order row-major when a sample is excluded")
    void testCellOrder_stableUnderExclusion() {
        LayoutPlan all = planner.plan(List.of("A", "B", "C", "D", "E", "F"), 2);
        LayoutPlan withoutC = planner.plan(List.of("A", "B", "D", "E", "F"), 2);

        assertEquals(List.of("A", "B", "C", "D", "E", "F"), all.cellOrder());
        assertEquals(List.of("A", "B", "D", "E", "F"), withoutC.cellOrder());
        assertEquals(0, all.rowOf(2));
        assertEquals(2, all.colOf(2));
        assertEquals(1, all.rowOf(3));
        assertEquals(0, all.colOf(3));
    }
}
