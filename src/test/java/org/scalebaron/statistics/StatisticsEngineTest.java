package org.scalebaron.statistics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.scalebaron.exceptions.EmptyDataException;
import org.scalebaron.model.ElementMatrix;
import org.scalebaron.model.StatisticsRecord;
import org.scalebaron.model.UnitType;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StatisticsEngine and StatisticsCache.
 */
class StatisticsEngineTest {

    private final StatisticsEngine engine = new StatisticsEngine();

    private static ElementMatrix matrix(double[][] values) {
        return new ElementMatrix(values, UnitType.PPM);
    }

    @Test
    @DisplayName("Percentiles interpolate linearly between order statistics")
    void testCompute_knownValues() {
        StatisticsRecord record = engine.compute(matrix(new double[][]{{1, 2, 3}, {4, 5, Double.NaN}}));

        assertEquals(2.0, record.p25(), 1e-12);
        assertEquals(3.0, record.p50(), 1e-12);
        assertEquals(4.0, record.p75(), 1e-12);
        assertEquals(4.96, record.p99(), 1e-12);
        assertEquals(2.0, record.iqr(), 1e-12);
        assertEquals(3.0, record.mean(), 1e-12);
        assertEquals(5, record.validPixels());
    }

    @Test
    void testCompute_medianOfEvenCount() {
        StatisticsRecord record = engine.compute(matrix(new double[][]{{10, 2}, {8, 4}}));
        assertEquals(6.0, record.p50(), 1e-12, "Median of 2,4,8,10 is the mean of the middle pair");
    }

    @Test
    void testCompute_sentinelsAreIgnored() {
        double[][] values = {
                {5, -1, Double.POSITIVE_INFINITY},
                {Double.NaN, 5, -9999}
        };
        StatisticsRecord record = engine.compute(matrix(values));

        assertEquals(2, record.validPixels());
        assertEquals(5.0, record.p25(), 1e-12);
        assertEquals(5.0, record.p99(), 1e-12);
        assertEquals(0.0, record.iqr(), 1e-12);
    }

    @Test
    void testCompute_allAbsentThrows() {
        ElementMatrix empty = matrix(new double[][]{{Double.NaN, -3}, {-1, Double.NaN}});
        assertThrows(EmptyDataException.class, () -> engine.compute(empty));
    }

    @Test
    void testCompute_percentilesAreMonotonic() {
        Random random = new Random(42);
        for (int trial = 0; trial < 20; trial++) {
            double[][] values = new double[8][8];
            for (double[] row : values) {
                for (int c = 0; c < row.length; c++) {
                    row[c] = random.nextDouble() < 0.1 ? Double.NaN : random.nextDouble() * 1000;
                }
            }
            StatisticsRecord r = engine.compute(matrix(values));
            assertTrue(r.p25() <= r.p50(), "p25 <= p50");
            assertTrue(r.p50() <= r.p75(), "p50 <= p75");
            assertTrue(r.p75() <= r.p99(), "p75 <= p99");
            assertEquals(r.p75() - r.p25(), r.iqr(), 1e-9);
        }
    }

    @Test
    @DisplayName("A constant matrix, including all zeros, has zero spread")
    void testCompute_allZero() {
        StatisticsRecord record = engine.compute(matrix(new double[][]{{0, 0}, {0, 0}}));
        assertEquals(0.0, record.p99());
        assertEquals(0.0, record.iqr());
        assertEquals(0.0, record.mean());
        assertEquals(4, record.validPixels());
    }

    @Test
    void testCompute_doesNotChangeTheMatrix() {
        double[][] values = {{3, 1, 2}};
        ElementMatrix m = matrix(values);
        engine.compute(m);
        assertEquals(3.0, m.get(0, 0));
        assertEquals(1.0, m.get(0, 1));
        assertEquals(2.0, m.get(0, 2));
    }

    @ParameterizedTest
    @CsvSource({
            "0, 10",
            "100, 50",
            "50, 30",
            "10, 14"
    })
    void testPercentile(double percentile, double expected) {
        double[] values = {40, 10, 50, 30, 20};
        assertEquals(expected, StatisticsEngine.percentile(values, percentile), 1e-12);
    }

    @Test
    void testPercentile_rejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class,
                () -> StatisticsEngine.percentile(new double[]{1}, 101));
        assertThrows(EmptyDataException.class,
                () -> StatisticsEngine.percentile(new double[0], 50));
    }
}
