package org.scalebaron.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SampleSetTest {

    @Test
    void testExclusionKeepsDisplayOrder() {
        SampleSet set = SampleSet.of(List.of("C", "A", "B"));
        SampleSet updated = set.with(set.get("A").orElseThrow().withIncluded(false));

        assertEquals(List.of("C", "A", "B"), updated.names());
        assertEquals(List.of("C", "B"), updated.includedNames());
        assertTrue(set.isIncluded("A"));
    }

    @Test
    void testUnknownSampleIsNotIncluded() {
        SampleSet set = SampleSet.of(List.of("A"));
        assertFalse(set.isIncluded("Z"));
        assertFalse(set.contains("Z"));
    }

    @Test
    void testMergeNamesKeepsExistingFlags() {
        SampleSet set = SampleSet.of(List.of("A", "B"));
        set = set.with(set.get("B").orElseThrow().withIncluded(false));

        SampleSet merged = set.mergeNames(List.of("B", "C"));

        assertEquals(List.of("A", "B", "C"), merged.names());
        assertFalse(merged.isIncluded("B"));
        assertTrue(merged.isIncluded("C"));
    }

    @Test
    void testSamplePixelSize() {
        Sample sample = Sample.of("A");
        assertEquals(2.5, sample.effectivePixelSize(2.5));
        assertEquals(0.5, sample.withPixelSize(0.5).effectivePixelSize(2.5));
        assertThrows(IllegalArgumentException.class, () -> sample.withPixelSize(-1.0));
    }
}
