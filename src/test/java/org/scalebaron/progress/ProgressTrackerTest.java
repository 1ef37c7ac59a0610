package org.scalebaron.progress;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scalebaron.model.ElementKey;
import org.scalebaron.model.ElementMatrix;
import org.scalebaron.model.InMemoryMatrixStore;
import org.scalebaron.model.ProgressRecord;
import org.scalebaron.model.ProgressStatus;
import org.scalebaron.model.StatisticsRecord;
import org.scalebaron.model.UnitType;
import org.scalebaron.service.StatisticsExporter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProgressTracker against a real output folder.
 */
class ProgressTrackerTest {

    private static final ElementKey FE = new ElementKey("Fe", UnitType.PPM);
    private static final ElementKey CU = new ElementKey("Cu63", UnitType.PPM);

    @TempDir Path output;

    private InMemoryMatrixStore store;
    private OutputLayout layout;
    private SampleInclusion inclusion;
    private ProgressTracker tracker;

    @BeforeEach
    void setUp() {
        ElementMatrix m = new ElementMatrix(new double[][]{{1, 2}, {3, 4}}, UnitType.PPM);
        store = new InMemoryMatrixStore()
                .put("S1", FE, m)
                .put("S1", CU, m)
                .put("S2", FE, m);
        layout = new OutputLayout(output);
        inclusion = SampleInclusion.allIncluded(store.getSampleNames());
        tracker = new ProgressTracker(layout, store, inclusion);
    }

    private static void writeBytes(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[]{1, 2, 3});
    }

    private void writeStatistics(String sample) throws IOException {
        StatisticsRecord record = new StatisticsRecord(1, 2, 3, 4, 2, 2.5, 4);
        new StatisticsExporter().write(layout.statisticsTable(FE),
                List.of(new StatisticsExporter.Row(sample, record, sample)));
    }

    @Test
    @DisplayName("Missing -> Partial -> Complete, and deleting the composite reverts to Partial")
    void testLifecycle() throws IOException {
        assertEquals(ProgressStatus.MISSING, tracker.refresh().statusOf("S1", FE));

        writeStatistics("S1");
        assertEquals(ProgressStatus.PARTIAL, tracker.refresh().statusOf("S1", FE));
        assertEquals(ProgressStatus.MISSING, tracker.refresh().statusOf("S2", FE));

        writeBytes(layout.compositeImage(FE));
        ProgressSnapshot complete = tracker.refresh();
        assertEquals(ProgressStatus.COMPLETE, complete.statusOf("S1", FE));
        assertEquals(ProgressStatus.COMPLETE, complete.statusOf("S2", FE));
        assertTrue(complete.isElementComplete(FE));
        assertFalse(complete.isElementComplete(CU));

        Files.delete(layout.compositeImage(FE));
        assertEquals(ProgressStatus.PARTIAL, tracker.refresh().statusOf("S1", FE));
    }

    @Test
    void testHistogramMarksPartial() throws IOException {
        writeBytes(layout.histogram(FE, "S2"));
        ProgressSnapshot snapshot = tracker.refresh();
        assertEquals(ProgressStatus.PARTIAL, snapshot.statusOf("S2", FE));
        assertEquals(ProgressStatus.MISSING, snapshot.statusOf("S1", FE));
    }

    @Test
    void testEmptyCompositeDoesNotCount() throws IOException {
        Files.createDirectories(layout.elementDir(FE));
        Files.createFile(layout.compositeImage(FE));
        assertEquals(ProgressStatus.MISSING, tracker.refresh().statusOf("S1", FE));
    }

    @Test
    void testPairWithoutInputIsMissing() throws IOException {
        writeBytes(layout.compositeImage(CU));
        ProgressRecord record = tracker.refresh().get("S2", CU).orElseThrow();
        assertEquals(ProgressStatus.MISSING, record.status());
        assertFalse(record.inputAvailable());
        assertTrue(tracker.refresh().isElementComplete(CU), "S2 has no Cu input, so S1 alone decides");
    }

    @Test
    void testCompositeOlderThanInputIsNotComplete() throws IOException {
        writeBytes(layout.compositeImage(FE));
        writeBytes(layout.histogram(FE, "S1"));
        Instant compositeTime = Instant.parse("2024-01-01T00:00:00Z");
        Files.setLastModifiedTime(layout.compositeImage(FE), FileTime.from(compositeTime));
        store.putTimestamp("S1", FE, compositeTime.plusSeconds(60));
        store.putTimestamp("S2", FE, compositeTime.minusSeconds(60));

        ProgressSnapshot snapshot = tracker.refresh();
        assertEquals(ProgressStatus.PARTIAL, snapshot.statusOf("S1", FE));
        assertEquals(ProgressStatus.COMPLETE, snapshot.statusOf("S2", FE));
        assertFalse(snapshot.isElementComplete(FE));
    }

    @Test
    void testLegacyCompositeIsRecognized() throws IOException {
        writeBytes(layout.legacyCompositeImage(FE));
        assertEquals(ProgressStatus.COMPLETE, tracker.refresh().statusOf("S1", FE));
    }

    @Test
    void testInclusionIsReportedButNeverChangesStatus() throws IOException {
        writeBytes(layout.compositeImage(FE));
        inclusion.execute(InclusionCommand.setIncluded("S2", false));

        ProgressRecord record = tracker.refresh().get("S2", FE).orElseThrow();
        assertFalse(record.included());
        assertEquals(ProgressStatus.COMPLETE, record.status());
        assertTrue(inclusion.current().contains("S2"), "Refreshing must not touch the inclusion flags");
    }

    @Test
    void testExcludedSamplesDoNotBlockCompletion() throws IOException {
        writeBytes(layout.compositeImage(FE));
        Files.setLastModifiedTime(layout.compositeImage(FE), FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));
        store.putTimestamp("S2", FE, Instant.parse("2024-06-01T00:00:00Z"));

        assertFalse(tracker.refresh().isElementComplete(FE));
        inclusion.execute(InclusionCommand.setIncluded("S2", false));
        assertTrue(tracker.refresh().isElementComplete(FE));
    }

    @Test
    void testInferredFromOutputFolderOnly() throws IOException {
        writeBytes(layout.histogram(FE, "S1"));
        writeBytes(output.resolve("Cu63").resolve("Cu63_composite.png"));
        writeBytes(layout.histogram(new ElementKey("Zn66", UnitType.CPS), "S3"));

        ProgressTracker inferred = new ProgressTracker(layout, null, SampleInclusion.allIncluded(List.of()));
        ProgressSnapshot snapshot = inferred.refresh();

        assertTrue(snapshot.getElements().contains(FE));
        assertTrue(snapshot.getElements().contains(CU));
        assertTrue(snapshot.getElements().contains(new ElementKey("Zn66", UnitType.CPS)));
        assertEquals(List.of("S1", "S3"), snapshot.getSamples());
        assertEquals(ProgressStatus.PARTIAL, snapshot.statusOf("S1", FE));
        assertEquals(ProgressStatus.COMPLETE, snapshot.statusOf("S1", CU));
        assertEquals(ProgressStatus.MISSING, snapshot.statusOf("S3", FE));
    }
}
