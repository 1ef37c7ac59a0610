package org.scalebaron.progress;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scalebaron.model.ElementKey;
import org.scalebaron.model.UnitType;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OutputLayoutTest {

    @TempDir
    Path tmp;

    private final ElementKey fe = new ElementKey("Fe56", UnitType.PPM);

    @Test
    void testPaths() {
        OutputLayout layout = new OutputLayout(tmp);

        assertEquals(tmp.resolve("Fe56_ppm").resolve("Fe56_ppm_composite.png"), layout.compositeImage(fe));
        assertEquals(tmp.resolve("Fe56_ppm").resolve("Histograms").resolve("Rock_1_histogram.png"),
                layout.histogram(fe, "Rock/1"));
        assertEquals(tmp.resolve("Fe56").resolve("Fe56_composite.png"), layout.legacyCompositeImage(fe));
        assertEquals(tmp.resolve("batch_summary.json"), layout.batchSummary());
    }

    @Test
    void testParseFolderName() {
        assertEquals(new ElementKey("Zn66", UnitType.CPS), OutputLayout.parseFolderName("Zn66_CPS"));
        assertEquals(new ElementKey("Fe56", UnitType.PPM), OutputLayout.parseFolderName("Fe56"));
        assertEquals(new ElementKey("Total_Mo", UnitType.PPM), OutputLayout.parseFolderName("Total_Mo"));
    }

    @Test
    void testCompositeTimestamp_ignoresEmptyFiles() throws Exception {
        OutputLayout layout = new OutputLayout(tmp);
        Files.createDirectories(layout.elementDir(fe));
        Files.createFile(layout.compositeImage(fe));

        assertTrue(layout.compositeTimestamp(fe).isEmpty());

        Files.write(layout.compositeImage(fe), new byte[]{1, 2, 3});
        assertTrue(layout.compositeTimestamp(fe).isPresent());
    }

    @Test
    void testCompositeTimestamp_fallsBackToLegacyLayout() throws Exception {
        OutputLayout layout = new OutputLayout(tmp);
        Files.createDirectories(layout.legacyElementDir(fe));
        Files.write(layout.legacyCompositeImage(fe), new byte[]{1});

        assertTrue(layout.compositeTimestamp(fe).isPresent());
    }

    @Test
    void testScanOutputColumns() throws Exception {
        OutputLayout layout = new OutputLayout(tmp);
        Path hist = layout.histogram(fe, "A");
        Files.createDirectories(hist.getParent());
        Files.write(hist, new byte[]{1});
        Files.createDirectories(tmp.resolve("Empty_ppm"));

        Map<ElementKey, Set<String>> columns = layout.scanOutputColumns();

        assertEquals(1, columns.size());
        assertEquals(Set.of("A"), columns.get(fe));
    }
}
