package org.scalebaron.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scalebaron.model.ElementKey;
import org.scalebaron.model.ScaleConfig;
import org.scalebaron.model.UnitType;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchConfigTest {

    @TempDir
    Path tmp;

    @Test
    void testDefaults() {
        BatchConfig config = new BatchConfig.Builder().outputFolder(tmp).build();

        assertEquals(BatchConfig.DEFAULT_PIXEL_SIZE, config.getDefaultPixelSize());
        assertNull(config.getUserRows());
        assertTrue(config.isAutoFallback());
        assertEquals(1.3, config.getTargetAspect(), 1e-12);
        assertEquals(10, config.getDownsampleThreshold());
        assertEquals(512, config.getDownsampleTarget());
        assertFalse(config.isUseCustomPixelSizes());
        assertTrue(config.isSampleEligible("anything"));
    }

    @Test
    @DisplayName("Missing output folder fails the build")
    void testBuild_requiresOutputFolder() {
        assertThrows(IllegalStateException.class, () -> new BatchConfig.Builder().build());
    }

    @Test
    void testBuild_rejectsInvalidValues() {
        assertThrows(IllegalStateException.class,
                () -> new BatchConfig.Builder().outputFolder(tmp).defaultPixelSize(0).build());
        assertThrows(IllegalStateException.class,
                () -> new BatchConfig.Builder().outputFolder(tmp).userRows(0).build());
        assertThrows(IllegalStateException.class,
                () -> new BatchConfig.Builder().outputFolder(tmp).scaleBarMicrons(-5).build());
        assertThrows(IllegalStateException.class,
                () -> new BatchConfig.Builder().outputFolder(tmp).customPixelSizes(Map.of("A", -1.0)).build());
    }

    @Test
    void testCustomPixelSizes_restrictEligibleSamples() {
        BatchConfig config = new BatchConfig.Builder()
                .outputFolder(tmp)
                .defaultPixelSize(2.0)
                .customPixelSizes(Map.of("A", 0.5))
                .build();

        assertTrue(config.isSampleEligible("A"));
        assertFalse(config.isSampleEligible("B"));
        assertEquals(0.5, config.pixelSizeFor("A"));
        assertEquals(2.0, config.pixelSizeFor("B"));
    }

    @Test
    void testScaleConfigPerElement() {
        ElementKey fe = new ElementKey("Fe56", UnitType.PPM);
        BatchConfig config = new BatchConfig.Builder()
                .outputFolder(tmp)
                .scaleConfig(fe, ScaleConfig.fixed(2500))
                .build();

        assertEquals(ScaleConfig.fixed(2500), config.scaleConfigFor(fe));
        assertEquals(ScaleConfig.AUTO, config.scaleConfigFor(new ElementKey("Cu63", UnitType.PPM)));
    }
}
