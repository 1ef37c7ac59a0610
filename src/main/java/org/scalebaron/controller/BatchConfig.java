package org.scalebaron.controller;

import org.scalebaron.layout.LayoutPlanner;
import org.scalebaron.layout.MatrixDownsampler;
import org.scalebaron.model.ElementKey;
import org.scalebaron.model.ScaleConfig;
import org.scalebaron.progress.ThrottledProgressReporter;
import org.scalebaron.scale.ScaleBarCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable settings for one batch run.
 *
 * <p>Everything the batch reads from the user (pixel sizes, scale choices, layout override,
 * output folder) is captured here once, before the run starts, and passed explicitly to
 * {@link BatchController}. Nothing in the engine reads these settings from anywhere else.
 *
 * <pre>{@code
 * BatchConfig config = new BatchConfig.Builder()
 *     .outputFolder(Path.of("/data/out"))
 *     .defaultPixelSize(5.0)                          // microns
 *     .scaleConfig(new ElementKey("Fe56", UnitType.PPM), ScaleConfig.fixed(2500))
 *     .userRows(2)
 *     .build();
 * }</pre>
 *
 * <p>The builder logs and warns on suspicious values as they are set; {@link Builder#build()}
 * rejects the configuration if a required value is missing or invalid.
 *
 * @author Mike Nelson
 * @since 0.3
 */
public final class BatchConfig {
    private static final Logger logger = LoggerFactory.getLogger(BatchConfig.class);

    public static final double DEFAULT_PIXEL_SIZE = 1.0;
    public static final int DEFAULT_DOWNSAMPLE_THRESHOLD = 10;

    private final Path outputFolder;
    private final double defaultPixelSize;
    private final boolean useCustomPixelSizes;
    private final Map<String, Double> customPixelSizes;
    private final double scaleBarMicrons;
    private final ScaleConfig defaultScale;
    private final Map<ElementKey, ScaleConfig> scaleConfigs;
    private final Integer userRows;
    private final boolean autoFallback;
    private final double targetAspect;
    private final int downsampleThreshold;
    private final int downsampleTarget;
    private final int maxUpdatesPerSecond;
    private final boolean exportIndividualImages;
    private final boolean exportCompositeMatrix;

    private BatchConfig(Builder b) {
        this.outputFolder = b.outputFolder;
        this.defaultPixelSize = b.defaultPixelSize;
        this.useCustomPixelSizes = b.useCustomPixelSizes;
        this.customPixelSizes = Collections.unmodifiableMap(new LinkedHashMap<>(b.customPixelSizes));
        this.scaleBarMicrons = b.scaleBarMicrons;
        this.defaultScale = b.defaultScale;
        this.scaleConfigs = Collections.unmodifiableMap(new LinkedHashMap<>(b.scaleConfigs));
        this.userRows = b.userRows;
        this.autoFallback = b.autoFallback;
        this.targetAspect = b.targetAspect;
        this.downsampleThreshold = b.downsampleThreshold;
        this.downsampleTarget = b.downsampleTarget;
        this.maxUpdatesPerSecond = b.maxUpdatesPerSecond;
        this.exportIndividualImages = b.exportIndividualImages;
        this.exportCompositeMatrix = b.exportCompositeMatrix;
    }

    /**
     * Builder for {@link BatchConfig}. Each setter logs the value at debug level and warns when
     * the value will fail validation.
     */
    public static class Builder {
        private static final Logger logger = LoggerFactory.getLogger(Builder.class);

        private Path outputFolder;
        private double defaultPixelSize = DEFAULT_PIXEL_SIZE;
        private boolean useCustomPixelSizes;
        private final Map<String, Double> customPixelSizes = new LinkedHashMap<>();
        private double scaleBarMicrons = ScaleBarCalculator.DEFAULT_SCALE_BAR_MICRONS;
        private ScaleConfig defaultScale = ScaleConfig.AUTO;
        private final Map<ElementKey, ScaleConfig> scaleConfigs = new LinkedHashMap<>();
        private Integer userRows;
        private boolean autoFallback = true;
        private double targetAspect = LayoutPlanner.DEFAULT_TARGET_ASPECT;
        private int downsampleThreshold = DEFAULT_DOWNSAMPLE_THRESHOLD;
        private int downsampleTarget = MatrixDownsampler.DEFAULT_TARGET_MAX;
        private int maxUpdatesPerSecond = ThrottledProgressReporter.DEFAULT_MAX_UPDATES_PER_SECOND;
        private boolean exportIndividualImages;
        private boolean exportCompositeMatrix;

        /**
         * @param folder root folder for all artifacts, required
         */
        public Builder outputFolder(Path folder) {
            logger.debug("Setting output folder: {}", folder);
            if (folder == null) {
                logger.warn("Output folder is null - this will cause build validation to fail");
            }
            this.outputFolder = folder;
            return this;
        }

        /**
         * @param micronsPerPixel pixel edge length used for samples without a custom size
         */
        public Builder defaultPixelSize(double micronsPerPixel) {
            logger.debug("Setting default pixel size: {} microns", micronsPerPixel);
            if (!(micronsPerPixel > 0) || Double.isInfinite(micronsPerPixel)) {
                logger.warn("Pixel size must be positive: {} - this will cause build validation to fail", micronsPerPixel);
            }
            this.defaultPixelSize = micronsPerPixel;
            return this;
        }

        /**
         * Enables custom pixel sizes. While enabled, only samples listed in {@code sizes} take part
         * in the run.
         */
        public Builder customPixelSizes(Map<String, Double> sizes) {
            logger.debug("Setting custom pixel sizes for {} sample(s)", sizes == null ? "null" : sizes.size());
            this.customPixelSizes.clear();
            if (sizes == null || sizes.isEmpty()) {
                logger.warn("Custom pixel sizes enabled with an empty table - no sample will be processed");
            } else {
                this.customPixelSizes.putAll(sizes);
            }
            this.useCustomPixelSizes = true;
            return this;
        }

        public Builder scaleBarMicrons(double microns) {
            logger.debug("Setting scale bar length: {} microns", microns);
            if (!(microns > 0)) {
                logger.warn("Scale bar length must be positive: {} - this will cause build validation to fail", microns);
            }
            this.scaleBarMicrons = microns;
            return this;
        }

        /**
         * Scale used for elements without an explicit {@link #scaleConfig(ElementKey, ScaleConfig)}.
         */
        public Builder defaultScale(ScaleConfig config) {
            logger.debug("Setting default scale: {}", config);
            this.defaultScale = config == null ? ScaleConfig.AUTO : config;
            return this;
        }

        public Builder scaleConfig(ElementKey element, ScaleConfig config) {
            logger.debug("Setting scale for {}: {}", element, config);
            if (config == null) {
                scaleConfigs.remove(element);
            } else {
                scaleConfigs.put(element, config);
            }
            return this;
        }

        /**
         * @param rows fixed number of layout rows, or null for automatic layout
         */
        public Builder userRows(Integer rows) {
            logger.debug("Setting layout rows: {}", rows == null ? "auto" : rows);
            if (rows != null && rows < 1) {
                logger.warn("Layout rows must be at least 1, got {} - this will cause build validation to fail", rows);
            }
            this.userRows = rows;
            return this;
        }

        public Builder autoFallback(boolean fallback) {
            logger.debug("Setting layout auto-fallback: {}", fallback);
            this.autoFallback = fallback;
            return this;
        }

        public Builder targetAspect(double aspect) {
            logger.debug("Setting target aspect ratio: {}", aspect);
            if (!(aspect > 0)) {
                logger.warn("Target aspect must be positive: {}", aspect);
            }
            this.targetAspect = aspect;
            return this;
        }

        /**
         * @param threshold composites with more samples than this are downsampled
         * @param targetMax longest side of a downsampled matrix
         */
        public Builder downsample(int threshold, int targetMax) {
            logger.debug("Setting downsampling: above {} samples to {} px", threshold, targetMax);
            this.downsampleThreshold = threshold;
            this.downsampleTarget = targetMax;
            return this;
        }

        public Builder maxUpdatesPerSecond(int rate) {
            logger.debug("Setting progress rate cap: {}/s", rate);
            this.maxUpdatesPerSecond = rate;
            return this;
        }

        public Builder exportIndividualImages(boolean export) {
            this.exportIndividualImages = export;
            return this;
        }

        public Builder exportCompositeMatrix(boolean export) {
            this.exportCompositeMatrix = export;
            return this;
        }

        /**
         * @throws IllegalStateException if a required value is missing or invalid
         */
        public BatchConfig build() {
            logger.debug("Building BatchConfig with validation");
            if (outputFolder == null) {
                fail("Output folder is required");
            }
            if (!(defaultPixelSize > 0) || Double.isInfinite(defaultPixelSize)) {
                fail("Default pixel size must be positive and finite: " + defaultPixelSize);
            }
            for (Map.Entry<String, Double> entry : customPixelSizes.entrySet()) {
                Double size = entry.getValue();
                if (size == null || !(size > 0) || size.isInfinite()) {
                    fail("Custom pixel size for " + entry.getKey() + " must be positive: " + size);
                }
            }
            if (!(scaleBarMicrons > 0) || Double.isInfinite(scaleBarMicrons)) {
                fail("Scale bar length must be positive: " + scaleBarMicrons);
            }
            if (userRows != null && userRows < 1) {
                fail("Layout rows must be at least 1: " + userRows);
            }
            if (!(targetAspect > 0) || Double.isInfinite(targetAspect)) {
                fail("Target aspect must be positive: " + targetAspect);
            }
            if (downsampleThreshold < 1 || downsampleTarget < 1) {
                fail(String.format("Downsampling settings must be positive: threshold=%d, target=%d",
                        downsampleThreshold, downsampleTarget));
            }
            if (maxUpdatesPerSecond < 1) {
                fail("Progress rate cap must be positive: " + maxUpdatesPerSecond);
            }
            BatchConfig config = new BatchConfig(this);
            logger.debug("Successfully built {}", config);
            return config;
        }

        private static void fail(String error) {
            logger.error("Build validation failed: {}", error);
            throw new IllegalStateException(error);
        }
    }

    public Path getOutputFolder() { return outputFolder; }

    public double getDefaultPixelSize() { return defaultPixelSize; }

    /**
     * @return true when only samples listed in {@link #getCustomPixelSizes()} take part
     */
    public boolean isUseCustomPixelSizes() { return useCustomPixelSizes; }

    public Map<String, Double> getCustomPixelSizes() { return customPixelSizes; }

    /**
     * Pixel size for a sample: its custom size when custom sizes are enabled and it has one,
     * the default otherwise.
     */
    public double pixelSizeFor(String sample) {
        if (useCustomPixelSizes) {
            Double custom = customPixelSizes.get(sample);
            if (custom != null) {
                return custom;
            }
        }
        return defaultPixelSize;
    }

    /**
     * @return false for samples excluded by the custom pixel-size table
     */
    public boolean isSampleEligible(String sample) {
        return !useCustomPixelSizes || customPixelSizes.containsKey(sample);
    }

    public double getScaleBarMicrons() { return scaleBarMicrons; }

    public ScaleConfig scaleConfigFor(ElementKey element) {
        return scaleConfigs.getOrDefault(element, defaultScale);
    }

    public Integer getUserRows() { return userRows; }

    public boolean isAutoFallback() { return autoFallback; }

    public double getTargetAspect() { return targetAspect; }

    public int getDownsampleThreshold() { return downsampleThreshold; }

    public int getDownsampleTarget() { return downsampleTarget; }

    public int getMaxUpdatesPerSecond() { return maxUpdatesPerSecond; }

    public boolean isExportIndividualImages() { return exportIndividualImages; }

    public boolean isExportCompositeMatrix() { return exportCompositeMatrix; }

    @Override
    public String toString() {
        return String.format("BatchConfig[output=%s, pixelSize=%s, customSizes=%s, scaleBar=%s um, rows=%s, "
                        + "autoFallback=%s, aspect=%s, downsample>%d->%d]",
                outputFolder, defaultPixelSize, useCustomPixelSizes ? customPixelSizes.size() : "off",
                scaleBarMicrons, userRows == null ? "auto" : userRows, autoFallback, targetAspect,
                downsampleThreshold, downsampleTarget);
    }
}
