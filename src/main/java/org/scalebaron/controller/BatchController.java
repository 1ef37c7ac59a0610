package org.scalebaron.controller;

import org.scalebaron.exceptions.EmptyDataException;
import org.scalebaron.exceptions.InvalidScaleException;
import org.scalebaron.exceptions.LayoutOverflowException;
import org.scalebaron.layout.CompositeMatrixBuilder;
import org.scalebaron.layout.LayoutPlanner;
import org.scalebaron.layout.MatrixDownsampler;
import org.scalebaron.model.ElementKey;
import org.scalebaron.model.ElementMatrix;
import org.scalebaron.model.LayoutPlan;
import org.scalebaron.model.MatrixStore;
import org.scalebaron.model.ResolvedScale;
import org.scalebaron.model.SampleSet;
import org.scalebaron.model.StatisticsRecord;
import org.scalebaron.progress.OutputLayout;
import org.scalebaron.progress.ProgressListener;
import org.scalebaron.progress.ProgressSnapshot;
import org.scalebaron.progress.ProgressTracker;
import org.scalebaron.progress.SampleInclusion;
import org.scalebaron.progress.ThrottledProgressReporter;
import org.scalebaron.scale.IntensityTransform;
import org.scalebaron.scale.Normalization;
import org.scalebaron.scale.ScaleBarCalculator;
import org.scalebaron.scale.ScaleResolver;
import org.scalebaron.scale.TransformRegistry;
import org.scalebaron.service.BatchSummaryWriter;
import org.scalebaron.service.CompositeMatrixExporter;
import org.scalebaron.service.CompositeRenderer;
import org.scalebaron.service.CompositeRequest;
import org.scalebaron.service.HistogramRenderer;
import org.scalebaron.service.SampleAliasStore;
import org.scalebaron.service.StatisticsExporter;
import org.scalebaron.statistics.StatisticsCache;
import org.scalebaron.statistics.StatisticsEngine;
import org.scalebaron.utilities.BatchLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * BatchController
 *
 * <p>Runs the batch: for every element column, loads the included samples, computes their
 * statistics, resolves one shared scale, plans the grid and hands the composite to the renderer.
 *
 * <p>Flow of {@link #processAllElements()}:
 * <ol>
 *   <li>Rescan progress; elements whose included samples are all Complete are skipped</li>
 *   <li>For each remaining element, in order, run {@link #processElement(ElementKey)}</li>
 *   <li>Log and write the batch summary</li>
 * </ol>
 *
 * <p>Failures are contained: a sample that cannot be read or has no valid pixels is recorded and
 * left out of the composite; an element with no processable sample is marked failed; the batch
 * always runs to its end (or to cancellation) and never throws because of one bad file.
 * Execution is strictly sequential. Cancellation is checked between samples and between elements.
 *
 * @author Mike Nelson
 * @since 0.3
 */
public class BatchController {
    private static final Logger logger = LoggerFactory.getLogger(BatchController.class);

    private final MatrixStore store;
    private final BatchConfig config;
    private final StatisticsCache statisticsCache;
    private final ScaleResolver scaleResolver;
    private final LayoutPlanner layoutPlanner;
    private final HistogramRenderer histogramRenderer;
    private final CompositeRenderer compositeRenderer;
    private final StatisticsExporter statisticsExporter;
    private final SampleInclusion inclusion;
    private final OutputLayout outputLayout;
    private final ProgressTracker progressTracker;
    private final SampleAliasStore aliasStore;
    private final ScaleBarCalculator scaleBar;
    private final MatrixDownsampler downsampler;
    private final CompositeMatrixBuilder compositeBuilder = new CompositeMatrixBuilder();
    private final CompositeMatrixExporter compositeExporter = new CompositeMatrixExporter();
    private final BatchSummaryWriter summaryWriter = new BatchSummaryWriter();
    private final CancellationToken cancellation = new CancellationToken();

    private ProgressListener progressListener = ProgressListener.NONE;

    /**
     * Creates a controller with the default engine components; every sample starts included.
     */
    public BatchController(MatrixStore store, BatchConfig config,
                           HistogramRenderer histogramRenderer, CompositeRenderer compositeRenderer) {
        this(store, config, new StatisticsEngine(), histogramRenderer, compositeRenderer,
                SampleInclusion.allIncluded(store.getSampleNames()));
    }

    /**
     * @param inclusion holder of the user's inclusion choices, shared with whatever edits them
     */
    public BatchController(MatrixStore store, BatchConfig config, StatisticsEngine statisticsEngine,
                           HistogramRenderer histogramRenderer, CompositeRenderer compositeRenderer,
                           SampleInclusion inclusion) {
        this.store = store;
        this.config = config;
        this.statisticsCache = new StatisticsCache(statisticsEngine);
        this.scaleResolver = new ScaleResolver();
        this.layoutPlanner = new LayoutPlanner(config.getTargetAspect(), config.isAutoFallback());
        this.histogramRenderer = histogramRenderer;
        this.compositeRenderer = compositeRenderer;
        this.statisticsExporter = new StatisticsExporter();
        this.inclusion = inclusion;
        this.outputLayout = new OutputLayout(config.getOutputFolder());
        this.progressTracker = new ProgressTracker(outputLayout, store, inclusion);
        this.aliasStore = new SampleAliasStore(outputLayout.aliasTable());
        this.scaleBar = new ScaleBarCalculator(config.getScaleBarMicrons());
        this.downsampler = new MatrixDownsampler(config.getDownsampleTarget());
    }

    /**
     * Progress updates are rate limited to {@link BatchConfig#getMaxUpdatesPerSecond()}.
     */
    public void setProgressListener(ProgressListener listener) {
        this.progressListener = new ThrottledProgressReporter(listener, config.getMaxUpdatesPerSecond());
    }

    public CancellationToken getCancellationToken() {
        return cancellation;
    }

    public ProgressTracker getProgressTracker() {
        return progressTracker;
    }

    public SampleAliasStore getAliasStore() {
        return aliasStore;
    }

    /**
     * Processes every element that is not already complete.
     *
     * @return the summary; also logged and written as JSON into the output folder
     */
    public BatchSummary processAllElements() {
        long start = System.nanoTime();
        try (BatchLogger.Session session = BatchLogger.start(config.getOutputFolder())) {
            logger.info("Starting batch: {} sample(s), {} element(s), {}",
                    store.getSampleNames().size(), store.getElements().size(), config);
            inclusion.register(store.getSampleNames());
            loadAliases();

            ProgressSnapshot progress = progressTracker.refresh();
            List<ElementKey> elements = new ArrayList<>(progress.getElements());
            List<ElementOutcome> outcomes = new ArrayList<>();
            int total = elements.size();

            for (int i = 0; i < total; i++) {
                ElementKey element = elements.get(i);
                if (cancellation.isCancelled()) {
                    outcomes.add(ElementOutcome.cancelled(element, List.of(), 0, List.of()));
                    continue;
                }
                progressListener.onProgress(i, total, "Processing " + element);
                if (progress.isElementComplete(element)) {
                    logger.info("Skipping {}: all included samples are complete", element);
                    outcomes.add(ElementOutcome.skipped(element));
                    continue;
                }
                ElementOutcome outcome;
                try {
                    outcome = processElement(element);
                } catch (RuntimeException e) {
                    logger.error("Unexpected failure processing {}", element, e);
                    outcome = ElementOutcome.failed(element, 0, List.of(), e.toString());
                }
                outcomes.add(outcome);
            }
            progressListener.onProgress(total, total, cancellation.isCancelled() ? "Cancelled" : "Done");

            BatchSummary summary = new BatchSummary(outcomes, cancellation.isCancelled(),
                    Duration.ofNanos(System.nanoTime() - start));
            summary.log();
            try {
                summaryWriter.write(outputLayout.batchSummary(), summary);
            } catch (IOException e) {
                logger.error("Could not write batch summary to {}", outputLayout.batchSummary(), e);
            }
            return summary;
        }
    }

    /**
     * Processes one element. Per-sample failures are recorded in the outcome and the remaining
     * samples still go into the composite.
     */
    public ElementOutcome processElement(ElementKey element) {
        // samples new to the inclusion holder join as included, for the scale as well as the grid
        SampleSet samples = inclusion.register(store.getSampleNames());
        List<String> candidates = new ArrayList<>();
        for (String sample : store.getSampleNames()) {
            if (samples.isIncluded(sample) && config.isSampleEligible(sample) && store.contains(sample, element)) {
                candidates.add(sample);
            }
        }
        if (candidates.isEmpty()) {
            logger.warn("No included sample has data for {}", element);
            return ElementOutcome.failed(element, 0, List.of(), "no included sample has data");
        }

        logger.info("Processing {} for {} sample(s)", element, candidates.size());
        Map<String, ElementMatrix> matrices = new LinkedHashMap<>();
        Map<String, StatisticsRecord> statistics = new LinkedHashMap<>();
        List<SampleFailure> failures = new ArrayList<>();
        try {
            for (int i = 0; i < candidates.size(); i++) {
                String sample = candidates.get(i);
                if (cancellation.isCancelled()) {
                    logger.info("Batch cancelled while processing {} ({} of {} samples done)",
                            element, i, candidates.size());
                    return ElementOutcome.cancelled(element, new ArrayList<>(matrices.keySet()),
                            candidates.size(), failures);
                }
                try {
                    ElementMatrix matrix = store.getMatrix(sample, element);
                    StatisticsRecord record = statisticsCache.get(sample, element, matrix);
                    histogramRenderer.renderHistogram(sample, element, matrix, record,
                            outputLayout.histogram(element, sample));
                    matrices.put(sample, matrix);
                    statistics.put(sample, record);
                } catch (IOException | EmptyDataException e) {
                    logger.warn("Skipping {} for {}: {}", sample, element, e.getMessage());
                    failures.add(SampleFailure.of(sample, element, e));
                } catch (RuntimeException e) {
                    logger.error("Unexpected error reading {} for {}", sample, element, e);
                    failures.add(SampleFailure.of(sample, element, e));
                }
            }

            if (matrices.isEmpty()) {
                logger.error("No sample of {} could be processed", element);
                return ElementOutcome.failed(element, candidates.size(), failures, "no sample could be processed");
            }

            statisticsExporter.merge(outputLayout.statisticsTable(element), statistics, aliasStore::labelFor);
            ResolvedScale scale = scaleResolver.resolve(element, samples, statistics, config.scaleConfigFor(element));
            LayoutPlan plan = layoutPlanner.plan(new ArrayList<>(matrices.keySet()), config.getUserRows());
            renderOutputs(element, matrices, scale, plan);

            ElementOutcome.Status status = failures.isEmpty()
                    ? ElementOutcome.Status.SUCCEEDED : ElementOutcome.Status.PARTIAL;
            ElementOutcome outcome = new ElementOutcome(element, status, new ArrayList<>(matrices.keySet()),
                    candidates.size(), failures, null, scale.value());
            logger.info("Finished {}", outcome);
            return outcome;
        } catch (InvalidScaleException | LayoutOverflowException | EmptyDataException e) {
            logger.error("Cannot composite {}: {}", element, e.getMessage());
            return ElementOutcome.failed(element, candidates.size(), failures, e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to write outputs for {}", element, e);
            return ElementOutcome.failed(element, candidates.size(), failures, "could not write outputs: " + e.getMessage());
        } finally {
            statisticsCache.discard(element);
        }
    }

    private void renderOutputs(ElementKey element, Map<String, ElementMatrix> matrices,
                               ResolvedScale scale, LayoutPlan plan) throws IOException {
        Files.createDirectories(outputLayout.elementDir(element));
        boolean downsample = matrices.size() > config.getDownsampleThreshold();
        if (downsample) {
            logger.info("Downsampling {} matrices of {} to at most {} px", matrices.size(), element,
                    downsampler.getTargetMax());
        }

        List<CompositeRequest.Panel> panels = new ArrayList<>();
        List<double[][]> fullResolution = new ArrayList<>();
        for (String sample : plan.cellOrder()) {
            ElementMatrix matrix = matrices.get(sample);
            double[][] values = matrix.toArray();
            fullResolution.add(values);
            double pixelSize = config.pixelSizeFor(sample);
            if (downsample) {
                double[][] reduced = downsampler.downsample(values);
                if (reduced.length > 0 && reduced[0].length > 0) {
                    pixelSize *= (double) matrix.getCols() / reduced[0].length;
                }
                values = reduced;
            }
            panels.add(new CompositeRequest.Panel(sample, aliasStore.labelFor(sample), values,
                    pixelSize, scaleBar.barLengthPixels(pixelSize)));
        }

        IntensityTransform transform = TransformRegistry.get(scale.transformName());
        Normalization normalization = transform.createNormalization(scale.value(), pooledValues(matrices));
        CompositeRequest request = new CompositeRequest(element, plan, panels, scale, normalization,
                ScaleBarCalculator.colorBarLabel(scale.value(), element.unit().getDisplayName()),
                scaleBar.barLabel());

        compositeRenderer.renderComposite(request, outputLayout.compositeImage(element));
        if (config.isExportIndividualImages()) {
            Files.createDirectories(outputLayout.elementDir(element).resolve(OutputLayout.INDIVIDUAL_DIR));
            for (CompositeRequest.Panel panel : panels) {
                compositeRenderer.renderIndividual(request, panel, false,
                        outputLayout.individualImage(element, panel.sample(), false));
                compositeRenderer.renderIndividual(request, panel, true,
                        outputLayout.individualImage(element, panel.sample(), true));
            }
        }
        if (config.isExportCompositeMatrix()) {
            compositeExporter.write(outputLayout.compositeMatrix(element),
                    compositeBuilder.build(plan, fullResolution));
        }
    }

    private static double[] pooledValues(Map<String, ElementMatrix> matrices) {
        int size = 0;
        List<double[]> parts = new ArrayList<>();
        for (ElementMatrix matrix : matrices.values()) {
            double[] valid = matrix.validValues();
            parts.add(valid);
            size += valid.length;
        }
        double[] pooled = new double[size];
        int offset = 0;
        for (double[] part : parts) {
            System.arraycopy(part, 0, pooled, offset, part.length);
            offset += part.length;
        }
        return pooled;
    }

    private void loadAliases() {
        try {
            aliasStore.load();
        } catch (IOException e) {
            logger.warn("Could not read sample aliases from {}: {}", outputLayout.aliasTable(), e.getMessage());
        }
    }
}
