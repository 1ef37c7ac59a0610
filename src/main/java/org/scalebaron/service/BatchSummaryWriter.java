package org.scalebaron.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.scalebaron.controller.BatchSummary;
import org.scalebaron.controller.ElementOutcome;
import org.scalebaron.controller.SampleFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Writes a {@link BatchSummary} as pretty-printed JSON.
 *
 * <pre>
 * {
 *   "finishedAt": "2024-05-01T10:15:00Z",
 *   "cancelled": false,
 *   "counts": { "succeeded": 4, "partial": 1, "failed": 0, "skipped": 0 },
 *   "elements": [
 *     { "element": "Fe56_ppm", "status": "PARTIAL", "scale": 812.4,
 *       "processed": ["S1", "S2"], "attempted": 3,
 *       "failures": [ { "sample": "S3", "type": "MatrixParseException", "reason": "..." } ] }
 *   ]
 * }
 * </pre>
 */
public class BatchSummaryWriter {
    private static final Logger logger = LoggerFactory.getLogger(BatchSummaryWriter.class);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public void write(Path file, BatchSummary summary) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(toJson(summary), w);
        }
        logger.info("Batch summary written to {}", file);
    }

    JsonObject toJson(BatchSummary summary) {
        JsonObject root = new JsonObject();
        root.addProperty("finishedAt", Instant.now().toString());
        root.addProperty("elapsedSeconds", summary.getElapsed().toMillis() / 1000.0);
        root.addProperty("cancelled", summary.isCancelled());

        JsonObject counts = new JsonObject();
        counts.addProperty("succeeded", summary.getSucceededCount());
        counts.addProperty("partial", summary.getPartialCount());
        counts.addProperty("failed", summary.getFailedCount());
        counts.addProperty("skipped", summary.getSkippedCount());
        root.add("counts", counts);

        JsonArray elements = new JsonArray();
        for (ElementOutcome outcome : summary.getOutcomes()) {
            JsonObject element = new JsonObject();
            element.addProperty("element", outcome.element().outputName());
            element.addProperty("status", outcome.status().name());
            // Gson rejects NaN by default
            if (Double.isFinite(outcome.scaleValue())) {
                element.addProperty("scale", outcome.scaleValue());
            }
            if (outcome.reason() != null) {
                element.addProperty("reason", outcome.reason());
            }
            JsonArray processed = new JsonArray();
            outcome.processedSamples().forEach(processed::add);
            element.add("processed", processed);
            element.addProperty("attempted", outcome.attemptedSamples());

            JsonArray failures = new JsonArray();
            for (SampleFailure failure : outcome.failures()) {
                JsonObject f = new JsonObject();
                f.addProperty("sample", failure.sample());
                f.addProperty("type", failure.errorType());
                f.addProperty("reason", failure.reason());
                failures.add(f);
            }
            element.add("failures", failures);
            elements.add(element);
        }
        root.add("elements", elements);
        return root;
    }
}
