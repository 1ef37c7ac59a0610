package org.scalebaron.service;

import org.scalebaron.model.ElementKey;
import org.scalebaron.model.ElementMatrix;
import org.scalebaron.model.StatisticsRecord;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the per-sample histogram image, the intermediate artifact that marks a pair Partial.
 */
@FunctionalInterface
public interface HistogramRenderer {

    /**
     * @param sample sample name
     * @param element element column
     * @param matrix the sample's matrix
     * @param statistics its statistics; the histogram range ends at {@code statistics.p99()}
     * @param target file to write
     */
    void renderHistogram(String sample, ElementKey element, ElementMatrix matrix,
                         StatisticsRecord statistics, Path target) throws IOException;
}
