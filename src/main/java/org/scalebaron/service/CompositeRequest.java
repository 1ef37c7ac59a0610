package org.scalebaron.service;

import org.scalebaron.model.ElementKey;
import org.scalebaron.model.LayoutPlan;
import org.scalebaron.model.ResolvedScale;
import org.scalebaron.scale.Normalization;

import java.util.List;

/**
 * Everything a renderer needs to draw one element.
 *
 * @param element element column
 * @param layout grid and cell order
 * @param panels one panel per cell, in cell order
 * @param scale the shared scale
 * @param normalization maps raw values to colormap positions for every panel
 * @param colorBarLabel color-bar maximum label, e.g. "412 ppm"
 * @param scaleBarLabel spatial scale bar text, e.g. "1000 µm"
 */
public record CompositeRequest(ElementKey element, LayoutPlan layout, List<Panel> panels,
                               ResolvedScale scale, Normalization normalization,
                               String colorBarLabel, String scaleBarLabel) {

    public CompositeRequest {
        panels = List.copyOf(panels);
    }

    /**
     * One sample's cell.
     *
     * @param sample sample name
     * @param label displayed label (alias if set)
     * @param values raw values, possibly downsampled, {@code [row][column]}
     * @param pixelSizeMicrons physical size of one pixel of {@code values}
     * @param scaleBarPixels scale bar length in pixels of {@code values}
     */
    public record Panel(String sample, String label, double[][] values,
                        double pixelSizeMicrons, int scaleBarPixels) {
    }
}
