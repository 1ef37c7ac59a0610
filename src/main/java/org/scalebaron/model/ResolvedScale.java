package org.scalebaron.model;

/**
 * Outcome of scale resolution for one element.
 *
 * @param element the element column
 * @param value shared display maximum
 * @param mode the mode that produced it
 * @param transformName intensity transform the renderer applies before colormap lookup
 * @param contributingSamples number of included samples the value was derived from
 */
public record ResolvedScale(ElementKey element, double value, ScaleMode mode,
                            String transformName, int contributingSamples) {
}
