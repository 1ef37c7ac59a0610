package org.scalebaron.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Rendering collaborator: draws composites and single-sample images with a plotting library.
 *
 * <p>The engine hands over fully resolved requests (grid, normalized panels, labels, scale bar
 * lengths); implementations only paint them.
 */
public interface CompositeRenderer {

    /**
     * Renders the element composite: every panel in its grid cell, one shared color bar and
     * scale bar.
     */
    void renderComposite(CompositeRequest request, Path target) throws IOException;

    /**
     * Renders one panel on its own.
     *
     * @param labeled whether to draw the sample label
     */
    default void renderIndividual(CompositeRequest request, CompositeRequest.Panel panel,
                                  boolean labeled, Path target) throws IOException {
        // Renderers that only produce composites need nothing here
    }
}
