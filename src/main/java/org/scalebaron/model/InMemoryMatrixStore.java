package org.scalebaron.model;

import org.scalebaron.exceptions.MissingFileException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * {@link MatrixStore} over matrices that have already been parsed.
 *
 * <p>Used by callers that do their own parsing (the GUI keeps matrices of the current element in
 * memory) and throughout the tests.
 */
public class InMemoryMatrixStore implements MatrixStore {

    private final Map<String, Map<ElementKey, ElementMatrix>> matrices = new LinkedHashMap<>();
    private final Map<String, Map<ElementKey, Instant>> timestamps = new LinkedHashMap<>();

    /**
     * Adds or replaces the matrix of a pair. Sample order follows first insertion.
     *
     * @return this store for chaining
     */
    public InMemoryMatrixStore put(String sample, ElementKey element, ElementMatrix matrix) {
        matrices.computeIfAbsent(sample, s -> new LinkedHashMap<>()).put(element, matrix);
        return this;
    }

    /**
     * Records an input timestamp for a pair.
     *
     * @return this store for chaining
     */
    public InMemoryMatrixStore putTimestamp(String sample, ElementKey element, Instant modified) {
        timestamps.computeIfAbsent(sample, s -> new LinkedHashMap<>()).put(element, modified);
        return this;
    }

    @Override
    public List<String> getSampleNames() {
        return Collections.unmodifiableList(new ArrayList<>(matrices.keySet()));
    }

    @Override
    public SortedSet<ElementKey> getElements() {
        SortedSet<ElementKey> elements = new TreeSet<>();
        matrices.values().forEach(m -> elements.addAll(m.keySet()));
        return Collections.unmodifiableSortedSet(elements);
    }

    @Override
    public boolean contains(String sample, ElementKey element) {
        Map<ElementKey, ElementMatrix> bySample = matrices.get(sample);
        return bySample != null && bySample.containsKey(element);
    }

    @Override
    public ElementMatrix getMatrix(String sample, ElementKey element) throws MissingFileException {
        Map<ElementKey, ElementMatrix> bySample = matrices.get(sample);
        ElementMatrix matrix = bySample == null ? null : bySample.get(element);
        if (matrix == null) {
            throw new MissingFileException("No matrix for " + sample + " / " + element, null);
        }
        return matrix;
    }

    @Override
    public Optional<Instant> getLastModified(String sample, ElementKey element) {
        Map<ElementKey, Instant> bySample = timestamps.get(sample);
        return Optional.ofNullable(bySample == null ? null : bySample.get(element));
    }
}
