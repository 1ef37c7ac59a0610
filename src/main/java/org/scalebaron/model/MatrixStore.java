package org.scalebaron.model;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Source of element matrices for a batch run.
 *
 * <p>The store is owned by the caller and is read-only to the engine. Implementations may parse
 * lazily, in which case {@link #getMatrix(String, ElementKey)} is where a malformed file surfaces as
 * a {@link org.scalebaron.exceptions.MatrixParseException}.
 */
public interface MatrixStore {

    /**
     * @return all sample names known to the store, in display order
     */
    List<String> getSampleNames();

    /**
     * @return all element columns present for at least one sample, in progress-table order
     */
    SortedSet<ElementKey> getElements();

    /**
     * @return true if a matrix exists for the pair (it may still fail to parse)
     */
    boolean contains(String sample, ElementKey element);

    /**
     * Cheap check that the input behind a pair can be handed to a parser, without parsing it.
     * Stores that keep files on disk report empty placeholder files as unreadable.
     */
    default boolean isReadable(String sample, ElementKey element) {
        return contains(sample, element);
    }

    /**
     * Returns the matrix for a pair.
     *
     * @throws org.scalebaron.exceptions.MissingFileException if there is no matrix for the pair
     * @throws org.scalebaron.exceptions.MatrixParseException if the matrix exists but cannot be read
     * @throws IOException on other read failures
     */
    ElementMatrix getMatrix(String sample, ElementKey element) throws IOException;

    /**
     * Modification time of the input behind a pair, used to decide whether an existing composite is
     * still current. Stores without timestamps return empty.
     */
    default Optional<Instant> getLastModified(String sample, ElementKey element) {
        return Optional.empty();
    }
}
