package org.scalebaron.service;

import org.scalebaron.model.ElementMatrix;
import org.scalebaron.model.UnitType;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parses one matrix file (spreadsheet or delimited text) into an {@link ElementMatrix}.
 *
 * <p>The spreadsheet mechanics live outside the engine; implementations are expected to throw
 * {@link org.scalebaron.exceptions.MatrixParseException} for malformed, truncated or not-yet-synced
 * files and {@link org.scalebaron.exceptions.MissingFileException} for absent ones.
 */
@FunctionalInterface
public interface MatrixLoader {

    ElementMatrix load(Path file, UnitType unit) throws IOException;
}
