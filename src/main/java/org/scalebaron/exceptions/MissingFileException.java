package org.scalebaron.exceptions;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when an expected input file (matrix, pixel-size table, configuration) is absent.
 *
 * @since 0.1
 */
public class MissingFileException extends IOException {

    private final transient Path path;

    public MissingFileException(Path path) {
        super("File not found: " + path);
        this.path = path;
    }

    public MissingFileException(String message, Path path) {
        super(message);
        this.path = path;
    }

    /**
     * @return the path that was looked up, may be null when only a message was available
     */
    public Path getPath() {
        return path;
    }
}
