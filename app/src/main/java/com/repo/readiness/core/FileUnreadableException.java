package com.repo.readiness.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when a source file cannot be read (permissions, missing file, malformed encoding).
 * Callers skip the file and continue with the rest of the sample.
 */
public class FileUnreadableException extends IOException {

    private final Path path;

    public FileUnreadableException(Path path, Throwable cause) {
        super("Cannot read " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
