package com.repo.readiness.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * A candidate source file found by the collector.
 * The stem (file name without extension) is the node key in the dependency graph.
 */
public record SourceFile(
        /** Absolute path to the file */
        Path path,

        /** Path relative to the repository root, always with '/' separators */
        String relativePath,

        /** Lower-cased extension including the leading dot; doubles as the language tag */
        String extension,

        /** File name without extension */
        String stem) {

    /**
     * Create a source file rooted at the given repository directory.
     */
    public static SourceFile of(Path repoRoot, Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path root = repoRoot.toAbsolutePath().normalize();
        String relative = absolute.startsWith(root)
                ? root.relativize(absolute).toString()
                : absolute.toString();

        String name = absolute.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String extension = dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
        String stem = dot > 0 ? name.substring(0, dot) : name;

        return new SourceFile(absolute, relative.replace('\\', '/'), extension, stem);
    }

    /**
     * Read the whole file as UTF-8.
     *
     * @throws FileUnreadableException if the file is missing, not permitted, or not valid UTF-8
     */
    public String read() throws FileUnreadableException {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new FileUnreadableException(path, e);
        }
    }
}
