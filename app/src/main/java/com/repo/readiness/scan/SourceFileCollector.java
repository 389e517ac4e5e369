package com.repo.readiness.scan;

import com.repo.readiness.core.ReadinessConfig;
import com.repo.readiness.core.SourceFile;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * Enumerates candidate source files under a repository root.
 *
 * Files are matched against the configured extension allow-list; dependency caches, VCS metadata
 * and build output directories are pruned, and minified bundles are dropped. The result is grouped
 * by allow-list order and sorted by relative path within each extension so repeated runs over an
 * unchanged tree sample the same files.
 *
 * Never throws: unreadable directories and a missing root simply contribute nothing.
 */
public class SourceFileCollector {

    private final ReadinessConfig config;

    public SourceFileCollector(ReadinessConfig config) {
        this.config = config;
    }

    public List<SourceFile> collect(Path repoRoot) {
        if (!Files.isDirectory(repoRoot)) {
            return List.of();
        }

        Path root = repoRoot.toAbsolutePath().normalize();
        Map<String, List<SourceFile>> byExtension = new LinkedHashMap<>();
        for (String ext : config.getExtensions()) {
            byExtension.put(ext, new ArrayList<>());
        }

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                    if (config.isExcludedDirectory(name)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile() || isMinified(file)) {
                        return FileVisitResult.CONTINUE;
                    }
                    SourceFile source = SourceFile.of(root, file);
                    List<SourceFile> bucket = byExtension.get(source.extension());
                    if (bucket != null) {
                        bucket.add(source);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    if (config.isVerbose()) {
                        System.out.println("  [SKIP] " + file + " (" + exc.getMessage() + ")");
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            // Visitor never throws; anything collected before the failure is still usable
            if (config.isVerbose()) {
                System.out.println("  [SKIP] traversal stopped early: " + e.getMessage());
            }
        }

        List<SourceFile> files = new ArrayList<>();
        for (List<SourceFile> bucket : byExtension.values()) {
            bucket.sort(Comparator.comparing(SourceFile::relativePath));
            files.addAll(bucket);
        }
        return files;
    }

    private boolean isMinified(Path file) {
        return file.getFileName().toString().contains(".min.");
    }
}
