package com.repo.readiness.graph;

import com.repo.readiness.complexity.ImportCounter;
import com.repo.readiness.core.FileUnreadableException;
import com.repo.readiness.core.SourceFile;

import java.util.*;

/**
 * Resolves each file's imports to other files of the same sample.
 *
 * An import references a file when the file's stem contains the import string, or when the file's
 * relative path contains the import with '.' replaced by '/'. The first matching file in sample
 * order wins. Matching is loose: an import of "Util" also matches "StringUtils".
 * Imports of third-party modules find no file and are dropped.
 */
public class DependencyGraphBuilder {

    private final ImportCounter importCounter;
    private final boolean verbose;

    public DependencyGraphBuilder(ImportCounter importCounter, boolean verbose) {
        this.importCounter = importCounter;
        this.verbose = verbose;
    }

    public DependencyGraph build(List<SourceFile> files) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();

        for (SourceFile file : files) {
            List<String> targets = new ArrayList<>();
            // A later file with the same stem replaces the earlier edge list
            adjacency.put(file.stem(), targets);

            String content;
            try {
                content = file.read();
            } catch (FileUnreadableException e) {
                if (verbose) {
                    System.out.println("  [SKIP] " + e.getMessage());
                }
                continue;
            }

            for (String imported : importCounter.extractTargets(file, content)) {
                resolve(imported, files).ifPresent(referenced -> targets.add(referenced.stem()));
            }
        }

        return DependencyGraph.of(adjacency);
    }

    /**
     * Find the first file in the sample that the import string refers to.
     */
    public static Optional<SourceFile> resolve(String imported, List<SourceFile> files) {
        String asPath = imported.replace('.', '/');
        return files.stream()
                .filter(f -> f.stem().contains(imported) || f.relativePath().contains(asPath))
                .findFirst();
    }
}
