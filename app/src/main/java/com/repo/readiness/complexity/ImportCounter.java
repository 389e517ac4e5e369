package com.repo.readiness.complexity;

import com.repo.readiness.core.LanguageProfile;
import com.repo.readiness.core.LanguageRegistry;
import com.repo.readiness.core.SourceFile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts import/include statements (the file's coupling) and extracts the names they reference.
 */
public class ImportCounter {

    private record ImportTarget(int position, String name) {
    }

    private final LanguageRegistry registry;

    public ImportCounter(LanguageRegistry registry) {
        this.registry = registry;
    }

    /**
     * Number of import-like statements in the file.
     */
    public int count(SourceFile source, String content) {
        int count = 0;
        for (Pattern pattern : registry.getProfile(source).getImportPatterns()) {
            Matcher matcher = pattern.matcher(content);
            while (matcher.find()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Imported module or file names, in the order they appear in the file.
     */
    public List<String> extractTargets(SourceFile source, String content) {
        LanguageProfile profile = registry.getProfile(source);
        List<ImportTarget> found = new ArrayList<>();

        for (Pattern pattern : profile.getImportTargetPatterns()) {
            Matcher matcher = pattern.matcher(content);
            while (matcher.find()) {
                if (matcher.groupCount() >= 1 && matcher.group(1) != null) {
                    found.add(new ImportTarget(matcher.start(1), matcher.group(1)));
                }
            }
        }

        // Stable sort keeps pattern order for targets sharing a position
        found.sort(Comparator.comparingInt(ImportTarget::position));
        return found.stream().map(ImportTarget::name).toList();
    }
}
