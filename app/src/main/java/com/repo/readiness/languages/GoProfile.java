package com.repo.readiness.languages;

import com.repo.readiness.core.LanguageProfile;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Go: plain functions and methods with a receiver. Import paths are package paths,
 * so no targets are resolved to files.
 */
public class GoProfile implements LanguageProfile {

    private static final Set<String> EXTENSIONS = Set.of(".go");

    private static final Pattern FUNCTION = Pattern.compile(
            "func\\s+(?:\\([\\w\\s*]+\\)\\s+)?\\w+\\s*\\([^)]*\\)\\s*(?:[\\w,\\s\\[\\]*]+)?\\s*\\{",
            Pattern.MULTILINE);

    private static final List<Pattern> IMPORTS = List.of(
            Pattern.compile("^import\\s+\\(", Pattern.MULTILINE),
            Pattern.compile("^import\\s+\"", Pattern.MULTILINE));

    @Override
    public String getLanguageId() {
        return "go";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public Pattern getFunctionPattern() {
        return FUNCTION;
    }

    @Override
    public List<Pattern> getImportPatterns() {
        return IMPORTS;
    }

    @Override
    public int getPriority() {
        return 10;
    }
}
