package com.repo.readiness.languages;

import com.repo.readiness.core.LanguageProfile;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Universal fallback profile using C-family heuristics.
 * Handles C, C++, headers, Rust and any extension without a dedicated profile.
 */
public class GenericProfile implements LanguageProfile {

    private static final Pattern FUNCTION = Pattern.compile(
            "\\w+\\s*\\([^)]*\\)\\s*\\{",
            Pattern.MULTILINE);

    private static final List<Pattern> IMPORTS = List.of(
            Pattern.compile("^import\\s+", Pattern.MULTILINE),
            Pattern.compile("^#include\\s*[<\"]", Pattern.MULTILINE));

    @Override
    public String getLanguageId() {
        return "generic";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of(); // Reached only as the registry fallback
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
        return Integer.MAX_VALUE; // Lowest priority (fallback)
    }
}
