package com.repo.readiness.languages;

import com.repo.readiness.core.LanguageProfile;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * C#: access-modified methods, `using` directives as imports.
 */
public class CSharpProfile implements LanguageProfile {

    private static final Set<String> EXTENSIONS = Set.of(".cs");

    private static final Pattern FUNCTION = Pattern.compile(
            "(public|private|protected|internal)\\s+(?:static\\s+)?(?:async\\s+)?\\w+(?:<[\\w,\\s]+>)?\\s+\\w+\\s*\\([^)]*\\)\\s*\\{",
            Pattern.MULTILINE);

    private static final List<Pattern> IMPORTS = List.of(
            Pattern.compile("^using\\s+[\\w.]+;", Pattern.MULTILINE),
            Pattern.compile("^using\\s+static\\s+[\\w.]+;", Pattern.MULTILINE));

    private static final List<Pattern> IMPORT_TARGETS = List.of(
            Pattern.compile("using\\s+([\\w.]+);", Pattern.MULTILINE));

    @Override
    public String getLanguageId() {
        return "csharp";
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
    public List<Pattern> getImportTargetPatterns() {
        return IMPORT_TARGETS;
    }

    @Override
    public int getPriority() {
        return 10;
    }
}
