package com.repo.readiness.languages;

import com.repo.readiness.core.LanguageProfile;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Java: methods need an explicit access modifier, which keeps control statements out.
 */
public class JavaProfile implements LanguageProfile {

    private static final Set<String> EXTENSIONS = Set.of(".java");

    private static final Pattern FUNCTION = Pattern.compile(
            "(public|private|protected)\\s+(?:static\\s+)?(?:final\\s+)?\\w+(?:<[\\w,\\s]+>)?\\s+\\w+\\s*\\([^)]*\\)"
                    + "(?:\\s*throws\\s+[\\w.,\\s]+?)?\\s*\\{",
            Pattern.MULTILINE);

    private static final List<Pattern> IMPORTS = List.of(
            Pattern.compile("^import\\s+(?:static\\s+)?[\\w.]+(?:\\.\\*)?;", Pattern.MULTILINE));

    private static final List<Pattern> IMPORT_TARGETS = List.of(
            Pattern.compile("import\\s+(?:static\\s+)?([\\w.]+);", Pattern.MULTILINE));

    @Override
    public String getLanguageId() {
        return "java";
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
