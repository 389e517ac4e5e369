package com.repo.readiness.languages;

import com.repo.readiness.core.LanguageProfile;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Python: `def` signatures with indentation-delimited bodies.
 */
public class PythonProfile implements LanguageProfile {

    private static final Set<String> EXTENSIONS = Set.of(".py");

    private static final Pattern FUNCTION = Pattern.compile(
            "def\\s+\\w+\\s*\\([^)]*\\)(?:\\s*->\\s*[^:\\n]+)?\\s*:",
            Pattern.MULTILINE);

    private static final List<Pattern> IMPORTS = List.of(
            Pattern.compile("^import\\s+[\\w.]+", Pattern.MULTILINE),
            Pattern.compile("^from\\s+[\\w.]+\\s+import", Pattern.MULTILINE));

    // The second pattern also picks up the imported name of a from-import
    private static final List<Pattern> IMPORT_TARGETS = List.of(
            Pattern.compile("from\\s+([\\w.]+)\\s+import", Pattern.MULTILINE),
            Pattern.compile("import\\s+([\\w.]+)", Pattern.MULTILINE));

    @Override
    public String getLanguageId() {
        return "python";
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
    public BodyStyle getBodyStyle() {
        return BodyStyle.INDENTATION;
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
        return 10; // High priority for Python files
    }
}
