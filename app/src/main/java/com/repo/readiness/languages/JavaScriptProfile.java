package com.repo.readiness.languages;

import com.repo.readiness.core.LanguageProfile;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * JavaScript/TypeScript: function declarations, arrow functions bound to a name, and method shorthand.
 * Only relative imports ("./x", "../x") are resolvable to files in the repository.
 */
public class JavaScriptProfile implements LanguageProfile {

    private static final Set<String> EXTENSIONS = Set.of(".js", ".jsx", ".ts", ".tsx");

    // The shorthand branch also matches `if (x) {`; accepted as a heuristic false positive
    private static final Pattern FUNCTION = Pattern.compile(
            "(function\\s+\\w+\\s*\\([^)]*\\)\\s*\\{"
                    + "|(?:const|let|var)\\s+\\w+\\s*=\\s*(?:async\\s*)?\\([^)]*\\)\\s*=>\\s*\\{"
                    + "|\\w+\\s*\\([^)]*\\)\\s*\\{)",
            Pattern.MULTILINE);

    private static final List<Pattern> IMPORTS = List.of(
            Pattern.compile("^import\\s+.*from\\s+['\"]", Pattern.MULTILINE),
            Pattern.compile("require\\s*\\(['\"]", Pattern.MULTILINE));

    private static final List<Pattern> IMPORT_TARGETS = List.of(
            Pattern.compile("import.*from\\s+['\"]\\.\\.?/([\\w/]+)['\"]", Pattern.MULTILINE),
            Pattern.compile("require\\(['\"]\\.\\.?/([\\w/]+)['\"]\\)", Pattern.MULTILINE));

    @Override
    public String getLanguageId() {
        return "javascript";
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
        return 10; // High priority for JS/TS files
    }
}
