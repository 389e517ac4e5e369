package com.repo.readiness.core;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Plugin interface for per-language heuristics.
 * Each implementation supplies the patterns used to find function-like units and import statements
 * for one language family. No parsing is involved; patterns are matched against raw file text.
 */
public interface LanguageProfile {

    /**
     * How the end of a unit's body is located.
     */
    enum BodyStyle {
        /** Balanced '{' / '}' starting at the first brace of the signature */
        BRACES,
        /** Lines indented deeper than the signature line */
        INDENTATION
    }

    /**
     * Unique identifier for this language (e.g., "java", "python", "generic").
     */
    String getLanguageId();

    /**
     * File extensions this profile handles (e.g., ".py", ".js", ".ts").
     * Extensions include the leading dot and are lower case.
     */
    Set<String> getSupportedExtensions();

    /**
     * Pattern matching the signature that starts a function or method.
     */
    Pattern getFunctionPattern();

    default BodyStyle getBodyStyle() {
        return BodyStyle.BRACES;
    }

    /**
     * Patterns whose occurrences are counted as import/include statements.
     */
    List<Pattern> getImportPatterns();

    /**
     * Patterns whose first capturing group names an imported module or file.
     * Languages whose imports cannot be mapped back to files return an empty list.
     */
    default List<Pattern> getImportTargetPatterns() {
        return List.of();
    }

    /**
     * Priority for this profile when multiple profiles claim the same extension.
     * Lower values = higher priority. Default is 100.
     */
    default int getPriority() {
        return 100;
    }
}
