package com.repo.readiness.complexity;

import com.repo.readiness.core.LanguageProfile;
import com.repo.readiness.core.LanguageRegistry;
import com.repo.readiness.core.SourceFile;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Splits file text into function-like units using the file's language profile.
 *
 * The profile's signature pattern marks where a unit starts; the end is found by brace counting
 * (or indentation for indentation-delimited languages). A body that never closes before the end of
 * the file is dropped rather than reported. Nested functions come back as separate, overlapping
 * units in order of appearance.
 */
public class FunctionExtractor {

    private final LanguageRegistry registry;

    public FunctionExtractor(LanguageRegistry registry) {
        this.registry = registry;
    }

    public List<CodeUnit> extract(SourceFile source, String content) {
        LanguageProfile profile = registry.getProfile(source);
        List<CodeUnit> units = new ArrayList<>();

        Matcher matcher = profile.getFunctionPattern().matcher(content);
        while (matcher.find()) {
            int end = switch (profile.getBodyStyle()) {
                case BRACES -> findBraceBodyEnd(content, matcher.start(), matcher.end());
                case INDENTATION -> findIndentedBodyEnd(content, matcher.start(), matcher.end());
            };
            if (end > 0) {
                units.add(new CodeUnit(source, matcher.start(), content.substring(matcher.start(), end)));
            }
        }

        return units;
    }

    /**
     * @return exclusive end offset of the unit, or -1 if the body never balances
     */
    private int findBraceBodyEnd(String content, int signatureStart, int signatureEnd) {
        int open = content.charAt(signatureEnd - 1) == '{'
                ? signatureEnd - 1
                : content.indexOf('{', signatureEnd);
        if (open < signatureStart) {
            return -1;
        }

        int depth = 0;
        for (int i = open; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    /**
     * @return exclusive end offset of the last line belonging to the body, or -1 if there is no body
     */
    private int findIndentedBodyEnd(String content, int signatureStart, int signatureEnd) {
        int lineStart = content.lastIndexOf('\n', signatureStart - 1) + 1;
        int signatureIndent = indentOf(content, lineStart);

        int lineEnd = lineEndOf(content, signatureEnd);
        // One-line body: "def f(): return 1"
        int end = content.substring(signatureEnd, lineEnd).isBlank() ? -1 : lineEnd;

        int pos = lineEnd + 1;
        while (pos < content.length()) {
            int nextEnd = lineEndOf(content, pos);
            String line = content.substring(pos, nextEnd);
            if (!line.isBlank()) {
                if (indentOf(content, pos) <= signatureIndent) {
                    break;
                }
                end = nextEnd;
            }
            pos = nextEnd + 1;
        }
        return end;
    }

    private int lineEndOf(String content, int from) {
        int newline = content.indexOf('\n', from);
        return newline < 0 ? content.length() : newline;
    }

    private int indentOf(String content, int lineStart) {
        int i = lineStart;
        while (i < content.length() && (content.charAt(i) == ' ' || content.charAt(i) == '\t')) {
            i++;
        }
        return i - lineStart;
    }
}
