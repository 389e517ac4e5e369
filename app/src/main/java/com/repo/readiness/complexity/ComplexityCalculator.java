package com.repo.readiness.complexity;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cyclomatic complexity estimate from raw text.
 *
 * Complexity = 1 + number of decision points. Every pattern is counted on its own, so an
 * {@code else if (} contributes both its {@code if (} and its {@code else if (}, and a decision
 * point inside a nested unit is counted again for each enclosing unit.
 */
public class ComplexityCalculator {

    private static final List<Pattern> DECISION_POINTS = List.of(
            Pattern.compile("\\bif\\s*\\("),
            Pattern.compile("\\belse\\s+if\\s*\\("),
            Pattern.compile("\\bwhile\\s*\\("),
            Pattern.compile("\\bfor\\s*\\("),
            Pattern.compile("\\bforeach\\s*\\("),
            Pattern.compile("\\bcase\\s+"),
            Pattern.compile("\\bcatch\\s*\\("),
            Pattern.compile("&&"),
            Pattern.compile("\\|\\|"),
            Pattern.compile("\\?"));

    private ComplexityCalculator() {
    }

    public static int calculate(String unitText) {
        int branches = 0;
        for (Pattern pattern : DECISION_POINTS) {
            Matcher matcher = pattern.matcher(unitText);
            while (matcher.find()) {
                branches++;
            }
        }
        return branches + 1; // Base complexity is 1 (the unit itself)
    }
}
