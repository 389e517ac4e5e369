package com.repo.readiness.core;

import java.util.List;

/**
 * Final result of one assessment category, as handed to report renderers.
 */
public record CategoryResult(
        /** Category key, e.g. "CodeComplexity" */
        String categoryName,

        /** Awarded points, capped at maxScore */
        int score,

        int maxScore,

        List<String> strengths,

        List<String> weaknesses,

        List<String> recommendations,

        /** Raw numbers behind the bands */
        ComplexityMetrics metrics) {

    public CategoryResult {
        strengths = List.copyOf(strengths);
        weaknesses = List.copyOf(weaknesses);
        recommendations = List.copyOf(recommendations);
    }

    /**
     * Fold merged check results into a category result, capping the score.
     */
    public static CategoryResult of(String categoryName, int maxScore, CheckResult checks, ComplexityMetrics metrics) {
        return new CategoryResult(
                categoryName,
                Math.min(maxScore, Math.max(0, checks.points())),
                maxScore,
                checks.strengths(),
                checks.weaknesses(),
                checks.recommendations(),
                metrics);
    }
}
