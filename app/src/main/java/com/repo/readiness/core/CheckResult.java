package com.repo.readiness.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one scored check: points awarded plus the findings it produced.
 */
public record CheckResult(
        int points,
        List<String> strengths,
        List<String> weaknesses,
        List<String> recommendations) {

    public CheckResult {
        strengths = List.copyOf(strengths);
        weaknesses = List.copyOf(weaknesses);
        recommendations = List.copyOf(recommendations);
    }

    /**
     * A check that had nothing to score.
     */
    public static CheckResult empty() {
        return new CheckResult(0, List.of(), List.of(), List.of());
    }

    public static CheckResult strength(int points, String strength) {
        return new CheckResult(points, List.of(strength), List.of(), List.of());
    }

    public static CheckResult weakness(int points, String weakness, String recommendation) {
        return new CheckResult(points, List.of(), List.of(weakness),
                recommendation == null ? List.of() : List.of(recommendation));
    }

    /**
     * Combine two results; findings keep their order, this result's first.
     */
    public CheckResult merge(CheckResult other) {
        return new CheckResult(
                points + other.points,
                concat(strengths, other.strengths),
                concat(weaknesses, other.weaknesses),
                concat(recommendations, other.recommendations));
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> out = new ArrayList<>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }
}
