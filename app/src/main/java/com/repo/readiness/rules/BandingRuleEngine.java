package com.repo.readiness.rules;

import com.repo.readiness.core.CheckResult;
import com.repo.readiness.core.ReadinessConfig;

import java.util.*;

/**
 * Threshold-based banding for one scored check.
 * Bands are tried in priority order; the first whose condition holds decides the points and the
 * finding. Finding and recommendation texts are format strings filled with the caller's arguments.
 */
public class BandingRuleEngine {

    /**
     * Condition on the measured value of a check.
     */
    @FunctionalInterface
    public interface BandCondition {
        boolean matches(double value);
    }

    public enum Outcome {
        STRENGTH,
        WEAKNESS
    }

    /**
     * One score band with priority (lower = tried first).
     */
    public record ScoreBand(
            String bandName,
            int priority,
            BandCondition condition,
            int points,
            Outcome outcome,
            String finding,
            String recommendation) {
    }

    private final String checkName;
    private final List<ScoreBand> bands;

    public BandingRuleEngine(String checkName, List<ScoreBand> bands) {
        this.checkName = checkName;
        this.bands = new ArrayList<>(bands);
        this.bands.sort(Comparator.comparingInt(ScoreBand::priority));
    }

    /**
     * Band for the value, if any band covers it.
     */
    public Optional<ScoreBand> match(double value) {
        return bands.stream()
                .filter(band -> band.condition().matches(value))
                .findFirst();
    }

    /**
     * Score the value. Values outside every band produce an empty result.
     */
    public CheckResult evaluate(double value, Object... findingArgs) {
        return match(value)
                .map(band -> toResult(band, findingArgs))
                .orElseGet(CheckResult::empty);
    }

    private CheckResult toResult(ScoreBand band, Object... args) {
        String finding = String.format(Locale.ROOT, band.finding(), args);
        if (band.outcome() == Outcome.STRENGTH) {
            return CheckResult.strength(band.points(), finding);
        }
        String recommendation = band.recommendation() == null
                ? null
                : String.format(Locale.ROOT, band.recommendation(), args);
        return CheckResult.weakness(band.points(), finding, recommendation);
    }

    public String getCheckName() {
        return checkName;
    }

    public List<ScoreBand> getBands() {
        return Collections.unmodifiableList(bands);
    }

    // === Default band tables ===

    /**
     * Average cyclomatic complexity per unit (8 points).
     */
    public static BandingRuleEngine cyclomaticComplexity(ReadinessConfig config) {
        return new BandingRuleEngine("Cyclomatic Complexity", List.of(
                new ScoreBand("EXCELLENT", 0,
                        avg -> avg < config.getComplexityLow(), 8, Outcome.STRENGTH,
                        "Excellent: Average cyclomatic complexity is %.1f (very simple)", null),
                new ScoreBand("GOOD", 1,
                        avg -> avg < config.getComplexityMid(), 6, Outcome.STRENGTH,
                        "Good: Average cyclomatic complexity is %.1f (manageable)", null),
                new ScoreBand("MODERATE", 2,
                        avg -> avg < config.getComplexityHigh(), 3, Outcome.WEAKNESS,
                        "Moderate complexity: Average cyclomatic complexity is %.1f",
                        "Consider refactoring complex methods to reduce cyclomatic complexity"),
                new ScoreBand("HIGH", 3,
                        avg -> true, 0, Outcome.WEAKNESS,
                        "High complexity: Average cyclomatic complexity is %.1f (hard for AI)",
                        "Reduce cyclomatic complexity - AI struggles with highly complex methods")));
    }

    /**
     * Flags a single unit above the very-high threshold, regardless of the average.
     */
    public static BandingRuleEngine complexityOutliers(ReadinessConfig config) {
        return new BandingRuleEngine("Complexity Outliers", List.of(
                new ScoreBand("VERY_HIGH_UNIT", 0,
                        max -> max > config.getComplexityVeryHigh(), 0, Outcome.WEAKNESS,
                        "Some methods have very high complexity (max: %d)", null)));
    }

    /**
     * Average import statements per file (6 points).
     */
    public static BandingRuleEngine fileCoupling(ReadinessConfig config) {
        return new BandingRuleEngine("File Coupling", List.of(
                new ScoreBand("LOW", 0,
                        avg -> avg < config.getCouplingLow(), 6, Outcome.STRENGTH,
                        "Low coupling: Average %.1f dependencies per file", null),
                new ScoreBand("MODERATE", 1,
                        avg -> avg < config.getCouplingMid(), 4, Outcome.STRENGTH,
                        "Moderate coupling: Average %.1f dependencies per file", null),
                new ScoreBand("HIGH", 2,
                        avg -> avg < config.getCouplingHigh(), 2, Outcome.WEAKNESS,
                        "High coupling: Average %.1f dependencies per file",
                        "Reduce file coupling to improve AI context understanding"),
                new ScoreBand("VERY_HIGH", 3,
                        avg -> true, 0, Outcome.WEAKNESS,
                        "Very high coupling: Average %.1f dependencies per file",
                        "Refactor to reduce dependencies - exceeds AI context window capacity")));
    }

    /**
     * Flags a single file above the very-high coupling threshold.
     */
    public static BandingRuleEngine couplingOutliers(ReadinessConfig config) {
        return new BandingRuleEngine("Coupling Outliers", List.of(
                new ScoreBand("VERY_HIGH_FILE", 0,
                        max -> max > config.getCouplingVeryHigh(), 0, Outcome.WEAKNESS,
                        "Some files have excessive dependencies (max: %d)", null)));
    }

    /**
     * Number of detected dependency cycles (6 points).
     */
    public static BandingRuleEngine circularDependencies(ReadinessConfig config) {
        return new BandingRuleEngine("Circular Dependencies", List.of(
                new ScoreBand("NONE", 0,
                        count -> count == 0, 6, Outcome.STRENGTH,
                        "No circular dependencies detected", null),
                new ScoreBand("FEW", 1,
                        count -> count <= config.getCyclesModerate(), 3, Outcome.WEAKNESS,
                        "Found %d circular dependency cycle(s)",
                        "Break circular dependencies to improve code clarity"),
                new ScoreBand("MANY", 2,
                        count -> true, 0, Outcome.WEAKNESS,
                        "Found %d circular dependency cycles (confuses AI)",
                        "Significant refactoring needed - circular dependencies prevent clear reasoning")));
    }

    /**
     * Longest dependency chain in the graph (5 points).
     */
    public static BandingRuleEngine dependencyDepth(ReadinessConfig config) {
        return new BandingRuleEngine("Dependency Depth", List.of(
                new ScoreBand("SHALLOW", 0,
                        max -> max <= config.getDepthShallow(), 5, Outcome.STRENGTH,
                        "Shallow dependency chains: Max depth %d (easy to understand)", null),
                new ScoreBand("MODERATE", 1,
                        max -> max <= config.getDepthModerate(), 3, Outcome.STRENGTH,
                        "Moderate dependency depth: Max %d hops", null),
                new ScoreBand("DEEP", 2,
                        max -> max <= config.getDepthDeep(), 1, Outcome.WEAKNESS,
                        "Deep dependency chains: Max depth %d",
                        "Flatten dependency chains for better AI comprehension"),
                new ScoreBand("VERY_DEEP", 3,
                        max -> true, 0, Outcome.WEAKNESS,
                        "Very deep dependency chains: Max depth %d (exceeds AI context)",
                        "Critical: Dependency depth requires understanding too much context for AI")));
    }
}
