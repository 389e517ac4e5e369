package com.repo.readiness.rules;

import com.repo.readiness.core.CheckResult;
import com.repo.readiness.core.ReadinessConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BandingRuleEngineTest {

    private final ReadinessConfig config = ReadinessConfig.defaults();

    @ParameterizedTest
    @CsvSource({
            "3.0, EXCELLENT, 8",
            "4.9, EXCELLENT, 8",
            "5.0, GOOD, 6",
            "9.9, GOOD, 6",
            "10.0, MODERATE, 3",
            "15.0, HIGH, 0",
            "40.0, HIGH, 0"
    })
    void testComplexityBandBoundaries(double average, String band, int points) {
        BandingRuleEngine engine = BandingRuleEngine.cyclomaticComplexity(config);

        assertEquals(band, engine.match(average).orElseThrow().bandName());
        assertEquals(points, engine.evaluate(average, average).points());
    }

    @Test
    void testExcellentComplexityFinding() {
        CheckResult result = BandingRuleEngine.cyclomaticComplexity(config).evaluate(3.0, 3.0);

        assertEquals(List.of("Excellent: Average cyclomatic complexity is 3.0 (very simple)"), result.strengths());
        assertTrue(result.weaknesses().isEmpty());
        assertTrue(result.recommendations().isEmpty());
    }

    @Test
    void testModerateComplexityCarriesRecommendation() {
        CheckResult result = BandingRuleEngine.cyclomaticComplexity(config).evaluate(12.0, 12.0);

        assertEquals(List.of("Moderate complexity: Average cyclomatic complexity is 12.0"), result.weaknesses());
        assertEquals(List.of("Consider refactoring complex methods to reduce cyclomatic complexity"),
                result.recommendations());
    }

    @Test
    void testOutlierOnlyAboveVeryHigh() {
        BandingRuleEngine outliers = BandingRuleEngine.complexityOutliers(config);

        assertEquals(CheckResult.empty(), outliers.evaluate(20, 20));
        CheckResult flagged = outliers.evaluate(21, 21);
        assertEquals(0, flagged.points());
        assertEquals(List.of("Some methods have very high complexity (max: 21)"), flagged.weaknesses());
        assertTrue(flagged.recommendations().isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
            "0.0, 6",
            "4.9, 6",
            "5.0, 4",
            "10.0, 2",
            "15.0, 0"
    })
    void testCouplingBands(double average, int points) {
        assertEquals(points, BandingRuleEngine.fileCoupling(config).evaluate(average, average).points());
    }

    @Test
    void testCircularDependencyBands() {
        BandingRuleEngine cycles = BandingRuleEngine.circularDependencies(config);

        assertEquals(List.of("No circular dependencies detected"), cycles.evaluate(0).strengths());
        assertEquals(6, cycles.evaluate(0).points());

        CheckResult few = cycles.evaluate(2, 2);
        assertEquals(3, few.points());
        assertEquals(List.of("Found 2 circular dependency cycle(s)"), few.weaknesses());

        CheckResult many = cycles.evaluate(3, 3);
        assertEquals(0, many.points());
        assertEquals(List.of("Found 3 circular dependency cycles (confuses AI)"), many.weaknesses());
    }

    @ParameterizedTest
    @CsvSource({
            "0, 5",
            "3, 5",
            "4, 3",
            "5, 3",
            "8, 1",
            "9, 0"
    })
    void testDependencyDepthBands(int maxDepth, int points) {
        assertEquals(points, BandingRuleEngine.dependencyDepth(config).evaluate(maxDepth, maxDepth).points());
    }

    @Test
    void testShallowDepthFinding() {
        CheckResult result = BandingRuleEngine.dependencyDepth(config).evaluate(1, 1);

        assertEquals(List.of("Shallow dependency chains: Max depth 1 (easy to understand)"), result.strengths());
    }

    @Test
    void testBandsAreTriedInPriorityOrder() {
        BandingRuleEngine engine = new BandingRuleEngine("Custom", List.of(
                new BandingRuleEngine.ScoreBand("CATCH_ALL", 5, v -> true, 0,
                        BandingRuleEngine.Outcome.WEAKNESS, "fallback", null),
                new BandingRuleEngine.ScoreBand("SMALL", 1, v -> v < 10, 2,
                        BandingRuleEngine.Outcome.STRENGTH, "small", null)));

        assertEquals("SMALL", engine.getBands().get(0).bandName());
        assertEquals("SMALL", engine.match(3).orElseThrow().bandName());
        assertEquals("CATCH_ALL", engine.match(30).orElseThrow().bandName());
        assertEquals("Custom", engine.getCheckName());
    }

    @Test
    void testNoMatchingBandIsEmpty() {
        BandingRuleEngine engine = new BandingRuleEngine("Never", List.of(
                new BandingRuleEngine.ScoreBand("NEVER", 0, v -> false, 9,
                        BandingRuleEngine.Outcome.STRENGTH, "never", null)));

        assertTrue(engine.match(1).isEmpty());
        assertEquals(CheckResult.empty(), engine.evaluate(1));
    }
}
