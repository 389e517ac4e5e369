package com.repo.readiness.core;

/**
 * Raw measurements behind the complexity category score.
 * Values are zero when the corresponding check had nothing to measure.
 */
public record ComplexityMetrics(
        int filesCollected,
        int unitsAnalyzed,
        double averageComplexity,
        int maxComplexity,
        int filesCoupled,
        double averageCoupling,
        int maxCoupling,
        int graphNodes,
        int cycleCount,
        double averageDepth,
        int maxDepth) {

    public static ComplexityMetrics empty() {
        return new ComplexityMetrics(0, 0, 0.0, 0, 0, 0.0, 0, 0, 0, 0.0, 0);
    }
}
