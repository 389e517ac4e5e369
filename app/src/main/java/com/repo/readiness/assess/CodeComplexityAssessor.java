package com.repo.readiness.assess;

import com.repo.readiness.complexity.CodeUnit;
import com.repo.readiness.complexity.FunctionExtractor;
import com.repo.readiness.complexity.ImportCounter;
import com.repo.readiness.core.*;
import com.repo.readiness.graph.CycleDetector;
import com.repo.readiness.graph.DependencyGraph;
import com.repo.readiness.graph.DependencyGraphBuilder;
import com.repo.readiness.graph.DepthAnalyzer;
import com.repo.readiness.rules.BandingRuleEngine;
import com.repo.readiness.scan.SourceFileCollector;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores how easily the code can be reasoned about: per-method cyclomatic complexity, per-file
 * coupling, circular dependencies and dependency depth.
 *
 * Each check samples its own prefix of the collected file list (see {@link ReadinessConfig}), so
 * different checks may look at different files. Checks return {@link CheckResult}s that are merged
 * in a fixed order, which keeps findings reproducible between runs.
 */
public class CodeComplexityAssessor implements Assessor {

    public static final String CATEGORY_NAME = "CodeComplexity";
    public static final int MAX_SCORE = 25;

    private final ReadinessConfig config;
    private final SourceFileCollector collector;
    private final FunctionExtractor functionExtractor;
    private final ImportCounter importCounter;
    private final DependencyGraphBuilder graphBuilder;
    private final CycleDetector cycleDetector = new CycleDetector();
    private final DepthAnalyzer depthAnalyzer = new DepthAnalyzer();

    public CodeComplexityAssessor(ReadinessConfig config) {
        this(config, LanguageRegistry.defaults());
    }

    public CodeComplexityAssessor(ReadinessConfig config, LanguageRegistry registry) {
        this.config = config;
        this.collector = new SourceFileCollector(config);
        this.functionExtractor = new FunctionExtractor(registry);
        this.importCounter = new ImportCounter(registry);
        this.graphBuilder = new DependencyGraphBuilder(importCounter, config.isVerbose());
    }

    @Override
    public String getCategoryName() {
        return CATEGORY_NAME;
    }

    @Override
    public int getMaxScore() {
        return MAX_SCORE;
    }

    @Override
    public CategoryResult assess(Path repoRoot) {
        System.out.println("Assessing Code Complexity & Dependencies...");

        List<SourceFile> files = collector.collect(repoRoot);
        if (files.isEmpty()) {
            CheckResult none = new CheckResult(0, List.of(), List.of("No code files found to analyze"), List.of());
            return CategoryResult.of(CATEGORY_NAME, MAX_SCORE, none, ComplexityMetrics.empty());
        }

        // 1. Cyclomatic complexity (8 points)
        ComplexitySample complexity = sampleComplexity(sample(files, config.getComplexitySampleSize()));
        CheckResult result = scoreComplexity(complexity);

        // 2. File coupling (6 points)
        CouplingSample coupling = sampleCoupling(sample(files, config.getCouplingSampleSize()));
        result = result.merge(scoreCoupling(coupling));

        // 3. Circular dependencies (6 points) and 4. dependency depth (5 points) share one graph
        DependencyGraph graph = graphBuilder.build(sample(files, config.getGraphSampleSize()));
        List<List<String>> cycles = cycleDetector.findCycles(graph);
        result = result.merge(BandingRuleEngine.circularDependencies(config).evaluate(cycles.size(), cycles.size()));

        Map<String, Integer> depths = depthAnalyzer.computeDepths(graph);
        int maxDepth = depths.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        double avgDepth = depths.values().stream().mapToInt(Integer::intValue).average().orElse(0.0);
        if (!depths.isEmpty()) {
            result = result.merge(BandingRuleEngine.dependencyDepth(config).evaluate(maxDepth, maxDepth));
        }

        ComplexityMetrics metrics = new ComplexityMetrics(
                files.size(),
                complexity.scores().size(),
                complexity.average(),
                complexity.max(),
                coupling.counts().size(),
                coupling.average(),
                coupling.max(),
                graph.size(),
                cycles.size(),
                avgDepth,
                maxDepth);

        return CategoryResult.of(CATEGORY_NAME, MAX_SCORE, result, metrics);
    }

    private record ComplexitySample(List<Integer> scores) {
        double average() {
            return scores.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        }

        int max() {
            return scores.stream().mapToInt(Integer::intValue).max().orElse(0);
        }
    }

    private record CouplingSample(List<Integer> counts) {
        double average() {
            return counts.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        }

        int max() {
            return counts.stream().mapToInt(Integer::intValue).max().orElse(0);
        }
    }

    private ComplexitySample sampleComplexity(List<SourceFile> files) {
        List<Integer> scores = new ArrayList<>();
        for (SourceFile file : files) {
            readOrSkip(file).ifPresent(content -> {
                for (CodeUnit unit : functionExtractor.extract(file, content)) {
                    scores.add(unit.complexity());
                }
            });
        }
        return new ComplexitySample(scores);
    }

    private CheckResult scoreComplexity(ComplexitySample sample) {
        if (sample.scores().isEmpty()) {
            return CheckResult.empty();
        }
        return BandingRuleEngine.cyclomaticComplexity(config).evaluate(sample.average(), sample.average())
                .merge(BandingRuleEngine.complexityOutliers(config).evaluate(sample.max(), sample.max()));
    }

    private CouplingSample sampleCoupling(List<SourceFile> files) {
        List<Integer> counts = new ArrayList<>();
        for (SourceFile file : files) {
            readOrSkip(file).ifPresent(content -> counts.add(importCounter.count(file, content)));
        }
        return new CouplingSample(counts);
    }

    private CheckResult scoreCoupling(CouplingSample sample) {
        if (sample.counts().isEmpty()) {
            return CheckResult.empty();
        }
        return BandingRuleEngine.fileCoupling(config).evaluate(sample.average(), sample.average())
                .merge(BandingRuleEngine.couplingOutliers(config).evaluate(sample.max(), sample.max()));
    }

    private Optional<String> readOrSkip(SourceFile file) {
        try {
            return Optional.of(file.read());
        } catch (FileUnreadableException e) {
            if (config.isVerbose()) {
                System.out.println("  [SKIP] " + e.getMessage());
            }
            return Optional.empty();
        }
    }

    private static List<SourceFile> sample(List<SourceFile> files, int limit) {
        return files.subList(0, Math.min(files.size(), Math.max(0, limit)));
    }
}
