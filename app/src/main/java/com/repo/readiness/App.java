package com.repo.readiness;

import com.repo.readiness.assess.CodeComplexityAssessor;
import com.repo.readiness.core.CategoryResult;
import com.repo.readiness.core.ComplexityMetrics;
import com.repo.readiness.core.ReadinessConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Console entry point: assesses code complexity for one repository and prints the findings.
 *
 * Usage: java -jar app.jar <repo_path> [--verbose]
 */
public class App {

    public static void main(String[] args) {
        System.out.println("=== Repo Readiness: Code Complexity ===");

        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage();
            System.exit(1);
        }

        if (!Files.isDirectory(cliArgs.repoPath())) {
            System.err.println("Error: Repository path not found: " + cliArgs.repoPath());
            System.exit(1);
        }

        ReadinessConfig config = ReadinessConfig.load(cliArgs.repoPath());
        if (cliArgs.verbose()) {
            config = config.withVerbose(true);
        }
        CategoryResult result = new CodeComplexityAssessor(config).assess(cliArgs.repoPath());
        print(result);
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar app.jar <repo_path> [--verbose]

                Arguments:
                  <repo_path>   Path to the repository to assess (required)
                  --verbose     Report files that were skipped because they could not be read
                """);
    }

    record CliArgs(Path repoPath, boolean verbose) {
    }

    /**
     * @return parsed arguments, or null when no repository path was given
     */
    static CliArgs parseArgs(String[] args) {
        Path repoPath = null;
        boolean verbose = false;

        for (String arg : args) {
            switch (arg) {
                case "--verbose", "-v" -> verbose = true;
                default -> {
                    if (repoPath == null && !arg.startsWith("-"))
                        repoPath = Path.of(arg);
                }
            }
        }

        if (repoPath == null) {
            return null;
        }
        return new CliArgs(repoPath, verbose);
    }

    static void print(CategoryResult result) {
        System.out.printf("%n%s: %d/%d%n", result.categoryName(), result.score(), result.maxScore());

        ComplexityMetrics m = result.metrics();
        System.out.println("\n| %-22s | %-10s |".formatted("Metric", "Value"));
        System.out.println("|" + "-".repeat(24) + "|" + "-".repeat(12) + "|");
        System.out.println("| %-22s | %-10d |".formatted("Files collected", m.filesCollected()));
        System.out.println("| %-22s | %-10d |".formatted("Methods analyzed", m.unitsAnalyzed()));
        System.out.println("| %-22s | %-10.1f |".formatted("Avg complexity", m.averageComplexity()));
        System.out.println("| %-22s | %-10d |".formatted("Max complexity", m.maxComplexity()));
        System.out.println("| %-22s | %-10.1f |".formatted("Avg coupling", m.averageCoupling()));
        System.out.println("| %-22s | %-10d |".formatted("Max coupling", m.maxCoupling()));
        System.out.println("| %-22s | %-10d |".formatted("Cycles", m.cycleCount()));
        System.out.println("| %-22s | %-10d |".formatted("Max dependency depth", m.maxDepth()));

        printSection("Strengths", result.strengths());
        printSection("Weaknesses", result.weaknesses());
        printSection("Recommendations", result.recommendations());
    }

    private static void printSection(String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        System.out.println("\n" + title + ":");
        items.forEach(item -> System.out.println("  - " + item));
    }
}
