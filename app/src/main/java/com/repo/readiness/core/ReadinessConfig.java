package com.repo.readiness.core;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Configuration for the readiness assessment.
 * Loaded from readiness.yaml in the analyzed repository root or uses the built-in defaults.
 */
public class ReadinessConfig {

    public static final String CONFIG_FILE_NAME = "readiness.yaml";

    /**
     * Upper bound for graph_files. Cycle and depth analysis recurse once per node on a chain.
     */
    public static final int MAX_GRAPH_SAMPLE_SIZE = 500;

    // Sample sizes (files analyzed per check)
    private int complexitySampleSize = 20;
    private int couplingSampleSize = 30;
    private int graphSampleSize = 50;

    // Cyclomatic complexity bands (average per unit)
    private int complexityLow = 5;
    private int complexityMid = 10;
    private int complexityHigh = 15;
    private int complexityVeryHigh = 20;

    // Coupling bands (average imports per file)
    private int couplingLow = 5;
    private int couplingMid = 10;
    private int couplingHigh = 15;
    private int couplingVeryHigh = 20;

    // Circular dependency bands
    private int cyclesModerate = 2;

    // Dependency depth bands (max edges on a chain)
    private int depthShallow = 3;
    private int depthModerate = 5;
    private int depthDeep = 8;

    private List<String> extensions = List.of(
            ".cs", ".js", ".ts", ".tsx", ".jsx", ".py", ".java", ".go", ".rs", ".cpp", ".c", ".h");

    // Directory names never descended into
    private Set<String> exclusions = Set.of(
            "node_modules", ".git", "bin", "obj", "dist", "build");

    private boolean verbose = false;

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static ReadinessConfig load(Path repoRoot) {
        ReadinessConfig config = new ReadinessConfig();
        Path configFile = repoRoot.resolve(CONFIG_FILE_NAME);

        if (Files.isRegularFile(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Map<String, Object> data = yaml.load(is);
                if (data != null) {
                    config.parseYaml(data);
                }
                System.out.println("Loaded configuration from: " + configFile);
            } catch (IOException | RuntimeException e) {
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
                return new ReadinessConfig();
            }
        }
        return config;
    }

    /**
     * Default configuration.
     */
    public static ReadinessConfig defaults() {
        return new ReadinessConfig();
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<String, Object> data) {
        if (data.containsKey("sampling")) {
            Map<String, Object> sampling = (Map<String, Object>) data.get("sampling");
            complexitySampleSize = getInt(sampling, "complexity_files", complexitySampleSize);
            couplingSampleSize = getInt(sampling, "coupling_files", couplingSampleSize);
            graphSampleSize = Math.min(getInt(sampling, "graph_files", graphSampleSize), MAX_GRAPH_SAMPLE_SIZE);
        }

        if (data.containsKey("thresholds")) {
            Map<String, Object> thresholds = (Map<String, Object>) data.get("thresholds");

            if (thresholds.containsKey("complexity")) {
                Map<String, Object> cc = (Map<String, Object>) thresholds.get("complexity");
                complexityLow = getInt(cc, "low", complexityLow);
                complexityMid = getInt(cc, "mid", complexityMid);
                complexityHigh = getInt(cc, "high", complexityHigh);
                complexityVeryHigh = getInt(cc, "very_high", complexityVeryHigh);
            }
            if (thresholds.containsKey("coupling")) {
                Map<String, Object> cp = (Map<String, Object>) thresholds.get("coupling");
                couplingLow = getInt(cp, "low", couplingLow);
                couplingMid = getInt(cp, "mid", couplingMid);
                couplingHigh = getInt(cp, "high", couplingHigh);
                couplingVeryHigh = getInt(cp, "very_high", couplingVeryHigh);
            }
            if (thresholds.containsKey("cycles")) {
                Map<String, Object> cy = (Map<String, Object>) thresholds.get("cycles");
                cyclesModerate = getInt(cy, "moderate", cyclesModerate);
            }
            if (thresholds.containsKey("depth")) {
                Map<String, Object> dp = (Map<String, Object>) thresholds.get("depth");
                depthShallow = getInt(dp, "shallow", depthShallow);
                depthModerate = getInt(dp, "moderate", depthModerate);
                depthDeep = getInt(dp, "deep", depthDeep);
            }
        }

        if (data.containsKey("extensions")) {
            List<String> extList = (List<String>) data.get("extensions");
            if (extList != null && !extList.isEmpty()) {
                extensions = extList.stream()
                        .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                        .map(ext -> ext.toLowerCase(Locale.ROOT))
                        .distinct()
                        .toList();
            }
        }

        if (data.containsKey("exclusions")) {
            List<String> excList = (List<String>) data.get("exclusions");
            if (excList != null && !excList.isEmpty()) {
                exclusions = new HashSet<>(excList);
            }
        }

        verbose = getBool(data, "verbose", verbose);
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private boolean getBool(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean)
            return (Boolean) val;
        return defaultVal;
    }

    // === Getters ===

    // Sampling
    public int getComplexitySampleSize() {
        return complexitySampleSize;
    }

    public int getCouplingSampleSize() {
        return couplingSampleSize;
    }

    public int getGraphSampleSize() {
        return graphSampleSize;
    }

    // Complexity
    public int getComplexityLow() {
        return complexityLow;
    }

    public int getComplexityMid() {
        return complexityMid;
    }

    public int getComplexityHigh() {
        return complexityHigh;
    }

    public int getComplexityVeryHigh() {
        return complexityVeryHigh;
    }

    // Coupling
    public int getCouplingLow() {
        return couplingLow;
    }

    public int getCouplingMid() {
        return couplingMid;
    }

    public int getCouplingHigh() {
        return couplingHigh;
    }

    public int getCouplingVeryHigh() {
        return couplingVeryHigh;
    }

    // Cycles and depth
    public int getCyclesModerate() {
        return cyclesModerate;
    }

    public int getDepthShallow() {
        return depthShallow;
    }

    public int getDepthModerate() {
        return depthModerate;
    }

    public int getDepthDeep() {
        return depthDeep;
    }

    // Collection
    public List<String> getExtensions() {
        return extensions;
    }

    public Set<String> getExclusions() {
        return exclusions;
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * True if the directory name is on the exclusion list.
     */
    public boolean isExcludedDirectory(String directoryName) {
        return exclusions.contains(directoryName);
    }

    public ReadinessConfig withVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }
}
