package com.repo.readiness.assess;

import com.repo.readiness.core.CategoryResult;

import java.nio.file.Path;

/**
 * One scored category of the readiness assessment.
 */
public interface Assessor {

    /**
     * Category key used in reports (e.g., "CodeComplexity").
     */
    String getCategoryName();

    /**
     * Upper bound of the category score.
     */
    int getMaxScore();

    /**
     * Assess the repository. Implementations never fail on bad input files; they degrade to
     * fewer findings instead.
     */
    CategoryResult assess(Path repoRoot);
}
