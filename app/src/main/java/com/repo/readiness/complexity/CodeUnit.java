package com.repo.readiness.complexity;

import com.repo.readiness.core.SourceFile;

/**
 * A function or method found by the extractor: its owning file, where its signature starts,
 * and a copy of its text from the signature through the end of its body.
 */
public record CodeUnit(SourceFile source, int offset, String text) {

    /**
     * Cyclomatic complexity of this unit's text.
     */
    public int complexity() {
        return ComplexityCalculator.calculate(text);
    }
}
