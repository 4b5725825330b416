package com.lorastudio.evaluation;

public record EvaluationPolicy(
        double minSemanticSimilarity,
        double maxUnsupportedClaimRate,
        double minRefusalAccuracy,
        double regressionTolerance,
        double fuzzyMatchThreshold,
        int maxFailureExamples) {

    public EvaluationPolicy {
        if (regressionTolerance < 0) {
            throw new IllegalArgumentException("regressionTolerance must not be negative");
        }
        if (fuzzyMatchThreshold <= 0 || fuzzyMatchThreshold > 1.0) {
            throw new IllegalArgumentException("fuzzyMatchThreshold must be in (0, 1]");
        }
        if (maxFailureExamples < 0) {
            throw new IllegalArgumentException("maxFailureExamples must not be negative");
        }
    }

    public static EvaluationPolicy defaults() {
        return new EvaluationPolicy(0.72, 0.12, 0.8, 0.05, 0.85, 20);
    }
}
