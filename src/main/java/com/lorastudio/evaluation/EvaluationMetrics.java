package com.lorastudio.evaluation;

public record EvaluationMetrics(
        double exactMatch,
        double fuzzyMatch,
        double meanFuzzyRatio,
        double semanticSimilarity,
        double refusalAccuracy,
        double refusalPrecision,
        double refusalRecall,
        double unsupportedClaimRate,
        long latencyMs,
        double tokensPerSecond,
        Double regressionDelta,
        boolean regressionFlagged,
        int examples) {
}
