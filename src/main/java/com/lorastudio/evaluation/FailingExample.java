package com.lorastudio.evaluation;

public record FailingExample(
        String exampleId,
        String prompt,
        String expected,
        String predicted,
        double semanticSimilarity,
        String reason) {
}
