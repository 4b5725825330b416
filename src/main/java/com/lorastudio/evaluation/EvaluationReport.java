package com.lorastudio.evaluation;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationReport(
        String id,
        String trainingRunId,
        String projectId,
        Instant createdAt,
        EvaluationMetrics metrics,
        boolean goNoGo,
        List<String> gateFailures,
        List<FailingExample> failingExamples,
        String reportPath) {

    public EvaluationReport {
        gateFailures = gateFailures == null ? List.of() : List.copyOf(gateFailures);
        failingExamples = failingExamples == null ? List.of() : List.copyOf(failingExamples);
    }
}
