package com.lorastudio.evaluation;

import java.util.Optional;

@FunctionalInterface
public interface PriorReportLookup {
    Optional<EvaluationReport> priorActiveReport(String projectId, String excludingRunId);
}
