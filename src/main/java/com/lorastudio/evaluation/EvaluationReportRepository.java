package com.lorastudio.evaluation;

import java.util.Optional;

public interface EvaluationReportRepository {
    void save(EvaluationReport report);

    Optional<EvaluationReport> find(String reportId);

    Optional<EvaluationReport> findByRun(String trainingRunId);
}
