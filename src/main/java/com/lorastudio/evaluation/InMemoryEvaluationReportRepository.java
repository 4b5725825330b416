package com.lorastudio.evaluation;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEvaluationReportRepository implements EvaluationReportRepository {
    private final Map<String, EvaluationReport> reports = new ConcurrentHashMap<>();

    @Override
    public void save(EvaluationReport report) {
        if (reports.putIfAbsent(report.id(), report) != null) {
            throw new IllegalStateException("Evaluation reports are immutable: " + report.id());
        }
    }

    @Override
    public Optional<EvaluationReport> find(String reportId) {
        return Optional.ofNullable(reports.get(reportId));
    }

    @Override
    public Optional<EvaluationReport> findByRun(String trainingRunId) {
        return reports.values().stream()
                .filter(report -> report.trainingRunId().equals(trainingRunId))
                .max(Comparator.comparing(EvaluationReport::createdAt));
    }
}
