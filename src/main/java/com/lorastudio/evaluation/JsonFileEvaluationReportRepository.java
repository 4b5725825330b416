package com.lorastudio.evaluation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lorastudio.store.JsonFileStore;

public class JsonFileEvaluationReportRepository implements EvaluationReportRepository {
    private static final TypeReference<List<EvaluationReport>> REPORT_LIST = new TypeReference<>() {
    };

    private final JsonFileStore<List<EvaluationReport>> store;

    public JsonFileEvaluationReportRepository(Path registryPath) {
        this.store = new JsonFileStore<>(Objects.requireNonNull(registryPath, "registryPath"), REPORT_LIST,
                List::of, JsonMapper.builder().findAndAddModules().build());
    }

    @Override
    public void save(EvaluationReport report) {
        store.update(reports -> {
            if (reports.stream().anyMatch(existing -> existing.id().equals(report.id()))) {
                throw new IllegalStateException("Evaluation reports are immutable: " + report.id());
            }
            List<EvaluationReport> next = new ArrayList<>(reports);
            next.add(report);
            return next;
        });
    }

    @Override
    public Optional<EvaluationReport> find(String reportId) {
        return store.read().stream().filter(report -> report.id().equals(reportId)).findFirst();
    }

    @Override
    public Optional<EvaluationReport> findByRun(String trainingRunId) {
        return store.read().stream()
                .filter(report -> report.trainingRunId().equals(trainingRunId))
                .max(Comparator.comparing(EvaluationReport::createdAt));
    }
}
