package com.lorastudio.training;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TrainingRun(
        String id,
        String tenantId,
        String projectId,
        String datasetVersionId,
        String requestedBy,
        String baseModelId,
        TrainingConfig config,
        RunState state,
        String stateMessage,
        double progress,
        Double vramEstimateGb,
        String checkpointPath,
        String adapterPath,
        String packagePath,
        String evalReportId,
        String errorMessage,
        int retryCount,
        Instant createdAt,
        Instant updatedAt) {

    public TrainingRun {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
        config = config == null ? TrainingConfig.defaults() : config;
    }

    public static TrainingRun queued(
            String id,
            String tenantId,
            String projectId,
            String datasetVersionId,
            String requestedBy,
            String baseModelId,
            TrainingConfig config,
            Instant now) {
        return new TrainingRun(id, tenantId, projectId, datasetVersionId, requestedBy, baseModelId, config,
                RunState.QUEUED, "Queued", 0.0, null, null, null, null, null, null, 0, now, now);
    }

    public TrainingRun withState(RunState newState, String message, Instant now) {
        Builder builder = toBuilder();
        builder.state = newState;
        builder.stateMessage = message;
        builder.updatedAt = now;
        return builder.build();
    }

    public TrainingRun withProgress(double newProgress, Instant now) {
        Builder builder = toBuilder();
        builder.progress = newProgress;
        builder.updatedAt = now;
        return builder.build();
    }

    public TrainingRun withVramEstimate(double estimateGb) {
        Builder builder = toBuilder();
        builder.vramEstimateGb = estimateGb;
        return builder.build();
    }

    public TrainingRun withTrainingArtifacts(String checkpoint, String adapter) {
        Builder builder = toBuilder();
        builder.checkpointPath = checkpoint;
        builder.adapterPath = adapter;
        return builder.build();
    }

    public TrainingRun withEvalReport(String reportId, Instant now) {
        Builder builder = toBuilder();
        builder.evalReportId = reportId;
        builder.updatedAt = now;
        return builder.build();
    }

    public TrainingRun withPackage(String path) {
        Builder builder = toBuilder();
        builder.packagePath = path;
        return builder.build();
    }

    public TrainingRun withRetryCount(int retries, Instant now) {
        Builder builder = toBuilder();
        builder.retryCount = retries;
        builder.updatedAt = now;
        return builder.build();
    }

    public TrainingRun withFailure(String error, Instant now) {
        Builder builder = toBuilder();
        builder.state = RunState.FAILED;
        builder.stateMessage = "Failed";
        builder.errorMessage = error;
        builder.updatedAt = now;
        return builder.build();
    }

    private Builder toBuilder() {
        return new Builder(this);
    }

    private static final class Builder {
        private final String id;
        private final String tenantId;
        private final String projectId;
        private final String datasetVersionId;
        private final String requestedBy;
        private final String baseModelId;
        private final TrainingConfig config;
        private final Instant createdAt;
        private RunState state;
        private String stateMessage;
        private double progress;
        private Double vramEstimateGb;
        private String checkpointPath;
        private String adapterPath;
        private String packagePath;
        private String evalReportId;
        private String errorMessage;
        private int retryCount;
        private Instant updatedAt;

        private Builder(TrainingRun run) {
            this.id = run.id;
            this.tenantId = run.tenantId;
            this.projectId = run.projectId;
            this.datasetVersionId = run.datasetVersionId;
            this.requestedBy = run.requestedBy;
            this.baseModelId = run.baseModelId;
            this.config = run.config;
            this.createdAt = run.createdAt;
            this.state = run.state;
            this.stateMessage = run.stateMessage;
            this.progress = run.progress;
            this.vramEstimateGb = run.vramEstimateGb;
            this.checkpointPath = run.checkpointPath;
            this.adapterPath = run.adapterPath;
            this.packagePath = run.packagePath;
            this.evalReportId = run.evalReportId;
            this.errorMessage = run.errorMessage;
            this.retryCount = run.retryCount;
            this.updatedAt = run.updatedAt;
        }

        private TrainingRun build() {
            return new TrainingRun(id, tenantId, projectId, datasetVersionId, requestedBy, baseModelId, config,
                    state, stateMessage, progress, vramEstimateGb, checkpointPath, adapterPath, packagePath,
                    evalReportId, errorMessage, retryCount, createdAt, updatedAt);
        }
    }
}
