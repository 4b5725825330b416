package com.lorastudio.training;

import java.nio.file.Path;

import com.lorastudio.dataset.DatasetVersion;

public record ExecutionRequest(
        String runId,
        String baseModelId,
        TrainingConfig config,
        DatasetVersion dataset,
        Path runDirectory) {
}
