package com.lorastudio.deployment;

import java.util.List;

public record InferenceResult(
        String deploymentId,
        String versionLabel,
        String text,
        List<String> snippetIds,
        boolean refused,
        String backend,
        long latencyMs) {

    public InferenceResult {
        snippetIds = snippetIds == null ? List.of() : List.copyOf(snippetIds);
    }
}
