package com.lorastudio.dataset;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DatasetVersion(
        String id,
        String tenantId,
        String projectId,
        String name,
        DatasetStatus status,
        String trainPath,
        String valPath,
        String testPath,
        String goldPath,
        Map<String, Object> stats) {

    public DatasetVersion {
        status = status == null ? DatasetStatus.BUILDING : status;
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }
}
