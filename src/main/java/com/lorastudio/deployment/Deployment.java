package com.lorastudio.deployment;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Deployment(
        String id,
        String tenantId,
        String projectId,
        String versionLabel,
        String trainingRunId,
        DeploymentStatus status,
        String endpointRef,
        String packagePath,
        Instant createdAt,
        Instant retiredAt) {

    public Deployment retire(Instant at) {
        return new Deployment(id, tenantId, projectId, versionLabel, trainingRunId, DeploymentStatus.RETIRED,
                endpointRef, packagePath, createdAt, at);
    }

    public Deployment reactivate() {
        return new Deployment(id, tenantId, projectId, versionLabel, trainingRunId, DeploymentStatus.ACTIVE,
                endpointRef, packagePath, createdAt, null);
    }
}
