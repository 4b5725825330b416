package com.lorastudio.deployment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

// at most one ACTIVE entry, always the one named by activeDeploymentId
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectDeployments(List<Deployment> deployments, String activeDeploymentId) {
    public ProjectDeployments {
        deployments = deployments == null ? List.of() : List.copyOf(deployments);
    }

    public static ProjectDeployments empty() {
        return new ProjectDeployments(List.of(), null);
    }

    @JsonIgnore
    public Optional<Deployment> active() {
        if (activeDeploymentId == null) {
            return Optional.empty();
        }
        return deployments.stream().filter(d -> d.id().equals(activeDeploymentId)).findFirst();
    }

    public boolean hasLabel(String versionLabel) {
        return deployments.stream().anyMatch(d -> d.versionLabel().equals(versionLabel));
    }

    public ProjectDeployments activate(Deployment deployment, Instant now) {
        List<Deployment> next = new ArrayList<>();
        for (Deployment existing : deployments) {
            next.add(existing.status() == DeploymentStatus.ACTIVE ? existing.retire(now) : existing);
        }
        next.add(deployment);
        return new ProjectDeployments(next, deployment.id());
    }

    public Optional<ProjectDeployments> rollback(Instant now) {
        Optional<Deployment> target = deployments.stream()
                .filter(d -> d.status() == DeploymentStatus.RETIRED && d.retiredAt() != null)
                .max(Comparator.comparing(Deployment::retiredAt));
        if (target.isEmpty()) {
            return Optional.empty();
        }
        String targetId = target.get().id();
        List<Deployment> next = new ArrayList<>();
        for (Deployment existing : deployments) {
            if (existing.id().equals(targetId)) {
                next.add(existing.reactivate());
            } else if (existing.status() == DeploymentStatus.ACTIVE) {
                next.add(existing.retire(now));
            } else {
                next.add(existing);
            }
        }
        return Optional.of(new ProjectDeployments(next, targetId));
    }
}
