package com.lorastudio.deployment;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

public class DeploymentRegistry {
    private final Map<String, AtomicReference<ProjectDeployments>> projects = new ConcurrentHashMap<>();

    public ProjectDeployments current(String projectId) {
        return reference(projectId).get();
    }

    /**
     * Applies {@code change} to the latest state and publishes the result, retrying if another writer got
     * there first. {@code change} must be free of side effects; exceptions it throws abort the swap.
     */
    public ProjectDeployments swap(String projectId, UnaryOperator<ProjectDeployments> change) {
        AtomicReference<ProjectDeployments> ref = reference(projectId);
        while (true) {
            ProjectDeployments before = ref.get();
            ProjectDeployments after = change.apply(before);
            if (ref.compareAndSet(before, after)) {
                return after;
            }
        }
    }

    private AtomicReference<ProjectDeployments> reference(String projectId) {
        return projects.computeIfAbsent(projectId, id -> new AtomicReference<>(ProjectDeployments.empty()));
    }
}
