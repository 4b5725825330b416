package com.lorastudio.deployment;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lorastudio.store.JsonFileStore;

public class JsonFileDeploymentRegistry extends DeploymentRegistry {
    private static final TypeReference<Map<String, ProjectDeployments>> REGISTRY_TYPE = new TypeReference<>() {
    };

    private final JsonFileStore<Map<String, ProjectDeployments>> store;

    public JsonFileDeploymentRegistry(Path registryPath) {
        this.store = new JsonFileStore<>(Objects.requireNonNull(registryPath, "registryPath"), REGISTRY_TYPE,
                TreeMap::new, JsonMapper.builder().findAndAddModules().build());
    }

    @Override
    public ProjectDeployments current(String projectId) {
        return store.read().getOrDefault(projectId, ProjectDeployments.empty());
    }

    @Override
    public ProjectDeployments swap(String projectId, UnaryOperator<ProjectDeployments> change) {
        ProjectDeployments[] published = new ProjectDeployments[1];
        store.update(projects -> {
            ProjectDeployments after = change.apply(projects.getOrDefault(projectId, ProjectDeployments.empty()));
            Map<String, ProjectDeployments> next = new TreeMap<>(projects);
            next.put(projectId, after);
            published[0] = after;
            return next;
        });
        return published[0];
    }
}
