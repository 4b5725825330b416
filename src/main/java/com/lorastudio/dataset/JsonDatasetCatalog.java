package com.lorastudio.dataset;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JsonDatasetCatalog implements DatasetCatalog {
    private static final TypeReference<List<DatasetVersion>> LIST_TYPE = new TypeReference<>() {
    };

    private final Path catalogPath;
    private final ObjectMapper objectMapper;

    public JsonDatasetCatalog(Path catalogPath) {
        this.catalogPath = Objects.requireNonNull(catalogPath, "catalogPath");
        this.objectMapper = JsonMapper.builder().findAndAddModules().build();
    }

    @Override
    public synchronized Optional<DatasetVersion> find(String datasetVersionId) {
        return load().stream().filter(d -> d.id().equals(datasetVersionId)).findFirst();
    }

    public synchronized void register(DatasetVersion version) throws IOException {
        List<DatasetVersion> versions = new ArrayList<>(load());
        versions.removeIf(d -> d.id().equals(version.id()));
        versions.add(version);
        if (catalogPath.getParent() != null) {
            Files.createDirectories(catalogPath.getParent());
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(catalogPath.toFile(), versions);
    }

    public synchronized List<DatasetVersion> list() {
        return load();
    }

    private List<DatasetVersion> load() {
        if (!Files.exists(catalogPath)) {
            return List.of();
        }
        try {
            return objectMapper.readValue(catalogPath.toFile(), LIST_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read dataset catalog " + catalogPath, e);
        }
    }
}
