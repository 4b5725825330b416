package com.lorastudio.dataset;

import java.util.Optional;

@FunctionalInterface
public interface DatasetCatalog {
    Optional<DatasetVersion> find(String datasetVersionId);
}
