package com.lorastudio.training;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class BaseModelRegistry {
    private final Map<String, BaseModel> models = new LinkedHashMap<>();

    public BaseModelRegistry(Collection<BaseModel> models) {
        for (BaseModel model : models) {
            this.models.put(model.id(), model);
        }
    }

    public Optional<BaseModel> find(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    public boolean isApproved(String modelId) {
        return find(modelId).map(BaseModel::approved).orElse(false);
    }

    public double parametersBillions(String modelId) {
        return find(modelId)
                .map(BaseModel::parametersBillions)
                .orElseThrow(() -> new ValidationException("Unknown base model: " + modelId));
    }

    public Collection<BaseModel> all() {
        return models.values();
    }
}
