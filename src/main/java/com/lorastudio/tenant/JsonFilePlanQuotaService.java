package com.lorastudio.tenant;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lorastudio.store.JsonFileStore;

public class JsonFilePlanQuotaService extends PlanQuotaService {
    private static final TypeReference<Map<String, Integer>> USAGE_TYPE = new TypeReference<>() {
    };

    private final JsonFileStore<Map<String, Integer>> store;

    public JsonFilePlanQuotaService(Path usagePath, PlanTier defaultPlan) {
        this(usagePath, defaultPlan, Clock.systemUTC());
    }

    JsonFilePlanQuotaService(Path usagePath, PlanTier defaultPlan, Clock clock) {
        super(defaultPlan, clock);
        this.store = new JsonFileStore<>(Objects.requireNonNull(usagePath, "usagePath"), USAGE_TYPE,
                TreeMap::new, JsonMapper.builder().build());
    }

    @Override
    protected int usage(String key) {
        return store.read().getOrDefault(key, 0);
    }

    @Override
    protected boolean reserve(String key, int amount, int limit) {
        boolean[] reserved = {false};
        store.update(counters -> {
            int used = counters.getOrDefault(key, 0);
            if (used + amount > limit) {
                return counters;
            }
            Map<String, Integer> next = new TreeMap<>(counters);
            next.put(key, used + amount);
            reserved[0] = true;
            return next;
        });
        return reserved[0];
    }
}
