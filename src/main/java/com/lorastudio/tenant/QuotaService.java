package com.lorastudio.tenant;

@FunctionalInterface
public interface QuotaService {
    String TRAINING_RUNS = "training_runs";

    /**
     * Reserves {@code amount} units of {@code resource} for the tenant. Returns false, reserving nothing,
     * when the reservation would exceed the tenant's limit.
     */
    boolean checkAndReserve(String tenantId, String resource, int amount);
}
