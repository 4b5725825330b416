package com.lorastudio.tenant;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PlanQuotaService implements QuotaService {
    private static final Logger log = LoggerFactory.getLogger(PlanQuotaService.class);

    private final PlanTier defaultPlan;
    private final Clock clock;
    private final Map<String, PlanTier> plans = new ConcurrentHashMap<>();
    private final Map<String, Integer> usage = new ConcurrentHashMap<>();

    public PlanQuotaService(PlanTier defaultPlan) {
        this(defaultPlan, Clock.systemUTC());
    }

    PlanQuotaService(PlanTier defaultPlan, Clock clock) {
        this.defaultPlan = Objects.requireNonNull(defaultPlan, "defaultPlan");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void assignPlan(String tenantId, PlanTier plan) {
        plans.put(tenantId, Objects.requireNonNull(plan, "plan"));
    }

    public PlanTier planFor(String tenantId) {
        return plans.getOrDefault(tenantId, defaultPlan);
    }

    public int used(String tenantId, String resource) {
        return usage(usageKey(tenantId, resource));
    }

    @Override
    public boolean checkAndReserve(String tenantId, String resource, int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        int limit = limitFor(tenantId, resource);
        boolean reserved = reserve(usageKey(tenantId, resource), amount, limit);
        if (!reserved) {
            log.warn("quota.exceeded tenant={} resource={} limit={}", tenantId, resource, limit);
        }
        return reserved;
    }

    protected int usage(String key) {
        return usage.getOrDefault(key, 0);
    }

    protected boolean reserve(String key, int amount, int limit) {
        boolean[] reserved = {false};
        usage.compute(key, (k, current) -> {
            int used = current == null ? 0 : current;
            if (used + amount > limit) {
                return current;
            }
            reserved[0] = true;
            return used + amount;
        });
        return reserved[0];
    }

    private int limitFor(String tenantId, String resource) {
        if (TRAINING_RUNS.equals(resource)) {
            return planFor(tenantId).monthlyTrainingRuns();
        }
        throw new IllegalArgumentException("Unknown quota resource: " + resource);
    }

    private String usageKey(String tenantId, String resource) {
        return tenantId + "|" + resource + "|" + YearMonth.now(clock.withZone(ZoneOffset.UTC));
    }
}
