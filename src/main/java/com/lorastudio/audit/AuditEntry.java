package com.lorastudio.audit;

import java.time.Instant;
import java.util.Map;

public record AuditEntry(
        Instant timestamp,
        String tenantId,
        String userId,
        String projectId,
        String action,
        String entityType,
        String entityId,
        Map<String, String> details) {

    public AuditEntry {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
