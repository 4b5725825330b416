package com.lorastudio.tenant;

import java.util.Objects;

public record Actor(String userId, String tenantId, Role role) {
    public Actor {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(role, "role");
    }

    public void requireTrainingManager(String action) {
        if (!role.canManageTraining()) {
            throw new AccessDeniedException("Role " + role + " may not " + action);
        }
    }

    public void requireTenant(String resourceTenantId) {
        if (!tenantId.equals(resourceTenantId)) {
            throw new AccessDeniedException("Actor " + userId + " does not belong to tenant " + resourceTenantId);
        }
    }
}
