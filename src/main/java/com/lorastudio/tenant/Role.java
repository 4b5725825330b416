package com.lorastudio.tenant;

public enum Role {
    OWNER,
    MANAGER,
    REVIEWER,
    VIEWER;

    public boolean canManageTraining() {
        return this == OWNER || this == MANAGER;
    }
}
