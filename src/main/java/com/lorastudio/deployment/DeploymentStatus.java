package com.lorastudio.deployment;

public enum DeploymentStatus {
    ACTIVE,
    RETIRED
}
