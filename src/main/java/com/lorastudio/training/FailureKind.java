package com.lorastudio.training;

public enum FailureKind {
    RESOURCE_EXCEEDED,
    STAGING_ERROR,
    BACKEND_ERROR,
    EVALUATION_ERROR,
    PACKAGING_ERROR,
    TIMEOUT,
    INTERNAL_ERROR;

    public String describe(String detail) {
        return name() + ": " + detail;
    }
}
