package com.lorastudio.dataset;

public enum DatasetStatus {
    BUILDING,
    READY,
    NEEDS_REVIEW,
    FAILED;

    public boolean isTrainable() {
        return this == READY;
    }
}
