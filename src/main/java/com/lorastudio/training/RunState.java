package com.lorastudio.training;

// FAILED is reachable from every non-terminal state, CANCELLED only before PACKAGING
public enum RunState {
    QUEUED,
    PREFLIGHT,
    STAGING,
    TRAINING,
    EVALUATING,
    PACKAGING,
    READY,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == READY || this == FAILED || this == CANCELLED;
    }

    public boolean isCancellable() {
        return !isTerminal() && this != PACKAGING;
    }

    public RunState next() {
        return switch (this) {
            case QUEUED -> PREFLIGHT;
            case PREFLIGHT -> STAGING;
            case STAGING -> TRAINING;
            case TRAINING -> EVALUATING;
            case EVALUATING -> PACKAGING;
            case PACKAGING -> READY;
            default -> throw new IllegalStateException(this + " has no successor");
        };
    }

    public boolean canTransitionTo(RunState target) {
        if (isTerminal()) {
            return false;
        }
        if (target == FAILED) {
            return true;
        }
        if (target == CANCELLED) {
            return isCancellable();
        }
        return target == next();
    }
}
