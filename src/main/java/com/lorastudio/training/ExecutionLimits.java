package com.lorastudio.training;

public record ExecutionLimits(long timeoutMs, int maxRetries, long retryBackoffMs) {
    public ExecutionLimits {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (maxRetries < 0 || retryBackoffMs < 0) {
            throw new IllegalArgumentException("maxRetries and retryBackoffMs must not be negative");
        }
    }

    public static ExecutionLimits defaults() {
        return new ExecutionLimits(3_600_000L, 2, 2_000L);
    }
}
