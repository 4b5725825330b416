package com.lorastudio.training;

public record VramEstimate(
        String baseModelId,
        double estimatedGb,
        double safeLimitGb,
        boolean willFit,
        String recommendation) {
}
