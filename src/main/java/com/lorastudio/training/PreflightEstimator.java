package com.lorastudio.training;

import java.util.Objects;

public class PreflightEstimator {
    private static final double REFERENCE_GB_PER_7B = 4.2;
    private static final double HALF_PRECISION_FACTOR = 0.78;
    private static final double FOUR_BIT_FACTOR = 0.7;

    private final BaseModelRegistry models;
    private final double maxGpuVramGb;
    private final double safetyFactor;

    public PreflightEstimator(BaseModelRegistry models, double maxGpuVramGb, double safetyFactor) {
        this.models = Objects.requireNonNull(models, "models");
        if (maxGpuVramGb <= 0 || safetyFactor <= 0 || safetyFactor > 1.0) {
            throw new IllegalArgumentException("maxGpuVramGb must be positive and safetyFactor in (0, 1]");
        }
        this.maxGpuVramGb = maxGpuVramGb;
        this.safetyFactor = safetyFactor;
    }

    public VramEstimate estimate(String baseModelId, TrainingConfig config) {
        double paramsB = models.parametersBillions(baseModelId);
        double base = REFERENCE_GB_PER_7B * (paramsB / 7.0);
        double seqFactor = config.sequenceLength() / 1024.0;
        double rankFactor = config.loraRank() / 16.0;
        double batchFactor = config.perDeviceBatchSize() * Math.max(config.gradientAccumulationSteps(), 1) / 8.0;
        double precisionFactor = config.halfPrecision() ? HALF_PRECISION_FACTOR : 1.0;
        double quantFactor = config.use4bit() ? FOUR_BIT_FACTOR : 1.0;

        double estimate = base * seqFactor * (0.7 + 0.3 * rankFactor) * (0.6 + 0.4 * batchFactor)
                * precisionFactor * quantFactor;
        double safeLimit = maxGpuVramGb * safetyFactor;
        boolean fits = estimate <= safeLimit;
        String recommendation = fits
                ? "Configuration fits within the GPU budget."
                : "Reduce sequence length or LoRA rank, lower the batch size, or enable 4-bit loading.";
        return new VramEstimate(baseModelId, round(estimate), round(safeLimit), fits, recommendation);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
