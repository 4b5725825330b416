package com.lorastudio.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StorageConfig storage = new StorageConfig();
    private PreflightConfig preflight = new PreflightConfig();
    private TrainingExecutionConfig training = new TrainingExecutionConfig();
    private WorkerConfig worker = new WorkerConfig();
    private EvaluationConfig evaluation = new EvaluationConfig();
    private InferenceConfig inference = new InferenceConfig();
    private QuotaConfig quota = new QuotaConfig();
    private Map<String, ModelConfig> models = defaultModels();

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public PreflightConfig getPreflight() {
        return preflight;
    }

    public void setPreflight(PreflightConfig preflight) {
        this.preflight = preflight == null ? new PreflightConfig() : preflight;
    }

    public TrainingExecutionConfig getTraining() {
        return training;
    }

    public void setTraining(TrainingExecutionConfig training) {
        this.training = training == null ? new TrainingExecutionConfig() : training;
    }

    public WorkerConfig getWorker() {
        return worker;
    }

    public void setWorker(WorkerConfig worker) {
        this.worker = worker == null ? new WorkerConfig() : worker;
    }

    public EvaluationConfig getEvaluation() {
        return evaluation;
    }

    public void setEvaluation(EvaluationConfig evaluation) {
        this.evaluation = evaluation == null ? new EvaluationConfig() : evaluation;
    }

    public InferenceConfig getInference() {
        return inference;
    }

    public void setInference(InferenceConfig inference) {
        this.inference = inference == null ? new InferenceConfig() : inference;
    }

    public QuotaConfig getQuota() {
        return quota;
    }

    public void setQuota(QuotaConfig quota) {
        this.quota = quota == null ? new QuotaConfig() : quota;
    }

    public Map<String, ModelConfig> getModels() {
        return models;
    }

    public void setModels(Map<String, ModelConfig> models) {
        this.models = models == null || models.isEmpty() ? defaultModels() : new LinkedHashMap<>(models);
    }

    static Map<String, ModelConfig> defaultModels() {
        Map<String, ModelConfig> defaults = new LinkedHashMap<>();
        defaults.put("mistralai/Mistral-7B-Instruct-v0.3", ModelConfig.approved("Apache-2.0", 7.2));
        defaults.put("meta-llama/Llama-3.1-8B-Instruct", ModelConfig.approved("Llama 3.1 Community License", 8.0));
        defaults.put("Qwen/Qwen2.5-7B-Instruct", ModelConfig.approved("Apache-2.0", 7.6));
        return defaults;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String artifactsPath = ".lorastudio/artifacts";
        private String runRegistryPath = ".lorastudio/runs.json";
        private String runEventLogPath = ".lorastudio/run-events.jsonl";
        private String reportRegistryPath = ".lorastudio/evaluation-reports.json";
        private String deploymentRegistryPath = ".lorastudio/deployments.json";
        private String auditLogPath = ".lorastudio/audit.jsonl";
        private String quotaUsagePath = ".lorastudio/quota-usage.json";
        private String datasetCatalogPath = ".lorastudio/datasets.json";

        public String getArtifactsPath() {
            return artifactsPath;
        }

        public void setArtifactsPath(String artifactsPath) {
            this.artifactsPath = artifactsPath;
        }

        public String getRunRegistryPath() {
            return runRegistryPath;
        }

        public void setRunRegistryPath(String runRegistryPath) {
            this.runRegistryPath = runRegistryPath;
        }

        public String getRunEventLogPath() {
            return runEventLogPath;
        }

        public void setRunEventLogPath(String runEventLogPath) {
            this.runEventLogPath = runEventLogPath;
        }

        public String getReportRegistryPath() {
            return reportRegistryPath;
        }

        public void setReportRegistryPath(String reportRegistryPath) {
            this.reportRegistryPath = reportRegistryPath;
        }

        public String getDeploymentRegistryPath() {
            return deploymentRegistryPath;
        }

        public void setDeploymentRegistryPath(String deploymentRegistryPath) {
            this.deploymentRegistryPath = deploymentRegistryPath;
        }

        public String getAuditLogPath() {
            return auditLogPath;
        }

        public void setAuditLogPath(String auditLogPath) {
            this.auditLogPath = auditLogPath;
        }

        public String getQuotaUsagePath() {
            return quotaUsagePath;
        }

        public void setQuotaUsagePath(String quotaUsagePath) {
            this.quotaUsagePath = quotaUsagePath;
        }

        public String getDatasetCatalogPath() {
            return datasetCatalogPath;
        }

        public void setDatasetCatalogPath(String datasetCatalogPath) {
            this.datasetCatalogPath = datasetCatalogPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PreflightConfig {
        private double maxGpuVramGb = 8.0;
        private double vramSafetyFactor = 0.85;

        public double getMaxGpuVramGb() {
            return maxGpuVramGb;
        }

        public void setMaxGpuVramGb(double maxGpuVramGb) {
            this.maxGpuVramGb = maxGpuVramGb;
        }

        public double getVramSafetyFactor() {
            return vramSafetyFactor;
        }

        public void setVramSafetyFactor(double vramSafetyFactor) {
            this.vramSafetyFactor = vramSafetyFactor;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TrainingExecutionConfig {
        private String backend = "simulator";
        private String commandTemplate = "";
        private long timeoutMs = 3_600_000L;
        private int maxRetries = 2;
        private long retryBackoffMs = 2000L;
        private int simulatedSteps = 100;
        private long simulatedStepDelayMs = 2L;

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getCommandTemplate() {
            return commandTemplate;
        }

        public void setCommandTemplate(String commandTemplate) {
            this.commandTemplate = commandTemplate;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public int getSimulatedSteps() {
            return simulatedSteps;
        }

        public void setSimulatedSteps(int simulatedSteps) {
            this.simulatedSteps = simulatedSteps;
        }

        public long getSimulatedStepDelayMs() {
            return simulatedStepDelayMs;
        }

        public void setSimulatedStepDelayMs(long simulatedStepDelayMs) {
            this.simulatedStepDelayMs = simulatedStepDelayMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WorkerConfig {
        private int threads = 1;
        private long pollIntervalMs = 2000L;
        private int maxRunsPerCycle = 3;
        private int maxCycles = 0;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getMaxRunsPerCycle() {
            return maxRunsPerCycle;
        }

        public void setMaxRunsPerCycle(int maxRunsPerCycle) {
            this.maxRunsPerCycle = maxRunsPerCycle;
        }

        public int getMaxCycles() {
            return maxCycles;
        }

        public void setMaxCycles(int maxCycles) {
            this.maxCycles = maxCycles;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EvaluationConfig {
        private double minSemanticSimilarity = 0.72;
        private double maxUnsupportedClaimRate = 0.12;
        private double minRefusalAccuracy = 0.8;
        private double regressionTolerance = 0.05;
        private double fuzzyMatchThreshold = 0.85;
        private int maxFailureExamples = 20;

        public double getMinSemanticSimilarity() {
            return minSemanticSimilarity;
        }

        public void setMinSemanticSimilarity(double minSemanticSimilarity) {
            this.minSemanticSimilarity = minSemanticSimilarity;
        }

        public double getMaxUnsupportedClaimRate() {
            return maxUnsupportedClaimRate;
        }

        public void setMaxUnsupportedClaimRate(double maxUnsupportedClaimRate) {
            this.maxUnsupportedClaimRate = maxUnsupportedClaimRate;
        }

        public double getMinRefusalAccuracy() {
            return minRefusalAccuracy;
        }

        public void setMinRefusalAccuracy(double minRefusalAccuracy) {
            this.minRefusalAccuracy = minRefusalAccuracy;
        }

        public double getRegressionTolerance() {
            return regressionTolerance;
        }

        public void setRegressionTolerance(double regressionTolerance) {
            this.regressionTolerance = regressionTolerance;
        }

        public double getFuzzyMatchThreshold() {
            return fuzzyMatchThreshold;
        }

        public void setFuzzyMatchThreshold(double fuzzyMatchThreshold) {
            this.fuzzyMatchThreshold = fuzzyMatchThreshold;
        }

        public int getMaxFailureExamples() {
            return maxFailureExamples;
        }

        public void setMaxFailureExamples(int maxFailureExamples) {
            this.maxFailureExamples = maxFailureExamples;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InferenceConfig {
        private String backend = "template";
        private String ollamaBaseUrl = "http://localhost:11434";
        private String ollamaChatModel = "llama3.1:8b";
        private long timeoutMs = 45_000L;
        private int groundingTopK = 3;
        private boolean requireGrounding = true;

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getOllamaBaseUrl() {
            return ollamaBaseUrl;
        }

        public void setOllamaBaseUrl(String ollamaBaseUrl) {
            this.ollamaBaseUrl = ollamaBaseUrl;
        }

        public String getOllamaChatModel() {
            return ollamaChatModel;
        }

        public void setOllamaChatModel(String ollamaChatModel) {
            this.ollamaChatModel = ollamaChatModel;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getGroundingTopK() {
            return groundingTopK;
        }

        public void setGroundingTopK(int groundingTopK) {
            this.groundingTopK = groundingTopK;
        }

        public boolean isRequireGrounding() {
            return requireGrounding;
        }

        public void setRequireGrounding(boolean requireGrounding) {
            this.requireGrounding = requireGrounding;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QuotaConfig {
        private String defaultPlan = "STARTER";

        public String getDefaultPlan() {
            return defaultPlan;
        }

        public void setDefaultPlan(String defaultPlan) {
            this.defaultPlan = defaultPlan;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelConfig {
        private String license = "";
        private double parametersBillions = 7.0;
        private boolean approved = false;

        static ModelConfig approved(String license, double parametersBillions) {
            ModelConfig model = new ModelConfig();
            model.setLicense(license);
            model.setParametersBillions(parametersBillions);
            model.setApproved(true);
            return model;
        }

        public String getLicense() {
            return license;
        }

        public void setLicense(String license) {
            this.license = license;
        }

        public double getParametersBillions() {
            return parametersBillions;
        }

        public void setParametersBillions(double parametersBillions) {
            this.parametersBillions = parametersBillions;
        }

        public boolean isApproved() {
            return approved;
        }

        public void setApproved(boolean approved) {
            this.approved = approved;
        }
    }
}
