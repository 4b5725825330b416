package com.lorastudio.runtime;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lorastudio.audit.AuditLog;
import com.lorastudio.dataset.JsonDatasetCatalog;
import com.lorastudio.deployment.DeploymentRouter;
import com.lorastudio.deployment.GroundingRetriever;
import com.lorastudio.deployment.InferenceBackend;
import com.lorastudio.deployment.JsonFileDeploymentRegistry;
import com.lorastudio.deployment.OllamaInferenceBackend;
import com.lorastudio.deployment.TemplateInferenceBackend;
import com.lorastudio.evaluation.EvaluationEngine;
import com.lorastudio.evaluation.EvaluationPolicy;
import com.lorastudio.evaluation.JsonFileEvaluationReportRepository;
import com.lorastudio.evaluation.ReferenceResponsePredictor;
import com.lorastudio.tenant.JsonFilePlanQuotaService;
import com.lorastudio.tenant.PlanQuotaService;
import com.lorastudio.tenant.PlanTier;
import com.lorastudio.training.BaseModel;
import com.lorastudio.training.BaseModelRegistry;
import com.lorastudio.training.DeploymentPackager;
import com.lorastudio.training.ExecutionBackend;
import com.lorastudio.training.ExecutionLimits;
import com.lorastudio.training.ExternalProcessExecutionBackend;
import com.lorastudio.training.JsonFileRunRepository;
import com.lorastudio.training.PreflightEstimator;
import com.lorastudio.training.SimulatedExecutionBackend;
import com.lorastudio.training.TrainingOrchestrator;
import com.lorastudio.training.TrainingWorkerPool;

import okhttp3.OkHttpClient;

public final class PipelineComponents {
    private static final Logger log = LoggerFactory.getLogger(PipelineComponents.class);

    private final AppConfig config;
    private final JsonDatasetCatalog datasets;
    private final PlanQuotaService quota;
    private final AuditLog audit;
    private final TrainingOrchestrator orchestrator;
    private final DeploymentRouter router;

    private PipelineComponents(
            AppConfig config,
            JsonDatasetCatalog datasets,
            PlanQuotaService quota,
            AuditLog audit,
            TrainingOrchestrator orchestrator,
            DeploymentRouter router) {
        this.config = config;
        this.datasets = datasets;
        this.quota = quota;
        this.audit = audit;
        this.orchestrator = orchestrator;
        this.router = router;
    }

    public static PipelineComponents fromConfig(AppConfig config) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(config.getInference().getTimeoutMs()))
                .build();
        return fromConfig(config, httpClient);
    }

    static PipelineComponents fromConfig(AppConfig config, OkHttpClient httpClient) {
        AppConfig.StorageConfig storage = config.getStorage();
        AuditLog audit = new AuditLog(Path.of(storage.getAuditLogPath()));
        JsonDatasetCatalog datasets = new JsonDatasetCatalog(Path.of(storage.getDatasetCatalogPath()));
        PlanQuotaService quota = new JsonFilePlanQuotaService(
                Path.of(storage.getQuotaUsagePath()), parsePlan(config.getQuota().getDefaultPlan()));
        JsonFileRunRepository runs = new JsonFileRunRepository(
                Path.of(storage.getRunRegistryPath()),
                Path.of(storage.getRunEventLogPath()));
        JsonFileEvaluationReportRepository reports = new JsonFileEvaluationReportRepository(
                Path.of(storage.getReportRegistryPath()));

        AppConfig.InferenceConfig inference = config.getInference();
        DeploymentRouter router = new DeploymentRouter(
                new JsonFileDeploymentRegistry(Path.of(storage.getDeploymentRegistryPath())),
                runs,
                reports,
                new GroundingRetriever(inference.getGroundingTopK()),
                selectInferenceBackend(inference, httpClient),
                audit,
                inference.getTimeoutMs(),
                inference.isRequireGrounding());

        BaseModelRegistry models = baseModels(config);
        AppConfig.EvaluationConfig evaluation = config.getEvaluation();
        EvaluationPolicy policy = new EvaluationPolicy(
                evaluation.getMinSemanticSimilarity(),
                evaluation.getMaxUnsupportedClaimRate(),
                evaluation.getMinRefusalAccuracy(),
                evaluation.getRegressionTolerance(),
                evaluation.getFuzzyMatchThreshold(),
                evaluation.getMaxFailureExamples());

        Map<String, Object> inferenceSettings = new LinkedHashMap<>();
        inferenceSettings.put("groundingTopK", inference.getGroundingTopK());
        inferenceSettings.put("requireGrounding", inference.isRequireGrounding());
        inferenceSettings.put("timeoutMs", inference.getTimeoutMs());

        AppConfig.TrainingExecutionConfig training = config.getTraining();
        TrainingOrchestrator orchestrator = new TrainingOrchestrator(
                runs,
                datasets,
                models,
                new PreflightEstimator(models, config.getPreflight().getMaxGpuVramGb(),
                        config.getPreflight().getVramSafetyFactor()),
                selectExecutionBackend(training),
                new EvaluationEngine(policy, new ReferenceResponsePredictor(), reports),
                router,
                new DeploymentPackager(inferenceSettings),
                quota,
                audit,
                Path.of(storage.getArtifactsPath()),
                new ExecutionLimits(training.getTimeoutMs(), training.getMaxRetries(), training.getRetryBackoffMs()));

        log.info("pipeline.ready trainingBackend={} inferenceBackend={} models={}",
                training.getBackend(), inference.getBackend(), models.all().size());
        return new PipelineComponents(config, datasets, quota, audit, orchestrator, router);
    }

    static ExecutionBackend selectExecutionBackend(AppConfig.TrainingExecutionConfig training) {
        String backend = training.getBackend() == null ? "" : training.getBackend().toLowerCase(Locale.ROOT);
        return switch (backend) {
            case "simulator" -> new SimulatedExecutionBackend(training.getSimulatedSteps(), training.getSimulatedStepDelayMs());
            case "command" -> new ExternalProcessExecutionBackend(training.getCommandTemplate());
            default -> throw new IllegalArgumentException("Unknown training.backend: " + training.getBackend());
        };
    }

    static InferenceBackend selectInferenceBackend(AppConfig.InferenceConfig inference, OkHttpClient httpClient) {
        String backend = inference.getBackend() == null ? "" : inference.getBackend().toLowerCase(Locale.ROOT);
        return switch (backend) {
            case "template" -> new TemplateInferenceBackend();
            case "ollama" -> new OllamaInferenceBackend(httpClient, inference.getOllamaBaseUrl(), inference.getOllamaChatModel());
            default -> throw new IllegalArgumentException("Unknown inference.backend: " + inference.getBackend());
        };
    }

    static BaseModelRegistry baseModels(AppConfig config) {
        List<BaseModel> models = new ArrayList<>();
        config.getModels().forEach((id, model) -> models.add(
                new BaseModel(id, model.getLicense(), model.getParametersBillions(), model.isApproved())));
        return new BaseModelRegistry(models);
    }

    private static PlanTier parsePlan(String plan) {
        try {
            return PlanTier.valueOf(plan.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown quota.defaultPlan: " + plan, e);
        }
    }

    public TrainingWorkerPool workerPool() {
        AppConfig.WorkerConfig worker = config.getWorker();
        return new TrainingWorkerPool(orchestrator, worker.getThreads(), worker.getPollIntervalMs(),
                worker.getMaxRunsPerCycle(), worker.getMaxCycles());
    }

    public AppConfig config() {
        return config;
    }

    public JsonDatasetCatalog datasets() {
        return datasets;
    }

    public PlanQuotaService quota() {
        return quota;
    }

    public AuditLog audit() {
        return audit;
    }

    public TrainingOrchestrator orchestrator() {
        return orchestrator;
    }

    public DeploymentRouter router() {
        return router;
    }
}
