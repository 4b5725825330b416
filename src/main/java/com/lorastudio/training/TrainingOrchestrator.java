package com.lorastudio.training;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lorastudio.audit.AuditEntry;
import com.lorastudio.audit.AuditLog;
import com.lorastudio.dataset.DatasetCatalog;
import com.lorastudio.dataset.DatasetVersion;
import com.lorastudio.dataset.HeldOutExample;
import com.lorastudio.dataset.HeldOutExampleLoader;
import com.lorastudio.evaluation.EvaluationEngine;
import com.lorastudio.evaluation.EvaluationReport;
import com.lorastudio.evaluation.PriorReportLookup;
import com.lorastudio.tenant.Actor;
import com.lorastudio.tenant.QuotaExceededException;
import com.lorastudio.tenant.QuotaService;

public class TrainingOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(TrainingOrchestrator.class);

    private final RunRepository runs;
    private final DatasetCatalog datasets;
    private final BaseModelRegistry models;
    private final PreflightEstimator preflight;
    private final ExecutionBackend backend;
    private final EvaluationEngine evaluation;
    private final PriorReportLookup priorReports;
    private final DeploymentPackager packager;
    private final QuotaService quota;
    private final AuditLog audit;
    private final Path artifactsRoot;
    private final ExecutionLimits limits;
    private final HeldOutExampleLoader heldOutLoader;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public TrainingOrchestrator(
            RunRepository runs,
            DatasetCatalog datasets,
            BaseModelRegistry models,
            PreflightEstimator preflight,
            ExecutionBackend backend,
            EvaluationEngine evaluation,
            PriorReportLookup priorReports,
            DeploymentPackager packager,
            QuotaService quota,
            AuditLog audit,
            Path artifactsRoot,
            ExecutionLimits limits) {
        this(runs, datasets, models, preflight, backend, evaluation, priorReports, packager, quota, audit,
                artifactsRoot, limits, new HeldOutExampleLoader(), Clock.systemUTC());
    }

    TrainingOrchestrator(
            RunRepository runs,
            DatasetCatalog datasets,
            BaseModelRegistry models,
            PreflightEstimator preflight,
            ExecutionBackend backend,
            EvaluationEngine evaluation,
            PriorReportLookup priorReports,
            DeploymentPackager packager,
            QuotaService quota,
            AuditLog audit,
            Path artifactsRoot,
            ExecutionLimits limits,
            HeldOutExampleLoader heldOutLoader,
            Clock clock) {
        this.runs = Objects.requireNonNull(runs, "runs");
        this.datasets = Objects.requireNonNull(datasets, "datasets");
        this.models = Objects.requireNonNull(models, "models");
        this.preflight = Objects.requireNonNull(preflight, "preflight");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.evaluation = Objects.requireNonNull(evaluation, "evaluation");
        this.priorReports = Objects.requireNonNull(priorReports, "priorReports");
        this.packager = Objects.requireNonNull(packager, "packager");
        this.quota = Objects.requireNonNull(quota, "quota");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.artifactsRoot = Objects.requireNonNull(artifactsRoot, "artifactsRoot");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.heldOutLoader = Objects.requireNonNull(heldOutLoader, "heldOutLoader");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.objectMapper = JsonMapper.builder().findAndAddModules().build();
    }

    public TrainingRun submit(
            Actor actor,
            String projectId,
            String datasetVersionId,
            String baseModelId,
            TrainingConfig config,
            boolean dataRightsConfirmed) {
        Objects.requireNonNull(actor, "actor");
        actor.requireTrainingManager("submit training runs");
        if (!dataRightsConfirmed) {
            throw new ValidationException("Data rights must be confirmed before training");
        }
        if (projectId == null || projectId.isBlank()) {
            throw new ValidationException("projectId is required");
        }
        TrainingConfig effectiveConfig = config == null ? TrainingConfig.defaults() : config;
        List<String> problems = effectiveConfig.problems();
        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid training config: " + String.join("; ", problems));
        }
        if (!models.isApproved(baseModelId)) {
            throw new ValidationException("Base model is not approved: " + baseModelId);
        }
        DatasetVersion dataset = datasets.find(datasetVersionId)
                .orElseThrow(() -> new ValidationException("Dataset version not found: " + datasetVersionId));
        if (!actor.tenantId().equals(dataset.tenantId()) || !projectId.equals(dataset.projectId())) {
            throw new ValidationException("Dataset version " + datasetVersionId + " does not belong to project " + projectId);
        }
        if (!dataset.status().isTrainable()) {
            throw new ValidationException("Dataset version is not ready for training (status=" + dataset.status() + ")");
        }
        if (!quota.checkAndReserve(actor.tenantId(), QuotaService.TRAINING_RUNS, 1)) {
            throw new QuotaExceededException("Monthly training run quota exhausted for tenant " + actor.tenantId());
        }

        TrainingRun run = TrainingRun.queued(
                "run-" + UUID.randomUUID(),
                actor.tenantId(),
                projectId,
                datasetVersionId,
                actor.userId(),
                baseModelId,
                effectiveConfig,
                clock.instant());
        runs.insert(run);
        record(run, actor.userId(), AuditLog.TRAINING_RUN_CREATED, Map.of(
                "datasetVersionId", datasetVersionId,
                "baseModelId", baseModelId));
        log.info("run.submitted runId={} tenant={} project={} model={}", run.id(), run.tenantId(), projectId, baseModelId);
        return run;
    }

    public Optional<TrainingRun> claimNext() {
        for (TrainingRun candidate : runs.findByState(RunState.QUEUED)) {
            Optional<TrainingRun> claimed = runs.compareAndSet(candidate.id(), RunState.QUEUED,
                    run -> run.withState(RunState.PREFLIGHT, "Picked by worker", clock.instant()));
            if (claimed.isPresent()) {
                log.info("run.claimed runId={} thread={}", candidate.id(), Thread.currentThread().getName());
                return claimed;
            }
        }
        return Optional.empty();
    }

    public TrainingRun advance(String runId) {
        TrainingRun run = getRun(runId);
        if (run.state() != RunState.PREFLIGHT) {
            throw new InvalidStateTransitionException(runId, run.state(), "be advanced without being claimed");
        }
        try {
            return drive(run);
        } catch (RunStopped stopped) {
            TrainingRun current = getRun(runId);
            log.info("run.advance.stopped runId={} state={}", runId, current.state());
            return current;
        } catch (StageFailure failure) {
            return fail(runId, failure.kind, failure.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(runId, FailureKind.INTERNAL_ERROR, "Worker interrupted");
        } catch (Exception e) {
            log.error("run.advance.unexpected runId={}", runId, e);
            return fail(runId, FailureKind.INTERNAL_ERROR, describe(e));
        }
    }

    public Optional<TrainingRun> processNext() {
        return claimNext().map(run -> advance(run.id()));
    }

    public TrainingRun cancel(Actor actor, String runId) {
        Objects.requireNonNull(actor, "actor");
        TrainingRun run = getRun(runId);
        actor.requireTrainingManager("cancel training runs");
        actor.requireTenant(run.tenantId());
        while (true) {
            if (!run.state().isCancellable()) {
                throw new InvalidStateTransitionException(runId, run.state(), "be cancelled");
            }
            Optional<TrainingRun> cancelled = runs.compareAndSet(runId, run.state(),
                    current -> current.withState(RunState.CANCELLED, "Cancelled by " + actor.userId(), clock.instant()),
                    Map.of("cancelledBy", actor.userId()));
            if (cancelled.isPresent()) {
                record(cancelled.get(), actor.userId(), AuditLog.TRAINING_RUN_CANCELLED,
                        Map.of("fromState", run.state().name()));
                log.info("run.cancelled runId={} from={} by={}", runId, run.state(), actor.userId());
                return cancelled.get();
            }
            run = getRun(runId);
        }
    }

    public VramEstimate estimate(String baseModelId, TrainingConfig config) {
        TrainingConfig effectiveConfig = config == null ? TrainingConfig.defaults() : config;
        List<String> problems = effectiveConfig.problems();
        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid training config: " + String.join("; ", problems));
        }
        return preflight.estimate(baseModelId, effectiveConfig);
    }

    public TrainingRun getRun(String runId) {
        return runs.find(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    public TrainingRun getRun(Actor actor, String runId) {
        TrainingRun run = getRun(runId);
        actor.requireTenant(run.tenantId());
        return run;
    }

    public List<TrainingRun> listRuns(Actor actor, String projectId) {
        return runs.findByProject(projectId).stream()
                .filter(run -> run.tenantId().equals(actor.tenantId()))
                .toList();
    }

    public List<RunEvent> events(Actor actor, String runId) {
        getRun(actor, runId);
        return runs.events(runId);
    }

    public Path runDirectory(TrainingRun run) {
        return artifactsRoot.resolve(run.tenantId()).resolve(run.projectId()).resolve("runs").resolve(run.id());
    }

    private TrainingRun drive(TrainingRun claimed) throws Exception {
        String runId = claimed.id();
        Path runDir = runDirectory(claimed);

        VramEstimate estimate = preflight.estimate(claimed.baseModelId(), claimed.config());
        TrainingRun run = update(runId, RunState.PREFLIGHT, current -> current.withVramEstimate(estimate.estimatedGb()));
        if (!estimate.willFit()) {
            throw new StageFailure(FailureKind.RESOURCE_EXCEEDED, String.format(Locale.ROOT,
                    "estimated %.2f GB exceeds safe limit %.2f GB. %s",
                    estimate.estimatedGb(), estimate.safeLimitGb(), estimate.recommendation()));
        }
        run = moveTo(run, RunState.STAGING, "Staging dataset", UnaryOperator.identity());

        DatasetVersion dataset = stage(run, runDir);
        run = moveTo(run, RunState.TRAINING, "Training adapter", current -> current.withProgress(0.0, clock.instant()));

        ExecutionBackend.Result result = train(run, dataset, runDir);
        if (result.cancelled()) {
            throw new RunStopped();
        }
        Path checkpoint = result.checkpointPath() != null ? result.checkpointPath() : result.adapterPath();
        run = moveTo(run, RunState.EVALUATING, "Evaluating adapter", current -> current
                .withTrainingArtifacts(String.valueOf(checkpoint), String.valueOf(result.adapterPath()))
                .withProgress(Math.max(current.progress(), 1.0), clock.instant()));

        EvaluationReport report = evaluate(run, dataset, checkpoint, runDir);
        run = update(runId, RunState.EVALUATING, current -> current.withEvalReport(report.id(), clock.instant()));
        if (!report.goNoGo()) {
            log.warn("run.evaluation.no-go runId={} report={} failures={}", runId, report.id(), report.gateFailures());
        }
        run = moveTo(run, RunState.PACKAGING, "Packaging adapter", UnaryOperator.identity());

        Path bundle = buildPackage(run, report, runDir);
        run = moveTo(run, RunState.READY, "Ready for deployment", current -> current.withPackage(bundle.toString()));
        record(run, run.requestedBy(), AuditLog.TRAINING_RUN_READY, Map.of(
                "evalReportId", report.id(),
                "goNoGo", Boolean.toString(report.goNoGo())));
        return run;
    }

    private DatasetVersion stage(TrainingRun run, Path runDir) throws StageFailure {
        DatasetVersion dataset = datasets.find(run.datasetVersionId())
                .orElseThrow(() -> new StageFailure(FailureKind.STAGING_ERROR,
                        "Dataset version not found: " + run.datasetVersionId()));
        if (!dataset.status().isTrainable()) {
            throw new StageFailure(FailureKind.STAGING_ERROR, "Dataset version is no longer usable (status="
                    + dataset.status() + ")");
        }
        if (!run.tenantId().equals(dataset.tenantId()) || !run.projectId().equals(dataset.projectId())) {
            throw new StageFailure(FailureKind.STAGING_ERROR, "Dataset version no longer belongs to the run's project");
        }
        String heldOut = dataset.goldPath() != null && !dataset.goldPath().isBlank()
                ? dataset.goldPath()
                : dataset.testPath();
        if (heldOut == null || !Files.exists(Path.of(heldOut))) {
            throw new StageFailure(FailureKind.STAGING_ERROR, "Held-out split missing for dataset " + dataset.id());
        }
        try {
            Files.createDirectories(runDir);
            Map<String, Object> snapshot = new LinkedHashMap<>();
            snapshot.put("runId", run.id());
            snapshot.put("baseModelId", run.baseModelId());
            snapshot.put("config", run.config());
            snapshot.put("dataset", dataset);
            snapshot.put("stagedAt", clock.instant().toString());
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(runDir.resolve("run-config-snapshot.json").toFile(), snapshot);
        } catch (IOException e) {
            throw new StageFailure(FailureKind.STAGING_ERROR, describe(e));
        }
        return dataset;
    }

    private ExecutionBackend.Result train(TrainingRun run, DatasetVersion dataset, Path runDir)
            throws StageFailure, InterruptedException {
        String runId = run.id();
        AtomicBoolean stop = new AtomicBoolean(false);
        ExecutionBackend.ProgressSink sink = fraction -> {
            if (stop.get()) {
                return false;
            }
            double clamped = Math.max(0.0, Math.min(1.0, fraction));
            Optional<TrainingRun> written = runs.compareAndSet(runId, RunState.TRAINING,
                    current -> clamped > current.progress() ? current.withProgress(clamped, clock.instant()) : current);
            if (written.isEmpty()) {
                stop.set(true);
                return false;
            }
            return true;
        };
        ExecutionRequest request = new ExecutionRequest(runId, run.baseModelId(), run.config(), dataset, runDir);

        int maxAttempts = Math.max(1, limits.maxRetries() + 1);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ExecutionBackend.Result result = executeBounded(runId, request, sink, stop);
            if (result.succeeded() || result.cancelled()) {
                return result;
            }
            if (!result.retryable()) {
                throw new StageFailure(FailureKind.BACKEND_ERROR, result.error());
            }
            if (attempt == maxAttempts) {
                throw new StageFailure(FailureKind.BACKEND_ERROR,
                        result.error() + " (gave up after " + maxAttempts + " attempts)");
            }
            long backoff = limits.retryBackoffMs() * attempt;
            log.warn("run.training.retry runId={} attempt={} maxAttempts={} backoffMs={} reason={}",
                    runId, attempt, maxAttempts, backoff, result.error());
            Optional<TrainingRun> counted = runs.compareAndSet(runId, RunState.TRAINING,
                    current -> current.withRetryCount(current.retryCount() + 1, clock.instant()));
            if (counted.isEmpty()) {
                return ExecutionBackend.Result.cancelled(0);
            }
            Thread.sleep(backoff);
        }
        throw new IllegalStateException("unreachable");
    }

    private ExecutionBackend.Result executeBounded(
            String runId,
            ExecutionRequest request,
            ExecutionBackend.ProgressSink sink,
            AtomicBoolean stop) throws StageFailure, InterruptedException {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ExecutionBackend.Result> future = executor.submit(() -> backend.execute(request, sink));
            ExecutionBackend.Result result = future.get(limits.timeoutMs(), TimeUnit.MILLISECONDS);
            return result == null ? ExecutionBackend.Result.failed("Backend returned no result", false) : result;
        } catch (TimeoutException e) {
            stop.set(true);
            log.warn("run.training.timeout runId={} timeoutMs={}", runId, limits.timeoutMs());
            throw new StageFailure(FailureKind.TIMEOUT, "Training exceeded " + limits.timeoutMs() + " ms");
        } catch (ExecutionException e) {
            log.error("run.training.backend-fault runId={} backend={}", runId, backend.name(), e.getCause());
            throw new StageFailure(FailureKind.INTERNAL_ERROR, "Backend fault: " + describe(e.getCause()));
        } finally {
            executor.shutdownNow();
        }
    }

    private EvaluationReport evaluate(TrainingRun run, DatasetVersion dataset, Path checkpoint, Path runDir)
            throws StageFailure {
        try {
            List<HeldOutExample> examples = heldOutLoader.load(dataset);
            EvaluationReport prior = priorReports.priorActiveReport(run.projectId(), run.id()).orElse(null);
            return evaluation.evaluate(run.id(), run.projectId(), checkpoint, examples, prior, runDir.resolve("evaluation"));
        } catch (IOException | IllegalArgumentException e) {
            throw new StageFailure(FailureKind.EVALUATION_ERROR, describe(e));
        }
    }

    private Path buildPackage(TrainingRun run, EvaluationReport report, Path runDir) throws StageFailure {
        try {
            return packager.buildPackage(run, report, runDir);
        } catch (IOException e) {
            throw new StageFailure(FailureKind.PACKAGING_ERROR, describe(e));
        }
    }

    private TrainingRun moveTo(TrainingRun run, RunState target, String message, UnaryOperator<TrainingRun> extra) {
        RunState from = run.state();
        TrainingRun moved = update(run.id(), from,
                current -> extra.apply(current).withState(target, message, clock.instant()));
        log.info("run.transition runId={} from={} to={}", run.id(), from, target);
        return moved;
    }

    private TrainingRun update(String runId, RunState expected, UnaryOperator<TrainingRun> mutation) {
        return runs.compareAndSet(runId, expected, mutation).orElseThrow(RunStopped::new);
    }

    private TrainingRun fail(String runId, FailureKind kind, String detail) {
        String error = kind.describe(detail);
        while (true) {
            TrainingRun current = getRun(runId);
            if (current.state().isTerminal()) {
                log.info("run.fail.skipped runId={} state={} error={}", runId, current.state(), error);
                return current;
            }
            Optional<TrainingRun> failed = runs.compareAndSet(runId, current.state(),
                    run -> run.withFailure(error, clock.instant()),
                    Map.of("failureKind", kind.name(), "error", error));
            if (failed.isPresent()) {
                log.error("run.failed runId={} from={} kind={} error={}", runId, current.state(), kind, detail);
                record(failed.get(), failed.get().requestedBy(), AuditLog.TRAINING_RUN_FAILED,
                        Map.of("failureKind", kind.name(), "fromState", current.state().name()));
                return failed.get();
            }
        }
    }

    private void record(TrainingRun run, String userId, String action, Map<String, String> details) {
        audit.append(new AuditEntry(clock.instant(), run.tenantId(), userId, run.projectId(), action,
                "training_run", run.id(), details));
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private static final class StageFailure extends Exception {
        private final FailureKind kind;

        private StageFailure(FailureKind kind, String message) {
            super(message);
            this.kind = kind;
        }
    }

    private static final class RunStopped extends RuntimeException {
        private RunStopped() {
            super(null, null, false, false);
        }
    }
}
