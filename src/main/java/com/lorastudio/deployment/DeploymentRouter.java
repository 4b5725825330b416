package com.lorastudio.deployment;

import java.time.Clock;
import java.util.List;
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lorastudio.audit.AuditEntry;
import com.lorastudio.audit.AuditLog;
import com.lorastudio.evaluation.EvaluationReport;
import com.lorastudio.evaluation.EvaluationReportRepository;
import com.lorastudio.evaluation.PriorReportLookup;
import com.lorastudio.tenant.Actor;
import com.lorastudio.training.RunNotFoundException;
import com.lorastudio.training.RunRepository;
import com.lorastudio.training.RunState;
import com.lorastudio.training.TrainingRun;
import com.lorastudio.training.ValidationException;

public class DeploymentRouter implements PriorReportLookup {
    static final String GROUNDED_REFUSAL = "I do not have grounded evidence in the current knowledge set. "
            + "Please provide more context or escalate.";

    private static final Logger log = LoggerFactory.getLogger(DeploymentRouter.class);

    private final DeploymentRegistry registry;
    private final RunRepository runs;
    private final EvaluationReportRepository reports;
    private final GroundingRetriever retriever;
    private final InferenceBackend backend;
    private final AuditLog audit;
    private final long inferenceTimeoutMs;
    private final boolean requireGrounding;
    private final Clock clock;

    public DeploymentRouter(
            DeploymentRegistry registry,
            RunRepository runs,
            EvaluationReportRepository reports,
            GroundingRetriever retriever,
            InferenceBackend backend,
            AuditLog audit,
            long inferenceTimeoutMs,
            boolean requireGrounding) {
        this(registry, runs, reports, retriever, backend, audit, inferenceTimeoutMs, requireGrounding,
                Clock.systemUTC());
    }

    DeploymentRouter(
            DeploymentRegistry registry,
            RunRepository runs,
            EvaluationReportRepository reports,
            GroundingRetriever retriever,
            InferenceBackend backend,
            AuditLog audit,
            long inferenceTimeoutMs,
            boolean requireGrounding,
            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.runs = Objects.requireNonNull(runs, "runs");
        this.reports = Objects.requireNonNull(reports, "reports");
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.audit = Objects.requireNonNull(audit, "audit");
        if (inferenceTimeoutMs <= 0) {
            throw new IllegalArgumentException("inference.timeoutMs must be positive");
        }
        this.inferenceTimeoutMs = inferenceTimeoutMs;
        this.requireGrounding = requireGrounding;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Deployment activate(Actor actor, String projectId, String trainingRunId, String versionLabel, String endpointRef) {
        Objects.requireNonNull(actor, "actor");
        actor.requireTrainingManager("activate deployments");
        if (versionLabel == null || versionLabel.isBlank()) {
            throw new ValidationException("versionLabel is required");
        }
        TrainingRun run = runs.find(trainingRunId)
                .filter(candidate -> candidate.projectId().equals(projectId))
                .filter(candidate -> candidate.tenantId().equals(actor.tenantId()))
                .orElseThrow(() -> new RunNotFoundException(trainingRunId));
        if (run.state() != RunState.READY) {
            throw new RunNotReadyException("Run " + trainingRunId + " is " + run.state() + ", activation requires READY");
        }

        Deployment deployment = new Deployment(
                "dep-" + UUID.randomUUID(),
                run.tenantId(),
                projectId,
                versionLabel,
                trainingRunId,
                DeploymentStatus.ACTIVE,
                endpointRef == null || endpointRef.isBlank() ? "local://" + projectId + "/" + versionLabel : endpointRef,
                run.packagePath(),
                clock.instant(),
                null);
        ProjectDeployments[] before = new ProjectDeployments[1];
        registry.swap(projectId, current -> {
            if (current.hasLabel(versionLabel)) {
                throw new DuplicateVersionException("Version " + versionLabel + " already exists for project " + projectId);
            }
            before[0] = current;
            return current.activate(deployment, clock.instant());
        });

        String retired = before[0].active().map(Deployment::id).orElse("none");
        reports.findByRun(trainingRunId).filter(report -> !report.goNoGo()).ifPresent(report ->
                log.warn("deployment.activated.no-go project={} run={} report={}", projectId, trainingRunId, report.id()));
        audit.append(new AuditEntry(clock.instant(), run.tenantId(), actor.userId(), projectId,
                AuditLog.DEPLOYMENT_ACTIVATED, "deployment", deployment.id(), Map.of(
                        "versionLabel", versionLabel,
                        "trainingRunId", trainingRunId,
                        "retiredDeploymentId", retired)));
        log.info("deployment.activated project={} version={} run={} retired={}", projectId, versionLabel, trainingRunId, retired);
        return deployment;
    }

    public Deployment rollback(Actor actor, String projectId) {
        Objects.requireNonNull(actor, "actor");
        actor.requireTrainingManager("roll back deployments");
        ProjectDeployments current = registry.current(projectId);
        current.deployments().stream().findFirst().ifPresent(d -> actor.requireTenant(d.tenantId()));

        ProjectDeployments after = registry.swap(projectId, ledger -> ledger.rollback(clock.instant())
                .orElseThrow(() -> new NoActiveDeploymentException("No previous deployment to roll back to for project " + projectId)));
        Deployment restored = after.active().orElseThrow();
        audit.append(new AuditEntry(clock.instant(), restored.tenantId(), actor.userId(), projectId,
                AuditLog.DEPLOYMENT_ROLLED_BACK, "deployment", restored.id(), Map.of(
                        "versionLabel", restored.versionLabel())));
        log.info("deployment.rolled-back project={} version={}", projectId, restored.versionLabel());
        return restored;
    }

    public Deployment resolveActive(String projectId) {
        return registry.current(projectId).active()
                .orElseThrow(() -> new NoActiveDeploymentException("No active deployment for project " + projectId));
    }

    public List<Deployment> list(String projectId) {
        return registry.current(projectId).deployments();
    }

    public InferenceResult infer(String projectId, String prompt, List<ContextDocument> contextDocuments) {
        if (prompt == null || prompt.isBlank()) {
            throw new ValidationException("prompt is required");
        }
        long started = System.nanoTime();
        Deployment deployment = resolveActive(projectId);
        List<GroundingSnippet> snippets = retriever.retrieve(prompt, contextDocuments);
        List<String> snippetIds = snippets.stream().map(GroundingSnippet::snippetId).toList();

        if (snippets.isEmpty() && requireGrounding) {
            log.info("inference.refused project={} version={} reason=no-grounding", projectId, deployment.versionLabel());
            return new InferenceResult(deployment.id(), deployment.versionLabel(), GROUNDED_REFUSAL, List.of(), true,
                    "grounding-policy", elapsedMs(started));
        }

        InferenceBackend.Generation generation = generateWithTimeout(prompt, new InferenceContext(deployment, snippets));
        long latencyMs = elapsedMs(started);
        log.info("inference.completed project={} version={} backend={} fallback={} snippets={} latencyMs={}",
                projectId, deployment.versionLabel(), generation.backend(), generation.fallback(), snippetIds.size(), latencyMs);
        return new InferenceResult(deployment.id(), deployment.versionLabel(), generation.text(), snippetIds, false,
                generation.backend(), latencyMs);
    }

    @Override
    public Optional<EvaluationReport> priorActiveReport(String projectId, String excludingRunId) {
        return registry.current(projectId).active()
                .map(Deployment::trainingRunId)
                .filter(runId -> !runId.equals(excludingRunId))
                .flatMap(reports::findByRun);
    }

    private InferenceBackend.Generation generateWithTimeout(String prompt, InferenceContext context) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<InferenceBackend.Generation> future = executor.submit(() -> backend.generate(prompt, context));
            return future.get(inferenceTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("inference.timeout timeoutMs={}", inferenceTimeoutMs);
            return new InferenceBackend.Generation("I could not complete generation within the configured timeout of "
                    + inferenceTimeoutMs + "ms. Please retry with a shorter prompt.", "timeout", true);
        } catch (ExecutionException e) {
            log.error("inference.failed", e.getCause());
            return new InferenceBackend.Generation("I hit an inference error while generating the response.", "error", true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new InferenceBackend.Generation("Generation interrupted.", "interrupted", true);
        } finally {
            executor.shutdownNow();
        }
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
