package com.autonomous.content.pipeline;

import com.autonomous.content.exception.ForbiddenException;
import com.autonomous.content.exception.InvalidRequestException;
import com.autonomous.content.exception.ResourceNotFoundException;
import com.autonomous.content.model.AdmissionDecision;
import com.autonomous.content.model.AgentConfig;
import com.autonomous.content.model.AgentKind;
import com.autonomous.content.model.AgentResult;
import com.autonomous.content.model.ArticleRequest;
import com.autonomous.content.model.CostEntry;
import com.autonomous.content.model.MemberRole;
import com.autonomous.content.model.NotificationEvent;
import com.autonomous.content.model.Pipeline;
import com.autonomous.content.model.PipelineLogEntry;
import com.autonomous.content.model.PipelineLogLevel;
import com.autonomous.content.model.PipelineSnapshot;
import com.autonomous.content.model.PipelineStatus;
import com.autonomous.content.model.StepStatus;
import com.autonomous.content.notification.Notifier;
import com.autonomous.content.service.AgentRegistryService;
import com.autonomous.content.service.AuditLogService;
import com.autonomous.content.service.BudgetGuardService;
import com.autonomous.content.service.CostLedgerService;
import com.autonomous.content.service.OrganizationService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Drives pipelines through their five agent steps. Pipelines wait in a priority queue and run on
 * a fixed worker pool; inside one pipeline the steps run strictly in order. Every status change
 * is applied under the store's per-pipeline lock and mirrored into the audit log.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final int DEFAULT_PRIORITY = 5;

    private final Clock clock;
    private final PipelineStore store;
    private final OrganizationService organizations;
    private final BudgetGuardService budgetGuard;
    private final AgentRegistryService agentRegistry;
    private final CostLedgerService costLedger;
    private final AuditLogService auditLog;
    private final AgentStepExecutor stepExecutor;
    private final Notifier notifier;
    private final PipelineLogService logs;
    private final ThreadPoolExecutor workers;
    private final AtomicLong submissions = new AtomicLong();

    @Autowired
    public PipelineOrchestrator(
            @Value("${pipeline.workers:4}") int workerCount,
            Clock clock,
            PipelineStore store,
            OrganizationService organizations,
            BudgetGuardService budgetGuard,
            AgentRegistryService agentRegistry,
            CostLedgerService costLedger,
            AuditLogService auditLog,
            AgentStepExecutor stepExecutor,
            Notifier notifier,
            PipelineLogService logs) {
        this.clock = clock;
        this.store = store;
        this.organizations = organizations;
        this.budgetGuard = budgetGuard;
        this.agentRegistry = agentRegistry;
        this.costLedger = costLedger;
        this.auditLog = auditLog;
        this.stepExecutor = stepExecutor;
        this.notifier = notifier;
        this.logs = logs;

        AtomicInteger threadCount = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(workerCount, workerCount, 0L, TimeUnit.MILLISECONDS,
            new PriorityBlockingQueue<>(), runnable -> {
                Thread thread = new Thread(runnable, "pipeline-worker-" + threadCount.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
    }

    /**
     * Creates the pipeline record, runs admission, and queues the pipeline when admitted. A
     * rejected request leaves a {@code failed} pipeline behind carrying the rejection code.
     */
    public PipelineCreationResult createPipeline(String organizationId, String userId, ArticleRequest request) {
        if (request == null || request.getTopic() == null || request.getTopic().isBlank()) {
            throw new InvalidRequestException("Article topic is required");
        }
        int priority = request.getPriority() != null ? request.getPriority() : DEFAULT_PRIORITY;
        if (priority < 1 || priority > 10) {
            throw new InvalidRequestException("Priority must be between 1 and 10, got " + priority);
        }
        MemberRole role = organizations.roleOf(organizationId, userId)
            .orElseThrow(() -> new ForbiddenException("User is not a member of organization " + organizationId));
        if (role == MemberRole.VIEWER) {
            throw new ForbiddenException("Viewers cannot request articles");
        }

        Pipeline pipeline = Pipeline.builder()
            .id(UUID.randomUUID().toString())
            .organizationId(organizationId)
            .userId(userId)
            .request(request)
            .priority(priority)
            .createdAt(clock.instant())
            .build();
        for (AgentKind kind : AgentKind.values()) {
            pipeline.getAgentStatus().put(kind, StepStatus.PENDING);
        }
        PipelineSnapshot created = store.insert(pipeline);
        String pipelineId = created.id();
        auditLog.recordChange(organizationId, userId, "pipeline.created", "pipeline", pipelineId, null, created);
        logs.append(pipelineId, PipelineLogLevel.INFO, null, "Pipeline created for topic: " + request.getTopic(),
            Map.of("priority", priority));

        AdmissionDecision decision;
        try {
            decision = budgetGuard.admit(organizationId, userId);
        } catch (RuntimeException e) {
            failAdmission(pipelineId, userId, e);
            throw e;
        }
        if (!decision.allowed()) {
            PipelineSnapshot rejected = mutate(pipelineId, userId,
                p -> p.fail(decision.reason().getCode(), decision.message(), clock.instant()));
            log.info("Pipeline {} rejected for organization {}: {}", pipelineId, organizationId, decision.message());
            logs.append(pipelineId, PipelineLogLevel.ERROR, null, "Admission rejected: " + decision.message(),
                Map.of("reason", decision.reason().getCode()));
            return PipelineCreationResult.rejected(rejected, decision.reason(), decision.message());
        }

        BigDecimal estimate = agentRegistry.estimateCost(organizationId);
        PipelineSnapshot queued = mutate(pipelineId, userId, p -> {
            p.transitionTo(PipelineStatus.QUEUED);
            p.setQueuedAt(clock.instant());
            p.setEstimatedCost(estimate);
        });
        enqueue(pipelineId, priority);
        logs.append(pipelineId, PipelineLogLevel.INFO, null, "Pipeline queued", Map.of("estimatedCost", estimate));
        log.info("Queued pipeline {} for organization {} (priority {})", pipelineId, organizationId, priority);
        return PipelineCreationResult.accepted(queued, decision.alert());
    }

    private void failAdmission(String pipelineId, String userId, RuntimeException cause) {
        try {
            mutate(pipelineId, userId, p -> p.fail("admission_error",
                "Admission failed: " + cause.getMessage(), clock.instant()));
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
        log.error("Admission of pipeline {} failed", pipelineId, cause);
        logs.append(pipelineId, PipelineLogLevel.ERROR, null, "Admission failed: " + cause.getMessage());
    }

    public PipelineSnapshot getPipeline(String pipelineId, String actorId) {
        PipelineSnapshot pipeline = store.get(pipelineId);
        organizations.requireMember(pipeline.organizationId(), actorId);
        return pipeline;
    }

    /**
     * The pipeline's most recent execution log lines, oldest first.
     */
    public List<PipelineLogEntry> getLogs(String pipelineId, String actorId, int limit) {
        getPipeline(pipelineId, actorId);
        return logs.entries(pipelineId, limit);
    }

    public PipelineStats stats(String organizationId, String actorId) {
        organizations.requireMember(organizationId, actorId);
        List<PipelineSnapshot> pipelines = store.findByOrganization(organizationId);
        int completed = count(pipelines, PipelineStatus.COMPLETED);
        int failed = count(pipelines, PipelineStatus.FAILED);
        int cancelled = count(pipelines, PipelineStatus.CANCELLED);
        int finished = completed + failed + cancelled;
        BigDecimal totalCost = pipelines.stream()
            .map(PipelineSnapshot::totalCost)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal successRate = finished == 0
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(completed * 100L).divide(BigDecimal.valueOf(finished), 2, RoundingMode.HALF_UP);
        BigDecimal averageCost = finished == 0
            ? BigDecimal.ZERO
            : totalCost.divide(BigDecimal.valueOf(finished), CostLedgerService.AMOUNT_SCALE, RoundingMode.HALF_UP);
        int generated = (int) pipelines.stream().filter(p -> p.articleId() != null).count();
        int published = (int) pipelines.stream()
            .filter(p -> p.agentStatus().get(AgentKind.PUBLISH) == StepStatus.COMPLETED)
            .count();
        Instant lastRunAt = pipelines.stream()
            .map(PipelineSnapshot::createdAt)
            .max(Comparator.naturalOrder())
            .orElse(null);
        return new PipelineStats(pipelines.size(), completed, failed, cancelled, pipelines.size() - finished,
            successRate, totalCost, averageCost, generated, published, lastRunAt);
    }

    public List<PipelineSnapshot> listPipelines(String organizationId, String actorId) {
        organizations.requireMember(organizationId, actorId);
        return store.findByOrganization(organizationId);
    }

    public PipelineSnapshot cancel(String pipelineId, String actorId) {
        authorizeControl(pipelineId, actorId);
        PipelineSnapshot cancelled = mutate(pipelineId, actorId, p -> {
            p.transitionTo(PipelineStatus.CANCELLED);
            p.setCompletedAt(clock.instant());
            p.setCurrentAgent(null);
        });
        log.info("Pipeline {} cancelled by {}", pipelineId, actorId);
        logs.append(pipelineId, PipelineLogLevel.WARNING, null, "Pipeline cancelled by " + actorId);
        return cancelled;
    }

    /**
     * Requests a pause. A step already running finishes first; the pipeline stops at the next
     * step boundary.
     */
    public PipelineSnapshot pause(String pipelineId, String actorId) {
        authorizeControl(pipelineId, actorId);
        PipelineSnapshot paused = mutate(pipelineId, actorId, p -> p.transitionTo(PipelineStatus.PAUSED));
        log.info("Pipeline {} paused by {}", pipelineId, actorId);
        logs.append(pipelineId, PipelineLogLevel.WARNING, null, "Pause requested by " + actorId);
        return paused;
    }

    public PipelineSnapshot resume(String pipelineId, String actorId) {
        authorizeControl(pipelineId, actorId);
        PipelineSnapshot[] resumed = new PipelineSnapshot[1];
        boolean needsWorker = store.update(pipelineId, p -> {
            resumed[0] = applyAudited(p, actorId, x -> x.transitionTo(PipelineStatus.RUNNING));
            return !p.isWorkerAttached();
        });
        if (needsWorker) {
            enqueue(pipelineId, resumed[0].priority());
        }
        log.info("Pipeline {} resumed by {}", pipelineId, actorId);
        logs.append(pipelineId, PipelineLogLevel.INFO, null, "Pipeline resumed by " + actorId);
        return resumed[0];
    }

    /**
     * Soft delete. Only pipelines in a terminal state can be deleted.
     */
    public void deletePipeline(String pipelineId, String actorId) {
        authorizeControl(pipelineId, actorId);
        store.update(pipelineId, p -> {
            if (!p.getStatus().isTerminal()) {
                throw new InvalidRequestException("Only finished pipelines can be deleted; pipeline "
                    + pipelineId + " is " + p.getStatus().toValue());
            }
            PipelineSnapshot before = PipelineSnapshot.of(p);
            p.setDeletedAt(clock.instant());
            auditLog.recordChange(p.getOrganizationId(), actorId, "pipeline.deleted", "pipeline", pipelineId,
                before, Map.of("deletedAt", p.getDeletedAt().toString()));
            return null;
        });
        logs.clear(pipelineId);
        log.info("Pipeline {} deleted by {}", pipelineId, actorId);
    }

    /**
     * Startup sweep: running and queued pipelines go back on the queue and continue from their
     * first unfinished step. Pipelines caught mid-admission are failed.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterrupted() {
        for (String pipelineId : store.idsWithStatus(PipelineStatus.PENDING)) {
            mutate(pipelineId, null, p -> p.fail("admission_interrupted",
                "Service restarted before admission completed", clock.instant()));
        }
        List<String> running = store.idsWithStatus(PipelineStatus.RUNNING);
        List<String> queued = store.idsWithStatus(PipelineStatus.QUEUED);
        running.forEach(id -> enqueue(id, store.get(id).priority()));
        queued.forEach(id -> enqueue(id, store.get(id).priority()));
        if (!running.isEmpty() || !queued.isEmpty()) {
            log.info("Recovered {} running and {} queued pipelines", running.size(), queued.size());
        }
    }

    public int queueDepth() {
        return workers.getQueue().size();
    }

    public int activeWorkers() {
        return workers.getActiveCount();
    }

    void runPipeline(String pipelineId) {
        boolean claimed;
        try {
            claimed = store.update(pipelineId, this::claim);
        } catch (ResourceNotFoundException e) {
            log.info("Pipeline {} was deleted before a worker picked it up", pipelineId);
            return;
        }
        if (!claimed) {
            return;
        }
        try {
            runSteps(pipelineId);
        } catch (RuntimeException e) {
            log.error("Pipeline {} aborted", pipelineId, e);
            abort(pipelineId, e);
        }
    }

    private boolean claim(Pipeline pipeline) {
        if (pipeline.isWorkerAttached()) {
            return false;
        }
        if (pipeline.getStatus() == PipelineStatus.QUEUED) {
            applyAudited(pipeline, null, p -> {
                p.transitionTo(PipelineStatus.RUNNING);
                p.setStartedAt(clock.instant());
            });
        } else if (pipeline.getStatus() != PipelineStatus.RUNNING) {
            return false;
        }
        pipeline.setWorkerAttached(true);
        logs.append(pipeline.getId(), PipelineLogLevel.INFO, null, "Worker started pipeline");
        return true;
    }

    private void runSteps(String pipelineId) {
        while (true) {
            Boundary boundary = store.update(pipelineId, this::atBoundary);
            if (boundary.completed() != null) {
                PipelineSnapshot done = boundary.completed();
                log.info("Pipeline {} completed, total cost {}", pipelineId, done.totalCost());
                logs.append(pipelineId, PipelineLogLevel.SUCCESS, null, "Pipeline completed",
                    Map.of("totalCost", done.totalCost()));
                notifier.notify(done.organizationId(), NotificationEvent.PIPELINE_COMPLETED, details(done));
                return;
            }
            if (boundary.step() == null) {
                return;
            }
            AgentKind kind = boundary.step();
            String organizationId = boundary.organizationId();

            AdmissionDecision continuation = budgetGuard.checkContinuation(organizationId, boundary.totalCost());
            if (!continuation.allowed()) {
                finishFailed(pipelineId, null, 0, continuation.reason().getCode(), continuation.message());
                return;
            }

            AgentConfig config = agentRegistry.get(organizationId, kind);
            if (!config.isEnabled()) {
                boolean skipped = store.update(pipelineId, p -> {
                    if (p.getStatus() != PipelineStatus.RUNNING) {
                        p.setWorkerAttached(false);
                        return false;
                    }
                    applyAudited(p, null, x -> x.getAgentStatus().put(kind, StepStatus.SKIPPED));
                    return true;
                });
                if (!skipped) {
                    return;
                }
                log.info("Pipeline {} skipped disabled agent {}", pipelineId, kind.getWireName());
                logs.append(pipelineId, PipelineLogLevel.INFO, kind, "Agent disabled; step skipped");
                continue;
            }

            Map<String, Object> payload = store.update(pipelineId, p -> startStep(p, kind, config));
            if (payload == null) {
                return;
            }
            Map<String, Object> stepDetails = new LinkedHashMap<>();
            stepDetails.put("model", config.getModel());
            stepDetails.put("maxRetries", config.getMaxRetries());
            logs.append(pipelineId, PipelineLogLevel.INFO, kind, "Starting " + kind.getWireName(), stepDetails);
            StepOutcome outcome = stepExecutor.execute(pipelineId, config, payload, listenerFor(pipelineId, organizationId));
            if (!recordOutcome(pipelineId, kind, outcome)) {
                return;
            }
        }
    }

    private static int count(List<PipelineSnapshot> pipelines, PipelineStatus status) {
        return (int) pipelines.stream().filter(p -> p.status() == status).count();
    }

    private Boundary atBoundary(Pipeline pipeline) {
        if (pipeline.getStatus() != PipelineStatus.RUNNING) {
            pipeline.setWorkerAttached(false);
            return Boundary.STOP;
        }
        if (pipeline.allStepsDone()) {
            PipelineSnapshot completed = applyAudited(pipeline, null, p -> {
                p.transitionTo(PipelineStatus.COMPLETED);
                p.setCompletedAt(clock.instant());
                p.setCurrentAgent(null);
            });
            pipeline.setWorkerAttached(false);
            return new Boundary(null, pipeline.getOrganizationId(), pipeline.getTotalCost(), completed);
        }
        return new Boundary(pipeline.nextStep().orElseThrow(), pipeline.getOrganizationId(),
            pipeline.getTotalCost(), null);
    }

    private Map<String, Object> startStep(Pipeline pipeline, AgentKind kind, AgentConfig config) {
        if (pipeline.getStatus() != PipelineStatus.RUNNING) {
            pipeline.setWorkerAttached(false);
            return null;
        }
        applyAudited(pipeline, null, p -> {
            p.setCurrentAgent(kind);
            p.getAgentStatus().put(kind, StepStatus.RUNNING);
        });

        Map<String, String> previousResults = new LinkedHashMap<>();
        pipeline.getResults().forEach((step, output) -> previousResults.put(step.getWireName(), output));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pipelineId", pipeline.getId());
        payload.put("organizationId", pipeline.getOrganizationId());
        payload.put("articleId", pipeline.getArticleId());
        payload.put("agent", kind.getWireName());
        payload.put("model", config.getModel());
        payload.put("maxCost", config.getMaxCost());
        payload.put("request", pipeline.getRequest());
        payload.put("previousResults", previousResults);
        return payload;
    }

    /**
     * @return whether the worker should move on to the next step
     */
    private boolean recordOutcome(String pipelineId, AgentKind kind, StepOutcome outcome) {
        switch (outcome.status()) {
            case COMPLETED:
                return store.update(pipelineId, p -> {
                    if (p.getStatus().isTerminal()) {
                        log.info("Pipeline {} is {}; discarding {} result",
                            pipelineId, p.getStatus().toValue(), kind.getWireName());
                        p.setWorkerAttached(false);
                        return false;
                    }
                    applyAudited(p, null, x -> {
                        x.markStepCompleted(kind, outcome.output());
                        if (outcome.articleId() != null) {
                            x.setArticleId(outcome.articleId());
                        }
                        x.setRetryCount(x.getRetryCount() + Math.max(0, outcome.attempts() - 1));
                        x.setCurrentAgent(null);
                    });
                    logs.append(pipelineId, PipelineLogLevel.SUCCESS, kind, kind.getWireName() + " completed",
                        Map.of("attempts", outcome.attempts()));
                    return true;
                });
            case FAILED:
                finishFailed(pipelineId, kind, outcome.attempts(), outcome.errorCode(), outcome.errorMessage());
                return false;
            case CANCELLED:
                detach(pipelineId);
                return false;
            case INTERRUPTED:
            default:
                log.info("Pipeline {} interrupted during {}; it resumes on restart", pipelineId, kind.getWireName());
                detach(pipelineId);
                return false;
        }
    }

    private void finishFailed(String pipelineId, AgentKind kind, int attempts, String errorCode, String message) {
        PipelineSnapshot failed = store.update(pipelineId, p -> {
            p.setWorkerAttached(false);
            if (p.getStatus().isTerminal()) {
                return null;
            }
            return applyAudited(p, null, x -> {
                if (kind != null) {
                    x.getAgentStatus().put(kind, StepStatus.FAILED);
                    x.setRetryCount(x.getRetryCount() + Math.max(0, attempts - 1));
                }
                x.fail(errorCode, message, clock.instant());
            });
        });
        if (failed != null) {
            log.warn("Pipeline {} failed: {} ({})", pipelineId, errorCode, message);
            logs.append(pipelineId, PipelineLogLevel.ERROR, kind, message, Map.of("errorCode", errorCode));
            Map<String, Object> details = details(failed);
            details.put("errorCode", errorCode);
            details.put("errorMessage", message);
            notifier.notify(failed.organizationId(), NotificationEvent.PIPELINE_FAILED, details);
        }
    }

    private void abort(String pipelineId, RuntimeException cause) {
        try {
            finishFailed(pipelineId, null, 0, "internal_error", cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not record failure of pipeline {}", pipelineId, e);
            detach(pipelineId);
        }
    }

    private void detach(String pipelineId) {
        try {
            store.update(pipelineId, p -> {
                p.setWorkerAttached(false);
                return null;
            });
        } catch (ResourceNotFoundException e) {
            log.debug("Pipeline {} deleted while detaching", pipelineId);
        }
    }

    private StepListener listenerFor(String pipelineId, String organizationId) {
        return new StepListener() {
            @Override
            public void onBilled(AgentKind agentKind, AgentResult result) {
                bill(pipelineId, organizationId, agentKind, result);
            }

            @Override
            public boolean isCancelled() {
                return store.find(pipelineId).map(p -> p.status().isTerminal()).orElse(true);
            }
        };
    }

    /**
     * Every billed attempt lands in the ledger. Pipeline totals only change while the pipeline is
     * not terminal.
     */
    private void bill(String pipelineId, String organizationId, AgentKind kind, AgentResult result) {
        String articleId = result.articleId() != null
            ? result.articleId()
            : store.find(pipelineId).map(PipelineSnapshot::articleId).orElse(null);
        CostEntry entry = costLedger.recordUsage(organizationId, pipelineId, articleId, kind, result.usage());
        if (entry.getAmount().signum() == 0) {
            return;
        }
        Map<String, Object> metric = new LinkedHashMap<>();
        metric.put("amount", entry.getAmount());
        metric.put("service", entry.getService());
        metric.put("model", entry.getModel());
        metric.put("success", result.success());
        logs.append(pipelineId, PipelineLogLevel.METRIC, kind, "Billed " + entry.getAmount(), metric);
        try {
            store.update(pipelineId, p -> {
                if (p.getStatus().isTerminal()) {
                    log.info("Pipeline {} is {}; cost {} recorded in ledger only",
                        pipelineId, p.getStatus().toValue(), entry.getAmount());
                    return null;
                }
                applyAudited(p, null, x -> x.addCost(kind, entry.getAmount()));
                return null;
            });
        } catch (ResourceNotFoundException e) {
            log.info("Pipeline {} deleted; cost {} recorded in ledger only", pipelineId, entry.getAmount());
        }
    }

    private PipelineSnapshot mutate(String pipelineId, String actorId, Consumer<Pipeline> change) {
        return store.update(pipelineId, p -> applyAudited(p, actorId, change));
    }

    private PipelineSnapshot applyAudited(Pipeline pipeline, String actorId, Consumer<Pipeline> change) {
        PipelineSnapshot before = PipelineSnapshot.of(pipeline);
        change.accept(pipeline);
        PipelineSnapshot after = PipelineSnapshot.of(pipeline);
        String action = before.status() != after.status()
            ? "pipeline." + after.status().toValue()
            : "pipeline.updated";
        auditLog.recordChange(pipeline.getOrganizationId(), actorId, action, "pipeline", pipeline.getId(), before, after);
        return after;
    }

    private void authorizeControl(String pipelineId, String actorId) {
        PipelineSnapshot pipeline = store.get(pipelineId);
        if (actorId != null && actorId.equals(pipeline.userId())) {
            return;
        }
        if (!organizations.isAdmin(pipeline.organizationId(), actorId)) {
            throw new ForbiddenException("Only the pipeline owner or an organization admin can do this");
        }
    }

    private void enqueue(String pipelineId, int priority) {
        try {
            workers.execute(new PipelineTask(pipelineId, priority, submissions.incrementAndGet(), this));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool is shut down; pipeline {} stays queued until restart", pipelineId);
        }
    }

    private static Map<String, Object> details(PipelineSnapshot pipeline) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pipelineId", pipeline.id());
        details.put("articleId", pipeline.articleId());
        details.put("totalCost", pipeline.totalCost());
        details.put("status", pipeline.status().toValue());
        return details;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Pipeline workers did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record Boundary(AgentKind step, String organizationId, BigDecimal totalCost, PipelineSnapshot completed) {
        static final Boundary STOP = new Boundary(null, null, null, null);
    }
}
