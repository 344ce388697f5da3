package fr.lapetina.modeltraffic.rollout;

import fr.lapetina.modeltraffic.domain.exception.BackendOperationException;
import fr.lapetina.modeltraffic.domain.exception.EvaluationInconclusiveException;
import fr.lapetina.modeltraffic.domain.exception.ValidationException;
import fr.lapetina.modeltraffic.domain.model.AggregateWindow;
import fr.lapetina.modeltraffic.domain.model.EndpointState;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsCollector;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modeltraffic.infrastructure.registry.EndpointRegistry;
import fr.lapetina.modeltraffic.infrastructure.registry.RegistrySnapshot;
import fr.lapetina.modeltraffic.spi.ControllerEvent;
import fr.lapetina.modeltraffic.spi.DeploymentBackend;
import fr.lapetina.modeltraffic.spi.DeploymentSpec;
import fr.lapetina.modeltraffic.spi.NotificationSink;
import fr.lapetina.modeltraffic.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives canary rollouts: ramps traffic to a new version step by step and evaluates each step
 * against the baseline version.
 *
 * Each plan is evaluated on the shared scheduler with a fixed delay, and every transition of a
 * plan happens while holding that plan's monitor, so a plan only ever has one writer. Weight
 * changes go through single registry commits, so the model's weights always sum to 100.
 */
public final class CanaryController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CanaryController.class);

    static final String PLAN_PREFIX = "rollout/plan/";
    static final String ACTIVE_PREFIX = "rollout/active/";

    private final EndpointRegistry registry;
    private final MetricsCollector collector;
    private final DeploymentBackend backend;
    private final NotificationSink sink;
    private final SnapshotStore store;
    private final EndpointDrainer drainer;
    private final RolloutLeases leases;
    private final MetricsRegistry metrics;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Map<String, PlanHandle> plans = new ConcurrentHashMap<>();

    public CanaryController(
            EndpointRegistry registry,
            MetricsCollector collector,
            DeploymentBackend backend,
            NotificationSink sink,
            SnapshotStore store,
            EndpointDrainer drainer,
            RolloutLeases leases,
            MetricsRegistry metrics,
            ScheduledExecutorService scheduler,
            Clock clock
    ) {
        this.registry = registry;
        this.collector = collector;
        this.backend = backend;
        this.sink = sink;
        this.store = store;
        this.drainer = drainer;
        this.leases = leases;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Starts a canary rollout.
     *
     * @throws ValidationException       if the configuration or the model's current state does not
     *                                   allow a rollout; nothing has changed in that case
     * @throws BackendOperationException if the canary deployment could not be created; the plan is
     *                                   ABORTED
     */
    public RolloutPlan start(RolloutConfig config) {
        config.validate();
        String model = config.model();
        RegistrySnapshot snapshot = registry.getSnapshot(model);
        Map<String, Integer> baselineWeights = baselineWeights(snapshot, config);

        String planId = UUID.randomUUID().toString();
        if (!leases.tryAcquire(model, planId)) {
            throw new ValidationException("Another rollout is active for model " + model + ": "
                    + leases.holder(model).orElse("?"));
        }

        Instant now = clock.instant();
        String canaryId = model + "-" + config.canaryVersion() + "-" + planId.substring(0, 8);
        RolloutPlan plan = RolloutPlan.builder()
                .id(planId)
                .config(config)
                .state(RolloutState.PENDING)
                .canaryEndpointId(canaryId)
                .baselineWeights(baselineWeights)
                .createdAt(now)
                .updatedAt(now)
                .build();
        PlanHandle handle = new PlanHandle(plan);
        plans.put(planId, handle);
        store.put(ACTIVE_PREFIX + model, planId);

        MDC.put("planId", planId);
        try {
            synchronized (handle) {
                publish(handle, plan);
                log.info("Canary rollout starting: model={}, canary={}, baseline={}, steps={}",
                        model, config.canaryVersion(), config.baselineVersion(), config.trafficSteps());

                URI address;
                try {
                    address = backend.create(model, config.canaryVersion(), new DeploymentSpec(
                            canaryId, config.costPerToken(), config.maxConcurrentRequests(), config.settings()));
                } catch (BackendOperationException e) {
                    terminate(handle, RolloutState.ABORTED, "Canary creation failed: " + e.getMessage(), false);
                    throw e;
                } catch (RuntimeException e) {
                    terminate(handle, RolloutState.ABORTED, "Canary creation failed: " + e.getMessage(), false);
                    throw new BackendOperationException(BackendOperationException.Operation.CREATE,
                            canaryId, e.getMessage(), e);
                }

                try {
                    registry.register(ModelEndpoint.builder()
                            .id(canaryId)
                            .model(model)
                            .version(config.canaryVersion())
                            .address(address)
                            .costPerToken(config.costPerToken())
                            .maxConcurrentRequests(config.maxConcurrentRequests())
                            .state(EndpointState.DRAFT)
                            .build());

                    int firstStep = config.trafficSteps().get(0);
                    commitStep(plan, firstStep);
                } catch (RuntimeException e) {
                    terminate(handle, RolloutState.ABORTED, "Canary registration failed: " + e.getMessage(), true);
                    if (registry.findEndpoint(canaryId).isEmpty()) {
                        deleteDeployment(canaryId);
                    }
                    throw e;
                }

                RolloutPlan ramping = handle.plan.toBuilder()
                        .state(RolloutState.RAMPING)
                        .stepIndex(0)
                        .canaryTraffic(config.trafficSteps().get(0))
                        .updatedAt(clock.instant())
                        .build();
                publish(handle, ramping);
                schedule(handle);
                notify(ControllerEvent.Type.CANARY_STARTED, ramping,
                        "Canary " + config.canaryVersion() + " receiving " + ramping.canaryTraffic() + "% of traffic");
                return ramping;
            }
        } finally {
            MDC.remove("planId");
        }
    }

    /**
     * Evaluates the current step of a plan and advances, promotes, defers or rolls back.
     *
     * A failure while committing the outcome aborts the plan through the rollback path.
     *
     * @return the plan after the evaluation
     * @throws EvaluationInconclusiveException if the plan was aborted after too many deferrals
     */
    public RolloutPlan evaluate(String planId) {
        PlanHandle handle = handle(planId);
        MDC.put("planId", planId);
        try {
            synchronized (handle) {
                RolloutPlan plan = handle.plan;
                if (plan.state() != RolloutState.RAMPING) {
                    log.debug("Evaluation skipped: planId={}, state={}", planId, plan.state());
                    return plan;
                }
                plan = publish(handle, plan.toBuilder().state(RolloutState.EVALUATING).updatedAt(clock.instant()).build());
                try {
                    return evaluateStep(handle, plan);
                } catch (RuntimeException e) {
                    if (handle.plan.isTerminal()) {
                        throw e;
                    }
                    log.error("Evaluation failed, aborting plan: planId={}, model={}, step={}",
                            planId, plan.model(), plan.stepIndex(), e);
                    return terminate(handle, RolloutState.ABORTED, "Evaluation failed: " + e.getMessage(), true);
                }
            }
        } finally {
            MDC.remove("planId");
        }
    }

    // Caller holds the plan monitor.
    private RolloutPlan evaluateStep(PlanHandle handle, RolloutPlan plan) {
        RolloutConfig config = plan.config();
        Instant now = clock.instant();
        AggregateWindow canary = collector.getAggregate(plan.canaryEndpointId(), config.evaluationInterval());
        AggregateWindow baseline = collector.getAggregate(plan.baselineWeights().keySet(), config.evaluationInterval());

        AggregateWindow reference = plan.baselineReference();
        if (baseline.sampleCount() >= config.minSampleCount()) {
            reference = baseline;
        }

        if (canary.sampleCount() < config.minSampleCount() || reference == null) {
            int deferrals = plan.deferrals() + 1;
            String detail = "canarySamples=" + canary.sampleCount() + ", baselineSamples=" + baseline.sampleCount()
                    + ", required=" + config.minSampleCount();
            log.info("Evaluation deferred: model={}, step={}, deferrals={}/{}, {}",
                    plan.model(), plan.stepIndex(), deferrals, config.maxDeferrals(), detail);

            RolloutPlan deferred = plan.toBuilder()
                    .deferrals(deferrals)
                    .baselineReference(reference)
                    .build()
                    .withEvaluation(new EvaluationRecord(now, plan.stepIndex(), plan.canaryTraffic(), canary,
                            baseline, List.of(),
                            deferrals >= config.maxDeferrals()
                                    ? EvaluationRecord.Decision.ABORT
                                    : EvaluationRecord.Decision.DEFER,
                            detail));

            if (deferrals >= config.maxDeferrals()) {
                publish(handle, deferred);
                RolloutPlan aborted = terminate(handle, RolloutState.ABORTED,
                        "Evaluation inconclusive after " + deferrals + " deferrals: " + detail, true);
                throw new EvaluationInconclusiveException(aborted.id(), deferrals, detail);
            }
            return publish(handle, deferred.toBuilder().state(RolloutState.RAMPING).updatedAt(now).build());
        }

        List<DeltaComparison.CriterionResult> criteria =
                DeltaComparison.evaluate(config.successCriteria(), reference, canary);
        boolean passed = DeltaComparison.allPassed(criteria);
        RolloutPlan evaluated = plan.toBuilder()
                .deferrals(0)
                .baselineReference(reference)
                .build();

        if (!passed) {
            String reason = "Success criteria breached at " + plan.canaryTraffic() + "%: " + criteria.stream()
                    .filter(c -> !c.passed())
                    .map(DeltaComparison.CriterionResult::toString)
                    .toList();
            publish(handle, evaluated.withEvaluation(new EvaluationRecord(now, plan.stepIndex(),
                    plan.canaryTraffic(), canary, reference, criteria, EvaluationRecord.Decision.ROLLBACK, reason)));
            return terminate(handle, RolloutState.ROLLED_BACK, reason, true);
        }

        if (plan.isFinalStep()) {
            return promote(handle, evaluated.withEvaluation(new EvaluationRecord(now, plan.stepIndex(),
                    plan.canaryTraffic(), canary, reference, criteria, EvaluationRecord.Decision.PROMOTE,
                    "Final step passed")));
        }

        int nextIndex = plan.stepIndex() + 1;
        int nextTraffic = config.trafficSteps().get(nextIndex);
        commitStep(plan, nextTraffic);
        RolloutPlan advanced = publish(handle, evaluated
                .withEvaluation(new EvaluationRecord(now, plan.stepIndex(), plan.canaryTraffic(), canary,
                        reference, criteria, EvaluationRecord.Decision.ADVANCE,
                        "Advancing to " + nextTraffic + "%"))
                .toBuilder()
                .state(RolloutState.RAMPING)
                .stepIndex(nextIndex)
                .canaryTraffic(nextTraffic)
                .updatedAt(now)
                .build());
        log.info("Canary advanced: model={}, step={}, canaryTraffic={}", plan.model(), nextIndex, nextTraffic);
        notify(ControllerEvent.Type.CANARY_STEP_ADVANCED, advanced,
                "Canary advanced to " + nextTraffic + "% of traffic");
        return advanced;
    }

    // Caller holds the plan monitor.
    private RolloutPlan promote(PlanHandle handle, RolloutPlan plan) {
        Map<String, EndpointState> states = new HashMap<>();
        states.put(plan.canaryEndpointId(), EndpointState.ACTIVE);
        List<String> retiring = registry.getSnapshot(plan.model()).endpoints().stream()
                .map(ModelEndpoint::id)
                .filter(plan.baselineWeights()::containsKey)
                .toList();
        retiring.forEach(id -> states.put(id, EndpointState.RETIRING));
        registry.commitWeights(plan.model(), Map.of(plan.canaryEndpointId(), 100), states);
        retiring.forEach(drainer::retire);

        Instant now = clock.instant();
        RolloutPlan succeeded = plan.toBuilder()
                .state(RolloutState.SUCCEEDED)
                .canaryTraffic(100)
                .updatedAt(now)
                .build();
        finish(handle, succeeded);
        log.info("Canary promoted: model={}, version={}, retiring={}",
                plan.model(), plan.config().canaryVersion(), retiring);
        notify(ControllerEvent.Type.CANARY_SUCCEEDED, succeeded,
                "Canary " + plan.config().canaryVersion() + " promoted to 100%");
        return succeeded;
    }

    /**
     * Aborts a non-terminal plan through the rollback path.
     *
     * @return false if the plan was already terminal
     */
    public boolean cancel(String planId) {
        PlanHandle handle = handle(planId);
        MDC.put("planId", planId);
        try {
            synchronized (handle) {
                if (handle.plan.isTerminal()) {
                    return false;
                }
                terminate(handle, RolloutState.ABORTED, "Cancelled by operator", true);
                return true;
            }
        } finally {
            MDC.remove("planId");
        }
    }

    public Optional<RolloutPlan> getPlan(String planId) {
        PlanHandle handle = plans.get(planId);
        if (handle != null) {
            return Optional.of(handle.plan);
        }
        return store.get(PLAN_PREFIX + planId, RolloutPlan.class);
    }

    public List<RolloutPlan> activePlans() {
        return plans.values().stream()
                .map(h -> h.plan)
                .filter(p -> !p.isTerminal())
                .sorted(Comparator.comparing(RolloutPlan::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public List<RolloutPlan> plansFor(String model) {
        return plans.values().stream()
                .map(h -> h.plan)
                .filter(p -> p.model().equals(model))
                .sorted(Comparator.comparing(RolloutPlan::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Reloads the persisted non-terminal plan of a model after a restart and reschedules it.
     * A plan that crashed before reaching RAMPING is aborted.
     */
    public Optional<RolloutPlan> resume(String model) {
        Optional<String> planId = store.get(ACTIVE_PREFIX + model, String.class);
        if (planId.isEmpty()) {
            return Optional.empty();
        }
        Optional<RolloutPlan> persisted = store.get(PLAN_PREFIX + planId.get(), RolloutPlan.class);
        if (persisted.isEmpty() || persisted.get().isTerminal()) {
            store.delete(ACTIVE_PREFIX + model);
            return Optional.empty();
        }
        RolloutPlan plan = persisted.get();
        if (!leases.tryAcquire(model, plan.id())) {
            log.warn("Cannot resume plan, model leased by another rollout: planId={}, model={}", plan.id(), model);
            return Optional.empty();
        }
        PlanHandle handle = new PlanHandle(plan);
        plans.put(plan.id(), handle);

        synchronized (handle) {
            if (plan.state() == RolloutState.PENDING) {
                boolean registered = registry.findEndpoint(plan.canaryEndpointId()).isPresent();
                return Optional.of(terminate(handle, RolloutState.ABORTED, "Interrupted during start", registered));
            }
            RolloutPlan resumed = publish(handle, plan.toBuilder()
                    .state(RolloutState.RAMPING)
                    .updatedAt(clock.instant())
                    .build());
            schedule(handle);
            log.info("Canary plan resumed: planId={}, model={}, step={}, canaryTraffic={}",
                    plan.id(), model, plan.stepIndex(), plan.canaryTraffic());
            return Optional.of(resumed);
        }
    }

    /**
     * Moves a plan to a terminal state. Unless the canary was never registered, the baseline
     * weights are restored and the canary retired in one commit.
     */
    // Caller holds the plan monitor.
    private RolloutPlan terminate(PlanHandle handle, RolloutState state, String reason, boolean rollback) {
        RolloutPlan plan = handle.plan;
        if (rollback) {
            try {
                rollbackWeights(plan);
            } catch (RuntimeException e) {
                log.error("Rollback commit failed, registry left as is: model={}, canary={}",
                        plan.model(), plan.canaryEndpointId(), e);
                reason = reason + " (rollback failed: " + e.getMessage() + ")";
            }
        }
        RolloutPlan terminal = plan.toBuilder()
                .state(state)
                .stepIndex(0)
                .canaryTraffic(0)
                .failureReason(reason)
                .updatedAt(clock.instant())
                .build();
        finish(handle, terminal);

        if (state == RolloutState.ROLLED_BACK) {
            log.warn("Canary rolled back: model={}, reason={}", plan.model(), reason);
            notify(ControllerEvent.Type.CANARY_ROLLED_BACK, terminal, reason);
        } else {
            log.warn("Canary aborted: model={}, reason={}", plan.model(), reason);
            notify(ControllerEvent.Type.CANARY_ABORTED, terminal, reason);
        }
        return terminal;
    }

    private void rollbackWeights(RolloutPlan plan) {
        String canaryId = plan.canaryEndpointId();
        RegistrySnapshot snapshot = registry.getSnapshot(plan.model());
        if (!snapshot.contains(canaryId)) {
            return;
        }
        Map<String, Integer> present = new LinkedHashMap<>();
        plan.baselineWeights().forEach((id, weight) -> {
            if (snapshot.contains(id)) {
                present.put(id, weight);
            }
        });
        if (present.isEmpty()) {
            log.error("Rollback impossible, no baseline endpoint left: model={}, canary={}", plan.model(), canaryId);
            return;
        }
        Map<String, EndpointState> states = new HashMap<>();
        states.put(canaryId, EndpointState.RETIRING);
        present.keySet().forEach(id -> states.put(id, EndpointState.ACTIVE));
        registry.commitWeights(plan.model(), WeightPlanner.split(100, present), states);
        drainer.retire(canaryId);
    }

    /**
     * Commits the canary at the given weight and the baselines at the proportional remainder.
     */
    private void commitStep(RolloutPlan plan, int canaryTraffic) {
        Map<String, Integer> weights = new HashMap<>(WeightPlanner.split(100 - canaryTraffic, plan.baselineWeights()));
        weights.put(plan.canaryEndpointId(), canaryTraffic);
        registry.commitWeights(plan.model(), weights, Map.of(plan.canaryEndpointId(), EndpointState.CANARY));
    }

    private Map<String, Integer> baselineWeights(RegistrySnapshot snapshot, RolloutConfig config) {
        if (snapshot.endpoints().isEmpty()) {
            throw new ValidationException("Unknown model: " + config.model());
        }
        if (snapshot.canary().isPresent()) {
            throw new ValidationException("Model " + config.model() + " already has a canary: "
                    + snapshot.canary().get().id());
        }
        Map<String, Integer> weights = new LinkedHashMap<>();
        for (ModelEndpoint endpoint : snapshot.servingEndpoints()) {
            if (!endpoint.version().equals(config.baselineVersion())) {
                throw new ValidationException("Endpoint " + endpoint.id() + " serves version " + endpoint.version()
                        + ", expected baseline " + config.baselineVersion());
            }
            if (endpoint.state() != EndpointState.ACTIVE) {
                throw new ValidationException("Baseline endpoint " + endpoint.id() + " is " + endpoint.state());
            }
            weights.put(endpoint.id(), endpoint.weight());
        }
        return weights;
    }

    private void schedule(PlanHandle handle) {
        long interval = handle.plan.config().evaluationInterval().toMillis();
        String planId = handle.plan.id();
        handle.task = scheduler.scheduleWithFixedDelay(() -> evaluateScheduled(planId),
                interval, interval, TimeUnit.MILLISECONDS);
    }

    private void evaluateScheduled(String planId) {
        try {
            evaluate(planId);
        } catch (EvaluationInconclusiveException e) {
            log.warn("Scheduled evaluation aborted plan: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled evaluation failed: planId={}", planId, e);
        }
    }

    // Caller holds the plan monitor.
    private void finish(PlanHandle handle, RolloutPlan terminal) {
        publish(handle, terminal);
        ScheduledFuture<?> task = handle.task;
        if (task != null) {
            task.cancel(false);
            handle.task = null;
        }
        leases.release(terminal.model(), terminal.id());
        safeDelete(ACTIVE_PREFIX + terminal.model());
    }

    private RolloutPlan publish(PlanHandle handle, RolloutPlan plan) {
        RolloutState previous = handle.plan.state();
        handle.plan = plan;
        try {
            store.put(PLAN_PREFIX + plan.id(), plan);
        } catch (RuntimeException e) {
            log.error("Failed to persist rollout plan: planId={}", plan.id(), e);
        }
        if (previous != plan.state() || handle.transitions++ == 0) {
            metrics.incrementRolloutTransition("canary", plan.model(), plan.state().name());
        }
        return plan;
    }

    private void deleteDeployment(String endpointId) {
        try {
            backend.delete(endpointId);
        } catch (RuntimeException e) {
            log.error("Backend delete failed: endpointId={}", endpointId, e);
        }
    }

    private void safeDelete(String key) {
        try {
            store.delete(key);
        } catch (RuntimeException e) {
            log.error("Failed to delete store key: {}", key, e);
        }
    }

    private void notify(ControllerEvent.Type type, RolloutPlan plan, String message) {
        try {
            sink.notify(new ControllerEvent(type, plan.model(), plan.id(), message, clock.instant(), Map.of(
                    "canaryVersion", plan.config().canaryVersion(),
                    "baselineVersion", plan.config().baselineVersion(),
                    "canaryTraffic", plan.canaryTraffic(),
                    "state", plan.state().name())));
        } catch (RuntimeException e) {
            log.error("Notification failed: type={}, planId={}", type, plan.id(), e);
        }
    }

    private PlanHandle handle(String planId) {
        PlanHandle handle = plans.get(planId);
        if (handle == null) {
            throw new ValidationException("Unknown rollout plan: " + planId);
        }
        return handle;
    }

    @Override
    public void close() {
        for (PlanHandle handle : plans.values()) {
            ScheduledFuture<?> task = handle.task;
            if (task != null) {
                task.cancel(false);
            }
        }
    }

    private static final class PlanHandle {
        private volatile RolloutPlan plan;
        private ScheduledFuture<?> task;
        private int transitions;

        private PlanHandle(RolloutPlan plan) {
            this.plan = plan;
        }
    }
}
