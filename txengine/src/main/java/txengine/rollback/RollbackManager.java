package txengine.rollback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txengine.AtomicOperation;
import txengine.IdGenerator;
import txengine.ValidationResult;
import txengine.alert.TransactionAlertLogger;
import txengine.config.EngineConfig;
import txengine.exceptions.RollbackPointNotFoundException;
import txengine.exceptions.RollbackStrategyNotFoundException;
import txengine.state.SnapshotMetadata;
import txengine.state.StateManager;
import txengine.transaction.TransactionContext;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds and runs undo plans, and assesses rollback points before they are
 * restored.
 *
 * <p>A {@link RollbackStrategy} wraps each operation's own
 * {@link AtomicOperation#rollback} as a {@link RollbackStep}. Strategies run
 * either in order or concurrently on a bounded worker pool; in both cases
 * {@link #executeRollbackStrategy(String)} reports failure through its return
 * value rather than by throwing.
 *
 * <p>Rollback points are registered here by the
 * {@link txengine.engine.TransactionManager} as they are created, which is what
 * feasibility checks and impact analysis work from.
 *
 * @see RollbackStrategy
 * @see RollbackPoint
 */
public class RollbackManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RollbackManager.class);

    /** Assumed restore throughput for downtime estimates. */
    static final long RESTORE_BYTES_PER_SECOND = 10L * 1024 * 1024;

    static final int MEDIUM_RISK_LATER_POINTS = 5;

    private final StateManager stateManager;
    private final TransactionAlertLogger alerts;
    private final Duration maxAge;
    private final ExecutorService workers;

    private final ConcurrentMap<String, RollbackStrategy> strategies = new ConcurrentHashMap<>();
    // registration order; "later" means registered after. Guarded by itself.
    private final Map<String, RollbackPoint> points = new LinkedHashMap<>();

    /**
     * Creates a rollback manager with default configuration.
     *
     * @param stateManager used to validate the snapshots behind rollback points (must not be null)
     */
    public RollbackManager(StateManager stateManager) {
        this(stateManager, new TransactionAlertLogger(EngineConfig.DEFAULTS.alertLevel()), EngineConfig.DEFAULTS);
    }

    /**
     * Creates a rollback manager.
     *
     * @param stateManager used to validate the snapshots behind rollback points (must not be null)
     * @param alerts event logger (must not be null)
     * @param config parallelism and rollback point age settings (must not be null)
     */
    public RollbackManager(StateManager stateManager, TransactionAlertLogger alerts, EngineConfig config) {
        this.stateManager = Objects.requireNonNull(stateManager);
        this.alerts = Objects.requireNonNull(alerts);
        this.maxAge = config.rollbackMaxAge();
        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.rollbackParallelism(), r -> {
            Thread t = new Thread(r, "txengine-rollback-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------- strategies ----------------

    /**
     * Builds an undo plan with a context carrying only the strategy id.
     *
     * @see #createRollbackStrategy(List, RollbackType, TransactionContext)
     */
    public RollbackStrategy createRollbackStrategy(List<? extends AtomicOperation<?>> operations, RollbackType type) {
        return createRollbackStrategy(operations, type, null);
    }

    /**
     * Builds an undo plan for already executed operations.
     *
     * <p>Steps keep the order of {@code operations}; pass them reversed to undo in
     * reverse execution order. Each step is estimated at half the operation's
     * timeout. A step gets {@link RiskLevel#HIGH} when an operation that depends
     * on it is undone after it, otherwise {@link RiskLevel#MEDIUM}.
     *
     * @param operations the operations to undo, in undo order
     * @param type sequential or parallel execution
     * @param context context handed to each rollback (null for a bare context)
     * @return the registered strategy
     */
    public RollbackStrategy createRollbackStrategy(List<? extends AtomicOperation<?>> operations,
                                                   RollbackType type,
                                                   TransactionContext context) {
        String strategyId = IdGenerator.next(IdGenerator.STRATEGY);
        TransactionContext ctx = context != null ? context : TransactionContext.of(strategyId);

        List<RollbackStep> steps = new ArrayList<>(operations.size());
        Duration total = Duration.ZERO;
        RiskLevel overall = RiskLevel.LOW;
        for (int i = 0; i < operations.size(); i++) {
            AtomicOperation<?> op = operations.get(i);
            RiskLevel risk = undoneBeforeDependent(op, operations.subList(i + 1, operations.size()))
                    ? RiskLevel.HIGH
                    : RiskLevel.MEDIUM;
            Duration estimate = op.timeout().dividedBy(2);
            steps.add(new RollbackStep(
                    "rollback_" + op.id(),
                    "Rollback " + op.name(),
                    op.id(),
                    () -> op.rollback(ctx),
                    estimate,
                    risk));
            total = total.plus(estimate);
            overall = overall.max(risk);
        }

        List<String> dependencies = operations.stream().map(AtomicOperation::id).toList();
        RollbackStrategy strategy = new RollbackStrategy(strategyId, type, steps, total, overall, dependencies);
        strategies.put(strategyId, strategy);
        log.debug("Created {}", strategy);
        return strategy;
    }

    private static boolean undoneBeforeDependent(AtomicOperation<?> op, List<? extends AtomicOperation<?>> undoneLater) {
        for (AtomicOperation<?> later : undoneLater) {
            if (later.dependencies().contains(op.id())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Runs a strategy's undo steps. A strategy runs at most once; it is
     * discarded as soon as it starts.
     *
     * @param strategyId the strategy to run
     * @return true only if every step completed without error
     * @throws RollbackStrategyNotFoundException if the strategy is unknown
     */
    public boolean executeRollbackStrategy(String strategyId) throws RollbackStrategyNotFoundException {
        RollbackStrategy strategy = strategies.remove(strategyId);
        if (strategy == null) {
            throw new RollbackStrategyNotFoundException(strategyId);
        }

        boolean ok = strategy.type() == RollbackType.SEQUENTIAL
                ? runSequential(strategy)
                : runParallel(strategy);
        if (ok) {
            alerts.strategyExecuted(strategyId, strategy.type(), strategy.steps().size());
        }
        return ok;
    }

    /**
     * @return the strategy with this id, if it was created here and has not run yet
     */
    public Optional<RollbackStrategy> getRollbackStrategy(String strategyId) {
        return Optional.ofNullable(strategies.get(strategyId));
    }

    private boolean runSequential(RollbackStrategy strategy) {
        for (RollbackStep step : strategy.steps()) {
            try {
                step.run();
            } catch (Exception e) {
                alerts.strategyFailed(strategy.id(), step.id(), e);
                return false;
            }
        }
        return true;
    }

    private boolean runParallel(RollbackStrategy strategy) {
        List<Future<?>> futures = new ArrayList<>(strategy.steps().size());
        for (RollbackStep step : strategy.steps()) {
            futures.add(workers.submit(() -> {
                step.run();
                return null;
            }));
        }

        boolean ok = true;
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (ExecutionException e) {
                alerts.strategyFailed(strategy.id(), strategy.steps().get(i).id(), e.getCause());
                ok = false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                alerts.strategyFailed(strategy.id(), strategy.steps().get(i).id(), e);
                return false;
            }
        }
        return ok;
    }

    // ---------------- rollback points ----------------

    /**
     * Makes a rollback point known to feasibility checks and impact analysis.
     * Registering the same id twice has no effect.
     */
    public void registerRollbackPoint(RollbackPoint point) {
        synchronized (points) {
            points.putIfAbsent(point.id(), point);
        }
    }

    /**
     * Drops rollback points that can no longer be restored, e.g. because their
     * transaction left the history.
     *
     * @return number of points that were registered
     */
    public int unregisterRollbackPoints(Collection<String> rollbackPointIds) {
        int removed = 0;
        synchronized (points) {
            for (String id : rollbackPointIds) {
                if (points.remove(id) != null) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Unregistered {} rollback point(s)", removed);
        }
        return removed;
    }

    public Optional<RollbackPoint> getRollbackPoint(String rollbackPointId) {
        synchronized (points) {
            return Optional.ofNullable(points.get(rollbackPointId));
        }
    }

    /**
     * Checks whether a rollback point can still be restored safely.
     *
     * <p>Invalid when the point is unknown, has no state snapshot, or a referenced
     * snapshot fails validation. Warns when the point is older than the configured
     * maximum age or when later rollback points exist, whose changes a restore
     * would discard.
     *
     * @param rollbackPointId the point to check
     * @return the feasibility verdict
     */
    public ValidationResult validateRollbackFeasibility(String rollbackPointId) {
        RollbackPoint point = getRollbackPoint(rollbackPointId).orElse(null);
        if (point == null) {
            return ValidationResult.invalid("Rollback point not found: " + rollbackPointId);
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (point.snapshots().isEmpty()) {
            errors.add("Rollback point " + rollbackPointId + " references no snapshot");
        }
        for (SnapshotMetadata snapshot : point.snapshots().values()) {
            errors.addAll(stateManager.validateSnapshot(snapshot.id()).errors());
        }

        if (!maxAge.isZero() && point.timestamp().plus(maxAge).isBefore(Instant.now())) {
            warnings.add("Rollback point is older than " + maxAge.toSeconds() + "s; dependent state may have moved on");
        }
        List<RollbackPoint> later = laterThan(point);
        if (!later.isEmpty()) {
            warnings.add(later.size() + " later rollback point(s) exist; their changes will be discarded");
        }

        return ValidationResult.of(errors, warnings);
    }

    /**
     * Estimates what restoring a rollback point would affect.
     *
     * @param rollbackPointId the point to analyse
     * @return the impact analysis
     * @throws RollbackPointNotFoundException if the point was never registered
     */
    public RollbackImpactAnalysis getRollbackImpactAnalysis(String rollbackPointId) throws RollbackPointNotFoundException {
        RollbackPoint point = getRollbackPoint(rollbackPointId)
                .orElseThrow(() -> new RollbackPointNotFoundException(rollbackPointId));

        List<String> services = new ArrayList<>(new TreeSet<>(point.snapshots().keySet()));
        List<RollbackPoint> later = laterThan(point);

        Set<String> users = new LinkedHashSet<>();
        for (RollbackPoint p : later) {
            p.userId().ifPresent(users::add);
        }

        boolean intact = true;
        long totalBytes = 0;
        for (SnapshotMetadata snapshot : point.snapshots().values()) {
            totalBytes += snapshot.size();
            if (!stateManager.validateSnapshot(snapshot.id()).valid()) {
                intact = false;
            }
        }

        RiskLevel risk;
        if (!intact || later.size() > MEDIUM_RISK_LATER_POINTS) {
            risk = RiskLevel.HIGH;
        } else if (!later.isEmpty()) {
            risk = RiskLevel.MEDIUM;
        } else {
            risk = RiskLevel.LOW;
        }

        Duration downtime = Duration.ofMillis(Math.max(1000L, totalBytes * 1000L / RESTORE_BYTES_PER_SECOND));

        List<String> recommendations = new ArrayList<>();
        recommendations.add("Create backup before rollback");
        if (!users.isEmpty()) {
            recommendations.add("Notify " + users.size() + " affected user(s) of maintenance");
        }
        if (!later.isEmpty()) {
            recommendations.add("Review changes made after " + point.timestamp());
        }
        if (!intact) {
            recommendations.add("Snapshot failed validation; choose an earlier rollback point");
        }

        return new RollbackImpactAnalysis(
                services,
                users.size(),
                risk,
                downtime,
                later.stream().map(RollbackPoint::id).toList(),
                recommendations);
    }

    private List<RollbackPoint> laterThan(RollbackPoint point) {
        List<RollbackPoint> later = new ArrayList<>();
        boolean seen = false;
        synchronized (points) {
            for (RollbackPoint p : points.values()) {
                if (seen) {
                    later.add(p);
                } else if (p.id().equals(point.id())) {
                    seen = true;
                }
            }
        }
        return later;
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
