package txengine.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import txengine.AtomicOperation;
import txengine.IdGenerator;
import txengine.ValidationResult;
import txengine.alert.TransactionAlertLogger;
import txengine.config.EngineConfig;
import txengine.config.EngineConfigLoader;
import txengine.exceptions.InvalidTransactionStateException;
import txengine.exceptions.MigrationStepException;
import txengine.exceptions.OperationValidationException;
import txengine.exceptions.RollbackPointNotFoundException;
import txengine.exceptions.RollbackStrategyNotFoundException;
import txengine.exceptions.TransactionException;
import txengine.exceptions.TransactionNotFoundException;
import txengine.migration.MigrationPlan;
import txengine.migration.MigrationResult;
import txengine.migration.MigrationStep;
import txengine.migration.RollbackScope;
import txengine.rollback.RollbackManager;
import txengine.rollback.RollbackPoint;
import txengine.rollback.RollbackPointType;
import txengine.rollback.RollbackStrategy;
import txengine.rollback.RollbackType;
import txengine.state.InMemorySnapshotStore;
import txengine.state.SnapshotMetadata;
import txengine.state.StateManager;
import txengine.state.StateProvider;
import txengine.transaction.Transaction;
import txengine.transaction.TransactionContext;
import txengine.transaction.TransactionHistory;
import txengine.transaction.TransactionOptions;
import txengine.transaction.TransactionResult;
import txengine.transaction.TransactionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Entry point of the engine: runs operations atomically, runs migrations and
 * keeps the registry of active transactions and the history of finished ones.
 *
 * <p>Every public "execute" method follows the same shape:
 * <ol>
 *   <li>begin a transaction and register it as active</li>
 *   <li>validate the operations; a failure is archived as FAILED and raised
 *       as {@link OperationValidationException} without undoing anything</li>
 *   <li>optionally take a checkpoint</li>
 *   <li>run the work; on error, roll the transaction back, archive the result
 *       and rethrow the original exception</li>
 *   <li>commit and archive</li>
 * </ol>
 * Whatever the outcome, the transaction leaves the active set and exactly one
 * {@link TransactionResult} is appended to the history.
 *
 * <h2>Example:</h2>
 * <pre>
 * try (TransactionManager manager = TransactionManager.create(provider, EngineConfig.DEFAULTS)) {
 *     TransactionResult&lt;Long&gt; result = manager.executeAtomicOperation(
 *             new InsertRow(row),
 *             TransactionOptions.builder().createCheckpoint(true).userId("alice").build());
 * }
 * </pre>
 *
 * <p>Instances are thread-safe; independent managers share nothing.
 */
public final class TransactionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransactionManager.class);

    private final StateManager stateManager;
    private final RollbackManager rollbackManager;
    private final TransactionAlertLogger alerts;
    private final SessionProvider sessionProvider;
    private final boolean enforceTimeouts;

    private final ConcurrentMap<String, Transaction> activeTransactions = new ConcurrentHashMap<>();
    private final TransactionHistory history;

    /**
     * Creates a manager with default configuration and no session provider.
     */
    public TransactionManager(StateManager stateManager,
                              RollbackManager rollbackManager,
                              TransactionAlertLogger alerts) {
        this(stateManager, rollbackManager, alerts, SessionProvider.NONE, EngineConfig.DEFAULTS);
    }

    /**
     * Creates a manager.
     *
     * @param stateManager snapshot storage shared with {@code rollbackManager} (must not be null)
     * @param rollbackManager undo planning and rollback point registry (must not be null)
     * @param alerts event logger (must not be null)
     * @param sessionProvider supplies user and session when the options carry none (must not be null)
     * @param config history size and timeout enforcement (must not be null)
     */
    public TransactionManager(StateManager stateManager,
                              RollbackManager rollbackManager,
                              TransactionAlertLogger alerts,
                              SessionProvider sessionProvider,
                              EngineConfig config) {
        this.stateManager = Objects.requireNonNull(stateManager);
        this.rollbackManager = Objects.requireNonNull(rollbackManager);
        this.alerts = Objects.requireNonNull(alerts);
        this.sessionProvider = Objects.requireNonNull(sessionProvider);
        this.enforceTimeouts = config.operationTimeoutEnforced();
        this.history = new TransactionHistory(config.historySize());
        log.debug("Created transaction manager with {}", config);
    }

    /**
     * Wires a manager with an in-memory snapshot store.
     *
     * @param stateProvider captures and applies the live state
     * @param config engine configuration
     * @return a new manager; close it to release the rollback workers
     */
    public static TransactionManager create(StateProvider stateProvider, EngineConfig config) {
        TransactionAlertLogger alerts = new TransactionAlertLogger(config.alertLevel());
        StateManager stateManager = new StateManager(stateProvider, new InMemorySnapshotStore(), alerts, config);
        RollbackManager rollbackManager = new RollbackManager(stateManager, alerts, config);
        return new TransactionManager(stateManager, rollbackManager, alerts, SessionProvider.NONE, config);
    }

    /**
     * Same as {@link #create(StateProvider, EngineConfig)} with the configuration
     * found on the classpath.
     *
     * @see EngineConfigLoader#load()
     */
    public static TransactionManager createFromClasspathConfig(StateProvider stateProvider) {
        return create(stateProvider, EngineConfigLoader.load());
    }

    // ---------------- transactions ----------------

    /**
     * Creates a PENDING transaction and registers it as active.
     *
     * @param options user, session, metadata and isolation label (null for defaults)
     * @return the new transaction
     */
    public Transaction beginTransaction(TransactionOptions options) {
        TransactionOptions opts = options != null ? options : TransactionOptions.DEFAULTS;
        String id = IdGenerator.next(IdGenerator.TRANSACTION);

        String userId = opts.userId() != null ? opts.userId() : sessionProvider.currentUserId().orElse(null);
        String sessionId = opts.sessionId() != null ? opts.sessionId() : sessionProvider.currentSessionId().orElse(null);

        TransactionContext context = new TransactionContext(id, userId, sessionId, Instant.now(), opts.metadata());
        Transaction transaction = new Transaction(id, context, stateManager, alerts);
        if (opts.isolationLevel() != null) {
            transaction.setIsolationLevel(opts.isolationLevel());
        }

        activeTransactions.put(id, transaction);
        alerts.transactionStarted(id, userId);
        return transaction;
    }

    /**
     * Runs one operation in a new transaction.
     *
     * <p>The operation is added to the transaction before it executes, so an
     * execution error invokes the operation's own {@code rollback}.
     *
     * @param operation the operation to run
     * @param options transaction options (null for defaults)
     * @return the COMMITTED result carrying the operation's return value
     * @throws OperationValidationException if the operation does not validate; nothing ran
     * @throws Exception the operation's own error, unchanged, after the rollback
     */
    public <T> TransactionResult<T> executeAtomicOperation(AtomicOperation<T> operation,
                                                           TransactionOptions options) throws Exception {
        Objects.requireNonNull(operation, "operation");
        TransactionOptions opts = options != null ? options : TransactionOptions.DEFAULTS;
        Transaction tx = beginTransaction(opts);
        long start = System.nanoTime();
        try {
            rejectInvalid(tx, List.of(operation), start);

            T value;
            try {
                if (opts.createCheckpoint()) {
                    createCheckpoint(tx, "Before " + operation.name(), RollbackPointType.CHECKPOINT);
                }
                tx.addOperation(operation);
                value = tx.execute(() -> invoke(operation, tx.getContext()));
                tx.commit();
            } catch (Exception e) {
                abort(tx, e, List.of(), start);
                throw e;
            }

            TransactionResult<T> result = TransactionResult.committed(tx, value, List.of(operation.id()), elapsed(start));
            archive(tx, result);
            return result;
        } finally {
            activeTransactions.remove(tx.getId());
        }
    }

    /**
     * Runs several operations, in order, in one new transaction.
     *
     * <p>All operations are validated before any executes. An operation is added
     * to the transaction only once its {@code execute} returned, so on failure
     * exactly the operations that ran to completion are rolled back (in reverse)
     * and the failing one is not.
     *
     * @param operations the operations in execution order
     * @param options transaction options (null for defaults)
     * @return the COMMITTED result; {@code executedOperations} lists every operation id
     * @throws OperationValidationException for the first operation that does not validate; nothing ran
     * @throws Exception the failing operation's error, unchanged, after the rollback
     */
    public TransactionResult<Void> executeAtomicOperations(List<? extends AtomicOperation<?>> operations,
                                                           TransactionOptions options) throws Exception {
        Objects.requireNonNull(operations, "operations");
        TransactionOptions opts = options != null ? options : TransactionOptions.DEFAULTS;
        Transaction tx = beginTransaction(opts);
        long start = System.nanoTime();
        try {
            rejectInvalid(tx, operations, start);

            List<String> executed = new ArrayList<>(operations.size());
            try {
                if (opts.createCheckpoint()) {
                    createCheckpoint(tx, "Before batch of " + operations.size() + " operations",
                            RollbackPointType.CHECKPOINT);
                }
                for (AtomicOperation<?> operation : operations) {
                    tx.execute(() -> invoke(operation, tx.getContext()));
                    tx.addOperation(operation);
                    executed.add(operation.id());
                }
                tx.commit();
            } catch (Exception e) {
                abort(tx, e, executed, start);
                throw e;
            }

            TransactionResult<Void> result = TransactionResult.committed(tx, null, executed, elapsed(start));
            archive(tx, result);
            return result;
        } finally {
            activeTransactions.remove(tx.getId());
        }
    }

    private void rejectInvalid(Transaction tx, List<? extends AtomicOperation<?>> operations, long start)
            throws OperationValidationException, InvalidTransactionStateException {
        for (AtomicOperation<?> operation : operations) {
            ValidationResult validation = validate(operation, tx.getContext());
            if (!validation.valid()) {
                OperationValidationException e = new OperationValidationException(
                        operation.id(), operation.name(), validation.errors(), tx.getId());
                tx.markFailed();
                alerts.transactionFailed(tx.getId(), tx.getStatus(), e);
                record(tx, TransactionResult.failed(tx, e, List.of(), elapsed(start)));
                throw e;
            }
            for (String warning : validation.warnings()) {
                log.warn("Operation {} validation warning: {}", operation.name(), warning);
            }
        }
    }

    private static ValidationResult validate(AtomicOperation<?> operation, TransactionContext context) {
        try {
            return operation.validate(context);
        } catch (Exception e) {
            return ValidationResult.invalid("Validation threw " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private <R> R invoke(AtomicOperation<R> operation, TransactionContext context) throws Exception {
        if (enforceTimeouts) {
            return TimeoutExecutor.call(operation.name(), operation.timeout(), () -> operation.execute(context));
        }
        return operation.execute(context);
    }

    /**
     * Rolls a failed transaction back and archives it. Problems while rolling
     * back are attached to {@code cause} as suppressed exceptions.
     */
    private void abort(Transaction tx, Exception cause, List<String> executed, long start) {
        try {
            tx.rollback();
        } catch (InvalidTransactionStateException e) {
            cause.addSuppressed(e);
            if (tx.getStatus() == TransactionStatus.ROLLED_BACK) {
                // cancelled while running; cancelTransaction archives it
                log.debug("Transaction {} was cancelled while running", tx.getId());
                return;
            }
        }
        alerts.transactionFailed(tx.getId(), tx.getStatus(), cause);
        record(tx, TransactionResult.failed(tx, cause, executed, elapsed(start)));
    }

    private void archive(Transaction tx, TransactionResult<?> result) {
        if (record(tx, result)) {
            alerts.transactionCommitted(result.transactionId(), result.duration().toMillis());
        }
    }

    /**
     * Appends the transaction's single history entry. Rollback points of
     * entries evicted to make room are unregistered.
     *
     * @return false if the transaction was already archived
     */
    private boolean record(Transaction tx, TransactionResult<?> result) {
        if (!tx.claimArchive()) {
            log.debug("Transaction {} already archived, dropping {} result", tx.getId(), result.status());
            return false;
        }
        forget(history.record(result));
        return true;
    }

    private void forget(List<TransactionResult<?>> dropped) {
        if (dropped.isEmpty()) {
            return;
        }
        List<String> pointIds = dropped.stream()
                .flatMap(r -> r.rollbackPoints().stream())
                .map(RollbackPoint::id)
                .toList();
        rollbackManager.unregisterRollbackPoints(pointIds);
    }

    private RollbackPoint createCheckpoint(Transaction tx, String description, RollbackPointType type)
            throws TransactionException {
        RollbackPoint point = tx.createCheckpoint(description, type);
        rollbackManager.registerRollbackPoint(point);
        return point;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    // ---------------- migrations ----------------

    /**
     * Runs migration steps strictly in the given order, each in its own
     * transaction preceded by a "Before step: &lt;name&gt;" checkpoint.
     *
     * <p>Before a step runs, its prerequisites must have completed and its
     * validation rules must pass. When a step fails, its transaction is rolled
     * back; under {@link RollbackScope#PHASE} the failing step's checkpoint is
     * restored and every completed step is undone in reverse completion order,
     * after which no step counts as completed. An invalid plan fails before any
     * step runs.
     *
     * <p>Failures are reported through the result; this method does not throw.
     *
     * @param steps the steps in execution order
     * @param options options applied to every step transaction (null for defaults)
     * @return the migration outcome
     */
    public MigrationResult executeMigration(List<MigrationStep> steps, TransactionOptions options) {
        Objects.requireNonNull(steps, "steps");
        TransactionOptions opts = options != null ? options : TransactionOptions.DEFAULTS;
        String migrationId = IdGenerator.next(IdGenerator.MIGRATION);
        long start = System.nanoTime();

        List<String> completed = new ArrayList<>();
        List<MigrationStep> completedSteps = new ArrayList<>();
        List<RollbackPoint> points = new ArrayList<>();
        Map<String, RollbackPoint> pointsByStep = new HashMap<>();

        alerts.migrationStarted(migrationId, steps.size());

        ValidationResult plan = MigrationPlan.validate(steps);
        if (!plan.valid()) {
            TransactionException error = new TransactionException(
                    "Invalid migration plan: " + String.join(", ", plan.errors()));
            alerts.migrationStepFailed(migrationId, "plan", error);
            return new MigrationResult(migrationId, false, completed, null, points, error,
                    elapsed(start), opts.metadata());
        }

        for (MigrationStep step : steps) {
            TransactionOptions stepOptions = opts.toBuilder()
                    .createCheckpoint(false)
                    .putMetadata("migrationId", migrationId)
                    .putMetadata("migrationStep", step.id())
                    .build();

            Transaction stepTx = beginTransaction(stepOptions);
            long stepStart = System.nanoTime();
            try {
                RollbackPoint point = createCheckpoint(stepTx, "Before step: " + step.name(),
                        RollbackPointType.MIGRATION_STEP);
                points.add(point);
                pointsByStep.put(step.id(), point);

                checkPreconditions(step, completed, stepTx.getContext());
                TransactionResult<Void> stepResult = executeAtomicOperations(step.operations(), stepOptions);

                stepTx.commit();
                archive(stepTx, TransactionResult.committed(stepTx, null, stepResult.executedOperations(),
                        elapsed(stepStart)));
                completed.add(step.id());
                completedSteps.add(step);
                alerts.migrationStepCompleted(migrationId, step.name());
            } catch (Exception e) {
                alerts.migrationStepFailed(migrationId, step.name(), e);
                abort(stepTx, e, List.of(), stepStart);
                if (step.rollbackStrategy() == RollbackScope.PHASE) {
                    rollbackPhase(migrationId, step, completedSteps, pointsByStep, e);
                    completed.clear();
                }
                return new MigrationResult(migrationId, false, completed, step.id(), points, e,
                        elapsed(start), opts.metadata());
            } finally {
                activeTransactions.remove(stepTx.getId());
            }
        }

        Duration duration = elapsed(start);
        alerts.migrationCompleted(migrationId, duration.toMillis());
        return new MigrationResult(migrationId, true, completed, null, points, null, duration, opts.metadata());
    }

    private static void checkPreconditions(MigrationStep step, List<String> completed, TransactionContext context)
            throws MigrationStepException {
        for (String prerequisite : step.prerequisites()) {
            if (!completed.contains(prerequisite)) {
                throw new MigrationStepException(step.id(), "Prerequisite step " + prerequisite + " has not completed");
            }
        }
        for (MigrationStep.ValidationRule rule : step.validationRules()) {
            ValidationResult verdict;
            try {
                verdict = rule.check(context);
            } catch (Exception e) {
                throw new MigrationStepException(step.id(), "Validation rule threw: " + e.getMessage(), e);
            }
            if (!verdict.valid()) {
                throw new MigrationStepException(step.id(),
                        "Validation rule failed: " + String.join(", ", verdict.errors()));
            }
        }
    }

    /**
     * Undoes the failing step's state and every completed step, newest first.
     * Each step's operations are undone in reverse before its checkpoint is
     * restored. Problems are attached to {@code cause} as suppressed exceptions;
     * the remaining steps are still undone.
     */
    private void rollbackPhase(String migrationId,
                               MigrationStep failed,
                               List<MigrationStep> completedSteps,
                               Map<String, RollbackPoint> pointsByStep,
                               Exception cause) {
        alerts.phaseRollback(migrationId, completedSteps.size());
        restoreQuietly(pointsByStep.get(failed.id()), cause);

        for (int i = completedSteps.size() - 1; i >= 0; i--) {
            MigrationStep step = completedSteps.get(i);
            List<AtomicOperation<?>> undoOrder = new ArrayList<>(step.operations());
            Collections.reverse(undoOrder);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("migrationId", migrationId);
            metadata.put("migrationStep", step.id());
            TransactionContext context = new TransactionContext(migrationId, null, null, Instant.now(), metadata);

            RollbackStrategy strategy = rollbackManager.createRollbackStrategy(undoOrder, RollbackType.SEQUENTIAL, context);
            try {
                if (!rollbackManager.executeRollbackStrategy(strategy.id())) {
                    cause.addSuppressed(new TransactionException(
                            "Undo of migration step " + step.id() + " did not complete"));
                }
            } catch (RollbackStrategyNotFoundException e) {
                cause.addSuppressed(e);
            }
            restoreQuietly(pointsByStep.get(step.id()), cause);
        }
    }

    private void restoreQuietly(RollbackPoint point, Exception cause) {
        if (point == null) {
            return;
        }
        if (!restore(point)) {
            cause.addSuppressed(new TransactionException("Could not restore rollback point " + point.id()));
        }
    }

    // ---------------- rollback points ----------------

    /**
     * Takes a checkpoint in an active transaction.
     *
     * @param transactionId the active transaction
     * @param type kind of marker
     * @param description human-readable description
     * @return the new rollback point
     * @throws TransactionNotFoundException if the transaction is not active
     * @throws TransactionException if the snapshot cannot be taken or the transaction is terminal
     */
    public RollbackPoint createRollbackPoint(String transactionId, RollbackPointType type, String description)
            throws TransactionException {
        Transaction tx = activeTransactions.get(transactionId);
        if (tx == null) {
            throw new TransactionNotFoundException(transactionId);
        }
        return createCheckpoint(tx, description, type);
    }

    /**
     * Restores the state behind a rollback point, looking in active transactions
     * first and then in the history.
     *
     * @param rollbackPointId the point to restore
     * @return true if the state was restored, false if the restore failed
     * @throws RollbackPointNotFoundException if no active or archived transaction has this point
     */
    public boolean executeRollback(String rollbackPointId) throws RollbackPointNotFoundException {
        for (Transaction tx : activeTransactions.values()) {
            for (RollbackPoint point : tx.getRollbackPoints()) {
                if (point.id().equals(rollbackPointId)) {
                    try {
                        tx.rollbackToCheckpoint(rollbackPointId);
                        return true;
                    } catch (TransactionException e) {
                        alerts.rollbackPointRestoreFailed(rollbackPointId, e);
                        return false;
                    }
                }
            }
        }

        List<TransactionResult<?>> archived = history.list();
        for (int i = archived.size() - 1; i >= 0; i--) {
            for (RollbackPoint point : archived.get(i).rollbackPoints()) {
                if (point.id().equals(rollbackPointId)) {
                    return restore(point);
                }
            }
        }

        throw new RollbackPointNotFoundException(rollbackPointId);
    }

    private boolean restore(RollbackPoint point) {
        Optional<SnapshotMetadata> snapshot = point.stateSnapshot();
        if (snapshot.isEmpty()) {
            log.debug("Rollback point {} has no state snapshot, nothing to restore", point.id());
            return true;
        }
        try {
            stateManager.restoreFromSnapshot(snapshot.get().id());
            return true;
        } catch (TransactionException e) {
            alerts.rollbackPointRestoreFailed(point.id(), e);
            return false;
        }
    }

    // ---------------- inspection ----------------

    /**
     * @throws TransactionNotFoundException if the transaction is neither active nor archived
     */
    public TransactionStatus getTransactionStatus(String transactionId) throws TransactionNotFoundException {
        Transaction tx = activeTransactions.get(transactionId);
        if (tx != null) {
            return tx.getStatus();
        }
        return history.find(transactionId)
                .map(TransactionResult::status)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    public List<Transaction> getActiveTransactions() {
        return List.copyOf(activeTransactions.values());
    }

    public Optional<Transaction> getTransaction(String transactionId) {
        return Optional.ofNullable(activeTransactions.get(transactionId));
    }

    /**
     * Rolls back an active transaction and archives it with
     * {@code metadata.cancelled=true}.
     *
     * @param transactionId the transaction to cancel
     * @return false if no such transaction is active or it can no longer be rolled back
     */
    public boolean cancelTransaction(String transactionId) {
        Transaction tx = activeTransactions.get(transactionId);
        if (tx == null) {
            return false;
        }

        Duration age = Duration.between(tx.getContext().timestamp(), Instant.now());
        try {
            tx.rollback();
        } catch (InvalidTransactionStateException e) {
            log.warn("Cannot cancel transaction {}: {}", transactionId, e.getMessage());
            return false;
        }
        activeTransactions.remove(transactionId);

        Map<String, Object> metadata = new LinkedHashMap<>(tx.getContext().metadata());
        metadata.put("cancelled", true);
        TransactionException reason = new TransactionException("Transaction cancelled", transactionId, null);
        record(tx, TransactionResult.failed(tx, reason, List.of(), age, metadata));
        alerts.transactionCancelled(transactionId);
        return true;
    }

    /** Returns the archived results, oldest first. */
    public List<TransactionResult<?>> getTransactionHistory() {
        return history.list();
    }

    /** Returns the archived results of one user, oldest first. */
    public List<TransactionResult<?>> getTransactionHistory(String userId) {
        return history.listByUser(userId);
    }

    /**
     * Removes archived results that completed before {@code cutoff}. Active
     * transactions are never touched.
     *
     * @return number of results removed
     */
    public int cleanupTransactions(Instant cutoff) {
        List<TransactionResult<?>> removed = history.removeOlderThan(cutoff);
        forget(removed);
        alerts.historyCleaned(removed.size());
        return removed.size();
    }

    public StateManager getStateManager() {
        return stateManager;
    }

    public RollbackManager getRollbackManager() {
        return rollbackManager;
    }

    @Override
    public void close() {
        rollbackManager.close();
    }
}
