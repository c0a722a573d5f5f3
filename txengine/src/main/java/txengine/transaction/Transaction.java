package txengine.transaction;

import txengine.AtomicOperation;
import txengine.IdGenerator;
import txengine.ValidationResult;
import txengine.alert.TransactionAlertLogger;
import txengine.exceptions.CheckpointNotFoundException;
import txengine.exceptions.InvalidTransactionStateException;
import txengine.exceptions.TransactionException;
import txengine.rollback.RollbackPoint;
import txengine.rollback.RollbackPointType;
import txengine.state.SnapshotMetadata;
import txengine.state.SnapshotType;
import txengine.state.StateManager;
import txengine.state.StateSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single unit of atomic work.
 *
 * <p>A transaction tracks its {@link TransactionStatus}, the operations added to
 * it (in insertion order) and the checkpoints taken while it was active.
 *
 * <h2>Lifecycle:</h2>
 * <ul>
 *   <li>{@link #execute} moves PENDING to ACTIVE; an error during execution
 *       sets FAILED and is rethrown. The transaction never rolls itself back;
 *       whoever calls {@code execute} decides whether to call {@link #rollback()}.</li>
 *   <li>{@link #commit()} ends in COMMITTED.</li>
 *   <li>{@link #rollback()} undoes every added operation in reverse order,
 *       best effort, and ends in ROLLED_BACK.</li>
 *   <li>{@link #rollbackToCheckpoint(String)} restores a checkpoint's snapshot
 *       without changing the status.</li>
 * </ul>
 *
 * <p>Mutators are synchronized; a transaction may be inspected from other
 * threads while it runs.
 *
 * @see txengine.engine.TransactionManager#beginTransaction(TransactionOptions)
 */
public class Transaction {

    private final String id;
    private final TransactionContext context;
    private final StateManager stateManager;
    private final TransactionAlertLogger alerts;

    private final List<AtomicOperation<?>> operations = new ArrayList<>();
    private final List<RollbackPoint> rollbackPoints = new ArrayList<>();
    private final List<RollbackFailure> rollbackFailures = new ArrayList<>();

    private volatile TransactionStatus status = TransactionStatus.PENDING;
    private volatile TransactionIsolationLevel isolationLevel = TransactionIsolationLevel.READ_COMMITTED;
    private final AtomicBoolean archived = new AtomicBoolean();

    /**
     * Creates a PENDING transaction.
     *
     * @param id the transaction id
     * @param context context handed to operation callbacks
     * @param stateManager takes checkpoint snapshots (must not be null)
     * @param alerts event logger (must not be null)
     */
    public Transaction(String id,
                       TransactionContext context,
                       StateManager stateManager,
                       TransactionAlertLogger alerts) {
        this.id = Objects.requireNonNull(id);
        this.context = Objects.requireNonNull(context);
        this.stateManager = Objects.requireNonNull(stateManager);
        this.alerts = Objects.requireNonNull(alerts);
    }

    public String getId() {
        return id;
    }

    public TransactionContext getContext() {
        return context;
    }

    public TransactionStatus getStatus() {
        return status;
    }

    /**
     * Labels the transaction with an isolation level. The label is stored and
     * logged only; no locking is performed.
     */
    public void setIsolationLevel(TransactionIsolationLevel level) {
        this.isolationLevel = Objects.requireNonNull(level);
        alerts.isolationLevelSet(id, level);
    }

    public TransactionIsolationLevel getIsolationLevel() {
        return isolationLevel;
    }

    /**
     * Runs a unit of work inside this transaction.
     *
     * @param work the work to run
     * @return whatever {@code work} returned
     * @throws InvalidTransactionStateException if the transaction is terminal
     * @throws Exception whatever {@code work} threw, after the status was set to FAILED
     */
    public <T> T execute(Callable<T> work) throws Exception {
        synchronized (this) {
            requireNotTerminal("execute work");
            status = TransactionStatus.ACTIVE;
        }
        try {
            return work.call();
        } catch (Exception | Error e) {
            status = TransactionStatus.FAILED;
            throw e;
        }
    }

    /**
     * Appends an operation so that a later {@link #rollback()} undoes it.
     * Does not execute it.
     *
     * @throws InvalidTransactionStateException if the transaction is terminal
     */
    public synchronized void addOperation(AtomicOperation<?> operation) throws InvalidTransactionStateException {
        requireNotTerminal("add operation " + operation.id());
        operations.add(operation);
        alerts.operationAdded(id, operation.name());
    }

    /**
     * Takes an incremental snapshot and records it as a {@link RollbackPointType#CHECKPOINT}.
     *
     * @see #createCheckpoint(String, RollbackPointType)
     */
    public RollbackPoint createCheckpoint(String description) throws TransactionException {
        return createCheckpoint(description, RollbackPointType.CHECKPOINT);
    }

    /**
     * Takes an incremental snapshot and wraps it in a rollback point tied to this
     * transaction.
     *
     * @param description human-readable description
     * @param type kind of marker
     * @return the new rollback point
     * @throws InvalidTransactionStateException if the transaction is terminal
     * @throws TransactionException if the snapshot cannot be taken
     */
    public synchronized RollbackPoint createCheckpoint(String description, RollbackPointType type)
            throws TransactionException {
        requireNotTerminal("create checkpoint");
        StateSnapshot snapshot = stateManager.createSnapshot(SnapshotType.INCREMENTAL);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("userId", context.userId());
        metadata.put("sessionId", context.sessionId());
        metadata.put("snapshotType", snapshot.type().name());

        RollbackPoint point = new RollbackPoint(
                IdGenerator.next(IdGenerator.ROLLBACK_POINT),
                id,
                type,
                Instant.now(),
                description,
                Map.<String, SnapshotMetadata>of(RollbackPoint.DATABASE, snapshot.metadata()),
                rollbackPoints.stream().map(RollbackPoint::id).toList(),
                List.of("checksum"),
                metadata);
        rollbackPoints.add(point);
        alerts.checkpointCreated(id, point.id(), description);
        return point;
    }

    /**
     * Restores the snapshot behind one of this transaction's checkpoints.
     * The transaction status is left unchanged.
     *
     * @param checkpointId the checkpoint to restore
     * @throws CheckpointNotFoundException if this transaction has no such checkpoint
     * @throws TransactionException if the snapshot is missing, corrupted or cannot be applied
     */
    public void rollbackToCheckpoint(String checkpointId) throws TransactionException {
        RollbackPoint checkpoint;
        synchronized (this) {
            checkpoint = rollbackPoints.stream()
                    .filter(rp -> rp.id().equals(checkpointId))
                    .findFirst()
                    .orElseThrow(() -> new CheckpointNotFoundException(checkpointId));
        }
        Optional<SnapshotMetadata> snapshot = checkpoint.stateSnapshot();
        if (snapshot.isPresent()) {
            stateManager.restoreFromSnapshot(snapshot.get().id());
        }
        alerts.checkpointRestored(id, checkpointId);
    }

    /**
     * Marks the transaction COMMITTED.
     *
     * @throws InvalidTransactionStateException if the transaction is already terminal
     */
    public synchronized void commit() throws InvalidTransactionStateException {
        requireNotTerminal("commit");
        status = TransactionStatus.COMMITTED;
    }

    /**
     * Marks the transaction FAILED without undoing anything, for work that was
     * refused before it ran (e.g. operations that failed validation).
     *
     * @throws InvalidTransactionStateException if the transaction is already terminal
     */
    public synchronized void markFailed() throws InvalidTransactionStateException {
        requireNotTerminal("mark failed");
        status = TransactionStatus.FAILED;
    }

    /**
     * Undoes every added operation in reverse insertion order.
     *
     * <p>An operation whose rollback throws is logged and recorded in
     * {@link #getRollbackFailures()}; the remaining operations are still undone
     * and the transaction ends ROLLED_BACK. Only an {@link Error} escaping the
     * loop leaves the transaction FAILED.
     *
     * @return the failures collected during this rollback (empty if all undo steps succeeded)
     * @throws InvalidTransactionStateException if the transaction already committed or rolled back
     */
    public synchronized List<RollbackFailure> rollback() throws InvalidTransactionStateException {
        if (status == TransactionStatus.COMMITTED || status == TransactionStatus.ROLLED_BACK) {
            throw new InvalidTransactionStateException(id, status, "roll back");
        }

        List<RollbackFailure> failures = new ArrayList<>();
        try {
            for (int i = operations.size() - 1; i >= 0; i--) {
                AtomicOperation<?> operation = operations.get(i);
                try {
                    operation.rollback(context);
                } catch (Exception e) {
                    alerts.operationRollbackFailed(id, operation.name(), e);
                    failures.add(new RollbackFailure(operation.id(), operation.name(), e));
                }
            }
        } catch (Error e) {
            status = TransactionStatus.FAILED;
            rollbackFailures.addAll(failures);
            throw e;
        }

        rollbackFailures.addAll(failures);
        status = TransactionStatus.ROLLED_BACK;
        alerts.transactionRolledBack(id, operations.size(), failures.size());
        return List.copyOf(failures);
    }

    /**
     * Validates every added operation, collecting all errors and warnings.
     * A validator that throws contributes an error instead of stopping the check.
     */
    public ValidationResult validate() {
        List<AtomicOperation<?>> ops = getOperations();
        List<ValidationResult> results = new ArrayList<>(ops.size());
        for (AtomicOperation<?> operation : ops) {
            try {
                results.add(operation.validate(context));
            } catch (Exception e) {
                results.add(ValidationResult.invalid(
                        "Validation failed for operation " + operation.name() + ": " + e.getMessage()));
            }
        }
        return ValidationResult.merge(results);
    }

    public synchronized List<AtomicOperation<?>> getOperations() {
        return List.copyOf(operations);
    }

    public synchronized List<RollbackPoint> getRollbackPoints() {
        return List.copyOf(rollbackPoints);
    }

    public synchronized List<RollbackFailure> getRollbackFailures() {
        return List.copyOf(rollbackFailures);
    }

    /**
     * Claims the single history entry this transaction gets. Only the first
     * caller sees {@code true}; a cancellation racing the executing thread
     * archives once.
     */
    public boolean claimArchive() {
        return archived.compareAndSet(false, true);
    }

    private void requireNotTerminal(String action) throws InvalidTransactionStateException {
        if (status.isTerminal()) {
            throw new InvalidTransactionStateException(id, status, action);
        }
    }

    @Override
    public String toString() {
        return "Transaction[id=" + id + ", status=" + status + ", operations=" + operations.size()
                + ", checkpoints=" + rollbackPoints.size() + "]";
    }
}
