package txengine.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txengine.config.AlertLevel;
import txengine.transaction.TransactionStatus;

import java.util.Objects;

/**
 * Structured logging for transaction engine events.
 *
 * <p>Provides a consistent log format suitable for log aggregators. Entries use
 * markers like TRANSACTION_STARTED, TRANSACTION_ROLLED_BACK, SNAPSHOT_RESTORED
 * with key=value pairs for easy parsing and alerting.
 *
 * <h2>Log Levels:</h2>
 * <ul>
 *   <li>INFO: lifecycle events (started, committed, snapshot created, step completed)</li>
 *   <li>WARN: rollbacks and cancellations (intentional recovery)</li>
 *   <li>ERROR: failed undo steps, failed restores, failed migration steps</li>
 * </ul>
 *
 * <p>Instances are injected into the engine components, so independent engines
 * can log at different levels or to different loggers. A failure inside the
 * logging backend is contained here and never fails a transaction.
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  txengine - TRANSACTION_STARTED id=txn_1697_1k3f9 user=alice
 * 12:00:00.010 INFO  txengine - CHECKPOINT_CREATED id=txn_1697_1k3f9 checkpoint=rbp_1697_2x8c1
 * 12:00:00.050 WARN  txengine - TRANSACTION_ROLLED_BACK id=txn_1697_1k3f9 undone=2 undo_failures=0
 * </pre>
 */
public final class TransactionAlertLogger {

    public static final String DEFAULT_LOGGER_NAME = "txengine";

    private final Logger log;
    private volatile AlertLevel alertLevel;

    /**
     * Creates an alert logger writing to the {@value #DEFAULT_LOGGER_NAME} logger.
     *
     * @param alertLevel minimum level to emit (null means WARNING)
     */
    public TransactionAlertLogger(AlertLevel alertLevel) {
        this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), alertLevel);
    }

    /**
     * Creates an alert logger writing to the given logger.
     *
     * @param log the target logger (must not be null)
     * @param alertLevel minimum level to emit (null means WARNING)
     */
    public TransactionAlertLogger(Logger log, AlertLevel alertLevel) {
        this.log = Objects.requireNonNull(log);
        setAlertLevel(alertLevel);
    }

    public void setAlertLevel(AlertLevel level) {
        this.alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    // ---------------- transactions ----------------

    public void transactionStarted(String transactionId, String userId) {
        if (shouldLogInfo()) {
            emit(() -> log.info("TRANSACTION_STARTED id={} user={}", transactionId, userId));
        }
    }

    public void operationAdded(String transactionId, String operationName) {
        if (shouldLogInfo()) {
            emit(() -> log.info("OPERATION_ADDED id={} operation=\"{}\"", transactionId, operationName));
        }
    }

    public void isolationLevelSet(String transactionId, Object level) {
        if (shouldLogInfo()) {
            emit(() -> log.info("ISOLATION_LEVEL_SET id={} level={} enforced=false", transactionId, level));
        }
    }

    public void transactionCommitted(String transactionId, long durationMs) {
        if (shouldLogInfo()) {
            emit(() -> log.info("TRANSACTION_COMMITTED id={} duration_ms={}", transactionId, durationMs));
        }
    }

    public void transactionRolledBack(String transactionId, int undone, int failures) {
        if (shouldLogWarn()) {
            emit(() -> log.warn("TRANSACTION_ROLLED_BACK id={} undone={} undo_failures={}",
                    transactionId, undone, failures));
        }
    }

    public void transactionFailed(String transactionId, TransactionStatus status, Throwable error) {
        emit(() -> log.error("TRANSACTION_FAILED id={} status={} error=\"{}\"",
                transactionId, status, message(error)));
    }

    public void transactionCancelled(String transactionId) {
        if (shouldLogWarn()) {
            emit(() -> log.warn("TRANSACTION_CANCELLED id={}", transactionId));
        }
    }

    /**
     * Always logged: a failed undo means domain state may not be fully restored.
     */
    public void operationRollbackFailed(String transactionId, String operationName, Throwable error) {
        emit(() -> log.error("OPERATION_ROLLBACK_FAILED id={} operation=\"{}\" error=\"{}\"",
                transactionId, operationName, message(error), error));
    }

    public void historyCleaned(int removed) {
        if (shouldLogInfo()) {
            emit(() -> log.info("HISTORY_CLEANED removed={}", removed));
        }
    }

    // ---------------- snapshots & checkpoints ----------------

    public void snapshotCreated(String snapshotId, Object type, long size) {
        if (shouldLogInfo()) {
            emit(() -> log.info("SNAPSHOT_CREATED snapshot={} type={} size={}", snapshotId, type, size));
        }
    }

    public void snapshotRestored(String snapshotId) {
        if (shouldLogWarn()) {
            emit(() -> log.warn("SNAPSHOT_RESTORED snapshot={}", snapshotId));
        }
    }

    public void snapshotRestoreFailed(String snapshotId, Throwable error) {
        emit(() -> log.error("SNAPSHOT_RESTORE_FAILED snapshot={} error=\"{}\"", snapshotId, message(error)));
    }

    public void snapshotDeleted(String snapshotId) {
        if (shouldLogInfo()) {
            emit(() -> log.info("SNAPSHOT_DELETED snapshot={}", snapshotId));
        }
    }

    public void checkpointCreated(String transactionId, String checkpointId, String description) {
        if (shouldLogInfo()) {
            emit(() -> log.info("CHECKPOINT_CREATED id={} checkpoint={} description=\"{}\"",
                    transactionId, checkpointId, description));
        }
    }

    public void checkpointRestored(String transactionId, String checkpointId) {
        if (shouldLogWarn()) {
            emit(() -> log.warn("CHECKPOINT_RESTORED id={} checkpoint={}", transactionId, checkpointId));
        }
    }

    public void rollbackPointRestoreFailed(String rollbackPointId, Throwable error) {
        emit(() -> log.error("ROLLBACK_POINT_RESTORE_FAILED point={} error=\"{}\"", rollbackPointId, message(error)));
    }

    // ---------------- rollback strategies ----------------

    public void strategyExecuted(String strategyId, Object type, int steps) {
        if (shouldLogWarn()) {
            emit(() -> log.warn("ROLLBACK_STRATEGY_EXECUTED strategy={} type={} steps={}", strategyId, type, steps));
        }
    }

    public void strategyFailed(String strategyId, String stepId, Throwable error) {
        emit(() -> log.error("ROLLBACK_STRATEGY_FAILED strategy={} step={} error=\"{}\"",
                strategyId, stepId, message(error)));
    }

    // ---------------- migrations ----------------

    public void migrationStarted(String migrationId, int steps) {
        if (shouldLogInfo()) {
            emit(() -> log.info("MIGRATION_STARTED id={} steps={}", migrationId, steps));
        }
    }

    public void migrationStepCompleted(String migrationId, String stepName) {
        if (shouldLogInfo()) {
            emit(() -> log.info("MIGRATION_STEP_COMPLETED id={} step=\"{}\"", migrationId, stepName));
        }
    }

    public void migrationStepFailed(String migrationId, String stepName, Throwable error) {
        emit(() -> log.error("MIGRATION_STEP_FAILED id={} step=\"{}\" error=\"{}\"",
                migrationId, stepName, message(error)));
    }

    public void phaseRollback(String migrationId, int completedSteps) {
        if (shouldLogWarn()) {
            emit(() -> log.warn("PHASE_ROLLBACK id={} completed_steps={}", migrationId, completedSteps));
        }
    }

    public void migrationCompleted(String migrationId, long durationMs) {
        if (shouldLogInfo()) {
            emit(() -> log.info("MIGRATION_COMPLETED id={} duration_ms={}", migrationId, durationMs));
        }
    }

    // ---------------- helpers ----------------

    private static String message(Throwable error) {
        return error != null ? String.valueOf(error.getMessage()) : "Unknown error";
    }

    private static void emit(Runnable logCall) {
        try {
            logCall.run();
        } catch (RuntimeException e) {
            // a broken appender must not turn into a transaction failure
            System.err.println("txengine: event logging failed: " + e);
        }
    }
}
