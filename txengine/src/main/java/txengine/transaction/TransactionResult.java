package txengine.transaction;

import txengine.rollback.RollbackPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable record of how a transaction ended.
 *
 * <p>Results are appended to {@link TransactionHistory} whether the transaction
 * committed or not, so failed attempts stay auditable. Use
 * {@link #committed} and {@link #failed} to create entries.
 *
 * @param transactionId the transaction
 * @param status final status (COMMITTED, ROLLED_BACK or FAILED)
 * @param result value produced by the operation (null unless committed)
 * @param error the error that ended the transaction (null on commit)
 * @param rollbackPoints checkpoints created during the transaction
 * @param executedOperations ids of operations that actually ran, in order
 * @param rollbackFailures operations whose undo threw during rollback
 * @param userId acting user (may be null)
 * @param timestamp when the transaction ended
 * @param duration wall time from begin to end
 * @param metadata caller metadata
 * @param <T> type of the operation result
 */
public record TransactionResult<T>(
        String transactionId,
        TransactionStatus status,
        T result,
        Throwable error,
        List<RollbackPoint> rollbackPoints,
        List<String> executedOperations,
        List<RollbackFailure> rollbackFailures,
        String userId,
        Instant timestamp,
        Duration duration,
        Map<String, Object> metadata
) {
    public TransactionResult {
        rollbackPoints = List.copyOf(rollbackPoints);
        executedOperations = List.copyOf(executedOperations);
        rollbackFailures = List.copyOf(rollbackFailures);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates a result for a committed transaction.
     */
    public static <T> TransactionResult<T> committed(Transaction transaction,
                                                     T result,
                                                     List<String> executedOperations,
                                                     Duration duration) {
        TransactionContext ctx = transaction.getContext();
        return new TransactionResult<>(
                transaction.getId(),
                TransactionStatus.COMMITTED,
                result,
                null,
                transaction.getRollbackPoints(),
                executedOperations,
                List.of(),
                ctx.userId(),
                Instant.now(),
                duration,
                ctx.metadata()
        );
    }

    /**
     * Creates a result for a transaction that ended with an error, taking the
     * final status and rollback failures from the transaction.
     */
    public static <T> TransactionResult<T> failed(Transaction transaction,
                                                  Throwable error,
                                                  List<String> executedOperations,
                                                  Duration duration) {
        return failed(transaction, error, executedOperations, duration, transaction.getContext().metadata());
    }

    /**
     * Same as {@link #failed(Transaction, Throwable, List, Duration)} with explicit metadata.
     */
    public static <T> TransactionResult<T> failed(Transaction transaction,
                                                  Throwable error,
                                                  List<String> executedOperations,
                                                  Duration duration,
                                                  Map<String, Object> metadata) {
        return new TransactionResult<>(
                transaction.getId(),
                transaction.getStatus(),
                null,
                error,
                transaction.getRollbackPoints(),
                executedOperations,
                transaction.getRollbackFailures(),
                transaction.getContext().userId(),
                Instant.now(),
                duration,
                metadata
        );
    }

    /** Returns true if the transaction committed. */
    public boolean isCommitted() {
        return status == TransactionStatus.COMMITTED;
    }
}
