package txengine.exceptions;

/**
 * Base exception for failures raised by the transaction engine itself.
 *
 * <p>Errors thrown by caller-supplied {@link txengine.AtomicOperation}s are never
 * wrapped in this type; they propagate to the caller unchanged. This exception
 * covers the engine's own failure modes:
 * <ul>
 *   <li>validation failures before any side effect ({@link OperationValidationException})</li>
 *   <li>illegal lifecycle transitions ({@link InvalidTransactionStateException})</li>
 *   <li>id lookups that found nothing ({@link NotFoundException} and subclasses)</li>
 *   <li>snapshot integrity failures ({@link SnapshotCorruptedException})</li>
 * </ul>
 *
 * <p>The transaction id is optional diagnostic context and is appended to
 * {@link #getMessage()} when present.
 *
 * @see txengine.engine.TransactionManager
 */
public class TransactionException extends Exception {

    private final String transactionId;

    /**
     * Creates a new transaction exception with a message.
     *
     * @param message the error message
     */
    public TransactionException(String message) {
        super(message);
        this.transactionId = null;
    }

    /**
     * Creates a new transaction exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public TransactionException(String message, Throwable cause) {
        super(message, cause);
        this.transactionId = null;
    }

    /**
     * Creates a new transaction exception tied to a transaction.
     *
     * @param message the error message
     * @param transactionId the transaction the failure belongs to (may be null)
     * @param cause the underlying cause (may be null)
     */
    public TransactionException(String message, String transactionId, Throwable cause) {
        super(message, cause);
        this.transactionId = transactionId;
    }

    /**
     * Returns the id of the transaction involved in the failure.
     *
     * @return the transaction id, or null if not set
     */
    public String getTransactionId() {
        return transactionId;
    }

    /**
     * Returns the message without the appended diagnostic context.
     *
     * @return the message as passed to the constructor
     */
    public String getBaseMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        if (transactionId == null) {
            return base;
        }
        return base + " [transaction=" + transactionId + "]";
    }
}
