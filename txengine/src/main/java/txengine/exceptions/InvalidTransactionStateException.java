package txengine.exceptions;

import txengine.transaction.TransactionStatus;

/**
 * Exception thrown when a transaction is asked to do something its current
 * status does not allow, e.g. executing work after it was committed.
 */
public class InvalidTransactionStateException extends TransactionException {

    private final TransactionStatus status;

    /**
     * @param transactionId the transaction
     * @param status the status the transaction was in
     * @param action what the caller attempted
     */
    public InvalidTransactionStateException(String transactionId, TransactionStatus status, String action) {
        super("Cannot " + action + " in status " + status, transactionId, null);
        this.status = status;
    }

    /** Returns the status the transaction was in when the call was rejected. */
    public TransactionStatus getStatus() {
        return status;
    }
}
