package txengine.exceptions;

import java.util.List;

/**
 * Exception thrown when an operation fails validation before execution.
 *
 * <p>Validation happens before any side effect, so no rollback is ever
 * triggered for this failure.
 *
 * @see txengine.AtomicOperation#validate(txengine.transaction.TransactionContext)
 */
public class OperationValidationException extends TransactionException {

    private final String operationId;
    private final List<String> errors;

    /**
     * Creates a new validation exception.
     *
     * @param operationId the operation that failed validation
     * @param operationName human-readable operation name, used in the message
     * @param errors the validation errors reported by the operation
     * @param transactionId the transaction the validation ran in (may be null)
     */
    public OperationValidationException(String operationId,
                                        String operationName,
                                        List<String> errors,
                                        String transactionId) {
        super("Operation " + operationName + " validation failed: " + String.join(", ", errors),
                transactionId, null);
        this.operationId = operationId;
        this.errors = List.copyOf(errors);
    }

    /** Returns the id of the operation that failed validation. */
    public String getOperationId() {
        return operationId;
    }

    /** Returns the validation errors. */
    public List<String> getErrors() {
        return errors;
    }
}
