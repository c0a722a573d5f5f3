package txengine.exceptions;

/**
 * Thrown when a transaction id is neither active nor archived.
 */
public class TransactionNotFoundException extends NotFoundException {

    public TransactionNotFoundException(String id) {
        super("Transaction", id);
    }
}
