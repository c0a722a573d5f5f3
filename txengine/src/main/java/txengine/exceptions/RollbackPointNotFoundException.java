package txengine.exceptions;

/**
 * Thrown when a rollback point id is unknown to both active transactions and history.
 */
public class RollbackPointNotFoundException extends NotFoundException {

    public RollbackPointNotFoundException(String id) {
        super("Rollback point", id);
    }
}
