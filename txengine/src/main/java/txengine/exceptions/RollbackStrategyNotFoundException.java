package txengine.exceptions;

/**
 * Thrown when a rollback strategy id was never created by the rollback manager.
 */
public class RollbackStrategyNotFoundException extends NotFoundException {

    public RollbackStrategyNotFoundException(String id) {
        super("Rollback strategy", id);
    }
}
