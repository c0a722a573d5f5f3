package txengine.exceptions;

/**
 * Thrown when a transaction has no checkpoint with the requested id.
 */
public class CheckpointNotFoundException extends NotFoundException {

    public CheckpointNotFoundException(String id) {
        super("Checkpoint", id);
    }
}
