package txengine.exceptions;

/**
 * Thrown when no snapshot with the requested id exists in the snapshot store.
 */
public class SnapshotNotFoundException extends NotFoundException {

    public SnapshotNotFoundException(String id) {
        super("Snapshot", id);
    }
}
