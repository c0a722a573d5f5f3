package txengine.exceptions;

import java.util.List;

/**
 * Exception thrown when a stored snapshot no longer matches its checksum.
 *
 * <p>Restoring from a corrupted snapshot is always refused; the data is never
 * applied and never repaired.
 *
 * @see txengine.state.StateManager#restoreFromSnapshot(String)
 */
public class SnapshotCorruptedException extends TransactionException {

    private final String snapshotId;
    private final List<String> errors;

    /**
     * @param snapshotId the corrupted snapshot
     * @param errors validation errors describing the mismatch
     */
    public SnapshotCorruptedException(String snapshotId, List<String> errors) {
        super("Snapshot validation failed for " + snapshotId + ": " + String.join(", ", errors));
        this.snapshotId = snapshotId;
        this.errors = List.copyOf(errors);
    }

    public String getSnapshotId() {
        return snapshotId;
    }

    public List<String> getErrors() {
        return errors;
    }
}
