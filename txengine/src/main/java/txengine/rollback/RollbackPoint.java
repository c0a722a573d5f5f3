package txengine.rollback;

import txengine.state.SnapshotMetadata;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, snapshot-backed marker that state can later be restored to.
 *
 * <p>Rollback points outlive their transaction: the snapshots they reference stay
 * in the {@link txengine.state.StateManager} and can be restored through
 * {@link txengine.engine.TransactionManager#executeRollback(String)} after the
 * owning transaction was archived.
 *
 * @param id the rollback point id
 * @param transactionId the transaction that created it
 * @param type kind of marker
 * @param timestamp when it was created
 * @param description human-readable description
 * @param snapshots named snapshot references; {@link #DATABASE} holds the checkpoint snapshot
 * @param dependencies ids of earlier rollback points of the same transaction
 * @param validationChecks checks run before restoring
 * @param metadata e.g. {@code userId}, {@code sessionId}
 */
public record RollbackPoint(
        String id,
        String transactionId,
        RollbackPointType type,
        Instant timestamp,
        String description,
        Map<String, SnapshotMetadata> snapshots,
        List<String> dependencies,
        List<String> validationChecks,
        Map<String, Object> metadata
) {
    /** Key of the state snapshot reference. */
    public static final String DATABASE = "database";

    public RollbackPoint {
        snapshots = Map.copyOf(snapshots);
        dependencies = List.copyOf(dependencies);
        validationChecks = List.copyOf(validationChecks);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * @return the snapshot this point restores to, if any
     */
    public Optional<SnapshotMetadata> stateSnapshot() {
        return Optional.ofNullable(snapshots.get(DATABASE));
    }

    /**
     * @return the acting user recorded when the point was created, if any
     */
    public Optional<String> userId() {
        Object user = metadata.get("userId");
        return user != null ? Optional.of(user.toString()) : Optional.empty();
    }
}
