package txengine.state;

import java.util.Collection;
import java.util.Optional;

/**
 * Keyed storage for snapshots.
 *
 * <p>Implementations must allow concurrent access to different keys without
 * contention. Durability across process restarts depends entirely on the
 * implementation; {@link InMemorySnapshotStore} offers none.
 */
public interface SnapshotStore {

    void put(StateSnapshot snapshot);

    Optional<StateSnapshot> get(String id);

    /**
     * @return true if a snapshot with this id existed
     */
    boolean remove(String id);

    /**
     * @return all stored snapshots, in the order they were first stored
     */
    Collection<StateSnapshot> all();
}
