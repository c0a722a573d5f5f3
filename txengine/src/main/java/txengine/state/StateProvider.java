package txengine.state;

/**
 * Capability that reads and writes the live state protected by snapshots.
 *
 * <p>The engine is data-agnostic: what "state" means (project documents, service
 * configuration, cached results) is decided by the deployment supplying this
 * provider to the {@link StateManager}.
 */
public interface StateProvider {

    /**
     * Captures the current live state.
     *
     * @param type whether a full or incremental capture is wanted
     * @return the serialized state (never null; may be empty)
     * @throws Exception if the state cannot be collected
     */
    byte[] capture(SnapshotType type) throws Exception;

    /**
     * Applies a previously captured state back to the live state.
     *
     * @param type the type the payload was captured with
     * @param data a payload returned earlier by {@link #capture}
     * @throws Exception if the state cannot be applied
     */
    void apply(SnapshotType type, byte[] data) throws Exception;
}
