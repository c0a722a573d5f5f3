package txengine.state;

/**
 * Kind of state capture requested from the {@link StateProvider}.
 */
public enum SnapshotType {
    /** Complete capture of the live state */
    FULL,
    /** Capture of what changed since the provider's last capture; checkpoints use this */
    INCREMENTAL
}
