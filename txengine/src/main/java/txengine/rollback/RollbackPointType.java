package txengine.rollback;

/**
 * Kind of point-in-time marker a {@link RollbackPoint} represents.
 */
public enum RollbackPointType {
    /** Taken explicitly inside a transaction */
    CHECKPOINT,
    /** Taken by the caller as a named save point */
    SAVEPOINT,
    /** Taken before a migration step runs */
    MIGRATION_STEP,
    /** Taken as a safety copy before a risky change */
    BACKUP
}
