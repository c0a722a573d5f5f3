package txengine.migration;

/**
 * How much of a migration is undone when a step fails.
 */
public enum RollbackScope {
    /** Undo only the failing step */
    STEP,
    /** Undo the failing step and every step completed before it, newest first */
    PHASE
}
