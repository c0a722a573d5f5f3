package txengine.rollback;

/**
 * How the undo steps of a {@link RollbackStrategy} are run.
 */
public enum RollbackType {
    /** One after another in strategy order, stopping at the first failure */
    SEQUENTIAL,
    /** All at once; the strategy waits for every step */
    PARALLEL
}
