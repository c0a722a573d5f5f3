package txengine.transaction;

/**
 * Lifecycle status of a {@link Transaction}.
 *
 * <pre>
 * PENDING --execute()--&gt; ACTIVE --commit()--&gt; COMMITTED
 *                          |  \--rollback()--&gt; ROLLED_BACK
 *                          \--execute() error--&gt; FAILED --rollback()--&gt; ROLLED_BACK
 * </pre>
 */
public enum TransactionStatus {
    /** Created, no work executed yet */
    PENDING,
    /** Work is being executed */
    ACTIVE,
    /** All work committed */
    COMMITTED,
    /** Executed work was undone */
    ROLLED_BACK,
    /** Execution or finalization failed; rollback is still permitted */
    FAILED;

    /**
     * Returns true if no further work may be added or executed.
     */
    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == FAILED;
    }
}
