package txengine.transaction;

/**
 * Describes how concurrent transactions are meant to observe each other's
 * uncommitted state.
 *
 * <p><strong>This is a label only.</strong> The engine stores and logs it but
 * performs no locking or snapshot isolation; transactions sharing mutable
 * resources must be serialized by the caller.
 *
 * @see Transaction#setIsolationLevel(TransactionIsolationLevel)
 */
public enum TransactionIsolationLevel {
    READ_UNCOMMITTED,
    READ_COMMITTED,
    REPEATABLE_READ,
    SERIALIZABLE
}
