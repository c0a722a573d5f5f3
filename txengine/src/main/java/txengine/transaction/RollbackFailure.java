package txengine.transaction;

/**
 * Records one operation whose {@code rollback} threw during a best-effort
 * transaction rollback.
 *
 * @param operationId the operation whose undo failed
 * @param operationName its human-readable name
 * @param error what it threw
 */
public record RollbackFailure(String operationId, String operationName, Throwable error) {
}
