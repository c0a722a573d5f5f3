package txengine;

import txengine.transaction.TransactionContext;

import java.time.Duration;
import java.util.List;

/**
 * A caller-supplied unit of reversible work.
 *
 * <p>Implementations pair an {@link #execute} with a matching {@link #rollback}
 * and are handed to {@link txengine.engine.TransactionManager} for execution.
 * The engine never mutates domain state directly; it only calls these methods.
 *
 * <h2>Contract:</h2>
 * <ul>
 *   <li>{@link #rollback} must be safe to call even if {@link #execute} failed
 *       part way or never ran, and must not throw for "nothing to undo"</li>
 *   <li>{@link #validate} must not have side effects</li>
 *   <li>{@link #dependencies()} is informational; operations run in the order
 *       they are submitted, so submit them in dependency order</li>
 *   <li>{@link #timeout()} and {@link #retryCount()} are metadata used for
 *       rollback duration estimates; the timeout is only enforced when
 *       {@code txengine.operation.timeout.enforced} is set</li>
 *   <li>with enforced timeouts, {@link #execute} runs on a worker thread and is
 *       interrupted when it times out. The engine waits briefly for it to stop
 *       before calling {@link #rollback}; an {@code execute} that ignores
 *       interrupts past that grace period can still be running while its
 *       {@code rollback} is called, so both must then be safe to overlap</li>
 * </ul>
 *
 * <h2>Example:</h2>
 * <pre>
 * class SaveProject implements AtomicOperation&lt;Void&gt; {
 *     public String id() { return "save-project"; }
 *     public String name() { return "Save project"; }
 *     public Void execute(TransactionContext ctx) { store.save(project); return null; }
 *     public void rollback(TransactionContext ctx) { store.restore(previous); }
 *     public ValidationResult validate(TransactionContext ctx) { return ValidationResult.ok(); }
 * }
 * </pre>
 *
 * @param <T> the type of value produced by {@link #execute}
 */
public interface AtomicOperation<T> {

    Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    int DEFAULT_PRIORITY = 5;

    /** Unique id of this operation within a transaction. */
    String id();

    /** Human-readable name used in logs and error messages. */
    String name();

    default String description() {
        return "";
    }

    /**
     * Performs the work.
     *
     * @param context the owning transaction's context
     * @return the operation result (may be null)
     * @throws Exception any failure; the engine rolls back and rethrows it unchanged
     */
    T execute(TransactionContext context) throws Exception;

    /**
     * Undoes the work done by {@link #execute}.
     *
     * @param context the owning transaction's context
     * @throws Exception if undo fails; logged and collected, never stops other rollbacks
     */
    void rollback(TransactionContext context) throws Exception;

    /**
     * Checks whether the operation can run. Called before anything executes.
     *
     * @param context the owning transaction's context
     * @return the validation outcome
     * @throws Exception if validation itself fails; treated as an invalid result
     */
    ValidationResult validate(TransactionContext context) throws Exception;

    default List<String> dependencies() {
        return List.of();
    }

    default Duration timeout() {
        return DEFAULT_TIMEOUT;
    }

    default int retryCount() {
        return 0;
    }

    default int priority() {
        return DEFAULT_PRIORITY;
    }
}
