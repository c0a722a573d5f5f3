package txengine.exceptions;

/**
 * Exception raised for a migration step that cannot run: an unmet prerequisite
 * or a failed step validation rule.
 *
 * <p>{@link txengine.engine.TransactionManager#executeMigration} does not throw
 * it; it is reported through {@link txengine.migration.MigrationResult#error()}.
 */
public class MigrationStepException extends TransactionException {

    private final String stepId;

    public MigrationStepException(String stepId, String message) {
        super(message + " [step=" + stepId + "]");
        this.stepId = stepId;
    }

    public MigrationStepException(String stepId, String message, Throwable cause) {
        super(message + " [step=" + stepId + "]", cause);
        this.stepId = stepId;
    }

    /** Returns the id of the step that could not run. */
    public String getStepId() {
        return stepId;
    }
}
