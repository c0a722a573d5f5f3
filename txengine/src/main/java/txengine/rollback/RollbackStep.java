package txengine.rollback;

import java.time.Duration;
import java.util.Objects;

/**
 * One undo step of a {@link RollbackStrategy}, wrapping an operation's rollback.
 */
public final class RollbackStep {

    /**
     * The undo action; may throw anything.
     */
    @FunctionalInterface
    public interface Undo {
        void run() throws Exception;
    }

    private final String id;
    private final String name;
    private final String operationId;
    private final Undo undo;
    private final Duration estimatedDuration;
    private final RiskLevel riskLevel;

    public RollbackStep(String id,
                        String name,
                        String operationId,
                        Undo undo,
                        Duration estimatedDuration,
                        RiskLevel riskLevel) {
        this.id = Objects.requireNonNull(id);
        this.name = name;
        this.operationId = operationId;
        this.undo = Objects.requireNonNull(undo);
        this.estimatedDuration = estimatedDuration != null ? estimatedDuration : Duration.ZERO;
        this.riskLevel = riskLevel != null ? riskLevel : RiskLevel.MEDIUM;
    }

    /** Returns the step id, {@code rollback_<operationId>}. */
    public String id() { return id; }

    public String name() { return name; }

    /** Returns the id of the operation this step undoes. */
    public String operationId() { return operationId; }

    public Duration estimatedDuration() { return estimatedDuration; }

    public RiskLevel riskLevel() { return riskLevel; }

    void run() throws Exception {
        undo.run();
    }

    @Override
    public String toString() {
        return "RollbackStep[id=" + id + ", risk=" + riskLevel + ", estimate=" + estimatedDuration.toMillis() + "ms]";
    }
}
