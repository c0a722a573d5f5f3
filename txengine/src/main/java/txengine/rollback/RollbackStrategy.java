package txengine.rollback;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * An undo plan built by {@link RollbackManager#createRollbackStrategy}.
 *
 * <p>The estimated duration is the plain sum of step estimates, also for
 * {@link RollbackType#PARALLEL} strategies; it does not model parallel speedup.
 */
public final class RollbackStrategy {

    private final String id;
    private final RollbackType type;
    private final List<RollbackStep> steps;
    private final Duration estimatedDuration;
    private final RiskLevel riskLevel;
    private final List<String> dependencies;

    RollbackStrategy(String id,
                     RollbackType type,
                     List<RollbackStep> steps,
                     Duration estimatedDuration,
                     RiskLevel riskLevel,
                     List<String> dependencies) {
        this.id = Objects.requireNonNull(id);
        this.type = Objects.requireNonNull(type);
        this.steps = List.copyOf(steps);
        this.estimatedDuration = estimatedDuration;
        this.riskLevel = riskLevel;
        this.dependencies = List.copyOf(dependencies);
    }

    public String id() { return id; }

    public RollbackType type() { return type; }

    /** Returns the undo steps in execution order. */
    public List<RollbackStep> steps() { return steps; }

    public Duration estimatedDuration() { return estimatedDuration; }

    /** Returns the highest risk of any step. */
    public RiskLevel riskLevel() { return riskLevel; }

    /** Returns the ids of the operations being undone. */
    public List<String> dependencies() { return dependencies; }

    @Override
    public String toString() {
        return "RollbackStrategy[id=" + id + ", type=" + type + ", steps=" + steps.size()
                + ", estimate=" + estimatedDuration.toMillis() + "ms, risk=" + riskLevel + "]";
    }
}
