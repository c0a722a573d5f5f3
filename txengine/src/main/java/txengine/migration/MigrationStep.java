package txengine.migration;

import txengine.AtomicOperation;
import txengine.ValidationResult;
import txengine.transaction.TransactionContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One step of a migration: a batch of operations executed in a single
 * transaction.
 *
 * <p>Before the step runs, every id in {@link #prerequisites()} must belong to a
 * step already completed in the same migration, and every
 * {@link ValidationRule} must pass. {@link #rollbackStrategy()} decides whether
 * a failure undoes only this step or the whole migration so far.
 *
 * <h2>Example:</h2>
 * <pre>
 * MigrationStep step = MigrationStep.builder("add-units", "Add unit column")
 *     .phase("schema")
 *     .operation(new AddColumn("units"))
 *     .prerequisite("create-table")
 *     .rollbackStrategy(RollbackScope.PHASE)
 *     .build();
 * </pre>
 */
public final class MigrationStep {

    /**
     * A check run before the step's operations execute.
     */
    @FunctionalInterface
    public interface ValidationRule {
        /**
         * @param context context of the step's transaction
         * @return the verdict; an invalid result fails the step
         * @throws Exception treated as a failed rule
         */
        ValidationResult check(TransactionContext context) throws Exception;
    }

    private final String id;
    private final String name;
    private final String description;
    private final String phase;
    private final List<AtomicOperation<?>> operations;
    private final List<String> prerequisites;
    private final RollbackScope rollbackStrategy;
    private final List<ValidationRule> validationRules;
    private final Duration estimatedDuration;

    private MigrationStep(Builder b) {
        this.id = b.id;
        this.name = b.name;
        this.description = b.description;
        this.phase = b.phase;
        this.operations = List.copyOf(b.operations);
        this.prerequisites = List.copyOf(b.prerequisites);
        this.rollbackStrategy = b.rollbackStrategy;
        this.validationRules = List.copyOf(b.validationRules);
        this.estimatedDuration = b.estimatedDuration;
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    public String id() { return id; }

    public String name() { return name; }

    public String description() { return description; }

    /** Returns the phase label, or null if the step has none. */
    public String phase() { return phase; }

    /** Returns the operations in execution order. */
    public List<AtomicOperation<?>> operations() { return operations; }

    public List<String> prerequisites() { return prerequisites; }

    public RollbackScope rollbackStrategy() { return rollbackStrategy; }

    public List<ValidationRule> validationRules() { return validationRules; }

    public Duration estimatedDuration() { return estimatedDuration; }

    @Override
    public String toString() {
        return "MigrationStep[id=" + id + ", name=" + name + ", phase=" + phase
                + ", operations=" + operations.size() + ", rollback=" + rollbackStrategy + "]";
    }

    /**
     * Builder for {@link MigrationStep}.
     */
    public static final class Builder {
        private final String id;
        private final String name;
        private String description = "";
        private String phase;
        private final List<AtomicOperation<?>> operations = new ArrayList<>();
        private final List<String> prerequisites = new ArrayList<>();
        private RollbackScope rollbackStrategy = RollbackScope.STEP;
        private final List<ValidationRule> validationRules = new ArrayList<>();
        private Duration estimatedDuration = Duration.ZERO;

        private Builder(String id, String name) {
            this.id = Objects.requireNonNull(id, "id");
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder phase(String phase) {
            this.phase = phase;
            return this;
        }

        public Builder operation(AtomicOperation<?> operation) {
            this.operations.add(Objects.requireNonNull(operation));
            return this;
        }

        public Builder operations(List<? extends AtomicOperation<?>> operations) {
            operations.forEach(this::operation);
            return this;
        }

        public Builder prerequisite(String stepId) {
            this.prerequisites.add(stepId);
            return this;
        }

        public Builder rollbackStrategy(RollbackScope scope) {
            this.rollbackStrategy = Objects.requireNonNull(scope);
            return this;
        }

        public Builder validationRule(ValidationRule rule) {
            this.validationRules.add(Objects.requireNonNull(rule));
            return this;
        }

        public Builder estimatedDuration(Duration duration) {
            this.estimatedDuration = duration;
            return this;
        }

        public MigrationStep build() {
            return new MigrationStep(this);
        }
    }
}
