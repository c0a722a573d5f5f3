package txengine.migration;

import txengine.ValidationResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural checks on an ordered list of migration steps.
 *
 * <p>Steps run strictly in the order given and are never reordered, so a plan is
 * valid only if:
 * <ul>
 *   <li>Step ids are unique</li>
 *   <li>Every prerequisite names a step of the same plan</li>
 *   <li>Every prerequisite appears before the step that needs it</li>
 * </ul>
 * The last rule also rules out prerequisite cycles.
 *
 * @see MigrationStep#prerequisites()
 */
public final class MigrationPlan {

    private MigrationPlan() {}

    /**
     * Checks a plan without running anything.
     *
     * @param steps the steps in execution order
     * @return all problems found; valid if there are none
     */
    public static ValidationResult validate(List<MigrationStep> steps) {
        Objects.requireNonNull(steps, "steps");

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Set<String> all = new HashSet<>();
        for (MigrationStep step : steps) {
            if (!all.add(step.id())) {
                errors.add("Duplicate migration step id: " + step.id());
            }
        }

        Set<String> seen = new HashSet<>();
        for (MigrationStep step : steps) {
            for (String prerequisite : step.prerequisites()) {
                if (!all.contains(prerequisite)) {
                    errors.add("Step " + step.id() + " requires unknown step " + prerequisite);
                } else if (!seen.contains(prerequisite)) {
                    errors.add("Step " + step.id() + " requires step " + prerequisite + " which runs after it");
                }
            }
            if (step.operations().isEmpty()) {
                warnings.add("Step " + step.id() + " has no operations");
            }
            seen.add(step.id());
        }

        return ValidationResult.of(errors, warnings);
    }
}
