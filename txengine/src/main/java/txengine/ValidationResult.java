package txengine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Outcome of validating an operation, a transaction or a snapshot.
 *
 * <p>A result is valid exactly when it carries no errors; warnings never make a
 * result invalid.
 *
 * @param valid true if no errors were found
 * @param errors the errors (never null)
 * @param warnings the warnings (never null)
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    private static final ValidationResult OK = new ValidationResult(true, List.of(), List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /** A valid result with no errors or warnings. */
    public static ValidationResult ok() {
        return OK;
    }

    /** A valid result carrying warnings. */
    public static ValidationResult withWarnings(String... warnings) {
        return new ValidationResult(true, List.of(), Arrays.asList(warnings));
    }

    /** An invalid result with the given errors. */
    public static ValidationResult invalid(String... errors) {
        return new ValidationResult(false, Arrays.asList(errors), List.of());
    }

    /**
     * Builds a result from collected errors and warnings; valid iff {@code errors} is empty.
     */
    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    /**
     * Combines several results, keeping every error and warning in order.
     */
    public static ValidationResult merge(List<ValidationResult> results) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (ValidationResult r : results) {
            errors.addAll(r.errors());
            warnings.addAll(r.warnings());
        }
        return of(errors, warnings);
    }
}
