package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Aggregated outcome of a resource validation.
 *
 * @param valid true when no errors were found
 * @param errors every violated rule
 * @param warnings informational findings that do not block a commit
 * @param capacityExceeded true if an error came from the host availability check
 */
public record ValidationResult(
        boolean valid,
        @Nonnull List<String> errors,
        @Nonnull List<String> warnings,
        boolean capacityExceeded) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @Nonnull
    public static ValidationResult of(@Nonnull List<String> errors, @Nonnull List<String> warnings,
                                      boolean capacityExceeded) {
        return new ValidationResult(errors.isEmpty(), errors, warnings, capacityExceeded);
    }

    @Nonnull
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), List.of(), false);
    }
}
