package io.rollo.api.vmmanager.error;

import io.rollo.api.vmmanager.ValidationResult;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A resource request violated one or more limits. Carries every violation found.
 */
public class ValidationException extends VmManagerException {

    private final ValidationResult result;

    public ValidationException(@Nonnull ValidationResult result) {
        super(ErrorKind.VALIDATION, "Resource validation failed: " + String.join("; ",
                Objects.requireNonNull(result, "result").errors()));
        this.result = result;
    }

    /**
     * Get the full validation result, including warnings.
     *
     * @return validation result
     */
    @Nonnull
    public ValidationResult getResult() {
        return result;
    }
}
