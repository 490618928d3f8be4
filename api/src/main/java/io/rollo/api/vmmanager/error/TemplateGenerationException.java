package io.rollo.api.vmmanager.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A domain definition could not be generated or rewritten.
 */
public class TemplateGenerationException extends OperationException {

    public TemplateGenerationException(@Nonnull String identity, @Nonnull String reason, @Nullable Throwable cause) {
        super("generate definition for", identity, reason, cause);
    }
}
