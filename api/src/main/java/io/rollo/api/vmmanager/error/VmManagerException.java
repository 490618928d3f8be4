package io.rollo.api.vmmanager.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Base class of every failure surfaced by the VM manager.
 */
public class VmManagerException extends RuntimeException {

    private final ErrorKind kind;

    public VmManagerException(@Nonnull ErrorKind kind, @Nonnull String message) {
        this(kind, message, null);
    }

    public VmManagerException(@Nonnull ErrorKind kind, @Nonnull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Get the failure classification.
     *
     * @return error kind
     */
    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }
}
