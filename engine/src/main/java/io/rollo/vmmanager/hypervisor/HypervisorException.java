package io.rollo.vmmanager.hypervisor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Failure reported by the hypervisor client, before translation.
 */
public class HypervisorException extends Exception {

    private final Kind kind;

    public HypervisorException(@Nonnull Kind kind, @Nonnull String message) {
        this(kind, message, null);
    }

    public HypervisorException(@Nonnull Kind kind, @Nonnull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * Coarse failure class used for translation.
     */
    public enum Kind {
        /**
         * The domain does not exist.
         */
        NO_DOMAIN,

        /**
         * Transport, authentication, or connection failure.
         */
        CONNECTION,

        /**
         * Any other rejection.
         */
        OPERATION
    }
}
