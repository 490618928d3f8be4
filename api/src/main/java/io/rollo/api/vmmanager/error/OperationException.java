package io.rollo.api.vmmanager.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The hypervisor or the host rejected a lifecycle operation.
 */
public class OperationException extends VmManagerException {

    private final String operation;
    private final String identity;
    private final String reason;

    public OperationException(@Nonnull String operation, @Nullable String identity, @Nonnull String reason) {
        this(operation, identity, reason, null);
    }

    public OperationException(
            @Nonnull String operation,
            @Nullable String identity,
            @Nonnull String reason,
            @Nullable Throwable cause) {
        super(ErrorKind.OPERATION, format(operation, identity, reason), cause);
        this.operation = operation;
        this.identity = identity;
        this.reason = reason;
    }

    private static String format(String operation, String identity, String reason) {
        if (identity == null) {
            return "Failed to " + operation + ": " + reason;
        }
        return "Failed to " + operation + " VM '" + identity + "': " + reason;
    }

    @Nonnull
    public String getOperation() {
        return operation;
    }

    @Nullable
    public String getIdentity() {
        return identity;
    }

    @Nonnull
    public String getReason() {
        return reason;
    }
}
