package io.rollo.api.vmmanager.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The hypervisor connection could not be opened or was lost.
 */
public class ConnectionException extends VmManagerException {

    public ConnectionException(@Nonnull String message) {
        super(ErrorKind.CONNECTION, message);
    }

    public ConnectionException(@Nonnull String message, @Nullable Throwable cause) {
        super(ErrorKind.CONNECTION, message, cause);
    }
}
