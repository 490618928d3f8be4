package io.rollo.api.vmmanager.error;

import javax.annotation.Nonnull;

/**
 * No domain matches the requested name or UUID.
 */
public class NotFoundException extends VmManagerException {

    private final String identity;

    public NotFoundException(@Nonnull String identity) {
        super(ErrorKind.NOT_FOUND, "VM '" + identity + "' not found");
        this.identity = identity;
    }

    /**
     * Get the name or UUID that failed to resolve.
     *
     * @return VM identity
     */
    @Nonnull
    public String getIdentity() {
        return identity;
    }
}
