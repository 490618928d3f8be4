package io.rollo.vmmanager.hypervisor;

import javax.annotation.Nonnull;

/**
 * Opens hypervisor connections.
 */
@FunctionalInterface
public interface HypervisorClientFactory {

    /**
     * Open a connection.
     *
     * @param uri connection URI, e.g. {@code qemu:///system}
     * @return the open client
     * @throws HypervisorException if the connection cannot be established
     */
    @Nonnull
    HypervisorClient open(@Nonnull String uri) throws HypervisorException;
}
