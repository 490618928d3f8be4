package io.rollo.vmmanager.connection;

import io.rollo.vmmanager.hypervisor.HypervisorClient;
import io.rollo.vmmanager.hypervisor.HypervisorException;

/**
 * Work executed against the shared hypervisor connection.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface HypervisorCall<T> {

    T apply(HypervisorClient client) throws HypervisorException;
}
