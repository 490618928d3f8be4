package io.rollo.vmmanager.connection;

import io.rollo.vmmanager.hypervisor.HypervisorDomain;
import io.rollo.vmmanager.hypervisor.HypervisorException;

/**
 * Work executed against one resolved domain.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface DomainCall<T> {

    T apply(HypervisorDomain domain) throws HypervisorException;
}
