package io.rollo.vmmanager.hypervisor;

import javax.annotation.Nonnull;

/**
 * Domain runtime information.
 *
 * @param state raw hypervisor state
 * @param maxMemoryKib configured maximum memory
 * @param memoryKib current memory
 * @param vcpus virtual CPU count
 * @param cpuTimeNs cumulative CPU time
 */
public record DomainInfo(
        @Nonnull HypervisorState state,
        long maxMemoryKib,
        long memoryKib,
        int vcpus,
        long cpuTimeNs) {
}
