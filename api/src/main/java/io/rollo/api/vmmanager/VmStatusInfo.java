package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;

/**
 * Live status of one domain.
 *
 * @param name domain name
 * @param uuid domain UUID
 * @param state current state
 * @param vcpus configured vCPUs
 * @param memoryMb current memory
 * @param maxMemoryMb configured maximum memory
 * @param cpuTimeNs cumulative CPU time
 */
public record VmStatusInfo(
        @Nonnull String name,
        @Nonnull String uuid,
        @Nonnull VmState state,
        int vcpus,
        long memoryMb,
        long maxMemoryMb,
        long cpuTimeNs) {
}
