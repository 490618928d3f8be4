package io.rollo.vmmanager.resource;

import io.rollo.vmmanager.hypervisor.NodeInfo;

import javax.annotation.Nonnull;

/**
 * Host hardware capacity, read live from the hypervisor.
 *
 * @param cpus logical CPUs
 * @param memoryKib total memory
 * @param mhz CPU frequency
 * @param numaNodes NUMA node count
 * @param sockets sockets per node
 * @param cores cores per socket
 * @param threads threads per core
 * @param model CPU model / architecture
 */
public record HostCapacity(
        int cpus,
        long memoryKib,
        int mhz,
        int numaNodes,
        int sockets,
        int cores,
        int threads,
        @Nonnull String model) {

    @Nonnull
    public static HostCapacity from(@Nonnull NodeInfo info) {
        return new HostCapacity(info.cpus(), info.memoryKib(), info.mhz(), info.nodes(),
                info.sockets(), info.cores(), info.threads(), info.model());
    }

    public long memoryMb() {
        return memoryKib / 1024;
    }
}
