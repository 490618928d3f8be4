package io.rollo.vmmanager.hypervisor;

import javax.annotation.Nonnull;

/**
 * Host hardware description.
 *
 * @param model CPU model / architecture
 * @param memoryKib total memory
 * @param cpus logical CPUs
 * @param mhz CPU frequency
 * @param nodes NUMA nodes
 * @param sockets sockets per node
 * @param cores cores per socket
 * @param threads threads per core
 */
public record NodeInfo(
        @Nonnull String model,
        long memoryKib,
        int cpus,
        int mhz,
        int nodes,
        int sockets,
        int cores,
        int threads) {
}
