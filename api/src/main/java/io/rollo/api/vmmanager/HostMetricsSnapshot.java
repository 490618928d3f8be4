package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import java.time.Instant;

/**
 * Host level aggregates.
 *
 * @param hostname hypervisor host name
 * @param activeVms running domains
 * @param totalVms all defined domains
 * @param hypervisorType driver name, e.g. QEMU
 * @param hypervisorVersion encoded hypervisor version
 * @param libraryVersion encoded client library version
 * @param logicalCpus host logical CPUs
 * @param memoryKib host memory
 * @param allocatedVcpus vCPUs configured across all domains
 * @param allocatedMemoryKib maximum memory configured across all domains
 * @param timestamp when the snapshot was taken
 */
public record HostMetricsSnapshot(
        @Nonnull String hostname,
        int activeVms,
        int totalVms,
        @Nonnull String hypervisorType,
        long hypervisorVersion,
        long libraryVersion,
        int logicalCpus,
        long memoryKib,
        int allocatedVcpus,
        long allocatedMemoryKib,
        @Nonnull Instant timestamp) {
}
