package io.rollo.vmmanager.resource;

import javax.annotation.Nonnull;
import java.time.Instant;

/**
 * Resources configured across every domain the hypervisor knows, at one instant.
 *
 * @param vcpus sum of configured vCPUs
 * @param memoryKib sum of configured maximum memory
 * @param activeDomains domains with a running process
 * @param totalDomains all defined domains
 * @param takenAt when the scan finished
 */
public record AllocationSnapshot(
        int vcpus,
        long memoryKib,
        int activeDomains,
        int totalDomains,
        @Nonnull Instant takenAt) {
}
