package io.rollo.vmmanager.resource;

/**
 * Host capacity not yet allocated.
 *
 * <p>{@code cpus} and {@code memoryKib} are exact differences and may be
 * negative on an overcommitted host.</p>
 *
 * @param cpus logical CPUs minus allocated vCPUs
 * @param memoryKib host memory minus allocated memory
 * @param schedulableVcpus vCPUs still allowed under the overcommit ratio
 * @param storageBytes usable storage, or -1 if it could not be read
 */
public record AvailableResources(
        int cpus,
        long memoryKib,
        int schedulableVcpus,
        long storageBytes) {

    public long memoryMb() {
        return memoryKib / 1024;
    }

    public boolean isStorageKnown() {
        return storageBytes >= 0;
    }
}
