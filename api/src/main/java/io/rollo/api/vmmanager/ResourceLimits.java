package io.rollo.api.vmmanager;

/**
 * Per-VM maxima and current host availability.
 *
 * @param maxCpuCores largest vCPU count a single VM may request
 * @param maxMemoryMb largest memory a single VM may request
 * @param maxDiskGb largest total disk a single VM may request
 * @param maxDisks disks per VM
 * @param maxNetworks interfaces per VM
 * @param availableVcpus vCPUs still schedulable under the overcommit ratio
 * @param availableMemoryMb memory not yet allocated to any domain
 * @param availableDiskGb usable free storage
 */
public record ResourceLimits(
        int maxCpuCores,
        long maxMemoryMb,
        double maxDiskGb,
        int maxDisks,
        int maxNetworks,
        int availableVcpus,
        long availableMemoryMb,
        double availableDiskGb) {
}
