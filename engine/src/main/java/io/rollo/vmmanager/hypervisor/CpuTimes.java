package io.rollo.vmmanager.hypervisor;

/**
 * CPU time split in nanoseconds. Negative values mean not reported.
 */
public record CpuTimes(long totalNs, long userNs, long systemNs) {
}
