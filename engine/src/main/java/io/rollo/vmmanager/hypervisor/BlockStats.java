package io.rollo.vmmanager.hypervisor;

/**
 * Cumulative block device counters.
 */
public record BlockStats(long readRequests, long readBytes, long writeRequests, long writeBytes, long errors) {
}
