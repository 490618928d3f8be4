package io.rollo.vmmanager.hypervisor;

/**
 * Cumulative network interface counters.
 */
public record InterfaceStats(
        long rxBytes,
        long rxPackets,
        long rxErrors,
        long rxDropped,
        long txBytes,
        long txPackets,
        long txErrors,
        long txDropped) {
}
