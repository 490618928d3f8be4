package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;

/**
 * Runtime counters of one VM at a point in time.
 *
 * <p>All counters are cumulative since the VM booted. Consumers compute
 * rates by diffing successive snapshots.</p>
 */
public record VmMetricsSnapshot(
        @Nonnull String name,
        @Nonnull String uuid,
        @Nonnull VmState state,
        @Nonnull Instant timestamp,
        @Nonnull CpuStats cpu,
        @Nonnull MemoryStats memory,
        @Nonnull List<DiskStats> disks,
        @Nonnull List<NetworkStats> interfaces) {

    public VmMetricsSnapshot {
        disks = List.copyOf(disks);
        interfaces = List.copyOf(interfaces);
    }

    public long totalReadBytes() {
        return disks.stream().mapToLong(DiskStats::readBytes).sum();
    }

    public long totalWriteBytes() {
        return disks.stream().mapToLong(DiskStats::writeBytes).sum();
    }

    public long totalRxBytes() {
        return interfaces.stream().mapToLong(NetworkStats::rxBytes).sum();
    }

    public long totalTxBytes() {
        return interfaces.stream().mapToLong(NetworkStats::txBytes).sum();
    }

    /**
     * CPU time in nanoseconds. User and system are -1 when the hypervisor
     * does not report the split.
     */
    public record CpuStats(long totalNs, long userNs, long systemNs, int vcpus) {}

    /**
     * Memory in KiB. When the guest runs a balloon driver, total is the memory the
     * guest sees and available is what it leaves unused. Resident is the host-side
     * footprint, -1 when not reported.
     */
    public record MemoryStats(long totalKib, long availableKib, long usedKib, long residentKib) {}

    public record DiskStats(
            @Nonnull String device,
            long readRequests,
            long readBytes,
            long writeRequests,
            long writeBytes,
            long errors) {}

    public record NetworkStats(
            @Nonnull String device,
            long rxBytes,
            long rxPackets,
            long rxErrors,
            long rxDropped,
            long txBytes,
            long txPackets,
            long txErrors,
            long txDropped) {}
}
