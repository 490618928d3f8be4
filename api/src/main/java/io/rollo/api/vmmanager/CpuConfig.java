package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Virtual CPU topology and scheduling parameters.
 *
 * @param cores cores per socket
 * @param sockets socket count
 * @param threads threads per core
 * @param model CPU model name, null for host-model
 * @param pinning host CPU index for each core, empty for no pinning
 * @param shares relative scheduler weight, null for the hypervisor default
 * @param limitPercent CPU bandwidth cap in percent, null for unlimited
 */
public record CpuConfig(
        int cores,
        int sockets,
        int threads,
        @Nullable String model,
        @Nonnull List<Integer> pinning,
        @Nullable Integer shares,
        @Nullable Integer limitPercent) {

    public CpuConfig {
        pinning = pinning == null ? List.of() : List.copyOf(pinning);
    }

    @Nonnull
    public static CpuConfig of(int cores) {
        return new CpuConfig(cores, 1, 1, null, List.of(), null, null);
    }

    @Nonnull
    public static CpuConfig topology(int cores, int sockets, int threads) {
        return new CpuConfig(cores, sockets, threads, null, List.of(), null, null);
    }

    @Nonnull
    public CpuConfig withModel(@Nullable String model) {
        return new CpuConfig(cores, sockets, threads, model, pinning, shares, limitPercent);
    }

    @Nonnull
    public CpuConfig withPinning(@Nonnull List<Integer> pinning) {
        return new CpuConfig(cores, sockets, threads, model, pinning, shares, limitPercent);
    }

    @Nonnull
    public CpuConfig withShares(@Nullable Integer shares) {
        return new CpuConfig(cores, sockets, threads, model, pinning, shares, limitPercent);
    }

    @Nonnull
    public CpuConfig withLimitPercent(@Nullable Integer limitPercent) {
        return new CpuConfig(cores, sockets, threads, model, pinning, shares, limitPercent);
    }

    /**
     * Number of logical CPUs the guest sees.
     *
     * @return cores * sockets * threads
     */
    public int totalVcpus() {
        return cores * sockets * threads;
    }
}
