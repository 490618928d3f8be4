package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Scheduler and memory controls of a VM. Null fields are left unchanged.
 *
 * @param cpuShares relative CPU weight
 * @param cpuPeriodUs CFS enforcement period in microseconds
 * @param cpuQuotaUs CFS quota per period in microseconds, -1 for unlimited
 * @param memoryHardLimitKib memory the guest may never exceed
 * @param memorySoftLimitKib memory enforced under host contention
 */
public record ResourceControls(
        @Nullable Long cpuShares,
        @Nullable Long cpuPeriodUs,
        @Nullable Long cpuQuotaUs,
        @Nullable Long memoryHardLimitKib,
        @Nullable Long memorySoftLimitKib) {

    @Nonnull
    public static ResourceControls none() {
        return new ResourceControls(null, null, null, null, null);
    }

    @Nonnull
    public ResourceControls withCpuShares(long shares) {
        return new ResourceControls(shares, cpuPeriodUs, cpuQuotaUs, memoryHardLimitKib, memorySoftLimitKib);
    }

    @Nonnull
    public ResourceControls withCpuBandwidth(long periodUs, long quotaUs) {
        return new ResourceControls(cpuShares, periodUs, quotaUs, memoryHardLimitKib, memorySoftLimitKib);
    }

    @Nonnull
    public ResourceControls withMemoryLimits(@Nullable Long hardLimitKib, @Nullable Long softLimitKib) {
        return new ResourceControls(cpuShares, cpuPeriodUs, cpuQuotaUs, hardLimitKib, softLimitKib);
    }

    public boolean hasCpuControls() {
        return cpuShares != null || cpuPeriodUs != null || cpuQuotaUs != null;
    }

    public boolean hasMemoryControls() {
        return memoryHardLimitKib != null || memorySoftLimitKib != null;
    }

    public boolean isEmpty() {
        return !hasCpuControls() && !hasMemoryControls();
    }
}
