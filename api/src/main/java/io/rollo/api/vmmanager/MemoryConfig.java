package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Guest memory configuration.
 *
 * @param sizeMb memory size in MiB
 * @param hugepages back guest memory with huge pages
 * @param balloon attach a balloon device
 * @param shares relative memory weight, null for the hypervisor default
 * @param overcommitRatio requested overcommit ratio, null when unset
 */
public record MemoryConfig(
        long sizeMb,
        boolean hugepages,
        boolean balloon,
        @Nullable Integer shares,
        @Nullable Double overcommitRatio) {

    @Nonnull
    public static MemoryConfig of(long sizeMb) {
        return new MemoryConfig(sizeMb, false, true, null, null);
    }

    @Nonnull
    public MemoryConfig withHugepages(boolean hugepages) {
        return new MemoryConfig(sizeMb, hugepages, balloon, shares, overcommitRatio);
    }

    @Nonnull
    public MemoryConfig withBalloon(boolean balloon) {
        return new MemoryConfig(sizeMb, hugepages, balloon, shares, overcommitRatio);
    }

    @Nonnull
    public MemoryConfig withShares(@Nullable Integer shares) {
        return new MemoryConfig(sizeMb, hugepages, balloon, shares, overcommitRatio);
    }

    @Nonnull
    public MemoryConfig withOvercommitRatio(@Nullable Double overcommitRatio) {
        return new MemoryConfig(sizeMb, hugepages, balloon, shares, overcommitRatio);
    }

    public long sizeKib() {
        return sizeMb * 1024L;
    }
}
