package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Requested configuration of a VM.
 *
 * <p>Use {@link #builder()} to create one:</p>
 * <pre>{@code
 * VmSpec spec = VmSpec.builder()
 *     .name("web-01")
 *     .cpu(CpuConfig.of(2))
 *     .memory(MemoryConfig.of(4096))
 *     .disk(DiskConfig.boot("root", 20))
 *     .network(NetworkConfig.nat("eth0"))
 *     .build();
 * }</pre>
 *
 * @param name domain name
 * @param uuid domain UUID, the correlation key for durable records
 * @param description free-form description, may be null
 * @param osType guest OS family
 * @param cpu CPU configuration
 * @param memory memory configuration
 * @param disks disks in attachment order
 * @param networks network interfaces in attachment order
 * @param vncEnabled attach a VNC console
 */
public record VmSpec(
        @Nonnull String name,
        @Nonnull String uuid,
        @Nullable String description,
        @Nonnull String osType,
        @Nonnull CpuConfig cpu,
        @Nonnull MemoryConfig memory,
        @Nonnull List<DiskConfig> disks,
        @Nonnull List<NetworkConfig> networks,
        boolean vncEnabled) {

    public VmSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(cpu, "cpu");
        Objects.requireNonNull(memory, "memory");
        osType = osType == null ? "linux" : osType;
        disks = disks == null ? List.of() : List.copyOf(disks);
        networks = networks == null ? List.of() : List.copyOf(networks);
    }

    @Nonnull
    public static VmSpecBuilder builder() {
        return new VmSpecBuilder();
    }

    public int totalVcpus() {
        return cpu.totalVcpus();
    }

    public long memoryKib() {
        return memory.sizeKib();
    }

    /**
     * Sum of all disk sizes.
     *
     * @return total requested disk in GiB
     */
    public double totalDiskGb() {
        return disks.stream().mapToDouble(DiskConfig::sizeGb).sum();
    }

    @Nonnull
    public Optional<DiskConfig> bootDisk() {
        return disks.stream().filter(DiskConfig::bootable).findFirst();
    }
}
