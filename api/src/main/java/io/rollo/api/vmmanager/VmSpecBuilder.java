package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Fluent builder for {@link VmSpec}.
 *
 * <p>A random UUID is assigned when none is given. CPU and memory default to
 * one core and 1 GiB.</p>
 */
public class VmSpecBuilder {

    private String name;
    private String uuid;
    private String description;
    private String osType = "linux";
    private CpuConfig cpu = CpuConfig.of(1);
    private MemoryConfig memory = MemoryConfig.of(1024);
    private final List<DiskConfig> disks = new ArrayList<>();
    private final List<NetworkConfig> networks = new ArrayList<>();
    private boolean vncEnabled = true;

    public VmSpecBuilder name(@Nonnull String name) {
        this.name = Objects.requireNonNull(name, "name");
        return this;
    }

    public VmSpecBuilder uuid(@Nullable String uuid) {
        this.uuid = uuid;
        return this;
    }

    public VmSpecBuilder description(@Nullable String description) {
        this.description = description;
        return this;
    }

    public VmSpecBuilder osType(@Nonnull String osType) {
        this.osType = Objects.requireNonNull(osType, "osType");
        return this;
    }

    public VmSpecBuilder cpu(@Nonnull CpuConfig cpu) {
        this.cpu = Objects.requireNonNull(cpu, "cpu");
        return this;
    }

    public VmSpecBuilder memory(@Nonnull MemoryConfig memory) {
        this.memory = Objects.requireNonNull(memory, "memory");
        return this;
    }

    public VmSpecBuilder disk(@Nonnull DiskConfig disk) {
        this.disks.add(Objects.requireNonNull(disk, "disk"));
        return this;
    }

    public VmSpecBuilder disks(@Nonnull List<DiskConfig> disks) {
        Objects.requireNonNull(disks, "disks");
        this.disks.addAll(disks);
        return this;
    }

    public VmSpecBuilder network(@Nonnull NetworkConfig network) {
        this.networks.add(Objects.requireNonNull(network, "network"));
        return this;
    }

    public VmSpecBuilder networks(@Nonnull List<NetworkConfig> networks) {
        Objects.requireNonNull(networks, "networks");
        this.networks.addAll(networks);
        return this;
    }

    public VmSpecBuilder vncEnabled(boolean vncEnabled) {
        this.vncEnabled = vncEnabled;
        return this;
    }

    /**
     * Build the spec.
     *
     * @return the spec
     * @throws IllegalStateException if no name was set
     */
    @Nonnull
    public VmSpec build() {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("VM name is required");
        }
        String resolvedUuid = uuid != null ? uuid : UUID.randomUUID().toString();
        return new VmSpec(name, resolvedUuid, description, osType, cpu, memory,
                new ArrayList<>(disks), new ArrayList<>(networks), vncEnabled);
    }
}
