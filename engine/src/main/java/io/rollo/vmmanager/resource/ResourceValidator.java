package io.rollo.vmmanager.resource;

import io.rollo.api.vmmanager.CpuConfig;
import io.rollo.api.vmmanager.DiskConfig;
import io.rollo.api.vmmanager.MemoryConfig;
import io.rollo.api.vmmanager.NetworkConfig;
import io.rollo.api.vmmanager.ResourceControls;
import io.rollo.api.vmmanager.ValidationResult;
import io.rollo.api.vmmanager.VmSpec;
import com.google.common.net.InetAddresses;
import io.rollo.vmmanager.config.VmManagerConfig;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a {@link VmSpec} against per-VM limits and host availability.
 *
 * <p>Every rule runs; the result lists all violations at once.</p>
 */
public class ResourceValidator {

    private static final Pattern MAC_PATTERN = Pattern.compile("^([0-9A-Fa-f]{2}[:-]){5}([0-9A-Fa-f]{2})$");
    private static final Pattern IPV4_PATTERN = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");

    private static final Set<String> DISK_FORMATS = Set.of("qcow2", "raw", "vmdk");
    private static final Set<String> CACHE_MODES = Set.of("none", "writeback", "writethrough", "directsync", "unsafe");

    private static final double MIN_DISK_GB = 1.0;
    private static final int MAX_SHARES = 2048;
    private static final int MAX_VLAN_ID = 4094;
    private static final double GIB = 1024.0 * 1024.0 * 1024.0;

    // cgroup bounds enforced by the hypervisor
    private static final long MIN_CPU_SHARES = 2;
    private static final long MAX_CPU_SHARES = 262_144;
    private static final long MIN_CPU_PERIOD_US = 1_000;
    private static final long MAX_CPU_PERIOD_US = 1_000_000;
    private static final long MIN_CPU_QUOTA_US = 1_000;

    private final VmManagerConfig.ResourceConfig config;

    public ResourceValidator(@Nonnull VmManagerConfig.ResourceConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Validate a spec.
     *
     * @param spec VM configuration
     * @param report host capacity and availability to check against
     * @return every error and warning found
     */
    @Nonnull
    public ValidationResult validate(@Nonnull VmSpec spec, @Nonnull ResourceReport report) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(report, "report");

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        validateCpu(spec.cpu(), report.capacity(), errors);
        validateMemory(spec.memory(), report.capacity(), errors, warnings);
        validateDisks(spec.disks(), errors, warnings);
        validateNetworks(spec.networks(), errors);

        int structural = errors.size();
        validateAvailability(spec, report, errors, warnings);

        return ValidationResult.of(errors, warnings, errors.size() > structural);
    }

    /**
     * Validate new resource sizes for an existing VM.
     *
     * <p>Applies the same host rules as creation: the vCPU count may not exceed the
     * host's logical CPUs and memory may not exceed the host memory ratio.</p>
     *
     * @param cpuCores new vCPU count, 0 to keep
     * @param memoryMb new memory size, 0 to keep
     * @param capacity host to check against
     * @return errors found, never capacity related
     */
    @Nonnull
    public ValidationResult validateResize(int cpuCores, long memoryMb, @Nonnull HostCapacity capacity) {
        Objects.requireNonNull(capacity, "capacity");
        List<String> errors = new ArrayList<>();
        if (cpuCores == 0 && memoryMb == 0) {
            errors.add("At least one of CPU cores or memory size must be given");
        }
        if (cpuCores < 0 || cpuCores > config.getMaxCpuCores()) {
            errors.add("CPU cores must be between 1 and " + config.getMaxCpuCores());
        }
        if (memoryMb < 0 || (memoryMb > 0 && memoryMb < config.getMinMemoryMb())) {
            errors.add("Memory size must be at least " + config.getMinMemoryMb() + "MB");
        }
        if (memoryMb > config.getMaxMemoryMb()) {
            errors.add("Memory size cannot exceed " + (config.getMaxMemoryMb() / 1024) + "GB");
        }
        if (cpuCores > capacity.cpus()) {
            errors.add("Total logical CPUs (" + cpuCores + ") exceeds system capacity (" + capacity.cpus() + ")");
        }
        if (memoryMb > capacity.memoryMb() * config.getHostMemoryRatio()) {
            errors.add(hostMemoryError(memoryMb, capacity));
        }
        return ValidationResult.of(errors, List.of(), false);
    }

    /**
     * Validate scheduler and memory controls for an existing VM.
     *
     * @param controls requested controls
     * @return errors found, never capacity related
     */
    @Nonnull
    public ValidationResult validateControls(@Nonnull ResourceControls controls) {
        Objects.requireNonNull(controls, "controls");
        List<String> errors = new ArrayList<>();
        if (controls.isEmpty()) {
            errors.add("At least one resource control must be given");
        }
        Long shares = controls.cpuShares();
        if (shares != null && (shares < MIN_CPU_SHARES || shares > MAX_CPU_SHARES)) {
            errors.add("CPU shares must be between " + MIN_CPU_SHARES + " and " + MAX_CPU_SHARES);
        }
        Long period = controls.cpuPeriodUs();
        if (period != null && (period < MIN_CPU_PERIOD_US || period > MAX_CPU_PERIOD_US)) {
            errors.add("CPU period must be between " + MIN_CPU_PERIOD_US + " and " + MAX_CPU_PERIOD_US + " microseconds");
        }
        Long quota = controls.cpuQuotaUs();
        if (quota != null && quota != -1 && quota < MIN_CPU_QUOTA_US) {
            errors.add("CPU quota must be -1 (unlimited) or at least " + MIN_CPU_QUOTA_US + " microseconds");
        }
        Long hard = controls.memoryHardLimitKib();
        Long soft = controls.memorySoftLimitKib();
        long minMemoryKib = config.getMinMemoryMb() * 1024L;
        if (hard != null && hard < minMemoryKib) {
            errors.add("Memory hard limit must be at least " + config.getMinMemoryMb() + "MB");
        }
        if (soft != null && soft <= 0) {
            errors.add("Memory soft limit must be positive");
        }
        if (hard != null && soft != null && soft > hard) {
            errors.add("Memory soft limit (" + soft + "KiB) exceeds hard limit (" + hard + "KiB)");
        }
        return ValidationResult.of(errors, List.of(), false);
    }

    // ==================== CPU ====================

    void validateCpu(CpuConfig cpu, HostCapacity capacity, List<String> errors) {
        if (cpu.cores() < 1 || cpu.cores() > config.getMaxCpuCores()) {
            errors.add("CPU cores must be between 1 and " + config.getMaxCpuCores());
        }
        if (cpu.sockets() < 1 || cpu.sockets() > config.getMaxSockets()) {
            errors.add("CPU sockets must be between 1 and " + config.getMaxSockets());
        }
        if (cpu.threads() < 1 || cpu.threads() > config.getMaxThreads()) {
            errors.add("CPU threads per core must be between 1 and " + config.getMaxThreads());
        }

        int total = cpu.totalVcpus();
        if (total > capacity.cpus()) {
            errors.add("Total logical CPUs (" + total + ") exceeds system capacity (" + capacity.cpus() + ")");
        }

        if (!cpu.pinning().isEmpty()) {
            for (Integer core : cpu.pinning()) {
                if (core == null || core < 0 || core >= capacity.cpus()) {
                    errors.add("CPU pinning core " + core + " is invalid (system has " + capacity.cpus() + " cores)");
                }
            }
            if (cpu.pinning().size() != cpu.cores()) {
                errors.add("CPU pinning list length must match number of cores");
            }
        }

        if (cpu.shares() != null && (cpu.shares() < 1 || cpu.shares() > MAX_SHARES)) {
            errors.add("CPU shares must be between 1 and " + MAX_SHARES);
        }
        if (cpu.limitPercent() != null && (cpu.limitPercent() < 1 || cpu.limitPercent() > 100)) {
            errors.add("CPU limit must be between 1 and 100 percent");
        }
    }

    // ==================== Memory ====================

    void validateMemory(MemoryConfig memory, HostCapacity capacity, List<String> errors, List<String> warnings) {
        if (memory.sizeMb() < config.getMinMemoryMb()) {
            errors.add("Memory size must be at least " + config.getMinMemoryMb() + "MB");
        }
        if (memory.sizeMb() > config.getMaxMemoryMb()) {
            errors.add("Memory size cannot exceed " + (config.getMaxMemoryMb() / 1024) + "GB");
        }

        if (memory.sizeMb() > capacity.memoryMb() * config.getHostMemoryRatio()) {
            errors.add(hostMemoryError(memory.sizeMb(), capacity));
        }

        if (memory.shares() != null && (memory.shares() < 1 || memory.shares() > MAX_SHARES)) {
            errors.add("Memory shares must be between 1 and " + MAX_SHARES);
        }
        if (memory.overcommitRatio() != null
                && (memory.overcommitRatio() < 0.5 || memory.overcommitRatio() > 2.0)) {
            errors.add("Memory overcommit ratio must be between 0.5 and 2.0");
        }
        if (memory.hugepages()) {
            warnings.add("Hugepages support requires proper system configuration");
        }
    }

    private String hostMemoryError(long memoryMb, HostCapacity capacity) {
        return "Memory allocation (" + memoryMb + "MB) exceeds "
                + Math.round(config.getHostMemoryRatio() * 100) + "% of system memory ("
                + capacity.memoryMb() + "MB)";
    }

    // ==================== Disks ====================

    void validateDisks(List<DiskConfig> disks, List<String> errors, List<String> warnings) {
        if (disks.isEmpty()) {
            errors.add("At least one disk is required");
            return;
        }
        if (disks.size() > config.getMaxDisks()) {
            errors.add("Maximum " + config.getMaxDisks() + " disks allowed per VM");
        }

        long bootable = disks.stream().filter(DiskConfig::bootable).count();
        if (bootable == 0) {
            warnings.add("No bootable disk specified");
        } else if (bootable > 1) {
            errors.add("Only one disk can be marked as bootable");
        }

        Set<String> names = new HashSet<>();
        for (DiskConfig disk : disks) {
            if (!names.add(disk.name())) {
                errors.add("Duplicate disk name: " + disk.name());
            }
            if (disk.sizeGb() < MIN_DISK_GB) {
                errors.add("Disk " + disk.name() + " size must be at least 1GB");
            }
            if (disk.sizeGb() > config.getMaxDiskGb()) {
                errors.add("Disk " + disk.name() + " size cannot exceed " + Math.round(config.getMaxDiskGb()) + "GB");
            }
            if (!DISK_FORMATS.contains(disk.format())) {
                errors.add("Disk " + disk.name() + " format must be qcow2, raw, or vmdk");
            }
            if (!CACHE_MODES.contains(disk.cache())) {
                errors.add("Disk " + disk.name() + " cache mode is invalid");
            }
        }
    }

    // ==================== Network ====================

    void validateNetworks(List<NetworkConfig> networks, List<String> errors) {
        if (networks.isEmpty()) {
            errors.add("At least one network interface is required");
            return;
        }
        if (networks.size() > config.getMaxNetworks()) {
            errors.add("Maximum " + config.getMaxNetworks() + " network interfaces allowed per VM");
        }

        Set<String> names = new HashSet<>();
        Set<String> macs = new HashSet<>();
        for (NetworkConfig network : networks) {
            if (!names.add(network.name())) {
                errors.add("Duplicate network interface name: " + network.name());
            }
            String mac = network.macAddress();
            if (mac != null && !mac.isEmpty()) {
                if (!macs.add(mac.toLowerCase(Locale.ROOT))) {
                    errors.add("Duplicate MAC address: " + mac);
                }
                if (!MAC_PATTERN.matcher(mac).matches()) {
                    errors.add("Invalid MAC address format: " + mac);
                }
            }
            if (network.vlanId() != null && (network.vlanId() < 1 || network.vlanId() > MAX_VLAN_ID)) {
                errors.add("VLAN ID for " + network.name() + " must be between 1 and " + MAX_VLAN_ID);
            }
            String ip = network.ipAddress();
            if (ip != null && !ip.isEmpty() && !isValidIpAddress(ip)) {
                errors.add("Invalid IP address for " + network.name() + ": " + ip);
            }
            if (network.bandwidthMbps() != null && network.bandwidthMbps() < 1) {
                errors.add("Bandwidth limit for " + network.name() + " must be at least 1 Mbps");
            }
        }
    }

    static boolean isValidIpAddress(String ip) {
        if (IPV4_PATTERN.matcher(ip).matches()) {
            return true;
        }
        if (!ip.contains(":")) {
            return false;
        }
        return InetAddresses.isInetAddress(ip);
    }

    // ==================== Availability ====================

    void validateAvailability(VmSpec spec, ResourceReport report, List<String> errors, List<String> warnings) {
        AvailableResources available = report.available();

        int vcpus = spec.totalVcpus();
        if (vcpus > available.schedulableVcpus()) {
            errors.add("Not enough CPU cores available (requested: " + vcpus
                    + ", available: " + Math.max(0, available.schedulableVcpus()) + ")");
        }
        if (spec.memory().sizeMb() > available.memoryMb()) {
            errors.add("Not enough memory available (requested: " + spec.memory().sizeMb()
                    + "MB, available: " + Math.max(0, available.memoryMb()) + "MB)");
        }

        double diskGb = spec.totalDiskGb();
        if (available.isStorageKnown()) {
            double availableGb = available.storageBytes() / GIB;
            if (diskGb > availableGb) {
                errors.add("Total disk allocation (" + formatGb(diskGb) + "GB) exceeds available space ("
                        + formatGb(availableGb) + "GB)");
            }
        } else {
            warnings.add("Could not check disk space: " + report.storageError());
        }
    }

    private static String formatGb(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
