package io.rollo.vmmanager.resource;

import io.rollo.api.vmmanager.CpuConfig;
import io.rollo.api.vmmanager.DiskConfig;
import io.rollo.api.vmmanager.MemoryConfig;
import io.rollo.api.vmmanager.NetworkConfig;
import io.rollo.api.vmmanager.ResourceLimits;
import io.rollo.api.vmmanager.VmSpec;
import io.rollo.api.vmmanager.error.ResourceAllocationException;
import io.rollo.api.vmmanager.error.ValidationException;
import io.rollo.vmmanager.MutableClock;
import io.rollo.vmmanager.config.VmManagerConfig;
import io.rollo.vmmanager.connection.ConnectionManager;
import io.rollo.vmmanager.hypervisor.FakeHypervisor;
import io.rollo.vmmanager.hypervisor.HypervisorState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static io.rollo.vmmanager.hypervisor.FakeHypervisor.GIB_KIB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceAccountantTest {

    private static final long GIB = 1024L * 1024 * 1024;

    private final FakeHypervisor hypervisor = new FakeHypervisor();
    private final MutableClock clock = new MutableClock();
    private final AtomicLong freeBytes = new AtomicLong(100 * GIB);
    private VmManagerConfig.ResourceConfig config;
    private ConnectionManager connection;
    private ResourceAccountant accountant;

    @BeforeEach
    void setUp() {
        config = new VmManagerConfig.ResourceConfig();
        connection = new ConnectionManager(new VmManagerConfig.ConnectionConfig(), hypervisor, clock);
        accountant = new ResourceAccountant(connection, config, 0.9, freeBytes::get, clock);
    }

    @AfterEach
    void tearDown() {
        connection.disconnect();
    }

    private void addDomain(String name, int vcpus, long memoryMb, HypervisorState state) {
        hypervisor.addDomain("<domain type='kvm'><name>" + name + "</name><uuid>" + UUID.randomUUID() + "</uuid>"
                + "<memory unit='MiB'>" + memoryMb + "</memory><vcpu>" + vcpus + "</vcpu></domain>", state);
    }

    private static VmSpec spec(int cores, long memoryMb) {
        return VmSpec.builder()
                .name("new-vm")
                .cpu(CpuConfig.of(cores))
                .memory(MemoryConfig.of(memoryMb))
                .disk(DiskConfig.boot("root", 10))
                .network(NetworkConfig.nat("eth0"))
                .build();
    }

    @Test
    void readsHostCapacity() {
        HostCapacity capacity = accountant.hostCapacity();

        assertThat(capacity.cpus()).isEqualTo(8);
        assertThat(capacity.memoryKib()).isEqualTo(16 * GIB_KIB);
        assertThat(capacity.memoryMb()).isEqualTo(16 * 1024);
        assertThat(capacity.model()).isEqualTo("x86_64");
    }

    @Test
    void allocationCountsEveryDefinedDomain() {
        addDomain("running", 2, 2048, HypervisorState.RUNNING);
        addDomain("stopped", 4, 4096, HypervisorState.SHUTOFF);
        addDomain("paused", 1, 1024, HypervisorState.PAUSED);

        AllocationSnapshot snapshot = accountant.scanAllocation();

        assertThat(snapshot.vcpus()).isEqualTo(7);
        assertThat(snapshot.memoryKib()).isEqualTo(7168L * 1024);
        assertThat(snapshot.activeDomains()).isEqualTo(2);
        assertThat(snapshot.totalDomains()).isEqualTo(3);
        assertThat(snapshot.takenAt()).isEqualTo(clock.instant());
    }

    @Test
    void allocatedPlusAvailableEqualsCapacity() {
        addDomain("a", 6, 8192, HypervisorState.RUNNING);
        addDomain("b", 6, 12288, HypervisorState.SHUTOFF);

        ResourceReport report = accountant.report(true);

        assertThat(report.allocated().vcpus() + report.available().cpus()).isEqualTo(report.capacity().cpus());
        assertThat(report.allocated().memoryKib() + report.available().memoryKib())
                .isEqualTo(report.capacity().memoryKib());
        // overcommitted host: exact differences, not clamped
        assertThat(report.available().cpus()).isEqualTo(-4);
        assertThat(report.available().memoryKib()).isEqualTo(-4 * GIB_KIB);
        assertThat(report.available().schedulableVcpus()).isEqualTo(32 - 12);
        assertThat(report.available().storageBytes()).isEqualTo((long) (100 * GIB * 0.9));
        assertThat(report.storageError()).isNull();
    }

    @Test
    void cachedAllocationExpiresAfterTtl() {
        config.setAllocationCacheTtlMillis(2000);
        accountant = new ResourceAccountant(connection, config, 0.9, freeBytes::get, clock);
        AllocationSnapshot first = accountant.allocated();

        addDomain("late", 2, 1024, HypervisorState.SHUTOFF);
        assertThat(accountant.allocated()).isSameAs(first);

        clock.advance(Duration.ofMillis(2000));
        assertThat(accountant.allocated().vcpus()).isEqualTo(2);
    }

    @Test
    void invalidateForcesRescan() {
        AllocationSnapshot first = accountant.allocated();
        addDomain("late", 2, 1024, HypervisorState.SHUTOFF);

        accountant.invalidate();

        assertThat(accountant.allocated()).isNotSameAs(first);
        assertThat(accountant.allocated().totalDomains()).isEqualTo(1);
    }

    @Test
    void scanOverlappingAnInvalidationIsNotCached() {
        config.setAllocationCacheTtlMillis(60_000);
        accountant = new ResourceAccountant(connection, config, 0.9, freeBytes::get, clock);
        AtomicInteger scans = new AtomicInteger();
        hypervisor.setListDomainsHook(() -> {
            // a commit lands after the listing was taken
            if (scans.incrementAndGet() == 1) {
                addDomain("committed", 2, 1024, HypervisorState.SHUTOFF);
                accountant.invalidate();
            }
        });

        AllocationSnapshot stale = accountant.allocated();

        assertThat(stale.totalDomains()).isZero();
        assertThat(accountant.allocated().totalDomains()).isEqualTo(1);
        assertThat(accountant.allocated().vcpus()).isEqualTo(2);
        assertThat(scans).hasValue(2);
    }

    @Test
    void freshReportBypassesCache() {
        accountant.allocated();
        addDomain("late", 3, 1024, HypervisorState.SHUTOFF);

        assertThat(accountant.report(false).allocated().vcpus()).isZero();
        assertThat(accountant.report(true).allocated().vcpus()).isEqualTo(3);
    }

    @Test
    void unreadableStorageIsReportedNotThrown() {
        accountant = new ResourceAccountant(connection, config, 0.9, () -> {
            throw new IOException("statvfs failed");
        }, clock);

        ResourceReport report = accountant.report(true);

        assertThat(report.available().isStorageKnown()).isFalse();
        assertThat(report.storageError()).isEqualTo("statvfs failed");
        assertThat(accountant.validate(spec(2, 1024)).warnings())
                .containsExactly("Could not check disk space: statvfs failed");
    }

    @Test
    void limitsAreBoundedByHost() {
        addDomain("a", 2, 4096, HypervisorState.RUNNING);

        ResourceLimits limits = accountant.limits();

        assertThat(limits.maxCpuCores()).isEqualTo(8);
        assertThat(limits.maxMemoryMb()).isEqualTo((long) (16 * 1024 * 0.9));
        assertThat(limits.maxDiskGb()).isEqualTo(90.0);
        assertThat(limits.maxDisks()).isEqualTo(10);
        assertThat(limits.maxNetworks()).isEqualTo(5);
        assertThat(limits.availableVcpus()).isEqualTo(30);
        assertThat(limits.availableMemoryMb()).isEqualTo(12 * 1024);
        assertThat(limits.availableDiskGb()).isEqualTo(90.0);
    }

    @Test
    void requireValidDistinguishesCapacityFromRuleViolations() {
        addDomain("big", 30, 14 * 1024, HypervisorState.RUNNING);

        assertThatThrownBy(() -> accountant.requireValid(spec(4, 4096)))
                .isInstanceOf(ResourceAllocationException.class)
                .hasMessageContaining("Not enough CPU cores available (requested: 4, available: 2)")
                .hasMessageContaining("Not enough memory available");

        assertThatThrownBy(() -> accountant.requireValid(spec(1, 100)))
                .isInstanceOf(ValidationException.class)
                .isNotInstanceOf(ResourceAllocationException.class)
                .hasMessageContaining("Memory size must be at least 512MB");
    }

    @Test
    void requireCapacityChecksOnlyAdditions() {
        addDomain("big", 30, 15 * 1024, HypervisorState.RUNNING);

        accountant.requireCapacity("resize", "vm", -4, -2048L * 1024);
        accountant.requireCapacity("resize", "vm", 2, 1024L * 1024);

        assertThatThrownBy(() -> accountant.requireCapacity("clone", "vm", 3, 0))
                .isInstanceOf(ResourceAllocationException.class)
                .hasMessageContaining("requested: 3, available: 2");
        assertThatThrownBy(() -> accountant.requireCapacity("clone", "vm", 0, 2048L * 1024))
                .isInstanceOf(ResourceAllocationException.class)
                .hasMessageContaining("requested: 2048MB, available: 1024MB");
    }

    @Test
    void commitValidatesAgainstFreshScanAndInvalidates() {
        accountant.allocated();
        addDomain("sneaky", 30, 1024, HypervisorState.SHUTOFF);

        // cache still shows an idle host
        assertThatThrownBy(() -> accountant.commit(spec(4, 1024), () -> "defined"))
                .isInstanceOf(ResourceAllocationException.class);

        String result = accountant.commit(spec(2, 1024), () -> {
            addDomain("new-vm", 2, 1024, HypervisorState.SHUTOFF);
            return "defined";
        });

        assertThat(result).isEqualTo("defined");
        assertThat(accountant.allocated().vcpus()).isEqualTo(32);
    }

    @Test
    void allocationLockIsReleasedAfterFailure() {
        assertThatThrownBy(() -> accountant.withAllocationLock(() -> {
            throw new IllegalStateException("define failed");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(accountant.withAllocationLock(() -> "again")).isEqualTo("again");
    }
}
