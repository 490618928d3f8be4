package io.rollo.vmmanager.resource;

import io.rollo.api.vmmanager.ResourceControls;
import io.rollo.api.vmmanager.ResourceLimits;
import io.rollo.api.vmmanager.ValidationResult;
import io.rollo.api.vmmanager.VmSpec;
import io.rollo.api.vmmanager.error.ResourceAllocationException;
import io.rollo.api.vmmanager.error.ValidationException;
import io.rollo.vmmanager.config.VmManagerConfig;
import io.rollo.vmmanager.connection.ConnectionManager;
import io.rollo.vmmanager.hypervisor.DomainInfo;
import io.rollo.vmmanager.hypervisor.HypervisorDomain;
import io.rollo.vmmanager.hypervisor.HypervisorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Tracks host capacity, allocated resources and availability.
 *
 * <p>Allocation is derived by scanning every domain the hypervisor knows. Operations
 * that commit new resources run under {@link #withAllocationLock}, which serializes
 * them against each other and always validates against a fresh scan, so two
 * conflicting requests cannot both pass.</p>
 */
public class ResourceAccountant {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceAccountant.class);

    private static final double GIB = 1024.0 * 1024.0 * 1024.0;

    private final ConnectionManager connection;
    private final VmManagerConfig.ResourceConfig config;
    private final double freeSpaceRatio;
    private final StorageProbe storage;
    private final ResourceValidator validator;
    private final Clock clock;
    private final Duration cacheTtl;

    private final ReentrantLock allocationLock = new ReentrantLock(true);
    // entries from an older generation are stale even if stored after the invalidation
    private final AtomicReference<CachedAllocation> cached = new AtomicReference<>();
    private final AtomicLong generation = new AtomicLong();

    public ResourceAccountant(@Nonnull ConnectionManager connection,
                              @Nonnull VmManagerConfig.ResourceConfig config,
                              double freeSpaceRatio,
                              @Nonnull StorageProbe storage) {
        this(connection, config, freeSpaceRatio, storage, Clock.systemUTC());
    }

    /**
     * Create an accountant.
     *
     * @param connection shared hypervisor connection
     * @param config limits, ratios and cache settings
     * @param freeSpaceRatio share of free storage usable for new disks
     * @param storage free space source
     * @param clock time source for the allocation cache
     */
    public ResourceAccountant(@Nonnull ConnectionManager connection,
                              @Nonnull VmManagerConfig.ResourceConfig config,
                              double freeSpaceRatio,
                              @Nonnull StorageProbe storage,
                              @Nonnull Clock clock) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.config = Objects.requireNonNull(config, "config");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.freeSpaceRatio = freeSpaceRatio;
        this.validator = new ResourceValidator(config);
        this.cacheTtl = Duration.ofMillis(Math.max(0, config.getAllocationCacheTtlMillis()));
    }

    // ==================== Observation ====================

    /**
     * Read host capacity from the hypervisor.
     *
     * @return current capacity
     */
    @Nonnull
    public HostCapacity hostCapacity() {
        return connection.execute("read host capacity", null, client -> HostCapacity.from(client.nodeInfo()));
    }

    /**
     * Allocated resources, served from the cache while it is younger than the TTL.
     *
     * @return allocation snapshot
     */
    @Nonnull
    public AllocationSnapshot allocated() {
        CachedAllocation entry = cached.get();
        AllocationSnapshot snapshot = entry != null && entry.generation() == generation.get()
                ? entry.snapshot() : null;
        if (snapshot != null && !cacheTtl.isZero()
                && clock.instant().isBefore(snapshot.takenAt().plus(cacheTtl))) {
            return snapshot;
        }
        return scanAllocation();
    }

    /**
     * Scan every domain and sum configured vCPUs and maximum memory.
     *
     * @return fresh snapshot, also stored in the cache unless it was invalidated during the scan
     */
    @Nonnull
    public AllocationSnapshot scanAllocation() {
        long startGeneration = generation.get();
        AllocationSnapshot snapshot = connection.execute("scan allocation", null, client -> {
            int vcpus = 0;
            long memoryKib = 0;
            int active = 0;
            int total = 0;
            for (HypervisorDomain domain : client.listDomains()) {
                DomainInfo info;
                try {
                    info = domain.info();
                } catch (HypervisorException e) {
                    if (e.getKind() != HypervisorException.Kind.NO_DOMAIN) {
                        throw e;
                    }
                    LOGGER.debug("Domain {} disappeared during allocation scan", domain.name());
                    continue;
                }
                vcpus += info.vcpus();
                memoryKib += info.maxMemoryKib();
                total++;
                if (info.state().isActive()) {
                    active++;
                }
            }
            return new AllocationSnapshot(vcpus, memoryKib, active, total, clock.instant());
        });
        CachedAllocation current = cached.get();
        CachedAllocation fresh = new CachedAllocation(startGeneration, snapshot);
        if (generation.get() == startGeneration && cached.compareAndSet(current, fresh)) {
            LOGGER.trace("Cached allocation scan: {}", snapshot);
        } else {
            LOGGER.debug("Allocation changed during scan, not caching it");
        }
        return snapshot;
    }

    /**
     * Drop the cached allocation so the next read scans again.
     */
    public void invalidate() {
        generation.incrementAndGet();
        cached.set(null);
    }

    /**
     * Compute capacity, allocation and availability together.
     *
     * @param fresh bypass the allocation cache
     * @return report whose values are consistent with each other
     */
    @Nonnull
    public ResourceReport report(boolean fresh) {
        HostCapacity capacity = hostCapacity();
        AllocationSnapshot allocation = fresh ? scanAllocation() : allocated();

        long storageBytes = -1;
        String storageError = null;
        try {
            storageBytes = (long) (storage.freeBytes() * freeSpaceRatio);
        } catch (IOException e) {
            storageError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            LOGGER.warn("Could not read free storage space: {}", storageError);
        }

        int schedulable = (int) Math.floor(capacity.cpus() * config.getVcpuOvercommitRatio()) - allocation.vcpus();
        AvailableResources available = new AvailableResources(
                capacity.cpus() - allocation.vcpus(),
                capacity.memoryKib() - allocation.memoryKib(),
                schedulable,
                storageBytes);
        return new ResourceReport(capacity, allocation, available, storageError);
    }

    @Nonnull
    public AvailableResources available() {
        return report(false).available();
    }

    /**
     * Per-VM maxima bounded by what the host has, plus current availability.
     *
     * @return limits for callers sizing a new VM
     */
    @Nonnull
    public ResourceLimits limits() {
        ResourceReport report = report(false);
        HostCapacity capacity = report.capacity();
        AvailableResources available = report.available();

        int maxCores = Math.min(config.getMaxCpuCores(), capacity.cpus());
        long maxMemoryMb = Math.min(config.getMaxMemoryMb(),
                (long) (capacity.memoryMb() * config.getHostMemoryRatio()));
        double availableDiskGb = available.isStorageKnown() ? available.storageBytes() / GIB : 0.0;
        double maxDiskGb = available.isStorageKnown()
                ? Math.min(config.getMaxDiskGb(), availableDiskGb)
                : config.getMaxDiskGb();

        return new ResourceLimits(maxCores, maxMemoryMb, maxDiskGb, config.getMaxDisks(), config.getMaxNetworks(),
                available.schedulableVcpus(), available.memoryMb(), availableDiskGb);
    }

    // ==================== Validation ====================

    /**
     * Validate a spec against limits and current availability.
     *
     * @param spec VM configuration
     * @return every error and warning
     */
    @Nonnull
    public ValidationResult validate(@Nonnull VmSpec spec) {
        Objects.requireNonNull(spec, "spec");
        return validator.validate(spec, report(false));
    }

    /**
     * Validate against a fresh scan and throw on failure. Call under the allocation lock.
     *
     * @param spec VM configuration
     * @throws ResourceAllocationException if the host cannot fit the VM
     * @throws ValidationException on any other rule violation
     */
    public void requireValid(@Nonnull VmSpec spec) {
        ValidationResult result = validator.validate(spec, report(true));
        if (!result.warnings().isEmpty()) {
            LOGGER.info("Validation warnings for VM {}: {}", spec.name(), result.warnings());
        }
        if (result.valid()) {
            return;
        }
        LOGGER.warn("Validation failed for VM {}: {}", spec.name(), result.errors());
        if (result.capacityExceeded()) {
            throw new ResourceAllocationException(result);
        }
        throw new ValidationException(result);
    }

    /**
     * Check requested resize values against per-VM limits and the host's size.
     *
     * @param cpuCores new vCPU count, 0 to keep
     * @param memoryMb new memory size, 0 to keep
     * @throws ValidationException if a value is out of range or larger than the host allows
     */
    public void requireValidResize(int cpuCores, long memoryMb) {
        ValidationResult result = validator.validateResize(cpuCores, memoryMb, hostCapacity());
        if (!result.valid()) {
            throw new ValidationException(result);
        }
    }

    /**
     * Check scheduler and memory controls before applying them.
     *
     * @param controls requested controls
     * @throws ValidationException if a value is out of range
     */
    public void requireValidControls(@Nonnull ResourceControls controls) {
        ValidationResult result = validator.validateControls(controls);
        if (!result.valid()) {
            throw new ValidationException(result);
        }
    }

    /**
     * Check that additional vCPUs and memory fit. Call under the allocation lock.
     *
     * @param operation operation name for logging
     * @param identity VM the resources are for
     * @param vcpus additional vCPUs
     * @param memoryKib additional memory
     * @throws ResourceAllocationException if either does not fit
     */
    public void requireCapacity(@Nonnull String operation, @Nullable String identity, int vcpus, long memoryKib) {
        AvailableResources available = report(true).available();
        List<String> errors = new ArrayList<>();
        if (vcpus > 0 && vcpus > available.schedulableVcpus()) {
            errors.add("Not enough CPU cores available (requested: " + vcpus
                    + ", available: " + Math.max(0, available.schedulableVcpus()) + ")");
        }
        if (memoryKib > 0 && memoryKib > available.memoryKib()) {
            errors.add("Not enough memory available (requested: " + (memoryKib / 1024)
                    + "MB, available: " + Math.max(0, available.memoryMb()) + "MB)");
        }
        if (!errors.isEmpty()) {
            LOGGER.warn("Cannot {} VM {}: {}", operation, identity, errors);
            throw new ResourceAllocationException(ValidationResult.of(errors, List.of(), true));
        }
    }

    // ==================== Commit ====================

    /**
     * Run an allocating action under the allocation lock. The cache is dropped
     * afterwards whether or not the action succeeded.
     *
     * @param action the work
     * @param <T> result type
     * @return the action result
     */
    public <T> T withAllocationLock(@Nonnull Supplier<T> action) {
        Objects.requireNonNull(action, "action");
        allocationLock.lock();
        try {
            return action.get();
        } finally {
            invalidate();
            allocationLock.unlock();
        }
    }

    /**
     * Validate a spec and run the action that commits it, atomically with
     * respect to every other commit.
     *
     * @param spec VM configuration
     * @param action commits the resources
     * @param <T> result type
     * @return the action result
     * @throws ValidationException if the spec does not validate
     */
    public <T> T commit(@Nonnull VmSpec spec, @Nonnull Supplier<T> action) {
        Objects.requireNonNull(spec, "spec");
        return withAllocationLock(() -> {
            requireValid(spec);
            return action.get();
        });
    }

    private record CachedAllocation(long generation, AllocationSnapshot snapshot) {
    }
}
