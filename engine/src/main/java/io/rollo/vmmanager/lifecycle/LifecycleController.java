package io.rollo.vmmanager.lifecycle;

import io.rollo.api.vmmanager.DiskConfig;
import io.rollo.api.vmmanager.OperationResult;
import io.rollo.api.vmmanager.ResourceControls;
import io.rollo.api.vmmanager.VmRef;
import io.rollo.api.vmmanager.VmSpec;
import io.rollo.api.vmmanager.VmState;
import io.rollo.api.vmmanager.VmStatusInfo;
import io.rollo.api.vmmanager.VmSummary;
import io.rollo.api.vmmanager.error.NotFoundException;
import io.rollo.api.vmmanager.error.OperationException;
import io.rollo.api.vmmanager.error.StateException;
import io.rollo.vmmanager.config.VmManagerConfig;
import io.rollo.vmmanager.connection.ConnectionManager;
import io.rollo.vmmanager.event.EventPublisher;
import io.rollo.vmmanager.event.VmCreatedEvent;
import io.rollo.vmmanager.event.VmDeletedEvent;
import io.rollo.vmmanager.event.VmStatusChangedEvent;
import io.rollo.vmmanager.hypervisor.DomainInfo;
import io.rollo.vmmanager.hypervisor.HypervisorDomain;
import io.rollo.vmmanager.hypervisor.HypervisorException;
import io.rollo.vmmanager.resource.ResourceAccountant;
import io.rollo.vmmanager.storage.DiskImageManager;
import io.rollo.vmmanager.template.DomainManifest;
import io.rollo.vmmanager.template.DomainTemplateGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives VM lifecycle transitions.
 *
 * <p>Every mutating operation resolves its target, then holds the per-VM lock
 * for its full duration. Operations that commit new resources additionally run
 * under the allocation lock of the {@link ResourceAccountant}. State is always
 * read from the hypervisor, never cached. Transitions this controller causes are
 * published as {@link VmStatusChangedEvent}s with the operation name as trigger.</p>
 */
public class LifecycleController {

    private static final Logger LOGGER = LoggerFactory.getLogger(LifecycleController.class);

    private final ConnectionManager connection;
    private final ResourceAccountant accountant;
    private final DiskImageManager images;
    private final DomainTemplateGenerator generator;
    private final EventPublisher events;
    private final VmLockRegistry locks;
    private final Duration settleTimeout;
    private final Duration settlePoll;
    private final Clock clock;

    /**
     * Create a lifecycle controller.
     *
     * @param connection shared hypervisor connection
     * @param accountant resource accounting
     * @param images disk image storage
     * @param generator domain definition generator
     * @param events event publisher
     * @param config restart settle settings
     * @param clock time source
     */
    public LifecycleController(
            @Nonnull ConnectionManager connection,
            @Nonnull ResourceAccountant accountant,
            @Nonnull DiskImageManager images,
            @Nonnull DomainTemplateGenerator generator,
            @Nonnull EventPublisher events,
            @Nonnull VmManagerConfig.LifecycleConfig config,
            @Nonnull Clock clock) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.accountant = Objects.requireNonNull(accountant, "accountant");
        this.images = Objects.requireNonNull(images, "images");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(config, "config");
        this.locks = new VmLockRegistry();
        this.settleTimeout = Duration.ofSeconds(config.getRestartSettleTimeoutSeconds());
        this.settlePoll = Duration.ofMillis(Math.max(1, config.getSettlePollMillis()));
    }

    @Nonnull
    VmLockRegistry getLocks() {
        return locks;
    }

    // ==================== Create ====================

    /**
     * Define a new VM and allocate its disks.
     *
     * @param spec VM configuration
     * @return result with status {@code created}
     * @throws OperationException if the name or UUID is taken, or allocation fails
     * @throws io.rollo.api.vmmanager.error.ValidationException if the spec does not validate
     */
    @Nonnull
    public OperationResult create(@Nonnull VmSpec spec) {
        Objects.requireNonNull(spec, "spec");

        return locks.withLock(spec.uuid(), () -> {
            ensureAbsent("create", spec.name(), spec.uuid());

            OperationResult result = accountant.commit(spec, () -> {
                // Another identity may have been defined while waiting for the allocation lock
                ensureAbsent("create", spec.name(), spec.uuid());
                return define(spec);
            });

            events.publish(new VmCreatedEvent(spec.name(), spec.uuid(), spec.totalVcpus(),
                    spec.memory().sizeMb(), clock.instant()));
            return result;
        });
    }

    private OperationResult define(VmSpec spec) {
        List<Path> created = new ArrayList<>();
        try {
            List<Path> paths = new ArrayList<>();
            for (DiskConfig disk : spec.disks()) {
                Path path = images.resolvePath(spec.name(), disk);
                if (disk.path() != null && Files.exists(path)) {
                    LOGGER.info("Attaching existing image {} to VM {}", path, spec.name());
                } else {
                    images.createImage(path, disk);
                    created.add(path);
                }
                paths.add(path);
            }

            String xml = generator.generate(spec, paths);
            connection.execute("create", spec.name(), client -> client.defineDomain(xml));

            LOGGER.info("Created VM {} ({}) with {} vCPUs, {} MB memory, {} disk(s)",
                    spec.name(), spec.uuid(), spec.totalVcpus(), spec.memory().sizeMb(), paths.size());
            return OperationResult.of(spec.name(), spec.uuid(), "create", OperationResult.CREATED);

        } catch (IOException e) {
            images.rollback(created);
            throw new OperationException("create", spec.name(), "disk allocation failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            images.rollback(created);
            throw e;
        }
    }

    // ==================== Start / Stop ====================

    /**
     * Start a stopped or failed VM.
     *
     * @param ref target VM
     * @return {@code started}, or {@code already_running}
     * @throws StateException if the VM is paused, suspended or stopping
     */
    @Nonnull
    public OperationResult start(@Nonnull VmRef ref) {
        Target target = resolve("start", ref);
        return locks.withLock(target.uuid(), () -> startLocked(target, "start"));
    }

    private OperationResult startLocked(Target target, String trigger) {
        VmState state = stateOf("start", target);
        if (state == VmState.RUNNING) {
            LOGGER.debug("VM {} already running", target.name());
            return target.result("start", OperationResult.ALREADY_RUNNING);
        }
        if (!state.isStartable()) {
            throw new StateException("start", target.name(), state, "STOPPED or ERROR");
        }

        connection.withDomain("start", target.ref(), domain -> {
            domain.create();
            return null;
        });
        accountant.invalidate();
        LOGGER.info("Started VM {}", target.name());
        publishStateChange(target, state, trigger);
        return target.result("start", OperationResult.STARTED);
    }

    /**
     * Stop a VM.
     *
     * @param ref target VM
     * @param force destroy immediately instead of requesting a guest shutdown
     * @return {@code destroyed}, {@code shutdown_requested}, {@code stopping} or {@code already_stopped}
     */
    @Nonnull
    public OperationResult stop(@Nonnull VmRef ref, boolean force) {
        Target target = resolve("stop", ref);
        return locks.withLock(target.uuid(), () -> stopLocked(target, force, "stop"));
    }

    private OperationResult stopLocked(Target target, boolean force, String trigger) {
        VmState state = stateOf("stop", target);
        if (state == VmState.STOPPED) {
            LOGGER.debug("VM {} already stopped", target.name());
            return target.result("stop", OperationResult.ALREADY_STOPPED);
        }

        if (force) {
            connection.withDomain("stop", target.ref(), domain -> {
                domain.destroy();
                return null;
            });
            accountant.invalidate();
            LOGGER.info("Destroyed VM {}", target.name());
            publishStateChange(target, state, trigger);
            return target.result("stop", OperationResult.DESTROYED);
        }

        if (state == VmState.STOPPING) {
            return target.result("stop", OperationResult.STOPPING);
        }

        connection.withDomain("stop", target.ref(), domain -> {
            domain.shutdown();
            return null;
        });
        accountant.invalidate();
        LOGGER.info("Requested shutdown of VM {}", target.name());
        publishStateChange(target, state, trigger);
        return target.result("stop", OperationResult.SHUTDOWN_REQUESTED);
    }

    /**
     * Stop a VM, wait until it is stopped, then start it again.
     *
     * @param ref target VM
     * @param force destroy instead of requesting a guest shutdown
     * @return result with status {@code restarted}
     * @throws OperationException if the VM does not stop within the settle timeout
     */
    @Nonnull
    public OperationResult restart(@Nonnull VmRef ref, boolean force) {
        Target target = resolve("restart", ref);
        return locks.withLock(target.uuid(), () -> {
            OperationResult stopped = stopLocked(target, force, "restart");
            if (!OperationResult.ALREADY_STOPPED.equals(stopped.status())) {
                awaitStopped(target);
            }
            startLocked(target, "restart");
            LOGGER.info("Restarted VM {}", target.name());
            return target.result("restart", OperationResult.RESTARTED);
        });
    }

    private void awaitStopped(Target target) {
        Instant deadline = clock.instant().plus(settleTimeout);
        while (true) {
            VmState state = stateOf("restart", target);
            if (state == VmState.STOPPED) {
                return;
            }
            if (!clock.instant().isBefore(deadline)) {
                throw new OperationException("restart", target.name(), "VM did not stop within "
                        + settleTimeout.toSeconds() + "s (state is " + state + ")");
            }
            try {
                Thread.sleep(settlePoll.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationException("restart", target.name(), "interrupted while waiting for stop", e);
            }
        }
    }

    // ==================== Pause / Resume ====================

    /**
     * Pause a running VM.
     *
     * @param ref target VM
     * @return {@code paused}, or {@code invalid_state} if the VM is not running
     */
    @Nonnull
    public OperationResult pause(@Nonnull VmRef ref) {
        Target target = resolve("pause", ref);
        return locks.withLock(target.uuid(), () -> {
            VmState state = stateOf("pause", target);
            if (state != VmState.RUNNING) {
                return invalidState(target, "pause", state, "VM is not running");
            }
            connection.withDomain("pause", target.ref(), domain -> {
                domain.suspend();
                return null;
            });
            LOGGER.info("Paused VM {}", target.name());
            publishStateChange(target, state, "pause");
            return target.result("pause", OperationResult.PAUSED);
        });
    }

    /**
     * Resume a paused VM.
     *
     * @param ref target VM
     * @return {@code resumed}, or {@code invalid_state} if the VM is not paused
     */
    @Nonnull
    public OperationResult resume(@Nonnull VmRef ref) {
        Target target = resolve("resume", ref);
        return locks.withLock(target.uuid(), () -> {
            VmState state = stateOf("resume", target);
            if (state != VmState.PAUSED) {
                return invalidState(target, "resume", state, "VM is not paused");
            }
            connection.withDomain("resume", target.ref(), domain -> {
                domain.resume();
                return null;
            });
            LOGGER.info("Resumed VM {}", target.name());
            publishStateChange(target, state, "resume");
            return target.result("resume", OperationResult.RESUMED);
        });
    }

    private static OperationResult invalidState(Target target, String operation, VmState state, String message) {
        LOGGER.debug("Cannot {} VM {} in state {}", operation, target.name(), state);
        return target.result(operation, OperationResult.INVALID_STATE)
                .withDetail(OperationResult.DETAIL_STATE, state.name())
                .withDetail(OperationResult.DETAIL_MESSAGE, message);
    }

    // ==================== Delete ====================

    /**
     * Destroy and undefine a VM, optionally removing its disk images.
     *
     * <p>Disk removal failures are reported in the result instead of failing the
     * operation, since the domain is already gone at that point.</p>
     *
     * @param ref target VM
     * @param deleteDisks remove file-backed disk images
     * @return result with {@code deleted_disks} and {@code failed_disks} details
     */
    @Nonnull
    public OperationResult delete(@Nonnull VmRef ref, boolean deleteDisks) {
        Target target = resolve("delete", ref);
        return locks.withLock(target.uuid(), () -> {
            List<String> diskPaths = connection.withDomain("delete", target.ref(), domain -> {
                List<String> paths = deleteDisks
                        ? DomainManifest.parse(domain.xmlDescription()).getDiskPaths()
                        : List.of();
                if (domain.info().state().isActive()) {
                    domain.destroy();
                }
                domain.undefine();
                return paths;
            });
            accountant.invalidate();
            locks.retire(target.uuid());
            LOGGER.info("Undefined VM {} ({})", target.name(), target.uuid());

            List<String> deleted = new ArrayList<>();
            List<String> failed = new ArrayList<>();
            for (String path : diskPaths) {
                try {
                    images.deleteImage(Paths.get(path));
                    deleted.add(path);
                } catch (IOException e) {
                    LOGGER.error("Failed to delete disk {} of VM {}: {}", path, target.name(), e.getMessage());
                    failed.add(path);
                }
            }

            events.publish(new VmDeletedEvent(target.name(), target.uuid(), deleted, clock.instant()));
            return target.result("delete", OperationResult.DELETED)
                    .withDetail(OperationResult.DETAIL_DELETED_DISKS, List.copyOf(deleted))
                    .withDetail(OperationResult.DETAIL_FAILED_DISKS, List.copyOf(failed));
        });
    }

    // ==================== Clone ====================

    /**
     * Clone a stopped VM, copying its file-backed disks.
     *
     * @param sourceRef VM to clone
     * @param newName clone name
     * @param newUuid clone UUID
     * @return result for the clone with status {@code cloned}
     * @throws StateException if the source is not stopped
     */
    @Nonnull
    public OperationResult cloneVm(@Nonnull VmRef sourceRef, @Nonnull String newName, @Nonnull String newUuid) {
        Objects.requireNonNull(newName, "newName");
        Objects.requireNonNull(newUuid, "newUuid");
        Target source = resolve("clone", sourceRef);

        return locks.withLocks(source.uuid(), newUuid, () -> {
            VmState state = stateOf("clone", source);
            if (state != VmState.STOPPED) {
                throw new StateException("clone", source.name(), state, "STOPPED");
            }
            ensureAbsent("clone", newName, newUuid);

            DomainManifest manifest = DomainManifest.parse(
                    connection.withDomain("clone", source.ref(), HypervisorDomain::xmlDescription));

            OperationResult result = accountant.withAllocationLock(() -> {
                ensureAbsent("clone", newName, newUuid);
                accountant.requireCapacity("clone", newName, manifest.getVcpus(), manifest.getMemoryKib());
                return defineClone(source, manifest, newName, newUuid);
            });

            events.publish(new VmCreatedEvent(newName, newUuid, manifest.getVcpus(),
                    manifest.getMemoryKib() / 1024, clock.instant()));
            return result;
        });
    }

    private OperationResult defineClone(Target source, DomainManifest manifest, String newName, String newUuid) {
        Map<String, String> mapping = new LinkedHashMap<>();
        List<Path> copied = new ArrayList<>();
        try {
            for (String path : manifest.getDiskPaths()) {
                Path sourcePath = Paths.get(path);
                Path targetPath = images.clonePath(newName, sourcePath);
                images.copyImage(sourcePath, targetPath);
                copied.add(targetPath);
                mapping.put(path, targetPath.toString());
            }

            String xml = manifest.rewriteForClone(newName, newUuid, mapping);
            connection.execute("clone", newName, client -> client.defineDomain(xml));

            LOGGER.info("Cloned VM {} to {} ({}), {} disk(s) copied", source.name(), newName, newUuid, copied.size());
            return OperationResult.of(newName, newUuid, "clone", OperationResult.CLONED)
                    .withDetail("source", source.name());

        } catch (IOException e) {
            images.rollback(copied);
            throw new OperationException("clone", source.name(), "disk copy failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            images.rollback(copied);
            throw e;
        }
    }

    // ==================== Resize ====================

    /**
     * Change the vCPU count and/or memory size of a VM.
     *
     * <p>A stopped VM is redefined and may grow as far as the host allows. A running
     * VM with {@code live} set is adjusted in place within its configured maxima.</p>
     *
     * @param ref target VM
     * @param cpuCores new vCPU count, 0 to keep
     * @param memoryMb new memory size, 0 to keep
     * @param live apply to a running VM
     * @return result with status {@code resized}
     * @throws StateException if the VM is running and {@code live} is false
     */
    @Nonnull
    public OperationResult resize(@Nonnull VmRef ref, int cpuCores, long memoryMb, boolean live) {
        accountant.requireValidResize(cpuCores, memoryMb);
        Target target = resolve("resize", ref);

        return locks.withLock(target.uuid(), () -> {
            DomainView view = connection.withDomain("resize", target.ref(),
                    domain -> new DomainView(domain.info(), DomainManifest.parse(domain.xmlDescription())));
            VmState state = view.info().state().toVmState();
            DomainManifest manifest = view.manifest();
            long memoryKib = memoryMb * 1024;

            OperationResult result;
            if (state == VmState.STOPPED) {
                result = accountant.withAllocationLock(() -> {
                    int addVcpus = cpuCores > 0 ? cpuCores - manifest.getVcpus() : 0;
                    long addMemoryKib = memoryMb > 0 ? memoryKib - manifest.getMemoryKib() : 0;
                    accountant.requireCapacity("resize", target.name(), addVcpus, addMemoryKib);

                    String xml = manifest.withResources(cpuCores, memoryKib);
                    connection.execute("resize", target.name(), client -> client.defineDomain(xml));
                    return target.result("resize", OperationResult.RESIZED).withDetail("live", false);
                });
            } else if (!live) {
                throw new StateException("resize", target.name(), state, "STOPPED");
            } else if (state == VmState.RUNNING || state == VmState.PAUSED) {
                result = resizeLive(target, view, cpuCores, memoryKib);
            } else {
                throw new StateException("resize", target.name(), state, "STOPPED, RUNNING or PAUSED");
            }

            if (cpuCores > 0) {
                result = result.withDetail("vcpus", cpuCores);
            }
            if (memoryMb > 0) {
                result = result.withDetail("memory_mb", memoryMb);
            }
            LOGGER.info("Resized VM {} (vcpus={}, memoryMb={}, live={})",
                    target.name(), cpuCores, memoryMb, state != VmState.STOPPED);
            return result;
        });
    }

    private OperationResult resizeLive(Target target, DomainView view, int cpuCores, long memoryKib) {
        int maxVcpus = view.manifest().getVcpus();
        long maxMemoryKib = view.info().maxMemoryKib();
        if (cpuCores > maxVcpus) {
            throw new OperationException("resize", target.name(), "requested " + cpuCores
                    + " vCPUs exceeds the configured maximum of " + maxVcpus + ", stop the VM to raise it");
        }
        if (memoryKib > maxMemoryKib) {
            throw new OperationException("resize", target.name(), "requested " + (memoryKib / 1024)
                    + " MB exceeds the configured maximum of " + (maxMemoryKib / 1024) + " MB, stop the VM to raise it");
        }

        connection.withDomain("resize", target.ref(), domain -> {
            if (cpuCores > 0) {
                domain.setVcpus(cpuCores);
            }
            if (memoryKib > 0) {
                domain.setMemory(memoryKib);
            }
            return null;
        });
        return target.result("resize", OperationResult.RESIZED).withDetail("live", true);
    }

    // ==================== Resource limits ====================

    /**
     * Set CPU scheduler and memory tuning of a VM.
     *
     * <p>The controls are written into the persistent definition. A running or
     * paused VM also gets its CPU controls applied immediately; its memory limits
     * take effect at the next start.</p>
     *
     * @param ref target VM
     * @param controls values to set, null fields are kept
     * @return result with status {@code limits_set}, listing the applied controls
     * @throws io.rollo.api.vmmanager.error.ValidationException if a value is out of range
     */
    @Nonnull
    public OperationResult setResourceLimits(@Nonnull VmRef ref, @Nonnull ResourceControls controls) {
        Objects.requireNonNull(controls, "controls");
        accountant.requireValidControls(controls);
        Target target = resolve("set resource limits of", ref);

        return locks.withLock(target.uuid(), () -> {
            DomainView view = connection.withDomain("set resource limits of", target.ref(),
                    domain -> new DomainView(domain.info(), DomainManifest.parse(domain.xmlDescription())));
            ResourceControls current = view.manifest().getResourceControls();
            Long hard = controls.memoryHardLimitKib() != null
                    ? controls.memoryHardLimitKib() : current.memoryHardLimitKib();
            Long soft = controls.memorySoftLimitKib() != null
                    ? controls.memorySoftLimitKib() : current.memorySoftLimitKib();
            if (hard != null && soft != null && soft > hard) {
                throw new OperationException("set resource limits of", target.name(), "memory soft limit "
                        + soft + "KiB would exceed the hard limit of " + hard + "KiB");
            }

            String xml = view.manifest().withResourceControls(controls);
            connection.execute("set resource limits of", target.name(), client -> client.defineDomain(xml));

            boolean active = view.info().state().isActive();
            Map<String, Long> scheduler = schedulerParameters(controls);
            if (active && !scheduler.isEmpty()) {
                connection.withDomain("set resource limits of", target.ref(), domain -> {
                    domain.setSchedulerParameters(scheduler);
                    return null;
                });
            }

            List<String> applied = describe(controls);
            boolean pendingRestart = active && controls.hasMemoryControls();
            LOGGER.info("Set resource limits of VM {}: {}{}", target.name(), applied,
                    pendingRestart ? " (memory limits apply at next start)" : "");
            return target.result("set_limits", OperationResult.LIMITS_SET)
                    .withDetail(OperationResult.DETAIL_LIMITS, applied)
                    .withDetail(OperationResult.DETAIL_PENDING_RESTART, pendingRestart);
        });
    }

    private static Map<String, Long> schedulerParameters(ResourceControls controls) {
        Map<String, Long> parameters = new LinkedHashMap<>();
        if (controls.cpuShares() != null) {
            parameters.put("cpu_shares", controls.cpuShares());
        }
        if (controls.cpuPeriodUs() != null) {
            parameters.put("vcpu_period", controls.cpuPeriodUs());
        }
        if (controls.cpuQuotaUs() != null) {
            parameters.put("vcpu_quota", controls.cpuQuotaUs());
        }
        return parameters;
    }

    private static List<String> describe(ResourceControls controls) {
        List<String> applied = new ArrayList<>();
        schedulerParameters(controls).forEach((key, value) -> applied.add(key + "=" + value));
        if (controls.memoryHardLimitKib() != null) {
            applied.add("hard_limit=" + controls.memoryHardLimitKib());
        }
        if (controls.memorySoftLimitKib() != null) {
            applied.add("soft_limit=" + controls.memorySoftLimitKib());
        }
        return List.copyOf(applied);
    }

    // ==================== Queries ====================

    /**
     * Read the live status of a VM.
     *
     * @param ref target VM
     * @return current status
     */
    @Nonnull
    public VmStatusInfo status(@Nonnull VmRef ref) {
        return connection.withDomain("get status of", ref, domain -> {
            DomainInfo info = domain.info();
            return new VmStatusInfo(domain.name(), domain.uuid(), info.state().toVmState(), info.vcpus(),
                    info.memoryKib() / 1024, info.maxMemoryKib() / 1024, info.cpuTimeNs());
        });
    }

    /**
     * List every defined VM.
     *
     * @return summaries in hypervisor order
     */
    @Nonnull
    public List<VmSummary> list() {
        return connection.execute("list", null, client -> {
            List<VmSummary> result = new ArrayList<>();
            for (HypervisorDomain domain : client.listDomains()) {
                try {
                    DomainInfo info = domain.info();
                    result.add(new VmSummary(domain.name(), domain.uuid(), info.state().toVmState(),
                            info.vcpus(), info.maxMemoryKib() / 1024));
                } catch (HypervisorException e) {
                    if (e.getKind() != HypervisorException.Kind.NO_DOMAIN) {
                        throw e;
                    }
                    LOGGER.debug("Domain {} disappeared while listing", domain.name());
                }
            }
            return result;
        });
    }

    /**
     * Read the state of a VM, reporting a missing one as {@link VmState#UNDEFINED}.
     *
     * @param ref target VM
     * @return current state
     */
    @Nonnull
    public VmState stateOf(@Nonnull VmRef ref) {
        try {
            return connection.withDomain("get state of", ref, domain -> domain.info().state().toVmState());
        } catch (NotFoundException e) {
            return VmState.UNDEFINED;
        }
    }

    // ==================== Internals ====================

    private Target resolve(String operation, VmRef ref) {
        Objects.requireNonNull(ref, "ref");
        return connection.withDomain(operation, ref, domain -> new Target(domain.name(), domain.uuid()));
    }

    private VmState stateOf(String operation, Target target) {
        return connection.withDomain(operation, target.ref(), domain -> domain.info().state().toVmState());
    }

    private void publishStateChange(Target target, VmState before, String trigger) {
        VmState after = stateOf(trigger, target);
        if (after != before) {
            events.publish(new VmStatusChangedEvent(target.name(), target.uuid(), before, after, trigger,
                    clock.instant()));
        }
    }

    private void ensureAbsent(String operation, String name, String uuid) {
        boolean exists = connection.execute(operation, name, client ->
                ConnectionManager.find(client, VmRef.byName(name)).isPresent()
                        || ConnectionManager.find(client, VmRef.byUuid(uuid)).isPresent());
        if (exists) {
            throw new OperationException(operation, name, "VM already exists");
        }
    }

    private record Target(String name, String uuid) {

        VmRef ref() {
            return VmRef.byUuid(uuid);
        }

        OperationResult result(String operation, String status) {
            return OperationResult.of(name, uuid, operation, status);
        }
    }

    private record DomainView(DomainInfo info, DomainManifest manifest) {
    }
}
