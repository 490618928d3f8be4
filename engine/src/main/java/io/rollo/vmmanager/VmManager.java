package io.rollo.vmmanager;

import io.rollo.api.vmmanager.ConnectionHealth;
import io.rollo.api.vmmanager.HostMetricsSnapshot;
import io.rollo.api.vmmanager.OperationResult;
import io.rollo.api.vmmanager.ResourceControls;
import io.rollo.api.vmmanager.ResourceLimits;
import io.rollo.api.vmmanager.ValidationResult;
import io.rollo.api.vmmanager.VmManagerAPI;
import io.rollo.api.vmmanager.VmMetricsSnapshot;
import io.rollo.api.vmmanager.VmRef;
import io.rollo.api.vmmanager.VmSpec;
import io.rollo.api.vmmanager.VmStatusInfo;
import io.rollo.api.vmmanager.VmSummary;
import io.rollo.api.vmmanager.error.ConnectionException;
import io.rollo.vmmanager.api.VmManagerAPIImpl;
import io.rollo.vmmanager.config.VmManagerConfig;
import io.rollo.vmmanager.connection.ConnectionManager;
import io.rollo.vmmanager.event.EventPublisher;
import io.rollo.vmmanager.event.EventSink;
import io.rollo.vmmanager.hypervisor.HypervisorClientFactory;
import io.rollo.vmmanager.hypervisor.libvirt.LibvirtHypervisorClientFactory;
import io.rollo.vmmanager.lifecycle.LifecycleController;
import io.rollo.vmmanager.monitoring.MonitoringCollector;
import io.rollo.vmmanager.resource.ResourceAccountant;
import io.rollo.vmmanager.storage.DiskImageManager;
import io.rollo.vmmanager.template.DomainTemplateGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Main entry point of the VM orchestration engine.
 *
 * <p>Wires the connection, storage, resource accounting, lifecycle and monitoring
 * components together and runs every request on a bounded worker pool, so
 * blocking hypervisor and {@code qemu-img} calls never stall the caller.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * VmManager manager = VmManager.load(Paths.get("vm-manager.yml"), event -> broadcaster.send(event));
 * manager.initialize();
 *
 * OperationResult created = manager.createVm(VmSpec.builder()
 *     .name("web-01")
 *     .cpu(CpuConfig.of(2))
 *     .memory(MemoryConfig.of(2048))
 *     .disk(DiskConfig.boot("root", 20))
 *     .network(NetworkConfig.nat("eth0"))
 *     .build()).join();
 *
 * manager.startVm(VmRef.byName("web-01")).join();
 *
 * // Shutdown when done
 * manager.shutdown();
 * }</pre>
 */
public class VmManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(VmManager.class);

    private final VmManagerConfig config;
    private final EventPublisher events;
    private final ConnectionManager connection;
    private final DiskImageManager diskImageManager;
    private final ResourceAccountant accountant;
    private final LifecycleController lifecycle;
    private final MonitoringCollector monitoring;
    private final VmManagerAPI api;

    private final ExecutorService workers;

    private volatile boolean initialized = false;
    private volatile boolean shutdown = false;

    /**
     * Create a VM manager backed by libvirt.
     *
     * @param config configuration
     * @param sink receives lifecycle and monitoring events
     */
    public VmManager(@Nonnull VmManagerConfig config, @Nonnull EventSink sink) {
        this(config, new LibvirtHypervisorClientFactory(config.getMonitoring().isEventsEnabled()), sink);
    }

    public VmManager(@Nonnull VmManagerConfig config,
                     @Nonnull HypervisorClientFactory factory,
                     @Nonnull EventSink sink) {
        this(config, factory, sink, Clock.systemUTC());
    }

    /**
     * Create a VM manager.
     *
     * @param config configuration
     * @param factory opens hypervisor connections
     * @param sink receives lifecycle and monitoring events
     * @param clock time source
     */
    public VmManager(@Nonnull VmManagerConfig config,
                     @Nonnull HypervisorClientFactory factory,
                     @Nonnull EventSink sink,
                     @Nonnull Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(clock, "clock");

        this.events = new EventPublisher(sink);
        this.connection = new ConnectionManager(config.getConnection(), factory, clock);
        this.diskImageManager = new DiskImageManager(config.getStorage());
        this.accountant = new ResourceAccountant(
                connection,
                config.getResources(),
                config.getStorage().getFreeSpaceRatio(),
                diskImageManager::freeSpaceBytes,
                clock
        );
        this.lifecycle = new LifecycleController(
                connection,
                accountant,
                diskImageManager,
                new DomainTemplateGenerator(),
                events,
                config.getLifecycle(),
                clock
        );
        this.monitoring = new MonitoringCollector(
                connection,
                accountant,
                events,
                config.getMonitoring(),
                config.getResources().getVcpuOvercommitRatio(),
                clock
        );
        this.api = new VmManagerAPIImpl(this);

        this.workers = Executors.newFixedThreadPool(Math.max(1, config.getLifecycle().getWorkerThreads()), r -> {
            Thread t = new Thread(r, "VmManager-Worker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Create a libvirt-backed VM manager from a configuration file.
     *
     * @param configPath YAML configuration, written with defaults if missing
     * @param sink receives lifecycle and monitoring events
     * @return the manager, not yet initialized
     * @throws IOException if the configuration cannot be read
     */
    @Nonnull
    public static VmManager load(@Nonnull Path configPath, @Nonnull EventSink sink) throws IOException {
        VmManagerConfig config = VmManagerConfig.load(configPath);
        LOGGER.info("Loaded VM manager configuration from {}", configPath);
        return new VmManager(config, sink);
    }

    // ==================== Initialization ====================

    /**
     * Initialize the engine.
     *
     * @throws IOException if the image storage cannot be prepared
     */
    public void initialize() throws IOException {
        if (initialized) {
            throw new IllegalStateException("VM manager already initialized");
        }

        LOGGER.info("Initializing VM manager...");

        diskImageManager.initialize();

        try {
            connection.connect();
        } catch (ConnectionException e) {
            LOGGER.warn("Hypervisor not reachable at startup, connecting on first use: {}", e.getMessage());
        }

        monitoring.start();

        initialized = true;
        LOGGER.info("VM manager initialized");
        LOGGER.info("  Hypervisor: {}", connection.getUri());
        LOGGER.info("  Image storage: {}", diskImageManager.getStorageDirectory());
        LOGGER.info("  Worker threads: {}", config.getLifecycle().getWorkerThreads());
    }

    // ==================== Lifecycle Operations ====================

    @Nonnull
    public CompletableFuture<OperationResult> createVm(@Nonnull VmSpec spec) {
        Objects.requireNonNull(spec, "spec");
        return submit(() -> lifecycle.create(spec));
    }

    @Nonnull
    public CompletableFuture<OperationResult> startVm(@Nonnull VmRef ref) {
        Objects.requireNonNull(ref, "ref");
        return submit(() -> lifecycle.start(ref));
    }

    @Nonnull
    public CompletableFuture<OperationResult> stopVm(@Nonnull VmRef ref, boolean force) {
        Objects.requireNonNull(ref, "ref");
        return submit(() -> lifecycle.stop(ref, force));
    }

    @Nonnull
    public CompletableFuture<OperationResult> restartVm(@Nonnull VmRef ref, boolean force) {
        Objects.requireNonNull(ref, "ref");
        return submit(() -> lifecycle.restart(ref, force));
    }

    @Nonnull
    public CompletableFuture<OperationResult> pauseVm(@Nonnull VmRef ref) {
        Objects.requireNonNull(ref, "ref");
        return submit(() -> lifecycle.pause(ref));
    }

    @Nonnull
    public CompletableFuture<OperationResult> resumeVm(@Nonnull VmRef ref) {
        Objects.requireNonNull(ref, "ref");
        return submit(() -> lifecycle.resume(ref));
    }

    @Nonnull
    public CompletableFuture<OperationResult> deleteVm(@Nonnull VmRef ref, boolean deleteDisks) {
        Objects.requireNonNull(ref, "ref");
        return submit(() -> lifecycle.delete(ref, deleteDisks));
    }

    @Nonnull
    public CompletableFuture<OperationResult> cloneVm(@Nonnull VmRef source, @Nonnull String newName,
                                                      @Nonnull String newUuid) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(newName, "newName");
        Objects.requireNonNull(newUuid, "newUuid");
        return submit(() -> lifecycle.cloneVm(source, newName, newUuid));
    }

    @Nonnull
    public CompletableFuture<OperationResult> resizeVm(@Nonnull VmRef ref, int cpuCores, long memoryMb,
                                                       boolean live) {
        Objects.requireNonNull(ref, "ref");
        return submit(() -> lifecycle.resize(ref, cpuCores, memoryMb, live));
    }

    @Nonnull
    public CompletableFuture<OperationResult> setResourceLimits(@Nonnull VmRef ref,
                                                                @Nonnull ResourceControls controls) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(controls, "controls");
        return submit(() -> lifecycle.setResourceLimits(ref, controls));
    }

    // ==================== Queries ====================

    @Nonnull
    public CompletableFuture<List<VmSummary>> listVms() {
        return submit(lifecycle::list);
    }

    @Nonnull
    public CompletableFuture<VmStatusInfo> getVmStatus(@Nonnull VmRef ref) {
        Objects.requireNonNull(ref, "ref");
        return submit(() -> lifecycle.status(ref));
    }

    @Nonnull
    public CompletableFuture<VmMetricsSnapshot> getVmMetrics(@Nonnull VmRef ref) {
        Objects.requireNonNull(ref, "ref");
        return submit(() -> monitoring.collectVmMetrics(ref));
    }

    @Nonnull
    public CompletableFuture<HostMetricsSnapshot> getHostMetrics() {
        return submit(monitoring::collectHostMetrics);
    }

    @Nonnull
    public CompletableFuture<ResourceLimits> getResourceLimits() {
        return submit(accountant::limits);
    }

    @Nonnull
    public CompletableFuture<ValidationResult> validateResources(@Nonnull VmSpec spec) {
        Objects.requireNonNull(spec, "spec");
        return submit(() -> accountant.validate(spec));
    }

    @Nonnull
    public CompletableFuture<ConnectionHealth> healthCheck() {
        return submit(connection::healthCheck);
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        checkInitialized();
        return CompletableFuture.supplyAsync(task, workers);
    }

    // ==================== Components ====================

    @Nonnull
    public VmManagerAPI getApi() {
        return api;
    }

    @Nonnull
    public VmManagerConfig getConfig() {
        return config;
    }

    @Nonnull
    public ConnectionManager getConnectionManager() {
        return connection;
    }

    @Nonnull
    public ResourceAccountant getResourceAccountant() {
        return accountant;
    }

    @Nonnull
    public LifecycleController getLifecycleController() {
        return lifecycle;
    }

    @Nonnull
    public MonitoringCollector getMonitoringCollector() {
        return monitoring;
    }

    // ==================== Lifecycle ====================

    /**
     * Check if the VM manager is initialized.
     *
     * @return true if initialized and not shut down
     */
    public boolean isInitialized() {
        return initialized && !shutdown;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("VM manager not initialized");
        }
        if (shutdown) {
            throw new IllegalStateException("VM manager is shut down");
        }
    }

    /**
     * Shutdown the engine. In-flight operations get a short grace period.
     */
    public void shutdown() {
        if (!initialized || shutdown) {
            return;
        }

        shutdown = true;
        LOGGER.info("Shutting down VM manager...");

        monitoring.shutdown();

        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Worker pool did not drain in time, interrupting remaining operations");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }

        events.shutdown();
        connection.disconnect();

        LOGGER.info("VM manager shut down");
    }
}
