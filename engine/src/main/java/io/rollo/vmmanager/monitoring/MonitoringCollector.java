package io.rollo.vmmanager.monitoring;

import io.rollo.api.vmmanager.HostMetricsSnapshot;
import io.rollo.api.vmmanager.VmMetricsSnapshot;
import io.rollo.api.vmmanager.VmRef;
import io.rollo.api.vmmanager.VmState;
import io.rollo.api.vmmanager.error.VmManagerException;
import io.rollo.vmmanager.config.VmManagerConfig;
import io.rollo.vmmanager.connection.ConnectListener;
import io.rollo.vmmanager.connection.ConnectionManager;
import io.rollo.vmmanager.event.EventPublisher;
import io.rollo.vmmanager.event.HostAlertEvent;
import io.rollo.vmmanager.event.HostMetricsEvent;
import io.rollo.vmmanager.event.VmMetricsEvent;
import io.rollo.vmmanager.event.VmStatusChangedEvent;
import io.rollo.vmmanager.hypervisor.BlockStats;
import io.rollo.vmmanager.hypervisor.CpuTimes;
import io.rollo.vmmanager.hypervisor.DomainInfo;
import io.rollo.vmmanager.hypervisor.GuestMemoryStats;
import io.rollo.vmmanager.hypervisor.HypervisorDomain;
import io.rollo.vmmanager.hypervisor.HypervisorException;
import io.rollo.vmmanager.hypervisor.InterfaceStats;
import io.rollo.vmmanager.resource.AllocationSnapshot;
import io.rollo.vmmanager.resource.HostCapacity;
import io.rollo.vmmanager.resource.ResourceAccountant;
import io.rollo.vmmanager.template.DomainManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls VM and host metrics on a fixed interval and publishes them as events.
 *
 * <p>Each poll also compares VM states with the previous poll to emit status
 * changes, and raises host alerts when allocation crosses the configured
 * thresholds. Counters are cumulative since VM boot.</p>
 */
public class MonitoringCollector {

    private static final Logger LOGGER = LoggerFactory.getLogger(MonitoringCollector.class);

    private static final Map<String, VmState> LIFECYCLE_STATES = Map.of(
            "defined", VmState.STOPPED,
            "undefined", VmState.UNDEFINED,
            "started", VmState.RUNNING,
            "suspended", VmState.PAUSED,
            "resumed", VmState.RUNNING,
            "stopped", VmState.STOPPED,
            "shutdown", VmState.STOPPING,
            "pmsuspended", VmState.SUSPENDED,
            "crashed", VmState.ERROR);

    private final ConnectionManager connection;
    private final ResourceAccountant accountant;
    private final EventPublisher events;
    private final VmManagerConfig.MonitoringConfig config;
    private final double vcpuOvercommitRatio;
    private final Clock clock;

    private final Map<String, ObservedDomain> lastSeen = new ConcurrentHashMap<>();
    private final Map<HostAlertEvent.AlertType, HostAlertEvent.Severity> activeAlerts = new ConcurrentHashMap<>();
    private final ConnectListener lifecycleSubscription = client -> {
        client.addLifecycleListener(this::onLifecycleEvent);
        LOGGER.info("Subscribed to hypervisor lifecycle events");
    };

    private ScheduledExecutorService scheduler;
    private volatile boolean shutdown = false;

    /**
     * Create a monitoring collector.
     *
     * @param connection shared hypervisor connection
     * @param accountant source of capacity and allocation
     * @param events event publisher
     * @param config polling and alert settings
     * @param vcpuOvercommitRatio vCPUs schedulable per logical CPU
     * @param clock time source
     */
    public MonitoringCollector(
            @Nonnull ConnectionManager connection,
            @Nonnull ResourceAccountant accountant,
            @Nonnull EventPublisher events,
            @Nonnull VmManagerConfig.MonitoringConfig config,
            double vcpuOvercommitRatio,
            @Nonnull Clock clock) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.accountant = Objects.requireNonNull(accountant, "accountant");
        this.events = Objects.requireNonNull(events, "events");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.vcpuOvercommitRatio = vcpuOvercommitRatio;
    }

    /**
     * Start polling and, if enabled, subscribe to hypervisor lifecycle events.
     */
    public synchronized void start() {
        if (!config.isEnabled()) {
            LOGGER.info("Monitoring disabled");
            return;
        }
        if (scheduler != null) {
            throw new IllegalStateException("Monitoring collector already started");
        }

        if (config.isEventsEnabled()) {
            subscribe();
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "VmManager-Monitor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(
                this::poll,
                config.getIntervalSeconds(),
                config.getIntervalSeconds(),
                TimeUnit.SECONDS
        );

        LOGGER.info("Monitoring started, polling every {}s", config.getIntervalSeconds());
    }

    // subscriptions live on the client, so they are renewed on every reconnect
    private void subscribe() {
        try {
            connection.addConnectListener(lifecycleSubscription);
            connection.connect();
        } catch (VmManagerException e) {
            LOGGER.warn("Hypervisor unavailable, lifecycle events start once it connects: {}", e.getMessage());
        }
    }

    // ==================== Polling ====================

    /**
     * Run one poll. Failures are logged; the next poll runs regardless.
     */
    public void poll() {
        if (shutdown) return;

        try {
            List<ObservedDomain> domains = observeDomains();
            detectStatusChanges(domains);

            for (ObservedDomain domain : domains) {
                if (domain.state() != VmState.RUNNING) {
                    continue;
                }
                try {
                    events.publish(new VmMetricsEvent(collectVmMetrics(VmRef.byUuid(domain.uuid()))));
                } catch (VmManagerException e) {
                    LOGGER.warn("Failed to collect metrics for VM {}: {}", domain.name(), e.getMessage());
                }
            }

            HostMetricsSnapshot host = collectHostMetrics();
            events.publish(new HostMetricsEvent(host));
            checkAlerts(host);

        } catch (RuntimeException e) {
            LOGGER.error("Monitoring poll failed: {}", e.getMessage(), e);
        }
    }

    private List<ObservedDomain> observeDomains() {
        return connection.execute("poll", null, client -> {
            List<ObservedDomain> result = new ArrayList<>();
            for (HypervisorDomain domain : client.listDomains()) {
                try {
                    result.add(new ObservedDomain(domain.name(), domain.uuid(),
                            domain.info().state().toVmState()));
                } catch (HypervisorException e) {
                    if (e.getKind() != HypervisorException.Kind.NO_DOMAIN) {
                        throw e;
                    }
                    LOGGER.debug("Domain {} disappeared during poll", domain.name());
                }
            }
            return result;
        });
    }

    private void detectStatusChanges(List<ObservedDomain> domains) {
        Set<String> seen = new HashSet<>();
        for (ObservedDomain domain : domains) {
            seen.add(domain.uuid());
            ObservedDomain previous = lastSeen.put(domain.uuid(), domain);
            VmState previousState = previous != null ? previous.state() : null;
            if (previousState != domain.state()) {
                publishStatusChange(domain.name(), domain.uuid(), previousState, domain.state(),
                        VmStatusChangedEvent.TRIGGER_POLL);
            }
        }

        for (String uuid : new ArrayList<>(lastSeen.keySet())) {
            if (!seen.contains(uuid)) {
                ObservedDomain previous = lastSeen.remove(uuid);
                if (previous != null) {
                    publishStatusChange(previous.name(), uuid, previous.state(), VmState.UNDEFINED,
                            VmStatusChangedEvent.TRIGGER_POLL);
                }
            }
        }
    }

    /**
     * Handle a hypervisor lifecycle event.
     *
     * @param domainName domain name
     * @param uuid domain UUID
     * @param event lower case event name
     */
    public void onLifecycleEvent(@Nonnull String domainName, @Nonnull String uuid, @Nonnull String event) {
        VmState state = LIFECYCLE_STATES.get(event.toLowerCase(Locale.ROOT));
        if (state == null) {
            LOGGER.debug("Ignoring lifecycle event {} for VM {}", event, domainName);
            return;
        }

        ObservedDomain previous = state == VmState.UNDEFINED
                ? lastSeen.remove(uuid)
                : lastSeen.put(uuid, new ObservedDomain(domainName, uuid, state));
        VmState previousState = previous != null ? previous.state() : null;
        if (previousState != state) {
            publishStatusChange(domainName, uuid, previousState, state, event);
        }
    }

    private void publishStatusChange(String name, String uuid, @Nullable VmState previous, VmState current,
                                     String trigger) {
        LOGGER.debug("VM {} changed state {} -> {} ({})", name, previous, current, trigger);
        events.publish(new VmStatusChangedEvent(name, uuid, previous, current, trigger, clock.instant()));
    }

    // ==================== Collection ====================

    /**
     * Collect runtime counters of one VM.
     *
     * <p>Disks and interfaces are enumerated from the VM's live definition.
     * A device whose counters cannot be read is left out.</p>
     *
     * @param ref target VM
     * @return metrics snapshot
     */
    @Nonnull
    public VmMetricsSnapshot collectVmMetrics(@Nonnull VmRef ref) {
        return connection.withDomain("collect metrics for", ref, domain -> {
            DomainInfo info = domain.info();
            CpuTimes cpu = domain.cpuTimes();
            DomainManifest manifest = DomainManifest.parse(domain.xmlDescription());

            List<VmMetricsSnapshot.DiskStats> disks = new ArrayList<>();
            for (String device : manifest.getDiskTargets()) {
                try {
                    BlockStats stats = domain.blockStats(device);
                    disks.add(new VmMetricsSnapshot.DiskStats(device, stats.readRequests(), stats.readBytes(),
                            stats.writeRequests(), stats.writeBytes(), stats.errors()));
                } catch (HypervisorException e) {
                    LOGGER.debug("No block stats for {} on VM {}: {}", device, domain.name(), e.getMessage());
                }
            }

            List<VmMetricsSnapshot.NetworkStats> interfaces = new ArrayList<>();
            for (String device : manifest.getInterfaceTargets()) {
                try {
                    InterfaceStats stats = domain.interfaceStats(device);
                    interfaces.add(new VmMetricsSnapshot.NetworkStats(device,
                            stats.rxBytes(), stats.rxPackets(), stats.rxErrors(), stats.rxDropped(),
                            stats.txBytes(), stats.txPackets(), stats.txErrors(), stats.txDropped()));
                } catch (HypervisorException e) {
                    LOGGER.debug("No interface stats for {} on VM {}: {}", device, domain.name(), e.getMessage());
                }
            }

            VmMetricsSnapshot.MemoryStats memory = memoryStats(domain, info);
            return new VmMetricsSnapshot(
                    domain.name(),
                    domain.uuid(),
                    info.state().toVmState(),
                    clock.instant(),
                    new VmMetricsSnapshot.CpuStats(cpu.totalNs(), cpu.userNs(), cpu.systemNs(), info.vcpus()),
                    memory,
                    disks,
                    interfaces);
        });
    }

    /**
     * Guest view of memory from the balloon driver. Without one, the hypervisor's
     * current allocation counts as used.
     */
    private static VmMetricsSnapshot.MemoryStats memoryStats(HypervisorDomain domain, DomainInfo info) {
        GuestMemoryStats stats;
        try {
            stats = domain.memoryStats();
        } catch (HypervisorException e) {
            LOGGER.debug("No memory stats for VM {}: {}", domain.name(), e.getMessage());
            stats = GuestMemoryStats.none();
        }
        if (stats.hasGuestUsage()) {
            long unused = Math.min(stats.unusedKib(), stats.availableKib());
            return new VmMetricsSnapshot.MemoryStats(stats.availableKib(), unused,
                    stats.availableKib() - unused, stats.rssKib());
        }
        long usedKib = info.memoryKib();
        return new VmMetricsSnapshot.MemoryStats(info.maxMemoryKib(),
                Math.max(0, info.maxMemoryKib() - usedKib), usedKib, stats.rssKib());
    }

    /**
     * Collect host-wide metrics.
     *
     * @return host snapshot
     */
    @Nonnull
    public HostMetricsSnapshot collectHostMetrics() {
        HostCapacity capacity = accountant.hostCapacity();
        AllocationSnapshot allocation = accountant.scanAllocation();
        return connection.execute("collect host metrics", null, client -> new HostMetricsSnapshot(
                client.hostname(),
                allocation.activeDomains(),
                allocation.totalDomains(),
                client.hypervisorType(),
                client.hypervisorVersion(),
                client.libraryVersion(),
                capacity.cpus(),
                capacity.memoryKib(),
                allocation.vcpus(),
                allocation.memoryKib(),
                clock.instant()));
    }

    // ==================== Alerts ====================

    void checkAlerts(HostMetricsSnapshot host) {
        if (host.memoryKib() > 0) {
            double memoryRatio = (double) host.allocatedMemoryKib() / host.memoryKib();
            evaluate(HostAlertEvent.AlertType.MEMORY_ALLOCATION, memoryRatio, config.getMemoryAlertThreshold(),
                    String.format(Locale.ROOT, "Host %s memory allocation is %.1f%% (%d of %d MB)",
                            host.hostname(), memoryRatio * 100, host.allocatedMemoryKib() / 1024,
                            host.memoryKib() / 1024));
        }

        double schedulable = host.logicalCpus() * vcpuOvercommitRatio;
        if (schedulable > 0) {
            double cpuRatio = host.allocatedVcpus() / schedulable;
            evaluate(HostAlertEvent.AlertType.CPU_ALLOCATION, cpuRatio, config.getCpuAlertThreshold(),
                    String.format(Locale.ROOT, "Host %s vCPU allocation is %.1f%% (%d of %d schedulable)",
                            host.hostname(), cpuRatio * 100, host.allocatedVcpus(), (long) schedulable));
        }
    }

    private void evaluate(HostAlertEvent.AlertType type, double ratio, double threshold, String message) {
        HostAlertEvent.Severity severity = ratio >= 1.0 ? HostAlertEvent.Severity.CRITICAL
                : ratio >= threshold ? HostAlertEvent.Severity.WARNING
                : null;

        if (severity == null) {
            if (activeAlerts.remove(type) != null) {
                LOGGER.info("Host {} alert cleared", type.name().toLowerCase(Locale.ROOT));
            }
            return;
        }

        // Raise only when the alert is new or its severity changed
        if (activeAlerts.put(type, severity) == severity) {
            return;
        }
        LOGGER.warn("{} ({})", message, severity);
        String alertId = "host-" + type.name().toLowerCase(Locale.ROOT).replace('_', '-')
                + "-" + clock.instant().toEpochMilli();
        events.publish(new HostAlertEvent(alertId, type, severity, message, ratio, threshold, clock.instant()));
    }

    // ==================== Lifecycle ====================

    /**
     * Stop polling.
     */
    public synchronized void shutdown() {
        shutdown = true;
        connection.removeConnectListener(lifecycleSubscription);
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Monitoring stopped");
    }

    private record ObservedDomain(String name, String uuid, VmState state) {
    }
}
