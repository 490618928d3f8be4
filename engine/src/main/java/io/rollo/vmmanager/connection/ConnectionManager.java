package io.rollo.vmmanager.connection;

import io.rollo.api.vmmanager.ConnectionHealth;
import io.rollo.api.vmmanager.VmRef;
import io.rollo.api.vmmanager.error.ConnectionException;
import io.rollo.api.vmmanager.error.NotFoundException;
import io.rollo.api.vmmanager.error.OperationException;
import io.rollo.api.vmmanager.error.VmManagerException;
import io.rollo.vmmanager.config.VmManagerConfig;
import io.rollo.vmmanager.hypervisor.HypervisorClient;
import io.rollo.vmmanager.hypervisor.HypervisorClientFactory;
import io.rollo.vmmanager.hypervisor.HypervisorDomain;
import io.rollo.vmmanager.hypervisor.HypervisorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single hypervisor connection of the process.
 *
 * <p>Every hypervisor call goes through {@link #execute}, which serializes
 * calls on one fair lock, opens the connection lazily, reopens it when the
 * liveness probe fails, and translates client failures into the engine's
 * error kinds. {@link ConnectListener}s are replayed on every new client.</p>
 */
public class ConnectionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionManager.class);

    private final HypervisorClientFactory factory;
    private final String uri;
    private final Duration livenessWindow;
    private final Duration lockTimeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final List<ConnectListener> connectListeners = new CopyOnWriteArrayList<>();

    // guarded by lock
    private HypervisorClient client;
    private Instant lastVerified;

    public ConnectionManager(@Nonnull VmManagerConfig.ConnectionConfig config,
                             @Nonnull HypervisorClientFactory factory) {
        this(config, factory, Clock.systemUTC());
    }

    /**
     * Create a connection manager.
     *
     * @param config connection settings
     * @param factory opens new connections
     * @param clock time source for the liveness window
     */
    public ConnectionManager(@Nonnull VmManagerConfig.ConnectionConfig config,
                             @Nonnull HypervisorClientFactory factory,
                             @Nonnull Clock clock) {
        Objects.requireNonNull(config, "config");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.uri = Objects.requireNonNull(config.getUri(), "uri");
        this.livenessWindow = Duration.ofSeconds(config.getLivenessWindowSeconds());
        this.lockTimeout = Duration.ofSeconds(config.getLockTimeoutSeconds());
    }

    // ==================== Connection ====================

    /**
     * Ensure an open, live connection exists.
     *
     * @throws ConnectionException if no connection can be established
     */
    public void connect() {
        acquire("connect");
        try {
            connectLocked();
        } finally {
            lock.unlock();
        }
    }

    private HypervisorClient connectLocked() {
        Instant now = clock.instant();
        if (client != null) {
            if (lastVerified != null && now.isBefore(lastVerified.plus(livenessWindow))) {
                return client;
            }
            try {
                client.hostname();
                lastVerified = now;
                return client;
            } catch (HypervisorException e) {
                LOGGER.warn("Hypervisor connection to {} failed liveness probe, reconnecting: {}",
                        uri, e.getMessage());
                closeLocked();
            }
        }

        try {
            client = factory.open(uri);
            lastVerified = now;
            LOGGER.info("Connected to hypervisor at {}", uri);
            for (ConnectListener listener : connectListeners) {
                notifyConnected(client, listener);
            }
            return client;
        } catch (HypervisorException e) {
            LOGGER.error("Failed to connect to hypervisor at {}: {}", uri, e.getMessage());
            throw new ConnectionException("Failed to connect to hypervisor at " + uri + ": " + e.getMessage(), e);
        }
    }

    private void notifyConnected(HypervisorClient active, ConnectListener listener) {
        try {
            listener.onConnect(active);
        } catch (HypervisorException e) {
            LOGGER.warn("Connection setup on {} failed: {}", uri, e.getMessage(), e);
        }
    }

    /**
     * Register setup to run on every client this manager opens. If a client is
     * already open, the listener runs on it before this method returns.
     *
     * @param listener per-connection setup
     */
    public void addConnectListener(@Nonnull ConnectListener listener) {
        Objects.requireNonNull(listener, "listener");
        acquire("register connect listener");
        try {
            connectListeners.add(listener);
            if (client != null) {
                notifyConnected(client, listener);
            }
        } finally {
            lock.unlock();
        }
    }

    public void removeConnectListener(@Nonnull ConnectListener listener) {
        connectListeners.remove(listener);
    }

    /**
     * Close the connection. Safe to call more than once.
     */
    public void disconnect() {
        lock.lock();
        try {
            closeLocked();
        } finally {
            lock.unlock();
        }
    }

    private void closeLocked() {
        if (client == null) {
            return;
        }
        try {
            client.close();
            LOGGER.info("Disconnected from hypervisor at {}", uri);
        } catch (HypervisorException e) {
            LOGGER.warn("Error closing hypervisor connection to {}: {}", uri, e.getMessage());
        } finally {
            client = null;
            lastVerified = null;
        }
    }

    /**
     * Check if a connection is currently held. Does not probe it.
     *
     * @return true if a handle is cached
     */
    public boolean isConnected() {
        lock.lock();
        try {
            return client != null;
        } finally {
            lock.unlock();
        }
    }

    @Nonnull
    public String getUri() {
        return uri;
    }

    // ==================== Calls ====================

    /**
     * Run a call on the shared connection.
     *
     * @param operation operation name used in error messages
     * @param identity VM name or UUID the call concerns, or null
     * @param call the work
     * @param <T> result type
     * @return the call result
     * @throws ConnectionException on transport failures
     * @throws NotFoundException if the hypervisor reports a missing domain
     * @throws OperationException on any other hypervisor failure
     */
    public <T> T execute(@Nonnull String operation, @Nullable String identity, @Nonnull HypervisorCall<T> call) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(call, "call");

        acquire(operation);
        try {
            HypervisorClient active = connectLocked();
            return call.apply(active);
        } catch (HypervisorException e) {
            throw translate(operation, identity, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolve a domain and run a call on it.
     *
     * @param operation operation name used in error messages
     * @param ref target VM
     * @param call the work
     * @param <T> result type
     * @return the call result
     * @throws NotFoundException if the domain does not exist
     */
    public <T> T withDomain(@Nonnull String operation, @Nonnull VmRef ref, @Nonnull DomainCall<T> call) {
        Objects.requireNonNull(ref, "ref");
        return execute(operation, ref.identity(), client -> call.apply(resolve(client, ref)));
    }

    /**
     * Look up a domain.
     *
     * @param ref target VM
     * @return the domain handle
     * @throws NotFoundException if the domain does not exist
     */
    @Nonnull
    public HypervisorDomain lookup(@Nonnull VmRef ref) {
        return withDomain("lookup", ref, domain -> domain);
    }

    /**
     * Look up a domain, reporting absence as an empty result.
     *
     * @param ref target VM
     * @return the domain, or empty if it does not exist
     */
    @Nonnull
    public Optional<HypervisorDomain> findDomain(@Nonnull VmRef ref) {
        Objects.requireNonNull(ref, "ref");
        return execute("lookup", ref.identity(), client -> find(client, ref));
    }

    /**
     * Resolve a reference on an already held client.
     *
     * @param client open client
     * @param ref target VM
     * @return the domain
     * @throws HypervisorException with kind {@code NO_DOMAIN} if absent
     */
    @Nonnull
    public static HypervisorDomain resolve(@Nonnull HypervisorClient client, @Nonnull VmRef ref)
            throws HypervisorException {
        return ref.isByUuid() ? client.lookupByUuid(ref.uuid()) : client.lookupByName(ref.name());
    }

    /**
     * Resolve a reference on an already held client without treating absence as a failure.
     *
     * @param client open client
     * @param ref target VM
     * @return the domain, or empty
     * @throws HypervisorException on failures other than absence
     */
    @Nonnull
    public static Optional<HypervisorDomain> find(@Nonnull HypervisorClient client, @Nonnull VmRef ref)
            throws HypervisorException {
        try {
            return Optional.of(resolve(client, ref));
        } catch (HypervisorException e) {
            if (e.getKind() == HypervisorException.Kind.NO_DOMAIN) {
                return Optional.empty();
            }
            throw e;
        }
    }

    // ==================== Health ====================

    /**
     * Probe the hypervisor. Never throws.
     *
     * @return health report
     */
    @Nonnull
    public ConnectionHealth healthCheck() {
        try {
            return execute("health check", null, c -> {
                String hostname = c.hostname();
                lastVerified = clock.instant();
                return new ConnectionHealth(true, hostname, c.activeDomainCount(), c.listDomains().size(),
                        uri, null, clock.instant());
            });
        } catch (VmManagerException e) {
            LOGGER.warn("Hypervisor health check failed: {}", e.getMessage());
            return new ConnectionHealth(false, null, 0, 0, uri, e.getMessage(), clock.instant());
        }
    }

    // ==================== Internals ====================

    private void acquire(String operation) {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ConnectionException("Timed out after " + lockTimeout.toSeconds()
                        + "s waiting for the hypervisor connection (" + operation + ")");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while waiting for the hypervisor connection ("
                    + operation + ")", e);
        }
    }

    private VmManagerException translate(String operation, String identity, HypervisorException e) {
        switch (e.getKind()) {
            case NO_DOMAIN:
                LOGGER.debug("{}: domain '{}' not found", operation, identity);
                return new NotFoundException(identity != null ? identity : "unknown");
            case CONNECTION:
                LOGGER.error("Hypervisor connection failed during {}: {}", operation, e.getMessage(), e);
                closeLocked();
                return new ConnectionException("Hypervisor connection failed during " + operation
                        + ": " + e.getMessage(), e);
            default:
                LOGGER.error("Failed to {} {}: {}", operation, identity != null ? identity : "", e.getMessage(), e);
                return new OperationException(operation, identity, e.getMessage(), e);
        }
    }
}
