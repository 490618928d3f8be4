package io.rollo.vmmanager.hypervisor;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Open connection to a hypervisor.
 *
 * <p>Implementations are not thread-safe. Callers serialize access through
 * {@link io.rollo.vmmanager.connection.ConnectionManager}.</p>
 */
public interface HypervisorClient extends AutoCloseable {

    @Nonnull
    String hostname() throws HypervisorException;

    @Nonnull
    NodeInfo nodeInfo() throws HypervisorException;

    @Nonnull
    String hypervisorType() throws HypervisorException;

    long hypervisorVersion() throws HypervisorException;

    long libraryVersion() throws HypervisorException;

    /**
     * List running and defined domains.
     *
     * @return every domain the hypervisor knows
     * @throws HypervisorException if the hypervisor fails
     */
    @Nonnull
    List<HypervisorDomain> listDomains() throws HypervisorException;

    int activeDomainCount() throws HypervisorException;

    /**
     * Look up a domain by name.
     *
     * @param name domain name
     * @return the domain
     * @throws HypervisorException with kind {@code NO_DOMAIN} if absent
     */
    @Nonnull
    HypervisorDomain lookupByName(@Nonnull String name) throws HypervisorException;

    /**
     * Look up a domain by UUID.
     *
     * @param uuid domain UUID
     * @return the domain
     * @throws HypervisorException with kind {@code NO_DOMAIN} if absent
     */
    @Nonnull
    HypervisorDomain lookupByUuid(@Nonnull String uuid) throws HypervisorException;

    /**
     * Define (persist) a domain from its XML description.
     *
     * @param xml domain definition
     * @return the defined domain
     * @throws HypervisorException if the definition is rejected
     */
    @Nonnull
    HypervisorDomain defineDomain(@Nonnull String xml) throws HypervisorException;

    /**
     * Subscribe to domain lifecycle events.
     *
     * @param listener event receiver
     * @throws HypervisorException if the hypervisor does not support events
     */
    void addLifecycleListener(@Nonnull DomainLifecycleListener listener) throws HypervisorException;

    @Override
    void close() throws HypervisorException;
}
