package io.rollo.vmmanager.hypervisor.libvirt;

import io.rollo.vmmanager.hypervisor.DomainLifecycleListener;
import io.rollo.vmmanager.hypervisor.HypervisorClient;
import io.rollo.vmmanager.hypervisor.HypervisorDomain;
import io.rollo.vmmanager.hypervisor.HypervisorException;
import io.rollo.vmmanager.hypervisor.NodeInfo;
import org.libvirt.Connect;
import org.libvirt.LibvirtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link HypervisorClient} backed by a libvirt {@link Connect}.
 */
public class LibvirtHypervisorClient implements HypervisorClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(LibvirtHypervisorClient.class);

    private final Connect connect;
    private final String uri;

    LibvirtHypervisorClient(@Nonnull Connect connect, @Nonnull String uri) {
        this.connect = Objects.requireNonNull(connect, "connect");
        this.uri = Objects.requireNonNull(uri, "uri");
    }

    @Override
    @Nonnull
    public String hostname() throws HypervisorException {
        try {
            return connect.getHostName();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("get hostname", e);
        }
    }

    @Override
    @Nonnull
    public NodeInfo nodeInfo() throws HypervisorException {
        try {
            org.libvirt.NodeInfo info = connect.nodeInfo();
            return new NodeInfo(info.model, info.memory, info.cpus, info.mhz,
                    info.nodes, info.sockets, info.cores, info.threads);
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("get node info", e);
        }
    }

    @Override
    @Nonnull
    public String hypervisorType() throws HypervisorException {
        try {
            return connect.getType();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("get hypervisor type", e);
        }
    }

    @Override
    public long hypervisorVersion() throws HypervisorException {
        try {
            return connect.getVersion();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("get hypervisor version", e);
        }
    }

    @Override
    public long libraryVersion() throws HypervisorException {
        try {
            return connect.getLibVersion();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("get library version", e);
        }
    }

    @Override
    @Nonnull
    public List<HypervisorDomain> listDomains() throws HypervisorException {
        List<HypervisorDomain> domains = new ArrayList<>();
        try {
            for (int id : connect.listDomains()) {
                domains.add(new LibvirtDomain(connect.domainLookupByID(id)));
            }
            for (String name : connect.listDefinedDomains()) {
                domains.add(new LibvirtDomain(connect.domainLookupByName(name)));
            }
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("list domains", e);
        }
        return domains;
    }

    @Override
    public int activeDomainCount() throws HypervisorException {
        try {
            return connect.numOfDomains();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("count domains", e);
        }
    }

    @Override
    @Nonnull
    public HypervisorDomain lookupByName(@Nonnull String name) throws HypervisorException {
        try {
            return new LibvirtDomain(connect.domainLookupByName(name));
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("look up " + name, e);
        }
    }

    @Override
    @Nonnull
    public HypervisorDomain lookupByUuid(@Nonnull String uuid) throws HypervisorException {
        try {
            return new LibvirtDomain(connect.domainLookupByUUIDString(uuid));
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("look up " + uuid, e);
        }
    }

    @Override
    @Nonnull
    public HypervisorDomain defineDomain(@Nonnull String xml) throws HypervisorException {
        try {
            return new LibvirtDomain(connect.domainDefineXML(xml));
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("define domain", e);
        }
    }

    @Override
    public void addLifecycleListener(@Nonnull DomainLifecycleListener listener) throws HypervisorException {
        Objects.requireNonNull(listener, "listener");
        try {
            connect.addLifecycleListener((domain, event) -> {
                try {
                    listener.onLifecycleEvent(domain.getName(), domain.getUUIDString(),
                            event.getType().name().toLowerCase(Locale.ROOT));
                } catch (LibvirtException e) {
                    LOGGER.warn("Failed to read domain of lifecycle event: {}", e.getMessage());
                }
                return 0;
            });
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("register lifecycle listener", e);
        }
    }

    @Override
    public void close() throws HypervisorException {
        try {
            connect.close();
            LOGGER.debug("Closed libvirt connection to {}", uri);
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("close connection", e);
        }
    }
}
