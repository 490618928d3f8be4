package io.rollo.vmmanager.hypervisor.libvirt;

import io.rollo.vmmanager.hypervisor.HypervisorClient;
import io.rollo.vmmanager.hypervisor.HypervisorClientFactory;
import io.rollo.vmmanager.hypervisor.HypervisorException;
import org.libvirt.Connect;
import org.libvirt.LibvirtException;
import org.libvirt.Library;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Opens libvirt connections.
 *
 * <p>When events are enabled, the libvirt event loop is initialized once and
 * driven by a daemon thread so lifecycle listeners receive callbacks.</p>
 */
public class LibvirtHypervisorClientFactory implements HypervisorClientFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(LibvirtHypervisorClientFactory.class);

    private final boolean eventsEnabled;
    private volatile boolean eventLoopStarted = false;

    public LibvirtHypervisorClientFactory(boolean eventsEnabled) {
        this.eventsEnabled = eventsEnabled;
    }

    @Override
    @Nonnull
    public HypervisorClient open(@Nonnull String uri) throws HypervisorException {
        if (eventsEnabled) {
            startEventLoop();
        }
        try {
            LOGGER.info("Opening libvirt connection to {}", uri);
            return new LibvirtHypervisorClient(new Connect(uri), uri);
        } catch (LibvirtException e) {
            throw new HypervisorException(HypervisorException.Kind.CONNECTION,
                    "connect to " + uri + ": " + e.getMessage(), e);
        }
    }

    private synchronized void startEventLoop() throws HypervisorException {
        if (eventLoopStarted) {
            return;
        }
        try {
            Library.initEventLoop();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("initialize event loop", e);
        }

        Thread thread = new Thread(() -> {
            try {
                Library.runEventLoop();
            } catch (Exception e) {
                LOGGER.error("libvirt event loop terminated: {}", e.getMessage(), e);
            }
        }, "Libvirt-EventLoop");
        thread.setDaemon(true);
        thread.start();
        eventLoopStarted = true;
        LOGGER.debug("Started libvirt event loop");
    }
}
