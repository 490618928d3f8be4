package io.rollo.vmmanager.hypervisor;

import javax.annotation.Nonnull;

/**
 * Receives domain lifecycle events from the hypervisor.
 */
@FunctionalInterface
public interface DomainLifecycleListener {

    /**
     * Called on the hypervisor event thread.
     *
     * @param domainName domain name
     * @param uuid domain UUID
     * @param event lower case event name (started, stopped, crashed, ...)
     */
    void onLifecycleEvent(@Nonnull String domainName, @Nonnull String uuid, @Nonnull String event);
}
