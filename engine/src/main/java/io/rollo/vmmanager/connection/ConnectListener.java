package io.rollo.vmmanager.connection;

import io.rollo.vmmanager.hypervisor.HypervisorClient;
import io.rollo.vmmanager.hypervisor.HypervisorException;

/**
 * Per-connection setup, run on every newly opened client.
 *
 * <p>Use it for state the hypervisor keeps per connection, such as event
 * subscriptions, which a reconnect would otherwise lose.</p>
 */
@FunctionalInterface
public interface ConnectListener {

    void onConnect(HypervisorClient client) throws HypervisorException;
}
