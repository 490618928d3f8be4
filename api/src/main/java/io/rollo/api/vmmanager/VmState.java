package io.rollo.api.vmmanager;

/**
 * Lifecycle state of a VM as observed on the hypervisor.
 *
 * <p>States are never cached; every inquiry reads the hypervisor.</p>
 */
public enum VmState {
    /**
     * No domain exists for the identity.
     */
    UNDEFINED,

    /**
     * Domain is defined but not running.
     */
    STOPPED,

    /**
     * Domain is booting.
     */
    STARTING,

    /**
     * Domain is running (or blocked on a resource).
     */
    RUNNING,

    /**
     * Domain execution is suspended by the hypervisor.
     */
    PAUSED,

    /**
     * Domain is suspended through guest power management.
     */
    SUSPENDED,

    /**
     * Domain is shutting down.
     */
    STOPPING,

    /**
     * Domain crashed or its state cannot be determined.
     */
    ERROR;

    /**
     * Check if the domain has a live process on the host.
     *
     * @return true if the domain holds runtime resources
     */
    public boolean isActive() {
        return this == STARTING || this == RUNNING || this == PAUSED
                || this == SUSPENDED || this == STOPPING;
    }

    /**
     * Check if the domain may be started.
     *
     * @return true if start is a valid transition
     */
    public boolean isStartable() {
        return this == STOPPED || this == ERROR;
    }

    /**
     * Check if the state is expected to change without further requests.
     *
     * @return true if transitional
     */
    public boolean isTransitional() {
        return this == STARTING || this == STOPPING;
    }
}
