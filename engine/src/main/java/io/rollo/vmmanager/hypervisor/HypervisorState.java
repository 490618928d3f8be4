package io.rollo.vmmanager.hypervisor;

import io.rollo.api.vmmanager.VmState;

import javax.annotation.Nonnull;

/**
 * Raw domain states reported by the hypervisor.
 */
public enum HypervisorState {
    NOSTATE(VmState.ERROR),
    RUNNING(VmState.RUNNING),
    BLOCKED(VmState.RUNNING),
    PAUSED(VmState.PAUSED),
    SHUTDOWN(VmState.STOPPING),
    SHUTOFF(VmState.STOPPED),
    CRASHED(VmState.ERROR),
    PMSUSPENDED(VmState.SUSPENDED);

    private final VmState vmState;

    HypervisorState(VmState vmState) {
        this.vmState = vmState;
    }

    @Nonnull
    public VmState toVmState() {
        return vmState;
    }

    /**
     * Check if the domain has a running process.
     *
     * @return true if active
     */
    public boolean isActive() {
        return this != SHUTOFF && this != NOSTATE && this != CRASHED;
    }
}
