package io.rollo.api.vmmanager.error;

import io.rollo.api.vmmanager.VmState;

import javax.annotation.Nonnull;

/**
 * The VM is in a state that does not allow the requested transition.
 */
public class StateException extends VmManagerException {

    private final String identity;
    private final VmState currentState;
    private final String requiredState;

    /**
     * Create a state exception.
     *
     * @param operation operation that was refused
     * @param identity VM name or UUID
     * @param currentState state the VM is in
     * @param requiredState human readable description of the accepted state(s)
     */
    public StateException(
            @Nonnull String operation,
            @Nonnull String identity,
            @Nonnull VmState currentState,
            @Nonnull String requiredState) {
        super(ErrorKind.STATE, "Cannot " + operation + " VM '" + identity + "': state is '"
                + currentState.name() + "' but requires '" + requiredState + "'");
        this.identity = identity;
        this.currentState = currentState;
        this.requiredState = requiredState;
    }

    @Nonnull
    public String getIdentity() {
        return identity;
    }

    @Nonnull
    public VmState getCurrentState() {
        return currentState;
    }

    @Nonnull
    public String getRequiredState() {
        return requiredState;
    }
}
