package io.rollo.api.vmmanager.error;

/**
 * Classifies a failure so callers can decide whether to retry.
 */
public enum ErrorKind {
    /**
     * The hypervisor connection failed. Retryable with backoff.
     */
    CONNECTION,

    /**
     * The VM or domain does not exist. Not retried automatically.
     */
    NOT_FOUND,

    /**
     * The hypervisor rejected the requested action.
     */
    OPERATION,

    /**
     * The resource request violates limits or availability.
     */
    VALIDATION,

    /**
     * The requested transition is invalid for the VM's current state.
     */
    STATE;

    /**
     * Check if the caller may retry the failed request unchanged.
     *
     * @return true if retryable
     */
    public boolean isRetryable() {
        return this == CONNECTION;
    }
}
