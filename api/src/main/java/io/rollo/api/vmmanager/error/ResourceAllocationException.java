package io.rollo.api.vmmanager.error;

import io.rollo.api.vmmanager.ValidationResult;

import javax.annotation.Nonnull;

/**
 * The request is well-formed but the host does not have enough free capacity for it.
 */
public class ResourceAllocationException extends ValidationException {

    public ResourceAllocationException(@Nonnull ValidationResult result) {
        super(result);
    }
}
