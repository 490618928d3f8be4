package io.rollo.vmmanager.resource;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Capacity, allocation and availability computed from one observation.
 *
 * @param capacity host capacity
 * @param allocated allocation scan
 * @param available difference of the two
 * @param storageError why storage could not be read, null if it was
 */
public record ResourceReport(
        @Nonnull HostCapacity capacity,
        @Nonnull AllocationSnapshot allocated,
        @Nonnull AvailableResources available,
        @Nullable String storageError) {
}
