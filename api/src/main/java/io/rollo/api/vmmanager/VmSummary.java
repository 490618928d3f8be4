package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;

/**
 * Listing entry for one domain.
 */
public record VmSummary(
        @Nonnull String name,
        @Nonnull String uuid,
        @Nonnull VmState state,
        int vcpus,
        long memoryMb) {
}
