package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Target of a lifecycle operation: exactly one of a VM name or a UUID.
 *
 * @param name domain name, or null when addressed by UUID
 * @param uuid domain UUID, or null when addressed by name
 */
public record VmRef(@Nullable String name, @Nullable String uuid) {

    public VmRef {
        boolean hasName = name != null && !name.isBlank();
        boolean hasUuid = uuid != null && !uuid.isBlank();
        if (hasName == hasUuid) {
            throw new IllegalArgumentException("Exactly one of VM name or UUID must be provided");
        }
        if (!hasName) {
            name = null;
        }
        if (!hasUuid) {
            uuid = null;
        }
    }

    @Nonnull
    public static VmRef byName(@Nonnull String name) {
        return new VmRef(name, null);
    }

    @Nonnull
    public static VmRef byUuid(@Nonnull String uuid) {
        return new VmRef(null, uuid);
    }

    /**
     * Create a reference from optional name and UUID values, as received from a caller.
     *
     * @param name VM name or null
     * @param uuid VM UUID or null
     * @return the reference
     * @throws IllegalArgumentException if neither or both are given
     */
    @Nonnull
    public static VmRef of(@Nullable String name, @Nullable String uuid) {
        return new VmRef(name, uuid);
    }

    public boolean isByUuid() {
        return uuid != null;
    }

    /**
     * Get the identifier used for lookups and messages.
     *
     * @return the UUID if present, otherwise the name
     */
    @Nonnull
    public String identity() {
        return uuid != null ? uuid : name;
    }

    @Override
    public String toString() {
        return identity();
    }
}
