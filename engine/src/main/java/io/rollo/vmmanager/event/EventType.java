package io.rollo.vmmanager.event;

import javax.annotation.Nonnull;

/**
 * Kinds of notifications published to the {@link EventSink}.
 */
public enum EventType {
    VM_STATUS_CHANGED("vmStatusChanged"),
    VM_CREATED("vmCreated"),
    VM_DELETED("vmDeleted"),
    VM_METRICS("vmMetrics"),
    HOST_METRICS("hostMetrics"),
    HOST_ALERT("hostAlert");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used by notification consumers.
     *
     * @return camel case event name
     */
    @Nonnull
    public String getWireName() {
        return wireName;
    }
}
