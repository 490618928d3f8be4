package io.rollo.vmmanager.event;

import io.rollo.api.vmmanager.HostMetricsSnapshot;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Event carrying the host aggregates of one poll.
 */
public class HostMetricsEvent extends VmEvent {

    private final HostMetricsSnapshot snapshot;

    public HostMetricsEvent(@Nonnull HostMetricsSnapshot snapshot) {
        super(EventType.HOST_METRICS, Objects.requireNonNull(snapshot, "snapshot").timestamp());
        this.snapshot = snapshot;
    }

    @Nonnull
    public HostMetricsSnapshot getSnapshot() {
        return snapshot;
    }
}
