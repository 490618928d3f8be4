package io.rollo.vmmanager.event;

import io.rollo.api.vmmanager.VmMetricsSnapshot;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Event carrying one VM metrics snapshot.
 */
public class VmMetricsEvent extends VmEvent {

    private final VmMetricsSnapshot snapshot;

    public VmMetricsEvent(@Nonnull VmMetricsSnapshot snapshot) {
        super(EventType.VM_METRICS, Objects.requireNonNull(snapshot, "snapshot").timestamp());
        this.snapshot = snapshot;
    }

    @Nonnull
    public VmMetricsSnapshot getSnapshot() {
        return snapshot;
    }

    @Nonnull
    public String getUuid() {
        return snapshot.uuid();
    }
}
