package io.rollo.vmmanager.event;

import io.rollo.api.vmmanager.VmState;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;

/**
 * Event fired when a VM is observed in a different state.
 *
 * <p>Fired by the metrics poll when it sees a state change between two polls,
 * by the hypervisor event subscription when one is active, and by lifecycle
 * operations (start, stop, restart, pause, resume) that change a VM's state.</p>
 */
public class VmStatusChangedEvent extends VmEvent {

    /**
     * Trigger used for changes detected by polling.
     */
    public static final String TRIGGER_POLL = "poll";

    private final String vmName;
    private final String uuid;
    private final VmState oldState;
    private final VmState newState;
    private final String trigger;

    /**
     * Create a status change event.
     *
     * @param vmName VM name
     * @param uuid VM UUID
     * @param oldState previous state, null if unknown
     * @param newState new state
     * @param trigger {@link #TRIGGER_POLL}, the hypervisor event name, or the operation name
     * @param timestamp when the change was observed
     */
    public VmStatusChangedEvent(
            @Nonnull String vmName,
            @Nonnull String uuid,
            @Nullable VmState oldState,
            @Nonnull VmState newState,
            @Nonnull String trigger,
            @Nonnull Instant timestamp) {
        super(EventType.VM_STATUS_CHANGED, timestamp);
        this.vmName = Objects.requireNonNull(vmName, "vmName");
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.oldState = oldState;
        this.newState = Objects.requireNonNull(newState, "newState");
        this.trigger = Objects.requireNonNull(trigger, "trigger");
    }

    @Nonnull
    public String getVmName() {
        return vmName;
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    @Nullable
    public VmState getOldState() {
        return oldState;
    }

    @Nonnull
    public VmState getNewState() {
        return newState;
    }

    @Nonnull
    public String getTrigger() {
        return trigger;
    }
}
