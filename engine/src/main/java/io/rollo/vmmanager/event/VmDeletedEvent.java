package io.rollo.vmmanager.event;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Event fired after a VM has been undefined.
 */
public class VmDeletedEvent extends VmEvent {

    private final String vmName;
    private final String uuid;
    private final List<String> deletedDisks;

    public VmDeletedEvent(@Nonnull String vmName, @Nonnull String uuid, @Nonnull List<String> deletedDisks,
                          @Nonnull Instant timestamp) {
        super(EventType.VM_DELETED, timestamp);
        this.vmName = Objects.requireNonNull(vmName, "vmName");
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.deletedDisks = List.copyOf(deletedDisks);
    }

    @Nonnull
    public String getVmName() {
        return vmName;
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    /**
     * Get the disk images removed along with the VM.
     *
     * @return image paths, empty when disks were kept
     */
    @Nonnull
    public List<String> getDeletedDisks() {
        return deletedDisks;
    }
}
