package io.rollo.vmmanager.event;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.Objects;

/**
 * Event fired after a VM has been defined.
 */
public class VmCreatedEvent extends VmEvent {

    private final String vmName;
    private final String uuid;
    private final int vcpus;
    private final long memoryMb;

    public VmCreatedEvent(@Nonnull String vmName, @Nonnull String uuid, int vcpus, long memoryMb,
                          @Nonnull Instant timestamp) {
        super(EventType.VM_CREATED, timestamp);
        this.vmName = Objects.requireNonNull(vmName, "vmName");
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.vcpus = vcpus;
        this.memoryMb = memoryMb;
    }

    @Nonnull
    public String getVmName() {
        return vmName;
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    public int getVcpus() {
        return vcpus;
    }

    public long getMemoryMb() {
        return memoryMb;
    }
}
