package io.rollo.vmmanager.event;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.Objects;

/**
 * Base class of every notification the engine publishes.
 */
public abstract class VmEvent {

    private final EventType type;
    private final Instant timestamp;

    protected VmEvent(@Nonnull EventType type, @Nonnull Instant timestamp) {
        this.type = Objects.requireNonNull(type, "type");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    @Nonnull
    public EventType getType() {
        return type;
    }

    @Nonnull
    public Instant getTimestamp() {
        return timestamp;
    }
}
