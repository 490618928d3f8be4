package io.rollo.vmmanager.event;

import javax.annotation.Nonnull;

/**
 * Receives engine notifications, e.g. a websocket broadcaster or a metrics store.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Sink that drops every event.
     */
    EventSink NOOP = event -> { };

    /**
     * Deliver an event. May block or throw; the engine calls it off the
     * request path and logs failures.
     *
     * @param event the event
     */
    void publish(@Nonnull VmEvent event);
}
