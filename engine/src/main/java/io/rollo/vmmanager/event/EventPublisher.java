package io.rollo.vmmanager.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget delivery of events to an {@link EventSink}.
 *
 * <p>Events are handed to a dedicated thread. A failing or slow sink never
 * blocks or fails the operation that produced the event.</p>
 */
public class EventPublisher {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventPublisher.class);

    private final EventSink sink;
    private final ExecutorService executor;

    public EventPublisher(@Nonnull EventSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "VmManager-Events");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue an event for delivery.
     *
     * @param event the event
     */
    public void publish(@Nonnull VmEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Dropped {} event, publisher is shut down", event.getType().getWireName());
        }
    }

    private void deliver(VmEvent event) {
        try {
            sink.publish(event);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to publish {} event: {}", event.getType().getWireName(), e.getMessage(), e);
        }
    }

    /**
     * Shutdown the publisher, delivering already queued events first.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
