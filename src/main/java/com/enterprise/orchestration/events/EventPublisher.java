package com.enterprise.orchestration.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process observer channel shared by the subsystems of one orchestrator.
 * <p>
 * Listeners run on the publishing thread. A listener that throws is logged and skipped,
 * it never interrupts the subsystem that emitted the event.
 */
public class EventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Publish an event to every listener interested in its type
     */
    public void publish(OrchestrationEvent event) {
        logger.debug("Publishing event {} for {}", event.getType(), event.getSubjectId());

        for (Listener listener : listeners) {
            if (listener.types.contains(event.getType())) {
                deliverSafely(listener.consumer, event);
            }
        }
    }

    /**
     * Subscribe to every event type
     */
    public Subscription subscribe(Consumer<OrchestrationEvent> consumer) {
        return subscribe(EnumSet.allOf(EventType.class), consumer);
    }

    /**
     * Subscribe to the given event types only
     */
    public Subscription subscribe(Set<EventType> types, Consumer<OrchestrationEvent> consumer) {
        Set<EventType> filter = types.isEmpty() ? EnumSet.noneOf(EventType.class) : EnumSet.copyOf(types);
        Listener listener = new Listener(filter, consumer);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OrchestrationEvent> consumer, OrchestrationEvent event) {
        try {
            consumer.accept(event);
        } catch (Exception e) {
            logger.warn("Listener threw exception processing event {}: {}",
                    event.getType(), e.getMessage(), e);
        }
    }

    private static final class Listener {
        private final Set<EventType> types;
        private final Consumer<OrchestrationEvent> consumer;

        private Listener(Set<EventType> types, Consumer<OrchestrationEvent> consumer) {
            this.types = types;
            this.consumer = consumer;
        }
    }
}
