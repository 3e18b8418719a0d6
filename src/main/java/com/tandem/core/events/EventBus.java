package com.tandem.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for committed task changes.
 * <p>
 * Subscriptions are per project. Thread-safe for concurrent publish and subscribe operations.
 * Delivery happens on the publisher's thread, so subscribers must hand off any real work.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-project subscribers keyed by projectId. */
    private final ConcurrentHashMap<Long, CopyOnWriteArrayList<Consumer<TandemEvent>>> projectSubscribers =
            new ConcurrentHashMap<>();

    /**
     * Publish an event to all subscribers of the event's project.
     *
     * @param event the event to publish
     */
    public void publish(TandemEvent event) {
        log.debug("Publishing event: {} for task {} in project {}",
                event.eventType(), event.taskId(), event.projectId());

        List<Consumer<TandemEvent>> subscribers = projectSubscribers.get(event.projectId());
        if (subscribers != null) {
            for (Consumer<TandemEvent> subscriber : subscribers) {
                deliverSafely(subscriber, event);
            }
        }
    }

    /**
     * Subscribe to events for a specific project.
     *
     * @param projectId the project to subscribe to
     * @param consumer  callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(long projectId, Consumer<TandemEvent> consumer) {
        projectSubscribers.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to project {}", projectId);
        return () -> projectSubscribers.computeIfPresent(projectId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /** Number of live subscriptions for a project. */
    public int subscriberCount(long projectId) {
        List<Consumer<TandemEvent>> subs = projectSubscribers.get(projectId);
        return subs == null ? 0 : subs.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<TandemEvent> subscriber, TandemEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
