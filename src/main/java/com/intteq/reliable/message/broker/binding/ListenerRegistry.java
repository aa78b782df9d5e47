package com.intteq.reliable.message.broker.binding;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Explicit collection of every binding and handler of the application.
 *
 * <p>Built once, before the broker connection is established, and passed by reference to the
 * topology builder, the dispatcher and the listener container. Several handlers may share one
 * physical queue as long as their patterns differ.
 */
@Slf4j
public class ListenerRegistry {

    private final Map<String, List<ListenerRegistration>> registrationsByQueue = new LinkedHashMap<>();
    private final Set<String> declaredQueues = new LinkedHashSet<>();

    /**
     * Adds a handler for the given binding.
     *
     * @throws IllegalStateException if the queue already has a handler for the same pattern,
     *                               or if the binding names a different channel than the
     *                               bindings already registered on the queue
     */
    public synchronized ListenerRegistry register(Binding binding, MessageHandler handler) {
        Objects.requireNonNull(binding, "binding must not be null");
        Objects.requireNonNull(handler, "handler must not be null");

        List<ListenerRegistration> onQueue =
                registrationsByQueue.computeIfAbsent(binding.getQueue(), q -> new ArrayList<>());

        for (ListenerRegistration existing : onQueue) {
            if (existing.getRoutingKeyPattern().equals(binding.getRoutingKey())) {
                throw new IllegalStateException("Queue '" + binding.getQueue()
                        + "' already has a handler for routing key '" + binding.getRoutingKey() + "'");
            }
            if (!Objects.equals(existing.getBinding().getChannel(), binding.getChannel())) {
                throw new IllegalStateException("Queue '" + binding.getQueue() + "' is bound on channel '"
                        + existing.getBinding().getChannel() + "', cannot also use channel '"
                        + binding.getChannel() + "'");
            }
        }

        onQueue.add(ListenerRegistration.of(binding, handler));
        declaredQueues.add(binding.getQueue());
        log.info("Registered handler {}", binding.describe());
        return this;
    }

    /**
     * Declares a queue that has no handler in this application. It still gets its
     * dead-letter queue.
     */
    public synchronized ListenerRegistry declareQueue(String queue) {
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("queue must not be blank");
        }
        declaredQueues.add(queue);
        return this;
    }

    public synchronized List<ListenerRegistration> registrations() {
        List<ListenerRegistration> all = new ArrayList<>();
        registrationsByQueue.values().forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    public synchronized List<ListenerRegistration> registrationsFor(String queue) {
        return List.copyOf(registrationsByQueue.getOrDefault(queue, List.of()));
    }

    /** Queues with at least one handler, in registration order. */
    public synchronized Set<String> consumedQueues() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(registrationsByQueue.keySet()));
    }

    /** Every queue known to the registry, consumed or only declared. */
    public synchronized Set<String> declaredQueues() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(declaredQueues));
    }

    /** Channel name shared by the bindings of a queue, {@code null} for the default channel. */
    public synchronized String channelFor(String queue) {
        List<ListenerRegistration> onQueue = registrationsByQueue.getOrDefault(queue, List.of());
        return onQueue.isEmpty() ? null : onQueue.get(0).getBinding().getChannel();
    }

    public synchronized boolean isEmpty() {
        return declaredQueues.isEmpty();
    }
}
