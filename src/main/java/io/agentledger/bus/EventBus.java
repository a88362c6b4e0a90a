package io.agentledger.bus;

import io.agentledger.model.Message;
import io.agentledger.model.MessageType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process publish/subscribe channel keyed by {@link MessageType}.
 *
 * <p>Delivery is synchronous: {@link #publish(Message)} invokes the matching handlers in the
 * caller's thread, in registration order, over a snapshot of the handler table taken when
 * publishing starts. Handlers may therefore publish, subscribe or unsubscribe while a
 * delivery is in progress.
 *
 * <p>There is no persistence. A message published while no handler matches is dropped and
 * only counted in {@link #droppedCount()}; an agent observes nothing that was published
 * before it started. Callers that need to know use the delivery count returned by
 * {@code publish}.
 */
public final class EventBus {
    private final Map<MessageType, List<Subscription>> handlers = new EnumMap<>(MessageType.class);
    private final AtomicLong droppedCount = new AtomicLong(0L);

    public synchronized void subscribe(String agentId, MessageType type, MessageHandler handler) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("subscriber identity cannot be empty");
        }
        if (type == null || handler == null) {
            throw new IllegalArgumentException("type and handler are required");
        }
        handlers.computeIfAbsent(type, ignored -> new ArrayList<>())
                .add(new Subscription(agentId, handler));
    }

    public synchronized int unsubscribeAll(String agentId) {
        int removed = 0;
        for (List<Subscription> subscriptions : handlers.values()) {
            int before = subscriptions.size();
            subscriptions.removeIf(s -> s.agentId().equals(agentId));
            removed += before - subscriptions.size();
        }
        return removed;
    }

    public int publish(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        List<Subscription> snapshot = snapshot(message.type());
        int delivered = 0;
        for (Subscription subscription : snapshot) {
            if (message.toAgent() != null && !message.toAgent().equals(subscription.agentId())) {
                continue;
            }
            subscription.handler().handle(message);
            delivered++;
        }
        if (delivered == 0) {
            droppedCount.incrementAndGet();
        }
        return delivered;
    }

    public synchronized boolean hasSubscriber(String agentId, MessageType type) {
        return handlers.getOrDefault(type, List.of()).stream()
                .anyMatch(s -> s.agentId().equals(agentId));
    }

    public synchronized void clear() {
        handlers.clear();
    }

    public long droppedCount() {
        return droppedCount.get();
    }

    private synchronized List<Subscription> snapshot(MessageType type) {
        return List.copyOf(handlers.getOrDefault(type, List.of()));
    }

    private record Subscription(String agentId, MessageHandler handler) {
    }
}
