package com.umitunal.elric.queue;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates {@link InMemoryQueue}s and keeps them reachable so in-process workers can drain them.
 */
public class InMemoryQueueFactory implements QueueFactory {
    private final Map<String, InMemoryQueue> queues = new ConcurrentHashMap<>();

    @Override
    public DistributedQueue create(String routingKey) {
        return queues.computeIfAbsent(routingKey, InMemoryQueue::new);
    }

    public Optional<InMemoryQueue> queue(String routingKey) {
        return Optional.ofNullable(queues.get(routingKey));
    }

    /**
     * Number of payloads waiting under a routing key, 0 if the queue was never created.
     */
    public int size(String routingKey) {
        InMemoryQueue queue = queues.get(routingKey);
        return queue == null ? 0 : queue.size();
    }
}
