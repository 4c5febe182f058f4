package com.umitunal.elric.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps routing keys to queue handles, creating each handle on first use.
 *
 * Handles are never removed. Lookup, creation and the append itself happen under the
 * table's lock; callers that also hold the job store lock must take it first.
 */
public class RouteTable {
    private static final Logger log = LoggerFactory.getLogger(RouteTable.class);

    private final QueueFactory factory;
    private final Map<String, DistributedQueue> queues = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public RouteTable(QueueFactory factory) {
        this.factory = factory;
    }

    /**
     * Append a payload to the queue for {@code routingKey}.
     */
    public void enqueue(String routingKey, byte[] payload) {
        lock.lock();
        try {
            DistributedQueue queue = queues.get(routingKey);
            if (queue == null) {
                queue = factory.create(routingKey);
                queues.put(routingKey, queue);
                log.debug("Created queue {} for routing key {}", queue.name(), routingKey);
            }
            queue.append(payload);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> routingKeys() {
        lock.lock();
        try {
            return Set.copyOf(queues.keySet());
        } finally {
            lock.unlock();
        }
    }
}
