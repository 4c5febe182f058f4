package com.umitunal.elric.queue;

/**
 * FIFO queue that workers for one routing key drain.
 *
 * Durability and delivery guarantees belong to the implementation. Append failures
 * are reported by throwing; the caller does not retry.
 */
public interface DistributedQueue {

    /**
     * Name of the queue, normally the routing key.
     */
    String name();

    /**
     * Append a serialized job to the tail of the queue.
     */
    void append(byte[] payload);
}
