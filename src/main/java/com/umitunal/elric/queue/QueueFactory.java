package com.umitunal.elric.queue;

/**
 * Creates the queue handle for a routing key.
 */
@FunctionalInterface
public interface QueueFactory {

    DistributedQueue create(String routingKey);
}
