package com.umitunal.elric.queue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-process queue for a single routing key.
 */
public class InMemoryQueue implements DistributedQueue {
    private final String name;
    private final ConcurrentLinkedQueue<byte[]> entries = new ConcurrentLinkedQueue<>();

    public InMemoryQueue(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void append(byte[] payload) {
        entries.add(payload);
    }

    /**
     * Retrieve and remove the head, or null if the queue is empty.
     */
    public byte[] poll() {
        return entries.poll();
    }

    public int size() {
        return entries.size();
    }

    public List<byte[]> snapshot() {
        return new ArrayList<>(entries);
    }
}
