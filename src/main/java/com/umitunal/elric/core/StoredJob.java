package com.umitunal.elric.core;

import java.util.Objects;

/**
 * A pending job as seen by a {@link JobStore}: identifier, routing key,
 * next fire time and the opaque serialized job.
 */
public final class StoredJob {
    private final String id;
    private final String routingKey;
    private final long nextRunTime;
    private final byte[] payload;

    public StoredJob(String id, String routingKey, long nextRunTime, byte[] payload) {
        this.id = Objects.requireNonNull(id, "id");
        this.routingKey = Objects.requireNonNull(routingKey, "routingKey");
        this.nextRunTime = nextRunTime;
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public String getId() { return id; }
    public String getRoutingKey() { return routingKey; }
    public long getNextRunTime() { return nextRunTime; }
    public byte[] getPayload() { return payload; }

    @Override
    public String toString() {
        return String.format("StoredJob{id='%s', key='%s', nextRunTime=%d, payload=%d bytes}",
                id, routingKey, nextRunTime, payload.length);
    }
}
