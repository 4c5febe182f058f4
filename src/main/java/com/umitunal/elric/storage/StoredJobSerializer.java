package com.umitunal.elric.storage;

import com.umitunal.elric.core.StoredJob;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary layout of job store records and schedule index keys.
 *
 * Record format:
 * - sequence (8 bytes)
 * - nextRunTime (8 bytes)
 * - routingKey length (4 bytes) + routingKey bytes (UTF-8)
 * - payload length (4 bytes) + payload bytes
 *
 * Schedule key format: [nextRunTime (8 bytes, sign-flipped)][sequence (8 bytes)][jobId bytes].
 * Flipping the sign bit makes unsigned byte order match signed time order.
 */
final class StoredJobSerializer {

    private StoredJobSerializer() {
    }

    static byte[] serialize(StoredJob job, long sequence) {
        byte[] keyBytes = job.getRoutingKey().getBytes(UTF_8);
        byte[] payload = job.getPayload();

        ByteBuffer buffer = ByteBuffer.allocate(8 + 8 + 4 + keyBytes.length + 4 + payload.length);
        buffer.putLong(sequence);
        buffer.putLong(job.getNextRunTime());
        buffer.putInt(keyBytes.length);
        buffer.put(keyBytes);
        buffer.putInt(payload.length);
        buffer.put(payload);
        return buffer.array();
    }

    static StoredJob deserialize(String jobId, byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        buffer.getLong(); // sequence
        long nextRunTime = buffer.getLong();

        byte[] keyBytes = new byte[buffer.getInt()];
        buffer.get(keyBytes);

        byte[] payload = new byte[buffer.getInt()];
        buffer.get(payload);

        return new StoredJob(jobId, new String(keyBytes, UTF_8), nextRunTime, payload);
    }

    static long readSequence(byte[] bytes) {
        return ByteBuffer.wrap(bytes).getLong();
    }

    static byte[] scheduleKey(long nextRunTime, long sequence, String jobId) {
        byte[] idBytes = jobId.getBytes(UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(16 + idBytes.length);
        buffer.putLong(nextRunTime ^ Long.MIN_VALUE);
        buffer.putLong(sequence);
        buffer.put(idBytes);
        return buffer.array();
    }

    static long scheduleTime(byte[] scheduleKey) {
        return ByteBuffer.wrap(scheduleKey).getLong() ^ Long.MIN_VALUE;
    }

    static String scheduleJobId(byte[] scheduleKey) {
        return new String(scheduleKey, 16, scheduleKey.length - 16, UTF_8);
    }
}
