package com.umitunal.elric.core;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Repository of pending jobs keyed by identifier and ordered by next fire time.
 *
 * Implementations are not required to be thread-safe; the owner serializes access.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Insert a new job.
     *
     * @return {@link StoreOutcome#ADDED}, or {@link StoreOutcome#ALREADY_EXISTS} leaving the
     *         existing record untouched
     */
    StoreOutcome add(String jobId, String routingKey, long nextRunTime, byte[] payload);

    /**
     * Overwrite an existing job in place, re-indexing it by the new fire time.
     *
     * @return {@link StoreOutcome#REPLACED} or {@link StoreOutcome#NOT_FOUND}
     */
    StoreOutcome replace(String jobId, String routingKey, long nextRunTime, byte[] payload);

    /**
     * Delete a job.
     *
     * @return {@link StoreOutcome#REMOVED} or {@link StoreOutcome#NOT_FOUND}
     */
    StoreOutcome remove(String jobId);

    /**
     * Snapshot of every job whose next fire time is at or before {@code instant},
     * in non-decreasing fire time order. Ties keep insertion order.
     */
    List<StoredJob> dueBefore(long instant);

    /**
     * Smallest next fire time across all jobs, or empty if the store is empty.
     */
    OptionalLong closestUpcoming();

    /**
     * Look up a single job.
     */
    Optional<StoredJob> get(String jobId);

    /**
     * Number of stored jobs.
     */
    int size();

    @Override
    void close();
}
