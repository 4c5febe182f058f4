package com.umitunal.elric.storage;

import com.umitunal.elric.core.JobStore;
import com.umitunal.elric.core.StoreOutcome;
import com.umitunal.elric.core.StoredJob;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Heap-backed job store: a map by id plus a sorted index by (next run time, insertion sequence).
 * Not thread-safe.
 */
public class MemoryJobStore implements JobStore {
    private final Map<String, Entry> jobs = new HashMap<>();
    private final TreeMap<ScheduleKey, String> schedule = new TreeMap<>();
    private long sequence;

    @Override
    public StoreOutcome add(String jobId, String routingKey, long nextRunTime, byte[] payload) {
        if (jobs.containsKey(jobId)) {
            return StoreOutcome.ALREADY_EXISTS;
        }
        Entry entry = new Entry(new StoredJob(jobId, routingKey, nextRunTime, payload), ++sequence);
        jobs.put(jobId, entry);
        schedule.put(entry.scheduleKey(), jobId);
        return StoreOutcome.ADDED;
    }

    @Override
    public StoreOutcome replace(String jobId, String routingKey, long nextRunTime, byte[] payload) {
        Entry existing = jobs.get(jobId);
        if (existing == null) {
            return StoreOutcome.NOT_FOUND;
        }
        schedule.remove(existing.scheduleKey());
        Entry entry = new Entry(new StoredJob(jobId, routingKey, nextRunTime, payload), existing.sequence);
        jobs.put(jobId, entry);
        schedule.put(entry.scheduleKey(), jobId);
        return StoreOutcome.REPLACED;
    }

    @Override
    public StoreOutcome remove(String jobId) {
        Entry existing = jobs.remove(jobId);
        if (existing == null) {
            return StoreOutcome.NOT_FOUND;
        }
        schedule.remove(existing.scheduleKey());
        return StoreOutcome.REMOVED;
    }

    @Override
    public List<StoredJob> dueBefore(long instant) {
        List<StoredJob> due = new ArrayList<>();
        for (Map.Entry<ScheduleKey, String> indexed : schedule.entrySet()) {
            if (indexed.getKey().time > instant) {
                break;
            }
            due.add(jobs.get(indexed.getValue()).job);
        }
        return due;
    }

    @Override
    public OptionalLong closestUpcoming() {
        return schedule.isEmpty() ? OptionalLong.empty() : OptionalLong.of(schedule.firstKey().time);
    }

    @Override
    public Optional<StoredJob> get(String jobId) {
        Entry entry = jobs.get(jobId);
        return entry == null ? Optional.empty() : Optional.of(entry.job);
    }

    @Override
    public int size() {
        return jobs.size();
    }

    @Override
    public void close() {
        jobs.clear();
        schedule.clear();
    }

    private static final class Entry {
        private final StoredJob job;
        private final long sequence;

        Entry(StoredJob job, long sequence) {
            this.job = job;
            this.sequence = sequence;
        }

        ScheduleKey scheduleKey() {
            return new ScheduleKey(job.getNextRunTime(), sequence);
        }
    }

    private static final class ScheduleKey implements Comparable<ScheduleKey> {
        private final long time;
        private final long sequence;

        ScheduleKey(long time, long sequence) {
            this.time = time;
            this.sequence = sequence;
        }

        @Override
        public int compareTo(ScheduleKey other) {
            int byTime = Long.compare(time, other.time);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ScheduleKey)) return false;
            ScheduleKey that = (ScheduleKey) o;
            return time == that.time && sequence == that.sequence;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(time) * 31 + Long.hashCode(sequence);
        }
    }
}
