package com.umitunal.elric.model;

import java.util.OptionalLong;

/**
 * Result of walking a job's trigger up to a point in time: how many fire times passed
 * and the latest of them.
 */
public final class ElapsedFireTimes {
    static final ElapsedFireTimes NONE = new ElapsedFireTimes(0, 0);

    private final long count;
    private final long last;

    ElapsedFireTimes(long count, long last) {
        this.count = count;
        this.last = last;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public long getCount() { return count; }

    /**
     * Latest elapsed fire time, or empty if none passed.
     */
    public OptionalLong getLast() {
        return count == 0 ? OptionalLong.empty() : OptionalLong.of(last);
    }

    @Override
    public String toString() {
        return count == 0 ? "ElapsedFireTimes{none}" : String.format("ElapsedFireTimes{count=%d, last=%d}", count, last);
    }
}
