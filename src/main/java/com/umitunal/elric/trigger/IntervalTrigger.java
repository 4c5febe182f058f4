package com.umitunal.elric.trigger;

import com.umitunal.elric.core.Trigger;
import com.umitunal.elric.core.TriggerType;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Fires at a fixed interval starting from a given instant, optionally until an end instant.
 */
public class IntervalTrigger implements Trigger {
    private final long startTime;
    private final long intervalMillis;
    private final Long endTime;

    public IntervalTrigger(long startTime, long intervalMillis) {
        this(startTime, intervalMillis, null);
    }

    /**
     * @param startTime first fire time (millis since epoch)
     * @param intervalMillis distance between fires, must be positive
     * @param endTime last instant a fire may happen at, or null for no end
     */
    public IntervalTrigger(long startTime, long intervalMillis, Long endTime) {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + intervalMillis);
        }
        this.startTime = startTime;
        this.intervalMillis = intervalMillis;
        this.endTime = endTime;
    }

    /**
     * Interval trigger whose first fire is one interval after {@code now}.
     */
    public static IntervalTrigger every(long intervalMillis, long now) {
        return new IntervalTrigger(now + intervalMillis, intervalMillis);
    }

    @Override
    public OptionalLong nextFireTime(OptionalLong previousFireTime, long referenceTime) {
        long next = previousFireTime.isPresent()
                ? previousFireTime.getAsLong() + intervalMillis
                : startTime;
        if (endTime != null && next > endTime) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(next);
    }

    @Override
    public TriggerType getType() {
        return TriggerType.INTERVAL;
    }

    public long getStartTime() { return startTime; }
    public long getIntervalMillis() { return intervalMillis; }
    public OptionalLong getEndTime() {
        return endTime == null ? OptionalLong.empty() : OptionalLong.of(endTime);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntervalTrigger)) return false;
        IntervalTrigger that = (IntervalTrigger) o;
        return startTime == that.startTime
                && intervalMillis == that.intervalMillis
                && Objects.equals(endTime, that.endTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startTime, intervalMillis, endTime);
    }

    @Override
    public String toString() {
        return String.format("IntervalTrigger{start=%d, interval=%dms, end=%s}",
                startTime, intervalMillis, endTime);
    }
}
