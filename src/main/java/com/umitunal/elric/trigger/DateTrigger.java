package com.umitunal.elric.trigger;

import com.umitunal.elric.core.Trigger;
import com.umitunal.elric.core.TriggerType;

import java.util.OptionalLong;

/**
 * Fires once at a fixed instant.
 */
public class DateTrigger implements Trigger {
    private final long runTime;

    public DateTrigger(long runTime) {
        this.runTime = runTime;
    }

    @Override
    public OptionalLong nextFireTime(OptionalLong previousFireTime, long referenceTime) {
        return previousFireTime.isPresent() ? OptionalLong.empty() : OptionalLong.of(runTime);
    }

    @Override
    public TriggerType getType() {
        return TriggerType.DATE;
    }

    public long getRunTime() {
        return runTime;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DateTrigger && ((DateTrigger) o).runTime == runTime;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(runTime);
    }

    @Override
    public String toString() {
        return "DateTrigger{runTime=" + runTime + "}";
    }
}
