package com.umitunal.elric.model;

import com.umitunal.elric.core.Trigger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Serializable form of a job, independent of any callable registry.
 *
 * This is what travels between clients, the master and the job store. The master never
 * resolves the callable; it only needs the trigger and the next fire time.
 */
public final class JobDescriptor {
    private final String id;
    private final String functionRef;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final Trigger trigger;
    private final Long nextRunTime;
    private final String filterKey;
    private final String filterValue;

    private JobDescriptor(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.functionRef = Objects.requireNonNull(builder.functionRef, "functionRef");
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.kwargs));
        this.trigger = builder.trigger;
        this.nextRunTime = builder.nextRunTime;
        this.filterKey = builder.filterKey;
        this.filterValue = builder.filterValue;
    }

    public String getId() { return id; }
    public String getFunctionRef() { return functionRef; }
    public List<Object> getArgs() { return args; }
    public Map<String, Object> getKwargs() { return kwargs; }
    public Trigger getTrigger() { return trigger; }
    public String getFilterKey() { return filterKey; }
    public String getFilterValue() { return filterValue; }

    public boolean hasTrigger() {
        return trigger != null;
    }

    public OptionalLong getNextRunTime() {
        return nextRunTime == null ? OptionalLong.empty() : OptionalLong.of(nextRunTime);
    }

    /**
     * Fire times that are at or before {@code now}, starting at the stored next run time
     * and following the trigger. Only the count and the latest one are kept.
     *
     * The walk stops early if the trigger fails to move strictly forward.
     */
    public ElapsedFireTimes elapsedFireTimes(long now) {
        if (trigger == null || nextRunTime == null || nextRunTime > now) {
            return ElapsedFireTimes.NONE;
        }

        long count = 0;
        long last = nextRunTime;
        long next = nextRunTime;
        while (next <= now) {
            count++;
            last = next;
            OptionalLong following = trigger.nextFireTime(OptionalLong.of(next), now);
            if (following.isEmpty() || following.getAsLong() <= next) {
                break;
            }
            next = following.getAsLong();
        }
        return new ElapsedFireTimes(count, last);
    }

    /**
     * Next fire time strictly following {@code fireTime}, or empty if the trigger is exhausted.
     */
    public OptionalLong nextFireTimeAfter(long fireTime) {
        if (trigger == null) {
            return OptionalLong.empty();
        }
        return trigger.nextFireTime(OptionalLong.of(fireTime), fireTime);
    }

    public JobDescriptor withNextRunTime(long nextRunTime) {
        return toBuilder().nextRunTime(nextRunTime).build();
    }

    public Builder toBuilder() {
        return new Builder(id, functionRef)
                .args(args)
                .kwargs(kwargs)
                .trigger(trigger)
                .nextRunTime(nextRunTime)
                .filter(filterKey, filterValue);
    }

    public static Builder builder(String id, String functionRef) {
        return new Builder(id, functionRef);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobDescriptor)) return false;
        JobDescriptor that = (JobDescriptor) o;
        return id.equals(that.id)
                && functionRef.equals(that.functionRef)
                && args.equals(that.args)
                && kwargs.equals(that.kwargs)
                && Objects.equals(trigger, that.trigger)
                && Objects.equals(nextRunTime, that.nextRunTime)
                && Objects.equals(filterKey, that.filterKey)
                && Objects.equals(filterValue, that.filterValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, functionRef, args, kwargs, trigger, nextRunTime, filterKey, filterValue);
    }

    @Override
    public String toString() {
        return String.format("JobDescriptor{id='%s', func='%s', trigger=%s, nextRunTime=%s}",
                id, functionRef, trigger, nextRunTime);
    }

    public static class Builder {
        private final String id;
        private final String functionRef;
        private List<Object> args = List.of();
        private Map<String, Object> kwargs = Map.of();
        private Trigger trigger;
        private Long nextRunTime;
        private String filterKey;
        private String filterValue;

        private Builder(String id, String functionRef) {
            this.id = id;
            this.functionRef = functionRef;
        }

        public Builder args(List<?> args) {
            this.args = args == null ? List.of() : new ArrayList<>(args);
            return this;
        }

        public Builder kwargs(Map<String, ?> kwargs) {
            this.kwargs = kwargs == null ? Map.of() : new LinkedHashMap<>(kwargs);
            return this;
        }

        public Builder trigger(Trigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder nextRunTime(Long nextRunTime) {
            this.nextRunTime = nextRunTime;
            return this;
        }

        public Builder filter(String key, String value) {
            this.filterKey = key;
            this.filterValue = value;
            return this;
        }

        public JobDescriptor build() {
            return new JobDescriptor(this);
        }
    }
}
