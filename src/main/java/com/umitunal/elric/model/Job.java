package com.umitunal.elric.model;

import com.umitunal.elric.core.JobDefinitionException;
import com.umitunal.elric.core.Trigger;
import com.umitunal.elric.registry.CallableRegistry;
import com.umitunal.elric.registry.JobFunction;
import com.umitunal.elric.registry.RegisteredCallable;
import com.umitunal.elric.serialization.JobCodec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * A unit of deferred or recurring work, validated against its callable.
 *
 * A job without a trigger is a one-shot that fires immediately and is never persisted.
 * A job with a trigger and no explicit next run time starts at the trigger's first fire time.
 */
public final class Job {
    private final String id;
    private final RegisteredCallable callable;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final Trigger trigger;
    private final Long nextRunTime;
    private final String filterKey;
    private final String filterValue;

    private Job(Builder builder, RegisteredCallable callable, Long nextRunTime) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString().replace("-", "");
        this.callable = callable;
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.kwargs));
        this.trigger = builder.trigger;
        this.nextRunTime = nextRunTime;
        this.filterKey = builder.filterKey;
        this.filterValue = builder.filterValue;
    }

    public String getId() { return id; }
    public String getFunctionRef() { return callable.getReference(); }
    public JobFunction getFunction() { return callable.getFunction(); }
    public List<Object> getArgs() { return args; }
    public Map<String, Object> getKwargs() { return kwargs; }
    public Optional<Trigger> getTrigger() { return Optional.ofNullable(trigger); }
    public String getFilterKey() { return filterKey; }
    public String getFilterValue() { return filterValue; }

    public OptionalLong getNextRunTime() {
        return nextRunTime == null ? OptionalLong.empty() : OptionalLong.of(nextRunTime);
    }

    public boolean isOneShot() {
        return trigger == null;
    }

    /**
     * Invoke the job's function with its arguments.
     */
    public Object invoke() throws Exception {
        return callable.getFunction().call(args, kwargs);
    }

    public JobDescriptor toDescriptor() {
        return JobDescriptor.builder(id, callable.getReference())
                .args(args)
                .kwargs(kwargs)
                .trigger(trigger)
                .nextRunTime(nextRunTime)
                .filter(filterKey, filterValue)
                .build();
    }

    public byte[] serialize(JobCodec codec) {
        return codec.encode(toDescriptor());
    }

    /**
     * Rebuild a job from its descriptor, resolving and re-validating the callable.
     *
     * @throws JobDefinitionException if the callable is unknown or the arguments do not fit
     */
    public static Job fromDescriptor(JobDescriptor descriptor, CallableRegistry registry) {
        Builder builder = new Builder(registry, descriptor.getFunctionRef(), null)
                .id(descriptor.getId())
                .args(descriptor.getArgs())
                .kwargs(descriptor.getKwargs())
                .trigger(descriptor.getTrigger())
                .filter(descriptor.getFilterKey(), descriptor.getFilterValue());
        descriptor.getNextRunTime().ifPresent(builder::nextRunTime);
        return builder.build();
    }

    public static Job deserialize(byte[] bytes, JobCodec codec, CallableRegistry registry) {
        return fromDescriptor(codec.decode(bytes), registry);
    }

    /**
     * Start a job that references a registered callable by name.
     */
    public static Builder builder(CallableRegistry registry, String functionRef) {
        return new Builder(registry, Objects.requireNonNull(functionRef, "functionRef"), null);
    }

    /**
     * Start a job for a function instance; it must be registered in {@code registry}.
     */
    public static Builder builder(CallableRegistry registry, JobFunction function) {
        return new Builder(registry, null, Objects.requireNonNull(function, "function"));
    }

    @Override
    public String toString() {
        return String.format("Job{id='%s', func='%s', trigger=%s, nextRunTime=%s}",
                id, callable.getReference(), trigger, nextRunTime);
    }

    public static class Builder {
        private final CallableRegistry registry;
        private final String functionRef;
        private final JobFunction function;
        private String id;
        private List<Object> args = List.of();
        private Map<String, Object> kwargs = Map.of();
        private Trigger trigger;
        private Long nextRunTime;
        private String filterKey;
        private String filterValue;
        private Long referenceTime;

        private Builder(CallableRegistry registry, String functionRef, JobFunction function) {
            this.registry = Objects.requireNonNull(registry, "registry");
            this.functionRef = functionRef;
            this.function = function;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder args(Object... args) {
            this.args = new ArrayList<>(Arrays.asList(args));
            return this;
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

        public Builder nextRunTime(long nextRunTime) {
            this.nextRunTime = nextRunTime;
            return this;
        }

        public Builder filter(String key, String value) {
            this.filterKey = key;
            this.filterValue = value;
            return this;
        }

        /**
         * Time passed to the trigger when computing the first fire time.
         * Default: the current time.
         */
        public Builder referenceTime(long referenceTime) {
            this.referenceTime = referenceTime;
            return this;
        }

        /**
         * Resolve the callable, check the arguments and compute the first fire time.
         *
         * @throws JobDefinitionException if any of these fail
         */
        public Job build() {
            RegisteredCallable callable = resolveCallable();
            callable.getSignature().check(args, kwargs);

            Long firstRun = nextRunTime;
            if (trigger != null && firstRun == null) {
                long now = referenceTime != null ? referenceTime : System.currentTimeMillis();
                OptionalLong first = trigger.nextFireTime(OptionalLong.empty(), now);
                if (first.isEmpty()) {
                    throw new JobDefinitionException("Trigger never fires: " + trigger);
                }
                firstRun = first.getAsLong();
            }
            return new Job(this, callable, firstRun);
        }

        private RegisteredCallable resolveCallable() {
            if (functionRef != null) {
                return registry.resolve(functionRef);
            }
            return registry.lookup(function).orElseThrow(() ->
                    new JobDefinitionException("Function is not registered: " + function));
        }
    }
}
