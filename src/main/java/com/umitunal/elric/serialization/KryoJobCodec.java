package com.umitunal.elric.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.umitunal.elric.core.JobCodecException;
import com.umitunal.elric.core.Trigger;
import com.umitunal.elric.model.JobDescriptor;
import com.umitunal.elric.trigger.CronTrigger;
import com.umitunal.elric.trigger.DateTrigger;
import com.umitunal.elric.trigger.IntervalTrigger;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compact binary job codec built on Kryo streams.
 *
 * Only argument values use Kryo's class-tagged object encoding; the job itself is written
 * field by field in a fixed order:
 * - version (1 byte)
 * - id, func (strings)
 * - args count (varint) + class-tagged values
 * - kwargs count (varint) + (key string, class-tagged value) pairs
 * - trigger tag (1 byte, 0 = none) + tag-specific fields
 * - nextRunTime presence (boolean) + value (8 bytes)
 * - filterKey, filterValue (nullable strings)
 */
public class KryoJobCodec implements JobCodec {
    public static final int VERSION = 1;

    private static final byte TAG_NONE = 0;
    private static final byte TAG_INTERVAL = 1;
    private static final byte TAG_DATE = 2;
    private static final byte TAG_CRON = 3;

    private final ThreadLocal<Kryo> kryoThreadLocal;

    public KryoJobCodec() {
        this.kryoThreadLocal = ThreadLocal.withInitial(() -> {
            Kryo kryo = new Kryo();
            // Argument values are caller-defined
            kryo.setRegistrationRequired(false);
            kryo.setReferences(true);
            return kryo;
        });
    }

    @Override
    public int schemaVersion() {
        return VERSION;
    }

    @Override
    public byte[] encode(JobDescriptor job) {
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            output.writeByte(VERSION);
            output.writeString(job.getId());
            output.writeString(job.getFunctionRef());

            output.writeVarInt(job.getArgs().size(), true);
            for (Object arg : job.getArgs()) {
                kryo.writeClassAndObject(output, arg);
            }

            output.writeVarInt(job.getKwargs().size(), true);
            for (Map.Entry<String, Object> entry : job.getKwargs().entrySet()) {
                output.writeString(entry.getKey());
                kryo.writeClassAndObject(output, entry.getValue());
            }

            writeTrigger(output, job.getTrigger());

            output.writeBoolean(job.getNextRunTime().isPresent());
            if (job.getNextRunTime().isPresent()) {
                output.writeLong(job.getNextRunTime().getAsLong());
            }

            output.writeString(job.getFilterKey());
            output.writeString(job.getFilterValue());
            output.flush();
            return baos.toByteArray();
        } catch (KryoException e) {
            throw new JobCodecException("Failed to serialize job " + job.getId() + " with Kryo", e);
        }
    }

    @Override
    public JobDescriptor decode(byte[] bytes) {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            int version = input.readByte();
            if (version != VERSION) {
                throw new JobCodecException("Unsupported job schema version: " + version);
            }
            String id = input.readString();
            String func = input.readString();
            if (id == null || func == null) {
                throw new JobCodecException("Serialized job is missing its id or function reference");
            }

            int argCount = checkCount(input, input.readVarInt(true), "arguments");
            List<Object> args = new ArrayList<>(argCount);
            for (int i = 0; i < argCount; i++) {
                args.add(kryo.readClassAndObject(input));
            }

            int kwargCount = checkCount(input, input.readVarInt(true), "keyword arguments");
            Map<String, Object> kwargs = new LinkedHashMap<>();
            for (int i = 0; i < kwargCount; i++) {
                String key = input.readString();
                kwargs.put(key, kryo.readClassAndObject(input));
            }

            Trigger trigger = readTrigger(input);
            Long nextRunTime = input.readBoolean() ? input.readLong() : null;
            String filterKey = input.readString();
            String filterValue = input.readString();

            return JobDescriptor.builder(id, func)
                    .args(args)
                    .kwargs(kwargs)
                    .trigger(trigger)
                    .nextRunTime(nextRunTime)
                    .filter(filterKey, filterValue)
                    .build();
        } catch (KryoException | IllegalArgumentException e) {
            throw new JobCodecException("Failed to deserialize job with Kryo", e);
        }
    }

    // Every element takes at least one byte, so a count larger than what is left is corrupt
    private static int checkCount(Input input, int count, String what) {
        int remaining = input.limit() - input.position();
        if (count < 0 || count > remaining) {
            throw new JobCodecException(String.format(
                    "Serialized job declares %d %s but only %d bytes remain", count, what, remaining));
        }
        return count;
    }

    private void writeTrigger(Output output, Trigger trigger) {
        if (trigger == null) {
            output.writeByte(TAG_NONE);
            return;
        }
        switch (trigger.getType()) {
            case INTERVAL -> {
                IntervalTrigger interval = TriggerSupport.expect(trigger, IntervalTrigger.class);
                output.writeByte(TAG_INTERVAL);
                output.writeLong(interval.getStartTime());
                output.writeLong(interval.getIntervalMillis());
                output.writeBoolean(interval.getEndTime().isPresent());
                if (interval.getEndTime().isPresent()) {
                    output.writeLong(interval.getEndTime().getAsLong());
                }
            }
            case DATE -> {
                output.writeByte(TAG_DATE);
                output.writeLong(TriggerSupport.expect(trigger, DateTrigger.class).getRunTime());
            }
            case CRON -> {
                CronTrigger cron = TriggerSupport.expect(trigger, CronTrigger.class);
                output.writeByte(TAG_CRON);
                output.writeString(cron.getExpression());
                output.writeLong(cron.getStartTime());
            }
        }
    }

    private Trigger readTrigger(Input input) {
        byte tag = input.readByte();
        switch (tag) {
            case TAG_NONE:
                return null;
            case TAG_INTERVAL: {
                long start = input.readLong();
                long interval = input.readLong();
                Long end = input.readBoolean() ? input.readLong() : null;
                return new IntervalTrigger(start, interval, end);
            }
            case TAG_DATE:
                return new DateTrigger(input.readLong());
            case TAG_CRON: {
                String expression = input.readString();
                return new CronTrigger(expression, input.readLong());
            }
            default:
                throw new JobCodecException("Unknown trigger tag: " + tag);
        }
    }
}
