package com.umitunal.elric.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.elric.core.JobCodecException;
import com.umitunal.elric.core.Trigger;
import com.umitunal.elric.core.TriggerType;
import com.umitunal.elric.model.JobDescriptor;
import com.umitunal.elric.trigger.CronTrigger;
import com.umitunal.elric.trigger.DateTrigger;
import com.umitunal.elric.trigger.IntervalTrigger;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * JSON job codec using Jackson's tree model.
 *
 * Layout (version 1):
 * <pre>
 * {"v":1, "id":..., "func":..., "args":[...], "kwargs":{...},
 *  "trigger":{"type":"interval","start":..,"interval":..,"end":..} | null,
 *  "nextRunTime":.. | null, "filterKey":.. | null, "filterValue":.. | null}
 * </pre>
 * Argument values go through Jackson's default typing, so integral numbers come back as the
 * smallest fitting type.
 */
public class JsonJobCodec implements JobCodec {
    public static final int VERSION = 1;

    private static final TypeReference<List<Object>> ARGS_TYPE = new TypeReference<>() { };
    private static final TypeReference<Map<String, Object>> KWARGS_TYPE = new TypeReference<>() { };

    private final ObjectMapper mapper;

    public JsonJobCodec() {
        this(createDefaultMapper());
    }

    public JsonJobCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public int schemaVersion() {
        return VERSION;
    }

    @Override
    public byte[] encode(JobDescriptor job) {
        try {
            ObjectNode root = mapper.createObjectNode();
            root.put("v", VERSION);
            root.put("id", job.getId());
            root.put("func", job.getFunctionRef());
            root.set("args", mapper.valueToTree(job.getArgs()));
            root.set("kwargs", mapper.valueToTree(job.getKwargs()));
            if (job.hasTrigger()) {
                root.set("trigger", encodeTrigger(job.getTrigger()));
            } else {
                root.putNull("trigger");
            }
            if (job.getNextRunTime().isPresent()) {
                root.put("nextRunTime", job.getNextRunTime().getAsLong());
            } else {
                root.putNull("nextRunTime");
            }
            root.put("filterKey", job.getFilterKey());
            root.put("filterValue", job.getFilterValue());
            return mapper.writeValueAsBytes(root);
        } catch (IOException | IllegalArgumentException e) {
            throw new JobCodecException("Failed to serialize job " + job.getId() + " to JSON", e);
        }
    }

    @Override
    public JobDescriptor decode(byte[] bytes) {
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new JobCodecException("Failed to deserialize job from JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new JobCodecException("Serialized job is not a JSON object");
        }

        int version = root.path("v").asInt(-1);
        if (version != VERSION) {
            throw new JobCodecException("Unsupported job schema version: " + version);
        }

        try {
            JobDescriptor.Builder builder = JobDescriptor.builder(requiredText(root, "id"), requiredText(root, "func"))
                    .args(root.hasNonNull("args") ? mapper.convertValue(root.get("args"), ARGS_TYPE) : null)
                    .kwargs(root.hasNonNull("kwargs") ? mapper.convertValue(root.get("kwargs"), KWARGS_TYPE) : null)
                    .trigger(root.hasNonNull("trigger") ? decodeTrigger(root.get("trigger")) : null)
                    .nextRunTime(optionalLong(root, "nextRunTime"))
                    .filter(optionalText(root, "filterKey"), optionalText(root, "filterValue"));
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new JobCodecException("Malformed serialized job: " + e.getMessage(), e);
        }
    }

    private ObjectNode encodeTrigger(Trigger trigger) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", trigger.getType().getTag());
        switch (trigger.getType()) {
            case INTERVAL -> {
                IntervalTrigger interval = TriggerSupport.expect(trigger, IntervalTrigger.class);
                node.put("start", interval.getStartTime());
                node.put("interval", interval.getIntervalMillis());
                if (interval.getEndTime().isPresent()) {
                    node.put("end", interval.getEndTime().getAsLong());
                }
            }
            case DATE -> node.put("runTime", TriggerSupport.expect(trigger, DateTrigger.class).getRunTime());
            case CRON -> {
                CronTrigger cron = TriggerSupport.expect(trigger, CronTrigger.class);
                node.put("expression", cron.getExpression());
                node.put("start", cron.getStartTime());
            }
        }
        return node;
    }

    private Trigger decodeTrigger(JsonNode node) {
        TriggerType type = TriggerType.fromTag(requiredText(node, "type"));
        return switch (type) {
            case INTERVAL -> new IntervalTrigger(
                    requiredLong(node, "start"),
                    requiredLong(node, "interval"),
                    optionalLong(node, "end"));
            case DATE -> new DateTrigger(requiredLong(node, "runTime"));
            case CRON -> new CronTrigger(requiredText(node, "expression"), requiredLong(node, "start"));
        };
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new JobCodecException("Missing text field '" + field + "'");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static long requiredLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new JobCodecException("Field '" + field + "' must be an integer");
        }
        return value.asLong();
    }

    private static Long optionalLong(JsonNode node, String field) {
        return node.hasNonNull(field) ? requiredLong(node, field) : null;
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return mapper;
    }
}
