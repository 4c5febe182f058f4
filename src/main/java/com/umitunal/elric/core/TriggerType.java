package com.umitunal.elric.core;

/**
 * Closed set of recurrence rule variants understood by the codecs.
 */
public enum TriggerType {
    INTERVAL("interval"),
    DATE("date"),
    CRON("cron");

    private final String tag;

    TriggerType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static TriggerType fromTag(String tag) {
        for (TriggerType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trigger type: " + tag);
    }
}
