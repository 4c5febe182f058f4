package com.umitunal.elric.serialization;

import com.umitunal.elric.core.JobCodecException;
import com.umitunal.elric.core.Trigger;

/**
 * Shared helpers for encoding tagged trigger variants.
 */
final class TriggerSupport {

    private TriggerSupport() {
    }

    static <T extends Trigger> T expect(Trigger trigger, Class<T> type) {
        if (!type.isInstance(trigger)) {
            throw new JobCodecException(String.format(
                    "Trigger tagged %s must be a %s, got %s",
                    trigger.getType(), type.getSimpleName(), trigger.getClass().getName()));
        }
        return type.cast(trigger);
    }
}
