package com.umitunal.elric.core;

import java.util.OptionalLong;

/**
 * Recurrence rule that decides when a job fires next.
 *
 * Implementations must be pure: the same inputs always produce the same answer,
 * and a returned fire time must be strictly later than the previous one.
 */
public interface Trigger {

    /**
     * Compute the next fire time.
     *
     * @param previousFireTime the last fire time (millis since epoch), or empty for the first fire
     * @param referenceTime the caller's notion of "now" (millis since epoch), a hint only
     * @return the next fire time, or empty if the rule is exhausted
     */
    OptionalLong nextFireTime(OptionalLong previousFireTime, long referenceTime);

    /**
     * Gets the tag identifying this rule variant on the wire.
     */
    TriggerType getType();
}
