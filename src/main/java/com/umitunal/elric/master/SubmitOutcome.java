package com.umitunal.elric.master;

/**
 * What happened to a submitted job.
 */
public enum SubmitOutcome {
    /** No trigger: appended straight to its routing key's queue. */
    DISPATCHED,
    /** Stored as a new scheduled job. */
    SCHEDULED,
    /** An existing job with the same id was overwritten on request. */
    REPLACED,
    /** A job with the same id exists and replacement was not requested; nothing changed. */
    CONFLICT
}
