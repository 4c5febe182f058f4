package com.umitunal.elric.serialization;

import com.umitunal.elric.model.JobDescriptor;

/**
 * Codec for serialized jobs. The encoded form carries a schema version and the trigger
 * as a tagged variant, so stored payloads stay readable across releases.
 *
 * Implementations throw {@link com.umitunal.elric.core.JobCodecException} on malformed input.
 */
public interface JobCodec {

    /**
     * Encode a job to bytes.
     */
    byte[] encode(JobDescriptor job);

    /**
     * Decode bytes to a job.
     */
    JobDescriptor decode(byte[] bytes);

    /**
     * Schema version written by this codec.
     */
    int schemaVersion();
}
