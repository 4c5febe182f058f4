package com.umitunal.elric.core;

/**
 * A serialized job could not be encoded or decoded.
 */
public class JobCodecException extends RuntimeException {

    public JobCodecException(String message) {
        super(message);
    }

    public JobCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
