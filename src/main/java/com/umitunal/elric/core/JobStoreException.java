package com.umitunal.elric.core;

/**
 * The storage engine behind a {@link JobStore} failed.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
