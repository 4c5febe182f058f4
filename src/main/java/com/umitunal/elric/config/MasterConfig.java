package com.umitunal.elric.config;

/**
 * Tunables for the scheduler loop.
 */
public class MasterConfig {
    /**
     * Longest single wait when no job is pending, in milliseconds.
     * Keeps timer arguments within what every platform accepts.
     */
    public static final long DEFAULT_MAX_WAIT_MILLIS = 4_294_967L * 1000L;

    private final long maxWaitMillis;
    private final long errorBackoffMillis;
    private final String threadName;

    private MasterConfig(Builder builder) {
        this.maxWaitMillis = builder.maxWaitMillis;
        this.errorBackoffMillis = builder.errorBackoffMillis;
        this.threadName = builder.threadName;
    }

    public long getMaxWaitMillis() { return maxWaitMillis; }
    public long getErrorBackoffMillis() { return errorBackoffMillis; }
    public String getThreadName() { return threadName; }

    public static MasterConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private long maxWaitMillis = DEFAULT_MAX_WAIT_MILLIS;
        private long errorBackoffMillis = 1000;
        private String threadName = "elric-scheduler";

        private Builder() {
        }

        /**
         * Wait used when the job store is empty.
         * Default: 4,294,967 seconds
         */
        public Builder withMaxWait(long millis) {
            if (millis <= 0) {
                throw new IllegalArgumentException("Max wait must be positive: " + millis);
            }
            this.maxWaitMillis = millis;
            return this;
        }

        /**
         * Pause after a failed tick before trying again.
         * Default: 1 second
         */
        public Builder withErrorBackoff(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("Error backoff must not be negative: " + millis);
            }
            this.errorBackoffMillis = millis;
            return this;
        }

        /**
         * Name of the loop thread.
         * Default: elric-scheduler
         */
        public Builder withThreadName(String name) {
            this.threadName = name;
            return this;
        }

        public MasterConfig build() {
            return new MasterConfig(this);
        }
    }
}
