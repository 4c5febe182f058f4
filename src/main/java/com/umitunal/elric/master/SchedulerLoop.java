package com.umitunal.elric.master;

import com.umitunal.elric.config.MasterConfig;
import com.umitunal.elric.core.AlreadyRunningException;
import com.umitunal.elric.core.JobCodecException;
import com.umitunal.elric.core.JobDefinitionException;
import com.umitunal.elric.core.JobStore;
import com.umitunal.elric.core.StoreOutcome;
import com.umitunal.elric.core.StoredJob;
import com.umitunal.elric.model.ElapsedFireTimes;
import com.umitunal.elric.model.Job;
import com.umitunal.elric.model.JobDescriptor;
import com.umitunal.elric.queue.RouteTable;
import com.umitunal.elric.serialization.JobCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * The scheduling master: keeps pending jobs in a {@link JobStore}, wakes when the earliest
 * one is due, pushes due jobs to their routing key's queue and advances or retires them.
 *
 * One dedicated thread runs the loop. {@link #submit}, {@link #update}, {@link #remove} and
 * {@link #wakeUp} may be called from any thread at any time.
 *
 * Locking: the job store is guarded by {@code storeLock}; the route table guards itself.
 * When both are held, the store lock is always taken first.
 */
public class SchedulerLoop implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private enum State { STOPPED, RUNNING, CLOSED }

    private final JobStore jobStore;
    private final RouteTable routeTable;
    private final JobCodec codec;
    private final MasterConfig config;
    private final LongSupplier clock;
    private final ReentrantLock storeLock = new ReentrantLock();
    private final WakeSignal wakeSignal = new WakeSignal();
    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    private volatile Thread loopThread;

    private SchedulerLoop(Builder builder) {
        this.jobStore = builder.jobStore;
        this.routeTable = builder.routeTable;
        this.codec = builder.codec;
        this.config = builder.config;
        this.clock = builder.clock;
    }

    /**
     * Start the loop thread.
     *
     * @throws AlreadyRunningException if the loop is already running
     * @throws IllegalStateException if the loop has been closed
     */
    public void start() {
        if (!state.compareAndSet(State.STOPPED, State.RUNNING)) {
            if (state.get() == State.RUNNING) {
                throw new AlreadyRunningException("Scheduler loop is already running");
            }
            throw new IllegalStateException("Scheduler loop has been closed");
        }
        log.info("Scheduler loop starting");
        loopThread = new Thread(this::run, config.getThreadName());
        loopThread.setDaemon(false);
        loopThread.start();
    }

    /**
     * Receive a serialized job.
     *
     * A job without a trigger goes straight to the queue for {@code routingKey}. Otherwise it
     * is stored; if {@code jobId} is taken, the existing job is overwritten when
     * {@code replaceExisting} is set and left alone (with a warning) when it is not.
     *
     * @throws com.umitunal.elric.core.JobCodecException if the payload cannot be decoded
     * @throws JobDefinitionException if a triggered job carries no next run time
     */
    public SubmitOutcome submit(byte[] serializedJob, String routingKey, String jobId, boolean replaceExisting) {
        log.debug("Submit job id={}, key={}", jobId, routingKey);
        JobDescriptor job = codec.decode(serializedJob);

        if (!job.hasTrigger()) {
            routeTable.enqueue(routingKey, serializedJob);
            return SubmitOutcome.DISPATCHED;
        }

        long nextRunTime = job.getNextRunTime().orElseThrow(() ->
                new JobDefinitionException("Job " + jobId + " has a trigger but no next run time"));

        SubmitOutcome outcome;
        storeLock.lock();
        try {
            if (jobStore.add(jobId, routingKey, nextRunTime, serializedJob) == StoreOutcome.ADDED) {
                outcome = SubmitOutcome.SCHEDULED;
            } else if (replaceExisting) {
                jobStore.replace(jobId, routingKey, nextRunTime, serializedJob);
                outcome = SubmitOutcome.REPLACED;
            } else {
                log.warn("Submit job error, job id {} already exists", jobId);
                outcome = SubmitOutcome.CONFLICT;
            }
        } finally {
            storeLock.unlock();
        }

        // A new job may be due before the current wait ends
        wakeUp();
        return outcome;
    }

    /**
     * Serialize and submit a job built on the client side.
     */
    public SubmitOutcome submit(Job job, String routingKey, boolean replaceExisting) {
        return submit(job.serialize(codec), routingKey, job.getId(), replaceExisting);
    }

    /**
     * Overwrite a stored job. A missing id is logged and reported as
     * {@link StoreOutcome#NOT_FOUND}; the store is left unchanged.
     *
     * Does not wake the loop, so an earlier fire time takes effect at the next wake-up.
     */
    public StoreOutcome update(String jobId, String routingKey, long nextRunTime, byte[] serializedJob) {
        codec.decode(serializedJob);

        storeLock.lock();
        try {
            StoreOutcome outcome = jobStore.replace(jobId, routingKey, nextRunTime, serializedJob);
            if (outcome == StoreOutcome.NOT_FOUND) {
                log.error("Update job error, job id {} does not exist", jobId);
            }
            return outcome;
        } finally {
            storeLock.unlock();
        }
    }

    /**
     * Delete a stored job. A missing id is logged and reported as {@link StoreOutcome#NOT_FOUND}.
     */
    public StoreOutcome remove(String jobId) {
        storeLock.lock();
        try {
            StoreOutcome outcome = jobStore.remove(jobId);
            if (outcome == StoreOutcome.NOT_FOUND) {
                log.error("Remove job error, job id {} does not exist", jobId);
            }
            return outcome;
        } finally {
            storeLock.unlock();
        }
    }

    /**
     * Cut the current wait short. Calls made while the loop is awake coalesce into one wake-up.
     */
    public void wakeUp() {
        wakeSignal.set();
    }

    /**
     * Run one tick: dispatch every job due at {@code now}, advance or retire it, and work out
     * how long to wait before the next tick.
     *
     * Each due job is appended to its queue once, however many of its fire times have passed.
     * Jobs are handled one by one: a job whose queue append fails stays where it is and the
     * tick moves on to the next one. A stored job whose payload no longer decodes is dropped
     * without being dispatched.
     *
     * @return wait in milliseconds; the error backoff if any append failed
     */
    public long runOnce(long now) {
        OptionalLong closest;
        int dispatched = 0;
        int failed = 0;

        storeLock.lock();
        try {
            List<StoredJob> dueJobs = jobStore.dueBefore(now);
            for (StoredJob due : dueJobs) {
                JobDescriptor job;
                try {
                    job = codec.decode(due.getPayload());
                } catch (JobCodecException e) {
                    log.error("Dropping job {}, stored payload cannot be decoded", due.getId(), e);
                    jobStore.remove(due.getId());
                    continue;
                }

                try {
                    routeTable.enqueue(due.getRoutingKey(), due.getPayload());
                } catch (RuntimeException e) {
                    log.error("Dispatch of job {} to {} failed", due.getId(), due.getRoutingKey(), e);
                    failed++;
                    continue;
                }
                dispatched++;

                try {
                    reschedule(due, job, now);
                } catch (RuntimeException e) {
                    log.error("Job {} was dispatched but cannot be advanced, removing it", due.getId(), e);
                    jobStore.remove(due.getId());
                }
            }
            if (dispatched > 0) {
                log.debug("Dispatched {} due jobs", dispatched);
            }
            closest = jobStore.closestUpcoming();
        } finally {
            storeLock.unlock();
        }

        if (failed > 0) {
            // Failed jobs are still due; don't spin on them
            log.warn("{} due jobs could not be dispatched, retrying in {} ms", failed, config.getErrorBackoffMillis());
            return config.getErrorBackoffMillis();
        }
        if (closest.isPresent()) {
            long waitMillis = Math.max(closest.getAsLong() - now, 0);
            log.debug("Next wakeup is due at {} (in {} ms)", closest.getAsLong(), waitMillis);
            return waitMillis;
        }
        return config.getMaxWaitMillis();
    }

    // Caller holds storeLock
    private void reschedule(StoredJob due, JobDescriptor decoded, long now) {
        JobDescriptor job = decoded.withNextRunTime(due.getNextRunTime());
        ElapsedFireTimes elapsed = job.elapsedFireTimes(now);

        OptionalLong next = elapsed.isEmpty()
                ? OptionalLong.empty()
                : job.nextFireTimeAfter(elapsed.getLast().getAsLong());

        if (next.isPresent()) {
            if (elapsed.getCount() > 1) {
                log.debug("Job {} missed {} fire times, dispatched once", due.getId(), elapsed.getCount() - 1);
            }
            byte[] payload = codec.encode(job.withNextRunTime(next.getAsLong()));
            jobStore.replace(due.getId(), due.getRoutingKey(), next.getAsLong(), payload);
        } else {
            log.info("Job {} has no next run time, removing it", due.getId());
            jobStore.remove(due.getId());
        }
    }

    private void run() {
        try {
            while (state.get() == State.RUNNING) {
                long waitMillis;
                try {
                    waitMillis = runOnce(clock.getAsLong());
                } catch (RuntimeException e) {
                    log.error("Scheduler tick failed, retrying in {} ms", config.getErrorBackoffMillis(), e);
                    waitMillis = config.getErrorBackoffMillis();
                }

                try {
                    wakeSignal.await(waitMillis);
                } catch (InterruptedException e) {
                    log.warn("Scheduler loop interrupted");
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            // An interrupted loop may be started again; a closed one stays closed
            state.compareAndSet(State.RUNNING, State.STOPPED);
            log.info("Scheduler loop stopped");
        }
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    /**
     * Look up a stored job.
     */
    public Optional<StoredJob> getStoredJob(String jobId) {
        storeLock.lock();
        try {
            return jobStore.get(jobId);
        } finally {
            storeLock.unlock();
        }
    }

    public int pendingJobCount() {
        storeLock.lock();
        try {
            return jobStore.size();
        } finally {
            storeLock.unlock();
        }
    }

    /**
     * Stop the loop thread. The job store stays open; closing it is the owner's job.
     */
    @Override
    public void close() {
        State previous = state.getAndSet(State.CLOSED);
        if (previous != State.RUNNING) {
            return;
        }
        wakeUp();
        Thread thread = loopThread;
        if (thread != null) {
            try {
                thread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public static Builder builder(JobStore jobStore, RouteTable routeTable, JobCodec codec) {
        return new Builder(jobStore, routeTable, codec);
    }

    public static class Builder {
        private final JobStore jobStore;
        private final RouteTable routeTable;
        private final JobCodec codec;
        private MasterConfig config = MasterConfig.defaults();
        private LongSupplier clock = System::currentTimeMillis;

        private Builder(JobStore jobStore, RouteTable routeTable, JobCodec codec) {
            this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
            this.routeTable = Objects.requireNonNull(routeTable, "routeTable");
            this.codec = Objects.requireNonNull(codec, "codec");
        }

        public Builder withConfig(MasterConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Source of "now" in millis since epoch.
         * Default: System.currentTimeMillis()
         */
        public Builder withClock(LongSupplier clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public SchedulerLoop build() {
            return new SchedulerLoop(this);
        }
    }
}
