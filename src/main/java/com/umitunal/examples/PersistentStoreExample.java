package com.umitunal.examples;

import com.umitunal.elric.config.StorageConfig;
import com.umitunal.elric.core.JobStore;
import com.umitunal.elric.master.SchedulerLoop;
import com.umitunal.elric.model.Job;
import com.umitunal.elric.queue.InMemoryQueueFactory;
import com.umitunal.elric.queue.RouteTable;
import com.umitunal.elric.registry.CallableRegistry;
import com.umitunal.elric.registry.FunctionSignature;
import com.umitunal.elric.serialization.JobCodec;
import com.umitunal.elric.serialization.KryoJobCodec;
import com.umitunal.elric.storage.RocksJobStore;
import com.umitunal.elric.trigger.CronTrigger;

/**
 * Scheduled jobs survive a master restart when kept in RocksDB.
 */
public class PersistentStoreExample {

    public static void main(String[] args) {
        System.out.println("=== Persistent Store Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/elric-jobs")
                .withDurableWrites(true)
                .build();
        CallableRegistry registry = new CallableRegistry()
                .register("reports.nightly", (a, kw) -> "done",
                        FunctionSignature.of("report").withOptional("format"));
        JobCodec codec = new KryoJobCodec();

        try {
            // First run: schedule and shut down
            try (JobStore store = new RocksJobStore(config)) {
                SchedulerLoop master = SchedulerLoop.builder(store, new RouteTable(new InMemoryQueueFactory()), codec)
                        .build();
                Job nightly = Job.builder(registry, "reports.nightly")
                        .id("nightly-report")
                        .args("sales")
                        .trigger(new CronTrigger("0 0 2 * * *", System.currentTimeMillis()))
                        .build();
                System.out.println("Submitted: " + master.submit(nightly, "reports", true));
                System.out.println("Next run at: " + nightly.getNextRunTime().getAsLong());
            }

            // Second run: the job is still there
            try (JobStore store = new RocksJobStore(config)) {
                System.out.println("Pending after restart: " + store.size());
                store.get("nightly-report").ifPresent(job ->
                        System.out.println("Restored: " + Job.deserialize(job.getPayload(), codec, registry)));
            }

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
