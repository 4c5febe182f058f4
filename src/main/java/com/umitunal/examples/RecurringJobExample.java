package com.umitunal.examples;

import com.umitunal.elric.core.JobStore;
import com.umitunal.elric.master.SchedulerLoop;
import com.umitunal.elric.model.Job;
import com.umitunal.elric.queue.InMemoryQueue;
import com.umitunal.elric.queue.InMemoryQueueFactory;
import com.umitunal.elric.queue.RouteTable;
import com.umitunal.elric.registry.CallableRegistry;
import com.umitunal.elric.registry.FunctionSignature;
import com.umitunal.elric.serialization.JobCodec;
import com.umitunal.elric.serialization.JsonJobCodec;
import com.umitunal.elric.storage.MemoryJobStore;
import com.umitunal.elric.trigger.IntervalTrigger;

/**
 * Recurring and one-shot jobs on a running master, drained by an in-process worker.
 */
public class RecurringJobExample {

    public static void main(String[] args) {
        System.out.println("=== Recurring Job Example ===\n");

        CallableRegistry registry = new CallableRegistry()
                .register("greet", (a, kw) -> {
                    System.out.println("  Hello, " + a.get(0) + "!");
                    return null;
                }, FunctionSignature.of("name"));

        JobCodec codec = new JsonJobCodec();
        InMemoryQueueFactory queues = new InMemoryQueueFactory();

        try (JobStore store = new MemoryJobStore();
             SchedulerLoop master = SchedulerLoop.builder(store, new RouteTable(queues), codec).build()) {

            master.start();

            long now = System.currentTimeMillis();
            Job oneShot = Job.builder(registry, "greet").args("once").build();
            Job recurring = Job.builder(registry, "greet")
                    .id("every-500ms")
                    .args("again")
                    .trigger(new IntervalTrigger(now + 500, 500, now + 1600))
                    .build();

            System.out.println("One-shot: " + master.submit(oneShot, "greetings", false));
            System.out.println("Recurring: " + master.submit(recurring, "greetings", false));

            Thread.sleep(2000);

            System.out.println("\nWorker draining queue 'greetings':");
            InMemoryQueue queue = queues.queue("greetings").orElseThrow();
            byte[] payload;
            while ((payload = queue.poll()) != null) {
                Job.deserialize(payload, codec, registry).invoke();
            }

            System.out.println("\nPending jobs after the trigger ran out: " + master.pendingJobCount());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
