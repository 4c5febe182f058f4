package com.umitunal.elric.master;

import com.umitunal.elric.config.MasterConfig;
import com.umitunal.elric.core.StoredJob;
import com.umitunal.elric.model.JobDescriptor;
import com.umitunal.elric.queue.InMemoryQueue;
import com.umitunal.elric.queue.InMemoryQueueFactory;
import com.umitunal.elric.queue.RouteTable;
import com.umitunal.elric.serialization.KryoJobCodec;
import com.umitunal.elric.storage.MemoryJobStore;
import com.umitunal.elric.trigger.DateTrigger;
import com.umitunal.elric.trigger.IntervalTrigger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

/**
 * Runs the loop on its own thread against the wall clock.
 */
class SchedulerLoopConcurrencyTest {

    private final KryoJobCodec codec = new KryoJobCodec();
    private InMemoryQueueFactory queues;
    private MemoryJobStore store;
    private SchedulerLoop loop;

    @BeforeEach
    void setUp() {
        queues = new InMemoryQueueFactory();
        store = new MemoryJobStore();
    }

    @AfterEach
    void tearDown() {
        if (loop != null) {
            loop.close();
        }
        store.close();
    }

    private byte[] oneShot(String id, long runTime) {
        return codec.encode(JobDescriptor.builder(id, "task")
                .trigger(new DateTrigger(runTime))
                .nextRunTime(runTime)
                .build());
    }

    @Test
    @DisplayName("Should cut a long sleep short when an earlier job arrives")
    void testWakeOnEarlierJob() {
        // Given
        loop = SchedulerLoop.builder(store, new RouteTable(queues), codec).build();
        long now = System.currentTimeMillis();
        loop.submit(oneShot("far", now + 100_000), "k", "far", false);
        loop.start();

        // Let the loop settle into its long wait
        await().pollDelay(Duration.ofMillis(100)).until(() -> true);
        assertThat(queues.size("k")).isZero();

        // When
        loop.submit(oneShot("near", System.currentTimeMillis() + 50), "k", "near", false);

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> queues.size("k") == 1);
        assertThat(loop.getStoredJob("near")).isEmpty();
        assertThat(loop.getStoredJob("far")).isPresent();
    }

    @Test
    @DisplayName("Should dispatch every concurrently submitted job exactly once")
    void testConcurrentSubmits() throws Exception {
        // Given
        loop = SchedulerLoop.builder(store, new RouteTable(queues), codec).build();
        loop.start();
        int threads = 8;
        int jobsPerThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(1);
        long now = System.currentTimeMillis();

        // When
        for (int t = 0; t < threads; t++) {
            int thread = t;
            executor.submit(() -> {
                ready.await();
                for (int i = 0; i < jobsPerThread; i++) {
                    String id = "job-" + thread + "-" + i;
                    loop.submit(oneShot(id, now + i), "key-" + (i % 3), id, false);
                }
                return null;
            });
        }
        ready.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // Then
        int total = threads * jobsPerThread;
        await().atMost(Duration.ofSeconds(10))
                .until(() -> queues.size("key-0") + queues.size("key-1") + queues.size("key-2") == total);
        assertThat(loop.pendingJobCount()).isZero();

        Set<String> dispatched = new HashSet<>();
        for (int k = 0; k < 3; k++) {
            InMemoryQueue queue = queues.queue("key-" + k).orElseThrow();
            for (byte[] payload : queue.snapshot()) {
                assertThat(dispatched.add(codec.decode(payload).getId())).isTrue();
            }
        }
        assertThat(dispatched).hasSize(total);
    }

    @Test
    @DisplayName("Should keep running after a failed tick")
    void testRecoversFromTickFailure() {
        // Given
        AtomicInteger failures = new AtomicInteger();
        MemoryJobStore flaky = new MemoryJobStore() {
            @Override
            public List<StoredJob> dueBefore(long instant) {
                if (failures.getAndIncrement() == 0) {
                    throw new IllegalStateException("disk hiccup");
                }
                return super.dueBefore(instant);
            }
        };
        loop = SchedulerLoop.builder(flaky, new RouteTable(queues), codec)
                .withConfig(MasterConfig.newBuilder().withErrorBackoff(50).build())
                .build();
        long now = System.currentTimeMillis();
        loop.submit(codec.encode(JobDescriptor.builder("tick", "task")
                .trigger(new IntervalTrigger(now, 60_000))
                .nextRunTime(now)
                .build()), "k", "tick", false);

        // When
        loop.start();

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> queues.size("k") == 1);
        assertThat(failures.get()).isGreaterThanOrEqualTo(2);
        assertThat(loop.isRunning()).isTrue();
        assertThat(loop.getStoredJob("tick").orElseThrow().getNextRunTime()).isEqualTo(now + 60_000);
    }

    @Test
    @DisplayName("Should stop the loop thread on close")
    void testClose() {
        loop = SchedulerLoop.builder(store, new RouteTable(queues), codec)
                .withConfig(MasterConfig.newBuilder().withThreadName("close-test").build())
                .build();
        loop.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> threadAlive("close-test"));

        loop.close();

        assertThat(loop.isRunning()).isFalse();
        await().atMost(Duration.ofSeconds(5)).until(() -> !threadAlive("close-test"));
    }

    @Test
    @DisplayName("Should report stopped and allow a restart after the loop thread is interrupted")
    void testInterruptedLoop() {
        // Given
        loop = SchedulerLoop.builder(store, new RouteTable(queues), codec)
                .withConfig(MasterConfig.newBuilder().withThreadName("interrupt-test").build())
                .build();
        loop.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> threadAlive("interrupt-test"));

        // When
        findThread("interrupt-test").interrupt();

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> !loop.isRunning() && !threadAlive("interrupt-test"));
        loop.start();
        assertThat(loop.isRunning()).isTrue();

        loop.submit(oneShot("after-restart", System.currentTimeMillis()), "k", "after-restart", false);
        await().atMost(Duration.ofSeconds(5)).until(() -> queues.size("k") == 1);
    }

    private static Thread findThread(String name) {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(thread -> thread.getName().equals(name) && thread.isAlive())
                .findFirst()
                .orElseThrow();
    }

    private static boolean threadAlive(String name) {
        return Thread.getAllStackTraces().keySet().stream()
                .anyMatch(thread -> thread.getName().equals(name) && thread.isAlive());
    }
}
