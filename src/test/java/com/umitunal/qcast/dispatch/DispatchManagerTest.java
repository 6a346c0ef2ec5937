package com.umitunal.qcast.dispatch;

import com.umitunal.qcast.config.BroadcastConfig;
import com.umitunal.qcast.core.DispatchMetrics;
import com.umitunal.qcast.core.SendResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class DispatchManagerTest {

    private final ScriptedTransport transport = new ScriptedTransport();
    private DispatchManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.stop();
        }
    }

    private static BroadcastConfig.Builder fastConfig() {
        return BroadcastConfig.newBuilder()
                .withSendRate(1000)
                .withWorkerCount(4)
                .withBaseBackoff(Duration.ofMillis(1));
    }

    @Test
    @DisplayName("Should start the worker pool only once")
    void testIdempotentStart() {
        // Given
        manager = new DispatchManager(fastConfig().withWorkerCount(3).build(), transport);

        // When
        manager.start();
        manager.start();

        // Then
        assertThat(manager.isStarted()).isTrue();
        assertThat(manager.getWorkerCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should deliver every enqueued message and report counters")
    void testDeliversAll() throws Exception {
        // Given
        transport.script("u7", SendResult.permanentFailure("user not found"));
        manager = new DispatchManager(fastConfig().build(), transport);
        manager.start();

        // When
        for (int i = 0; i < 50; i++) {
            manager.enqueueJob("u" + i, "Reminder", "job-1");
        }

        // Then
        await().atMost(10, TimeUnit.SECONDS).until(manager::isIdle);
        DispatchMetrics metrics = manager.getMetrics();
        assertThat(metrics.getTotalEnqueued()).isEqualTo(50);
        assertThat(metrics.getTotalSent()).isEqualTo(49);
        assertThat(metrics.getPermanentFailures()).isEqualTo(1);
        assertThat(metrics.getDropped()).isZero();
        assertThat(metrics.getQueueDepth()).isZero();
    }

    @Test
    @DisplayName("Should deliver despite transient failures within the retry budget")
    void testAtLeastOnceUnderTransientFailures() throws Exception {
        // Given
        transport.script("u1",
                SendResult.transientError("HTTP 500"),
                SendResult.transientError("HTTP 502"));
        manager = new DispatchManager(fastConfig().withMaxRetries(3).build(), transport);
        manager.start();

        // When
        manager.enqueueJob("u1", "Reminder", "job-1");

        // Then
        await().atMost(10, TimeUnit.SECONDS).until(manager::isIdle);
        assertThat(transport.getDelivered()).containsExactly("u1:Reminder");
        assertThat(transport.getCalls()).hasSize(3);
    }

    @Test
    @DisplayName("Should block producers while the queue is full instead of dropping")
    void testBackpressure() throws Exception {
        // Given - workers not started yet, room for two tasks
        manager = new DispatchManager(fastConfig().withQueueCapacity(2).build(), transport);
        manager.enqueueJob("u1", "Hi", "job-1");
        manager.enqueueJob("u2", "Hi", "job-1");

        // When
        AtomicBoolean thirdQueued = new AtomicBoolean(false);
        Thread producer = new Thread(() -> {
            try {
                manager.enqueueJob("u3", "Hi", "job-1");
                thirdQueued.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        // Then
        await().during(300, TimeUnit.MILLISECONDS).atMost(1, TimeUnit.SECONDS)
                .until(() -> !thirdQueued.get());
        assertThat(producer.isAlive()).isTrue();

        manager.start();
        await().atMost(5, TimeUnit.SECONDS).untilTrue(thirdQueued);
        await().atMost(5, TimeUnit.SECONDS).until(manager::isIdle);
        assertThat(manager.getTotalSent()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should report undelivered tasks on stop")
    void testStopReportsRemaining() throws Exception {
        // Given
        manager = new DispatchManager(fastConfig().build(), transport);
        manager.enqueueJob("u1", "Hi", "job-1");
        manager.enqueueJob("u2", "Hi", "job-1");

        // When
        int remaining = manager.stop();

        // Then
        assertThat(remaining).isEqualTo(2);
        assertThat(transport.getCalls()).isEmpty();
    }
}
