package com.eainde.boardingpass.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcAwareExecutorTest {

    private final MdcAwareExecutor executor = new MdcAwareExecutor(1);

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.close();
    }

    @Test
    @DisplayName("the submitter's MDC is visible in the worker")
    void propagatesMdc() throws Exception {
        MDC.put("extractionId", "abc-123");

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("extractionId"), executor)
                .get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo("abc-123");
    }

    @Test
    @DisplayName("a worker does not keep the MDC of an earlier task")
    void clearsAfterTask() throws Exception {
        MDC.put("extractionId", "first");
        CompletableFuture.runAsync(() -> { }, executor).get(5, TimeUnit.SECONDS);
        MDC.clear();

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("extractionId"), executor)
                .get(5, TimeUnit.SECONDS);

        assertThat(seen).isNull();
    }

    @Test
    @DisplayName("workers are named daemon threads")
    void workerThreads() throws Exception {
        Thread worker = CompletableFuture.supplyAsync(Thread::currentThread, executor).get(5, TimeUnit.SECONDS);

        assertThat(worker.getName()).startsWith("extraction-worker-");
        assertThat(worker.isDaemon()).isTrue();
    }

    @Test
    @DisplayName("cancelling a submitted task interrupts its worker and frees it for the next task")
    void cancelInterruptsWorker() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        Future<?> stuck = executor.submit(() -> {
            running.countDown();
            try {
                new CountDownLatch(1).await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
        });
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        stuck.cancel(true);

        assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(executor.submit(() -> "next").get(1, TimeUnit.SECONDS)).isEqualTo("next");
    }
}
