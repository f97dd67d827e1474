package com.dnobretech.jarvisepubconverter.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

@DisplayName("FutureJoiner Tests")
class FutureJoinerTest {

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("Should return results in creation order")
    void shouldReturnInCreationOrder() {
        CountDownLatch fastDone = new CountDownLatch(1);
        Callable<String> slow = () -> {
            fastDone.await();
            return "slow";
        };
        Callable<String> fast = () -> {
            fastDone.countDown();
            return "fast";
        };

        List<String> out = FutureJoiner.invokeAll(pool, List.of(slow, fast), IllegalStateException::new);

        assertThat(out).containsExactly("slow", "fast");
    }

    @Test
    @DisplayName("Should report a later failure without waiting for earlier work and interrupt it")
    void shouldFailFastAndInterruptRunningWork() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        Callable<String> blocked = () -> {
            started.countDown();
            try {
                new CountDownLatch(1).await();
                return "never";
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
        };
        Callable<String> failing = () -> {
            started.await();
            throw new IllegalArgumentException("bad");
        };

        assertTimeoutPreemptively(Duration.ofSeconds(5), () ->
            assertThatThrownBy(() -> FutureJoiner.invokeAll(pool, List.of(blocked, failing), IllegalStateException::new))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad"));
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Should wrap checked failures")
    void shouldWrapCheckedFailures() {
        Callable<String> failing = () -> {
            throw new IOException("io");
        };

        assertThatThrownBy(() -> FutureJoiner.invokeAll(pool, List.of(failing), IllegalStateException::new))
            .isInstanceOf(IllegalStateException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should return an empty list for no tasks")
    void shouldHandleNoTasks() {
        List<Callable<String>> none = List.of();

        assertThat(FutureJoiner.invokeAll(pool, none, IllegalStateException::new)).isEmpty();
    }

}
