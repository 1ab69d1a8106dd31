package com.rateview.support.concurrency;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SingleFlight 테스트.
 */
class SingleFlightTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @DisplayName("진행 중인 작업이 있으면 대기자는 선행 작업의 결과를 받는다.")
    @Test
    void waitersReceiveLeaderResult() throws Exception {
        // arrange
        SingleFlight<String, Integer> singleFlight = new SingleFlight<>(Duration.ofSeconds(5));
        AtomicInteger executions = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        // act
        Future<Integer> leader = executor.submit(() -> singleFlight.execute("k", () -> {
            started.countDown();
            await(release);
            return executions.incrementAndGet();
        }));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        Future<Integer> waiter = executor.submit(() -> singleFlight.execute("k", executions::incrementAndGet));
        Thread.sleep(200);
        release.countDown();

        // assert
        assertThat(leader.get(5, TimeUnit.SECONDS)).isEqualTo(1);
        assertThat(waiter.get(5, TimeUnit.SECONDS)).isEqualTo(1);
        assertThat(executions.get()).isEqualTo(1);
    }

    @DisplayName("대기 시간이 지나면 대기자가 직접 실행한다.")
    @Test
    void waiterRunsItself_afterTimeout() throws Exception {
        // arrange
        SingleFlight<String, String> singleFlight = new SingleFlight<>(Duration.ofMillis(50));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<String> leader = executor.submit(() -> singleFlight.execute("k", () -> {
            started.countDown();
            await(release);
            return "leader";
        }));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // act
        String result = singleFlight.execute("k", () -> "waiter");

        // assert
        assertThat(result).isEqualTo("waiter");
        release.countDown();
        assertThat(leader.get(5, TimeUnit.SECONDS)).isEqualTo("leader");
    }

    @DisplayName("선행 작업이 실패하면 대기자가 직접 실행한다.")
    @Test
    void waiterRunsItself_whenLeaderFails() throws Exception {
        // arrange
        SingleFlight<String, String> singleFlight = new SingleFlight<>(Duration.ofSeconds(5));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<String> leader = executor.submit(() -> singleFlight.execute("k", () -> {
            started.countDown();
            await(release);
            throw new IllegalStateException("build failed");
        }));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        Future<String> waiter = executor.submit(() -> singleFlight.execute("k", () -> "recovered"));
        Thread.sleep(200);

        // act
        release.countDown();

        // assert
        assertThat(waiter.get(5, TimeUnit.SECONDS)).isEqualTo("recovered");
        assertThatThrownBy(() -> leader.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(IllegalStateException.class);
    }

    @DisplayName("키 상태는 실행 중 BUILDING이고 끝나면 IDLE로 돌아온다.")
    @Test
    void tracksBuildState() throws Exception {
        // arrange
        SingleFlight<String, String> singleFlight = new SingleFlight<>(Duration.ofSeconds(5));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        assertThat(singleFlight.stateOf("k")).isEqualTo(SingleFlight.BuildState.IDLE);

        // act
        Future<String> leader = executor.submit(() -> singleFlight.execute("k", () -> {
            started.countDown();
            await(release);
            return "done";
        }));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // assert
        assertThat(singleFlight.stateOf("k")).isEqualTo(SingleFlight.BuildState.BUILDING);
        assertThat(singleFlight.stateOf("other")).isEqualTo(SingleFlight.BuildState.IDLE);
        release.countDown();
        leader.get(5, TimeUnit.SECONDS);
        assertThat(singleFlight.stateOf("k")).isEqualTo(SingleFlight.BuildState.IDLE);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
