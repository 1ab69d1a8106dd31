package com.rateview.support.concurrency;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 키별 단일 실행 그룹.
 * <p>
 * 같은 키에 대해 동시에 하나의 작업만 실행합니다. 작업이 진행 중일 때 들어온 호출은
 * 최대 {@code waitTimeout}까지 선행 작업의 결과를 기다리고, 시간 안에 끝나지 않으면 직접 실행합니다.
 * </p>
 * <p>
 * 키 상태: {@code IDLE → BUILDING → READY}. 작업이 끝나면 키는 다시 IDLE로 돌아갑니다.
 * </p>
 *
 * @param <K> 키 타입
 * @param <V> 결과 타입
 */
@Slf4j
public class SingleFlight<K, V> {

    public enum BuildState {
        IDLE,
        BUILDING,
        READY
    }

    private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    public SingleFlight(Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    /**
     * 키에 대한 작업을 실행하거나 진행 중인 작업의 결과를 기다립니다.
     *
     * @param key 키
     * @param task 실행할 작업
     * @return 작업 결과
     */
    public V execute(K key, Supplier<V> task) {
        CompletableFuture<V> mine = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            return awaitLeader(key, existing, task);
        }

        try {
            V result = task.get();
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * 키의 현재 상태를 반환합니다.
     */
    public BuildState stateOf(K key) {
        CompletableFuture<V> future = inFlight.get(key);
        if (future == null) {
            return BuildState.IDLE;
        }
        return future.isDone() ? BuildState.READY : BuildState.BUILDING;
    }

    private V awaitLeader(K key, CompletableFuture<V> leader, Supplier<V> task) {
        try {
            return leader.get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("선행 작업 대기 시간 초과, 직접 실행: key={}, waitTimeout={}", key, waitTimeout);
            return task.get();
        } catch (ExecutionException e) {
            log.warn("선행 작업 실패, 직접 실행: key={}, error={}", key, e.getCause().getMessage());
            return task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("선행 작업 대기 중 인터럽트되었습니다: key=" + key, e);
        }
    }
}
