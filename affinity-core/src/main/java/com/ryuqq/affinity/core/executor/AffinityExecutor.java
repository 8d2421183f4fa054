package com.ryuqq.affinity.core.executor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Thread-affinity 실행자.
 *
 * <p>여러 호출자가 동시에 제출한 작업을 하나의 전용 실행 컨텍스트에서
 * 제출 순서(FIFO)대로 한 번에 하나씩 실행합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>작업 제출 (비블로킹, 즉시 future 반환)</li>
 *   <li>작업별 타임아웃 적용 (만료 시 취소)</li>
 *   <li>작업 예외를 해당 호출자의 future로 전파</li>
 *   <li>종료(dispose) 시 워커 정리</li>
 * </ul>
 *
 * <p><strong>결과 관찰:</strong></p>
 * <ul>
 *   <li>정상 완료: future가 값으로 완료</li>
 *   <li>실패: future가 producer의 원래 예외로 실패 ({@code ExecutionException#getCause()})</li>
 *   <li>타임아웃: future가 {@code WorkTimeoutException}(CancellationException)으로 취소</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (AffinityExecutor executor = new WorkerThreadExecutor()) {
 *     CompletableFuture<Integer> result = executor.execute(() -> resource.read(), Duration.ofSeconds(1));
 *     CompletableFuture<String> async = executor.executeAsync(() -> client.fetchAsync(), Duration.ofSeconds(5));
 *     result.get();
 * }
 * }</pre>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public interface AffinityExecutor extends AutoCloseable {

    /**
     * 값을 반환하는 작업 제출.
     *
     * <p>이 메서드는 큐에 작업을 넣고 즉시 반환합니다.</p>
     *
     * @param producer 워커에서 호출될 callable
     * @param timeout 작업 타임아웃 (0 이상, 워커가 작업을 꺼낸 시점부터 측정)
     * @param <T> 결과 타입
     * @return 결과 future (읽기 전용)
     * @throws IllegalArgumentException producer가 null이거나 timeout이 null/음수인 경우
     * @throws ExecutorDisposedException 이미 dispose가 시작된 경우
     */
    <T> CompletableFuture<T> execute(Callable<T> producer, Duration timeout);

    /**
     * 비동기 stage를 반환하는 작업 제출.
     *
     * <p>워커는 반환된 stage가 완료될 때까지 기다리며, stage의 최종 값이 결과가 됩니다.</p>
     *
     * @param producer 워커에서 호출될 callable (stage 반환)
     * @param timeout 작업 타임아웃 (0 이상)
     * @param <T> 결과 타입
     * @return 결과 future (읽기 전용)
     * @throws IllegalArgumentException producer가 null이거나 timeout이 null/음수인 경우
     * @throws ExecutorDisposedException 이미 dispose가 시작된 경우
     */
    <T> CompletableFuture<T> executeAsync(Callable<? extends CompletionStage<T>> producer, Duration timeout);

    /**
     * 기본 타임아웃으로 값을 반환하는 작업 제출.
     *
     * @param producer 워커에서 호출될 callable
     * @param <T> 결과 타입
     * @return 결과 future
     * @see #defaultTimeout()
     */
    default <T> CompletableFuture<T> execute(Callable<T> producer) {
        return execute(producer, defaultTimeout());
    }

    /**
     * 기본 타임아웃으로 비동기 stage 작업 제출.
     *
     * @param producer 워커에서 호출될 callable (stage 반환)
     * @param <T> 결과 타입
     * @return 결과 future
     * @see #defaultTimeout()
     */
    default <T> CompletableFuture<T> executeAsync(Callable<? extends CompletionStage<T>> producer) {
        return executeAsync(producer, defaultTimeout());
    }

    /**
     * 타임아웃을 생략한 제출에 사용되는 기본 타임아웃.
     *
     * @return 기본 타임아웃
     */
    Duration defaultTimeout();

    /**
     * 종료 요청 후 워커가 끝나기를 최대 graceTimeout 동안 대기.
     *
     * <p>아직 시작하지 않은 작업은 {@link ExecutorDisposedException}으로 실패합니다.
     * 실행 중인 작업은 끝까지 실행됩니다.</p>
     *
     * @param graceTimeout 최대 대기 시간 (0 이상)
     * @return 워커가 시간 안에 종료된 경우 true
     * @throws IllegalArgumentException graceTimeout이 null이거나 음수인 경우
     */
    boolean dispose(Duration graceTimeout);

    /**
     * dispose가 시작되었는지 확인.
     *
     * @return dispose가 한 번이라도 호출된 경우 true
     */
    boolean isDisposed();

    /**
     * 설정된 기본 grace 시간으로 dispose.
     */
    @Override
    void close();
}
