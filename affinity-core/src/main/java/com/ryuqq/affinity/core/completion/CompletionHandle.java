package com.ryuqq.affinity.core.completion;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 단일 할당(single-assignment) 결과 셀.
 *
 * <p>작업 하나의 결과를 담으며, PENDING에서 종료 상태(RESOLVED, FAILED, CANCELLED)로의
 * 전이는 정확히 한 번만 성공합니다. 이후의 전이 시도는 아무 효과 없이 {@code false}를
 * 반환합니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>전이는 {@link AtomicReference#compareAndSet}으로 수행되므로 별도의 락이 필요 없습니다.</li>
 *   <li>워커 스레드(resolve/fail)와 타임아웃 타이머(cancel)가 서로 독립적으로 같은 CAS를 호출합니다.</li>
 *   <li>CAS에서 이긴 쪽만 future를 완료합니다.</li>
 * </ul>
 *
 * <p><strong>호출자 뷰:</strong> {@link #future()}는 읽기 전용입니다.
 * 외부에서 {@code complete}, {@code completeExceptionally}, {@code cancel},
 * {@code obtrude*}, {@code orTimeout} 등으로 결과를 쓰려고 하면
 * {@link UnsupportedOperationException}이 발생합니다. 파생 stage({@code thenApply} 등)는
 * 일반 {@link CompletableFuture}입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CompletionHandle<String> handle = new CompletionHandle<>();
 * CompletableFuture<String> view = handle.future();
 *
 * handle.resolve("done");      // true
 * handle.cancel(new WorkTimeoutException(timeout)); // false (이미 종료)
 *
 * view.join();                 // "done"
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Affinity Team
 * @since 1.0.0
 */
public final class CompletionHandle<T> {

    private final AtomicReference<CompletionState> state = new AtomicReference<>(CompletionState.PENDING);
    private final ReadOnlyFuture<T> future = new ReadOnlyFuture<>();

    /**
     * 값으로 완료 시도.
     *
     * @param value 결과 값 (null 허용)
     * @return 이 호출이 전이에 성공한 경우 true, 이미 종료 상태였던 경우 false
     */
    public boolean resolve(T value) {
        if (!transition(CompletionState.RESOLVED)) {
            return false;
        }
        future.settle(value);
        return true;
    }

    /**
     * 예외로 완료 시도.
     *
     * <p>전달된 예외는 감싸지 않고 그대로 호출자에게 전파됩니다.</p>
     *
     * @param error 실패 원인
     * @return 이 호출이 전이에 성공한 경우 true, 이미 종료 상태였던 경우 false
     * @throws IllegalArgumentException error가 null인 경우
     */
    public boolean fail(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (!transition(CompletionState.FAILED)) {
            return false;
        }
        future.settleExceptionally(error);
        return true;
    }

    /**
     * 취소 시도.
     *
     * @param reason 취소 사유 (보통 {@link WorkTimeoutException})
     * @return 이 호출이 전이에 성공한 경우 true, 이미 종료 상태였던 경우 false
     * @throws IllegalArgumentException reason이 null인 경우
     */
    public boolean cancel(CancellationException reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (!transition(CompletionState.CANCELLED)) {
            return false;
        }
        future.settleExceptionally(reason);
        return true;
    }

    /**
     * 현재 상태 조회.
     *
     * @return 현재 상태 (non-null)
     */
    public CompletionState state() {
        return state.get();
    }

    /**
     * 종료 상태 여부.
     *
     * @return RESOLVED, FAILED, CANCELLED 중 하나인 경우 true
     */
    public boolean isTerminal() {
        return state.get().isTerminal();
    }

    /**
     * 호출자에게 제공되는 읽기 전용 future.
     *
     * @return 항상 같은 인스턴스
     */
    public CompletableFuture<T> future() {
        return future;
    }

    private boolean transition(CompletionState target) {
        return state.compareAndSet(CompletionState.PENDING, target);
    }

    @Override
    public String toString() {
        return "CompletionHandle{state=" + state.get() + "}";
    }

    /**
     * 외부 쓰기를 거부하는 CompletableFuture.
     *
     * <p>내부 완료는 {@code super}의 메서드를 통해서만 수행합니다.</p>
     */
    private static final class ReadOnlyFuture<T> extends CompletableFuture<T> {

        private static final String READ_ONLY = "Result is owned by the executor and cannot be completed externally";

        void settle(T value) {
            super.complete(value);
        }

        void settleExceptionally(Throwable error) {
            super.completeExceptionally(error);
        }

        @Override
        public boolean complete(T value) {
            throw new UnsupportedOperationException(READ_ONLY);
        }

        @Override
        public boolean completeExceptionally(Throwable ex) {
            throw new UnsupportedOperationException(READ_ONLY);
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            throw new UnsupportedOperationException(READ_ONLY);
        }

        @Override
        public void obtrudeValue(T value) {
            throw new UnsupportedOperationException(READ_ONLY);
        }

        @Override
        public void obtrudeException(Throwable ex) {
            throw new UnsupportedOperationException(READ_ONLY);
        }

        @Override
        public CompletableFuture<T> completeAsync(Supplier<? extends T> supplier, Executor executor) {
            throw new UnsupportedOperationException(READ_ONLY);
        }

        @Override
        public CompletableFuture<T> completeAsync(Supplier<? extends T> supplier) {
            throw new UnsupportedOperationException(READ_ONLY);
        }

        @Override
        public CompletableFuture<T> orTimeout(long timeout, TimeUnit unit) {
            throw new UnsupportedOperationException(READ_ONLY);
        }

        @Override
        public CompletableFuture<T> completeOnTimeout(T value, long timeout, TimeUnit unit) {
            throw new UnsupportedOperationException(READ_ONLY);
        }

        @Override
        public <U> CompletableFuture<U> newIncompleteFuture() {
            return new CompletableFuture<>();
        }
    }
}
