package com.ryuqq.affinity.core.observable;

import com.ryuqq.affinity.core.executor.AffinityExecutor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 제출 횟수를 세는 {@link AffinityExecutor} 데코레이터.
 *
 * <p>모든 호출을 감싼 실행자에게 그대로 전달하고, 제출이 수락될 때마다
 * 카운터를 1 증가시킵니다.</p>
 *
 * <p><strong>카운팅 규칙:</strong></p>
 * <ul>
 *   <li>감싼 실행자의 execute가 반환된 직후 증가 (작업 완료 시점이 아님)</li>
 *   <li>작업의 성공/실패/취소 여부와 무관</li>
 *   <li>감싼 실행자가 사용 오류로 예외를 던진 제출은 세지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ObservableExecutor executor = new ObservableExecutor(new WorkerThreadExecutor());
 * executor.execute(() -> 1, Duration.ofSeconds(1));
 * executor.submissionCount(); // 1
 * }</pre>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public final class ObservableExecutor implements AffinityExecutor {

    private final AffinityExecutor delegate;
    private final SubmissionCounter submissionCounter = new SubmissionCounter();

    /**
     * 생성자.
     *
     * @param delegate 감쌀 실행자
     * @throws IllegalArgumentException delegate가 null인 경우
     */
    public ObservableExecutor(AffinityExecutor delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public <T> CompletableFuture<T> execute(Callable<T> producer, Duration timeout) {
        CompletableFuture<T> result = delegate.execute(producer, timeout);
        submissionCounter.increment();
        return result;
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(Callable<? extends CompletionStage<T>> producer, Duration timeout) {
        CompletableFuture<T> result = delegate.executeAsync(producer, timeout);
        submissionCounter.increment();
        return result;
    }

    @Override
    public Duration defaultTimeout() {
        return delegate.defaultTimeout();
    }

    @Override
    public boolean dispose(Duration graceTimeout) {
        return delegate.dispose(graceTimeout);
    }

    @Override
    public boolean isDisposed() {
        return delegate.isDisposed();
    }

    @Override
    public void close() {
        delegate.close();
    }

    /**
     * 지금까지 수락된 제출 횟수.
     *
     * @return 제출 횟수
     */
    public long submissionCount() {
        return submissionCounter.value();
    }
}
