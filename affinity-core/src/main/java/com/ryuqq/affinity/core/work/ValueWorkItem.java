package com.ryuqq.affinity.core.work;

import com.ryuqq.affinity.core.completion.CompletionHandle;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * 값을 직접 반환하는 작업.
 *
 * @param producer 워커 스레드에서 호출될 callable
 * @param timeout 작업 타임아웃 (0 이상)
 * @param handle 결과 셀
 * @param <T> 결과 타입
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public record ValueWorkItem<T>(
    Callable<T> producer,
    Duration timeout,
    CompletionHandle<T> handle
) implements WorkItem<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException producer, timeout, handle 중 하나가 null이거나 timeout이 음수인 경우
     */
    public ValueWorkItem {
        if (producer == null) {
            throw new IllegalArgumentException("producer cannot be null");
        }
        WorkItem.requireValidTimeout(timeout);
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
    }

    /**
     * 새 CompletionHandle과 함께 작업 생성.
     *
     * @param producer 값을 반환하는 callable
     * @param timeout 작업 타임아웃
     * @param <T> 결과 타입
     * @return ValueWorkItem 인스턴스
     * @throws IllegalArgumentException producer 또는 timeout이 유효하지 않은 경우
     */
    public static <T> ValueWorkItem<T> of(Callable<T> producer, Duration timeout) {
        return new ValueWorkItem<>(producer, timeout, new CompletionHandle<>());
    }

    @Override
    public WorkKind kind() {
        return WorkKind.VALUE;
    }
}
