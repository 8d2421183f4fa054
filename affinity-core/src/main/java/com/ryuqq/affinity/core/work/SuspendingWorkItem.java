package com.ryuqq.affinity.core.work;

import com.ryuqq.affinity.core.completion.CompletionHandle;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionStage;

/**
 * 비동기 stage를 반환하는 작업.
 *
 * <p>워커는 producer가 반환한 stage가 완료될 때까지 기다린 뒤 그 값으로 handle을 완료합니다.
 * stage가 실패하면 원래 예외가 그대로 호출자에게 전파됩니다.</p>
 *
 * @param producer 워커 스레드에서 호출될 callable (stage 반환)
 * @param timeout 작업 타임아웃 (0 이상)
 * @param handle 결과 셀
 * @param <T> 결과 타입
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public record SuspendingWorkItem<T>(
    Callable<? extends CompletionStage<T>> producer,
    Duration timeout,
    CompletionHandle<T> handle
) implements WorkItem<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException producer, timeout, handle 중 하나가 null이거나 timeout이 음수인 경우
     */
    public SuspendingWorkItem {
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
     * @param producer stage를 반환하는 callable
     * @param timeout 작업 타임아웃
     * @param <T> 결과 타입
     * @return SuspendingWorkItem 인스턴스
     * @throws IllegalArgumentException producer 또는 timeout이 유효하지 않은 경우
     */
    public static <T> SuspendingWorkItem<T> of(Callable<? extends CompletionStage<T>> producer, Duration timeout) {
        return new SuspendingWorkItem<>(producer, timeout, new CompletionHandle<>());
    }

    @Override
    public WorkKind kind() {
        return WorkKind.SUSPENDING;
    }
}
