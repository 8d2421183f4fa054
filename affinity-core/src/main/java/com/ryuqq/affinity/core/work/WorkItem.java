package com.ryuqq.affinity.core.work;

import com.ryuqq.affinity.core.completion.CompletionHandle;

import java.time.Duration;

/**
 * 워커에게 전달되는 작업 단위.
 *
 * <p>WorkItem은 두 가지 제출 형태를 표현하는 tagged union입니다:</p>
 * <ul>
 *   <li>{@link ValueWorkItem}: {@code Callable<T>}, 반환 값이 결과</li>
 *   <li>{@link SuspendingWorkItem}: {@code Callable<CompletionStage<T>>}, 내부 stage의 최종 값이 결과</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 형태 외의 구현을 허용하지 않습니다.
 * 각 WorkItem은 제출 시점에 생성된 {@link CompletionHandle}을 단독으로 소유합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 handle의 상태를 제외하고 변경 불가</p>
 *
 * @param <T> 결과 타입
 * @author Affinity Team
 * @since 1.0.0
 */
public sealed interface WorkItem<T> permits ValueWorkItem, SuspendingWorkItem {

    /**
     * 제출 형태 조회.
     *
     * @return VALUE 또는 SUSPENDING
     */
    WorkKind kind();

    /**
     * 작업 타임아웃 (워커가 꺼낸 시점부터 측정).
     *
     * @return 0 이상의 Duration
     */
    Duration timeout();

    /**
     * 이 작업이 소유한 결과 셀.
     *
     * @return CompletionHandle (non-null)
     */
    CompletionHandle<T> handle();

    /**
     * 타임아웃 유효성 검증.
     *
     * @param timeout 검증할 타임아웃
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    static void requireValidTimeout(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative (current: " + timeout + ")");
        }
    }
}
