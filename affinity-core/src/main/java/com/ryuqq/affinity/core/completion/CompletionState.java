package com.ryuqq.affinity.core.completion;

/**
 * CompletionHandle의 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → RESOLVED (정상 완료)</li>
 *   <li>PENDING → FAILED (예외 발생)</li>
 *   <li>PENDING → CANCELLED (타임아웃 만료)</li>
 *   <li><strong>종료 상태에서 다른 상태로 전이 불가 (first-writer-wins)</strong></li>
 * </ul>
 *
 * <pre>
 *            ┌─► RESOLVED
 *            │
 * PENDING ───┼─► FAILED
 *            │
 *            └─► CANCELLED
 * </pre>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public enum CompletionState {

    /**
     * 대기 중 (아직 결과 없음).
     */
    PENDING,

    /**
     * 값으로 완료됨.
     */
    RESOLVED,

    /**
     * 예외로 완료됨.
     */
    FAILED,

    /**
     * 타임아웃으로 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return PENDING이 아닌 경우 true
     */
    public boolean isTerminal() {
        return this != PENDING;
    }
}
