package com.ryuqq.affinity.core.statemachine;

/**
 * 워커 루프의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 *        (작업 dequeue)
 * IDLE ──────────────► EXECUTING
 *  ▲                      │
 *  └──────────────────────┘ (handle 완료)
 *
 * IDLE / EXECUTING ──► STOPPING (dispose)
 *
 * STOPPING ──► TERMINATED (루프 종료)
 * </pre>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public enum WorkerState {

    /**
     * 빈 큐에서 대기 중.
     */
    IDLE,

    /**
     * 작업 하나를 실행 중.
     */
    EXECUTING,

    /**
     * 종료 요청을 받음. 현재 작업이 끝나면 루프를 빠져나감.
     */
    STOPPING,

    /**
     * 워커 스레드가 루프를 빠져나옴.
     */
    TERMINATED;

    /**
     * 종료 상태인지 확인.
     *
     * @return TERMINATED인 경우 true
     */
    public boolean isTerminal() {
        return this == TERMINATED;
    }

    /**
     * 종료가 요청되었거나 이미 종료되었는지 확인.
     *
     * @return STOPPING 또는 TERMINATED인 경우 true
     */
    public boolean isShuttingDown() {
        return this == STOPPING || this == TERMINATED;
    }
}
