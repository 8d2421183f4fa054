package com.ryuqq.affinity.core.statemachine;

/**
 * 워커 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → EXECUTING</li>
 *   <li>EXECUTING → IDLE</li>
 *   <li>IDLE → STOPPING, EXECUTING → STOPPING</li>
 *   <li>STOPPING → TERMINATED</li>
 * </ul>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public final class WorkerStateTransition {

    // Utility class - prevent instantiation
    private WorkerStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 허용되는지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되는 전이인 경우 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(WorkerState from, WorkerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case IDLE -> to == WorkerState.EXECUTING || to == WorkerState.STOPPING;
            case EXECUTING -> to == WorkerState.IDLE || to == WorkerState.STOPPING;
            case STOPPING -> to == WorkerState.TERMINATED;
            case TERMINATED -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkerState from, WorkerState to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid worker state transition: %s → %s", from, to)
            );
        }
    }
}
