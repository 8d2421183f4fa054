/**
 * State Machine - 워커 루프 생명주기.
 *
 * <ul>
 *   <li>{@link com.ryuqq.affinity.core.statemachine.WorkerState} - IDLE / EXECUTING / STOPPING / TERMINATED</li>
 *   <li>{@link com.ryuqq.affinity.core.statemachine.WorkerStateTransition} - 전이 규칙 검증</li>
 * </ul>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
package com.ryuqq.affinity.core.statemachine;
