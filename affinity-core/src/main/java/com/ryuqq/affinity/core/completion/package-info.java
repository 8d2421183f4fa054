/**
 * Completion - 단일 할당 결과 셀.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.affinity.core.completion.CompletionHandle} - first-writer-wins 결과 셀</li>
 *   <li>{@link com.ryuqq.affinity.core.completion.CompletionState} - PENDING / RESOLVED / FAILED / CANCELLED</li>
 *   <li>{@link com.ryuqq.affinity.core.completion.WorkTimeoutException} - 타임아웃 취소 신호</li>
 * </ul>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
package com.ryuqq.affinity.core.completion;
