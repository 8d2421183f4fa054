/**
 * Executor - Thread-affinity 작업 제출 계약.
 *
 * <p>이 패키지는 단일 워커 실행자의 공개 API와 설정을 정의합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.affinity.core.executor.AffinityExecutor} - 작업 제출/종료 인터페이스</li>
 *   <li>{@link com.ryuqq.affinity.core.executor.WorkerExecutorConfig} - 워커 설정</li>
 *   <li>{@link com.ryuqq.affinity.core.executor.ExecutorDisposedException} - dispose 이후 사용 오류</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>비블로킹 제출:</strong> execute()는 즉시 future 반환</li>
 *   <li><strong>FIFO:</strong> 실행 순서 = 제출 순서</li>
 *   <li><strong>상호 배제:</strong> 동시에 실행되는 작업은 최대 하나</li>
 * </ul>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
package com.ryuqq.affinity.core.executor;
