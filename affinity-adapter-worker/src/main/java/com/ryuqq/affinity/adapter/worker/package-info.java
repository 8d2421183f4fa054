/**
 * Worker Adapter Layer - 단일 워커 스레드 실행자 구현.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.affinity.adapter.worker.WorkerThreadExecutor} - 전용 워커 스레드 기반 AffinityExecutor</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-worker (WorkerThreadExecutor, WorkerLoop, WorkQueue, TimeoutScheduler)
 *   ↓ implements
 * core/executor (AffinityExecutor)
 *   ↓ depends on
 * core (CompletionHandle, WorkItem, WorkerState, DebuggerProbe)
 * </pre>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
package com.ryuqq.affinity.adapter.worker;
