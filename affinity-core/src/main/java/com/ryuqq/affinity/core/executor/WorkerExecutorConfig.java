package com.ryuqq.affinity.core.executor;

import java.time.Duration;

/**
 * 워커 스레드 실행자 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threadName: 워커 스레드 이름 (기본 "affinity-worker")</li>
 *   <li>disposeTimeout: {@code close()}가 워커 종료를 기다리는 시간 (기본 5초)</li>
 *   <li>defaultTimeout: 타임아웃을 생략한 제출의 작업 타임아웃 (기본 30초)</li>
 *   <li>daemon: 워커를 백그라운드(daemon) 스레드로 만들지 여부 (기본 true)</li>
 * </ul>
 *
 * @author Affinity Team
 * @since 1.0.0
 * @param threadName 워커 스레드 이름 (blank 불가)
 * @param disposeTimeout close() 대기 시간 (0 이상)
 * @param defaultTimeout 기본 작업 타임아웃 (0 이상)
 * @param daemon daemon 스레드 여부
 */
public record WorkerExecutorConfig(
    String threadName,
    Duration disposeTimeout,
    Duration defaultTimeout,
    boolean daemon
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: threadName="affinity-worker", disposeTimeout=5s, defaultTimeout=30s, daemon=true</p>
     */
    public WorkerExecutorConfig() {
        this("affinity-worker", Duration.ofSeconds(5), Duration.ofSeconds(30), true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerExecutorConfig {
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
        if (disposeTimeout == null || disposeTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "disposeTimeout must not be null or negative (current: " + disposeTimeout + ")"
            );
        }
        if (defaultTimeout == null || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "defaultTimeout must not be null or negative (current: " + defaultTimeout + ")"
            );
        }
    }

    /**
     * threadName만 변경한 새 인스턴스 생성.
     */
    public WorkerExecutorConfig withThreadName(String threadName) {
        return new WorkerExecutorConfig(threadName, disposeTimeout, defaultTimeout, daemon);
    }

    /**
     * disposeTimeout만 변경한 새 인스턴스 생성.
     */
    public WorkerExecutorConfig withDisposeTimeout(Duration disposeTimeout) {
        return new WorkerExecutorConfig(threadName, disposeTimeout, defaultTimeout, daemon);
    }

    /**
     * defaultTimeout만 변경한 새 인스턴스 생성.
     */
    public WorkerExecutorConfig withDefaultTimeout(Duration defaultTimeout) {
        return new WorkerExecutorConfig(threadName, disposeTimeout, defaultTimeout, daemon);
    }

    /**
     * daemon만 변경한 새 인스턴스 생성.
     */
    public WorkerExecutorConfig withDaemon(boolean daemon) {
        return new WorkerExecutorConfig(threadName, disposeTimeout, defaultTimeout, daemon);
    }
}
