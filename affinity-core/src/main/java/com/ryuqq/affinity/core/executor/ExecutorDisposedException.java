package com.ryuqq.affinity.core.executor;

/**
 * dispose가 시작된 실행자에 작업을 제출했거나,
 * 실행되기 전에 dispose로 버려진 작업을 나타냅니다.
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public class ExecutorDisposedException extends IllegalStateException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public ExecutorDisposedException(String message) {
        super(message);
    }
}
