package com.ryuqq.affinity.core.completion;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * 작업이 설정된 타임아웃 안에 완료되지 않아 취소되었음을 나타냅니다.
 *
 * <p>{@link CancellationException}을 상속하므로 호출자의 future는
 * {@code isCancelled() == true}로 관찰되고, {@code get()}/{@code join()}은
 * 이 예외를 그대로 던집니다.</p>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public class WorkTimeoutException extends CancellationException {

    private final Duration timeout;

    /**
     * 생성자.
     *
     * @param timeout 만료된 타임아웃
     */
    public WorkTimeoutException(Duration timeout) {
        super("Work item timed out after " + (timeout == null ? "?" : timeout.toMillis()) + "ms");
        this.timeout = timeout;
    }

    /**
     * 만료된 타임아웃 조회.
     *
     * @return 작업에 설정되었던 타임아웃
     */
    public Duration getTimeout() {
        return timeout;
    }
}
