package com.ryuqq.affinity.core.observable;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 단조 증가 64-bit 카운터.
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public final class SubmissionCounter {

    private final AtomicLong value = new AtomicLong();

    /**
     * 1 증가.
     *
     * @return 증가 후 값
     */
    public long increment() {
        return value.incrementAndGet();
    }

    /**
     * 현재 값 조회.
     *
     * @return 현재 값
     */
    public long value() {
        return value.get();
    }

    @Override
    public String toString() {
        return "SubmissionCounter{value=" + value.get() + "}";
    }
}
