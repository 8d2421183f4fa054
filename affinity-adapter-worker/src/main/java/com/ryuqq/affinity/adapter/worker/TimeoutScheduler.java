package com.ryuqq.affinity.adapter.worker;

import com.ryuqq.affinity.core.completion.WorkTimeoutException;
import com.ryuqq.affinity.core.debug.DebuggerProbe;
import com.ryuqq.affinity.core.work.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 작업별 타임아웃 타이머.
 *
 * <p>만료 시 작업의 handle을 {@link WorkTimeoutException}으로 취소합니다.
 * handle이 이미 종료 상태라면 취소는 아무 효과가 없습니다.</p>
 *
 * <p>디버거가 연결되어 있으면 타이머를 걸지 않습니다.</p>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
final class TimeoutScheduler {

    private static final Logger log = LoggerFactory.getLogger(TimeoutScheduler.class);

    private static final Disarm NOT_ARMED = () -> false;

    private final ScheduledThreadPoolExecutor timer;
    private final DebuggerProbe debuggerProbe;

    TimeoutScheduler(String threadName, DebuggerProbe debuggerProbe) {
        if (debuggerProbe == null) {
            throw new IllegalArgumentException("debuggerProbe cannot be null");
        }
        this.debuggerProbe = debuggerProbe;
        this.timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
        this.timer.setRemoveOnCancelPolicy(true);
    }

    /**
     * 작업의 타임아웃 타이머 시작.
     *
     * @param item 실행 직전의 작업
     * @return 타이머 해제 핸들 (디버거 연결 시 아무 것도 하지 않음)
     */
    Disarm arm(WorkItem<?> item) {
        if (debuggerProbe.isAttached()) {
            log.debug("Debugger attached, timeout suppressed for {}", item.kind());
            return NOT_ARMED;
        }
        ScheduledFuture<?> expiry = timer.schedule(
            () -> expire(item),
            delayNanos(item),
            TimeUnit.NANOSECONDS
        );
        return () -> expiry.cancel(false);
    }

    private static long delayNanos(WorkItem<?> item) {
        try {
            return item.timeout().toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    private void expire(WorkItem<?> item) {
        if (item.handle().cancel(new WorkTimeoutException(item.timeout()))) {
            log.warn("{} work item cancelled after timeout of {}ms", item.kind(), item.timeout().toMillis());
        }
    }

    /**
     * 타이머 스레드 종료 (워커 루프가 끝날 때 호출).
     *
     * <p>이미 걸려 있는 타이머는 만료 시 계속 실행됩니다.</p>
     */
    void shutdown() {
        timer.shutdown();
    }

    /**
     * 타이머 해제 핸들.
     */
    @FunctionalInterface
    interface Disarm {

        /**
         * 아직 만료되지 않은 타이머를 해제.
         *
         * @return 해제된 경우 true
         */
        boolean disarm();
    }
}
