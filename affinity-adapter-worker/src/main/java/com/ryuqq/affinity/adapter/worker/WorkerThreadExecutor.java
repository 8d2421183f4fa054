package com.ryuqq.affinity.adapter.worker;

import com.ryuqq.affinity.core.debug.DebuggerProbe;
import com.ryuqq.affinity.core.debug.JvmDebuggerProbe;
import com.ryuqq.affinity.core.executor.AffinityExecutor;
import com.ryuqq.affinity.core.executor.ExecutorDisposedException;
import com.ryuqq.affinity.core.executor.WorkerExecutorConfig;
import com.ryuqq.affinity.core.statemachine.WorkerState;
import com.ryuqq.affinity.core.work.SuspendingWorkItem;
import com.ryuqq.affinity.core.work.ValueWorkItem;
import com.ryuqq.affinity.core.work.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 전용 워커 스레드 하나에서 작업을 실행하는 {@link AffinityExecutor} 구현체.
 *
 * <p>생성 시 워커 스레드와 타임아웃 타이머 스레드를 시작하며,
 * 모든 작업은 워커 스레드에서 제출 순서대로 하나씩 실행됩니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>{@link WorkQueue}: 제출 스레드들과 워커 사이의 FIFO 큐</li>
 *   <li>{@link WorkerLoop}: 워커 스레드에서 실행되는 dequeue/실행 루프</li>
 *   <li>{@link TimeoutScheduler}: 작업별 타임아웃 타이머</li>
 * </ul>
 *
 * <p><strong>종료 정책:</strong></p>
 * <ul>
 *   <li>dispose는 큐를 닫고 wake 신호를 보내므로, 빈 큐에서 대기 중인 워커도 즉시 종료됩니다.</li>
 *   <li>아직 시작하지 않은 작업은 {@link ExecutorDisposedException}으로 실패합니다.</li>
 *   <li>실행 중인 작업은 끝까지 실행되며, grace 시간 안에 끝나지 않으면
 *       워커 스레드를 인터럽트하고 경고를 남긴 뒤 false를 반환합니다.</li>
 * </ul>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public final class WorkerThreadExecutor implements AffinityExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkerThreadExecutor.class);

    private final WorkerExecutorConfig config;
    private final WorkQueue<WorkItem<?>> queue;
    private final WorkerLoop loop;
    private final Thread workerThread;
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    /**
     * 기본 설정으로 생성.
     */
    public WorkerThreadExecutor() {
        this(new WorkerExecutorConfig());
    }

    /**
     * 설정을 지정하여 생성 (JVM 인자 기반 디버거 감지).
     *
     * @param config 워커 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public WorkerThreadExecutor(WorkerExecutorConfig config) {
        this(config, new JvmDebuggerProbe());
    }

    /**
     * 설정과 디버거 감지기를 지정하여 생성.
     *
     * @param config 워커 설정
     * @param debuggerProbe 디버거 연결 감지기
     * @throws IllegalArgumentException config 또는 debuggerProbe가 null인 경우
     */
    public WorkerThreadExecutor(WorkerExecutorConfig config, DebuggerProbe debuggerProbe) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (debuggerProbe == null) {
            throw new IllegalArgumentException("debuggerProbe cannot be null");
        }
        this.config = config;
        this.queue = new WorkQueue<>();
        this.loop = new WorkerLoop(queue, new TimeoutScheduler(config.threadName() + "-timeout", debuggerProbe));
        this.workerThread = new Thread(loop, config.threadName());
        this.workerThread.setDaemon(config.daemon());
        this.workerThread.start();
    }

    @Override
    public <T> CompletableFuture<T> execute(Callable<T> producer, Duration timeout) {
        return enqueue(ValueWorkItem.of(producer, timeout));
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(Callable<? extends CompletionStage<T>> producer, Duration timeout) {
        return enqueue(SuspendingWorkItem.of(producer, timeout));
    }

    private <T> CompletableFuture<T> enqueue(WorkItem<T> item) {
        if (disposed.get() || !queue.offer(item)) {
            throw new ExecutorDisposedException("Executor '" + config.threadName() + "' is disposed");
        }
        return item.handle().future();
    }

    @Override
    public Duration defaultTimeout() {
        return config.defaultTimeout();
    }

    @Override
    public boolean dispose(Duration graceTimeout) {
        if (graceTimeout == null || graceTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "graceTimeout must not be null or negative (current: " + graceTimeout + ")"
            );
        }

        if (disposed.compareAndSet(false, true)) {
            log.info("Disposing executor '{}' (grace {}ms)", config.threadName(), graceTimeout.toMillis());
            loop.requestStop();
            WorkerLoop.failRemaining(queue.close());
        }

        if (Thread.currentThread() == workerThread) {
            log.warn("dispose() called from worker thread '{}', not waiting for it to exit", config.threadName());
            return false;
        }

        boolean exited = awaitWorker(graceTimeout);
        if (!exited) {
            // 실행 중인 작업이 인터럽트에 응답하면 해당 작업은 InterruptedException으로 실패
            log.warn("Worker '{}' did not exit within {}ms, interrupting", config.threadName(), graceTimeout.toMillis());
            workerThread.interrupt();
        }
        return exited;
    }

    private boolean awaitWorker(Duration graceTimeout) {
        long graceMillis = graceTimeout.toMillis();
        if (graceMillis > 0) {
            try {
                workerThread.join(graceMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for worker '{}' to exit", config.threadName());
            }
        }
        return !workerThread.isAlive();
    }

    /**
     * dispose가 호출되었거나 워커 루프가 이미 종료되어 더 이상 작업을 받지 않는지 여부.
     */
    @Override
    public boolean isDisposed() {
        return disposed.get() || queue.isClosed();
    }

    @Override
    public void close() {
        dispose(config.disposeTimeout());
    }

    /**
     * 워커 루프의 현재 상태.
     *
     * @return 워커 상태
     */
    public WorkerState workerState() {
        return loop.state();
    }

    /**
     * 아직 실행되지 않고 큐에 남아 있는 작업 수.
     *
     * @return 대기 작업 수
     */
    public int pendingCount() {
        return queue.size();
    }

    @Override
    public String toString() {
        return "WorkerThreadExecutor{thread=" + config.threadName()
            + ", state=" + loop.state()
            + ", pending=" + queue.size()
            + ", disposed=" + disposed.get() + "}";
    }
}
