package com.ryuqq.affinity.adapter.worker;

import com.ryuqq.affinity.core.completion.CompletionHandle;
import com.ryuqq.affinity.core.executor.ExecutorDisposedException;
import com.ryuqq.affinity.core.statemachine.WorkerState;
import com.ryuqq.affinity.core.statemachine.WorkerStateTransition;
import com.ryuqq.affinity.core.work.SuspendingWorkItem;
import com.ryuqq.affinity.core.work.ValueWorkItem;
import com.ryuqq.affinity.core.work.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 단일 워커 실행 루프.
 *
 * <p>전용 스레드 하나에서 큐의 작업을 하나씩 꺼내 실행하고, 결과나 예외를
 * 해당 작업의 {@link CompletionHandle}로 전달합니다.</p>
 *
 * <p><strong>처리 흐름 (작업당, 큐 락을 잡지 않은 상태):</strong></p>
 * <pre>
 * take() → item
 *   ↓
 * 1. 타임아웃 타이머 시작 (디버거 연결 시 생략)
 * 2. producer 호출
 *    - VALUE: 반환 값이 결과
 *    - SUSPENDING: 반환된 stage가 완료되거나 handle이 종료될 때까지 대기
 * 3. 성공 → handle.resolve(value) / 예외 → handle.fail(원래 예외)
 *    (타이머가 먼저 취소했다면 둘 다 no-op)
 * 4. 타이머 해제, 작업이 남긴 인터럽트 플래그 제거
 * 5. 다음 작업 (큐가 닫혔으면 종료)
 * </pre>
 *
 * <p>작업 하나의 실패가 루프를 종료시키지 않습니다.</p>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
final class WorkerLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    private final WorkQueue<WorkItem<?>> queue;
    private final TimeoutScheduler timeoutScheduler;
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.IDLE);

    WorkerLoop(WorkQueue<WorkItem<?>> queue, TimeoutScheduler timeoutScheduler) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (timeoutScheduler == null) {
            throw new IllegalArgumentException("timeoutScheduler cannot be null");
        }
        this.queue = queue;
        this.timeoutScheduler = timeoutScheduler;
    }

    @Override
    public void run() {
        log.info("Worker loop started on {}", Thread.currentThread().getName());
        int executed = 0;
        try {
            WorkItem<?> item;
            while ((item = queue.take()) != null) {
                advance(WorkerState.IDLE, WorkerState.EXECUTING);
                process(item);
                executed++;
                advance(WorkerState.EXECUTING, WorkerState.IDLE);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker loop interrupted on {}", Thread.currentThread().getName());
        } finally {
            requestStop();
            failRemaining(queue.close());
            advance(WorkerState.STOPPING, WorkerState.TERMINATED);
            timeoutScheduler.shutdown();
            log.info("Worker loop stopped: {} work items executed", executed);
        }
    }

    /**
     * 종료 요청 표시 (IDLE/EXECUTING → STOPPING).
     *
     * <p>루프를 실제로 깨우는 것은 큐의 close()입니다.</p>
     */
    void requestStop() {
        WorkerState current = state.get();
        while (!current.isShuttingDown()) {
            if (state.compareAndSet(current, WorkerState.STOPPING)) {
                return;
            }
            current = state.get();
        }
    }

    WorkerState state() {
        return state.get();
    }

    /**
     * 상태 전이. 종료 요청으로 상태가 이미 바뀌었다면 무시합니다.
     */
    private void advance(WorkerState from, WorkerState to) {
        WorkerStateTransition.validate(from, to);
        state.compareAndSet(from, to);
    }

    private <T> void process(WorkItem<T> item) {
        CompletionHandle<T> handle = item.handle();
        TimeoutScheduler.Disarm timer = timeoutScheduler.arm(item);
        try {
            if (item instanceof ValueWorkItem<T> valueItem) {
                handle.resolve(valueItem.producer().call());
            } else if (item instanceof SuspendingWorkItem<T> suspendingItem) {
                awaitSuspending(suspendingItem);
            }
        } catch (Throwable t) {
            Throwable cause = unwrap(t);
            log.debug("{} work item failed: {}", item.kind(), cause.toString());
            handle.fail(cause);
        } finally {
            timer.disarm();
            clearItemInterrupt(item);
        }
    }

    /**
     * 작업이 남긴 인터럽트 플래그 제거.
     *
     * <p>큐가 열려 있는 동안의 인터럽트는 작업 자신의 실패로 취급하고 다음 작업에
     * 넘기지 않습니다. 큐가 닫힌 뒤(dispose의 grace 초과 인터럽트)에는 플래그를 유지해
     * 루프가 종료되도록 합니다.</p>
     */
    private void clearItemInterrupt(WorkItem<?> item) {
        if (!queue.isClosed() && Thread.interrupted()) {
            log.debug("Interrupt flag left by {} work item cleared", item.kind());
        }
    }

    /**
     * 내부 stage가 완료되거나 handle이 (타임아웃으로) 종료될 때까지 대기.
     *
     * <p>타임아웃이 먼저 오면 내부 stage를 더 기다리지 않고 다음 작업으로 넘어갑니다.</p>
     */
    private <T> void awaitSuspending(SuspendingWorkItem<T> item) throws Exception {
        CompletionHandle<T> handle = item.handle();
        CompletionStage<T> stage = item.producer().call();
        if (stage == null) {
            throw new IllegalStateException("Suspending producer returned null stage");
        }
        CompletableFuture<T> inner = stage.toCompletableFuture();

        CompletableFuture.anyOf(inner, handle.future())
            .handle((ignored, error) -> null)
            .get();

        if (inner.isCancelled()) {
            // CANCELLED 상태는 타임아웃 전용이므로 내부 stage 취소는 실패로 전달
            handle.fail(new CompletionException("Inner stage was cancelled", cancellationOf(inner)));
        } else if (inner.isDone()) {
            handle.resolve(inner.join());
        }
    }

    private static Throwable cancellationOf(CompletableFuture<?> cancelled) {
        try {
            cancelled.join();
            return new CancellationException();
        } catch (CancellationException e) {
            return e;
        }
    }

    /**
     * 실행되지 못하고 남은 작업을 실패 처리.
     */
    static void failRemaining(List<WorkItem<?>> remaining) {
        for (WorkItem<?> item : remaining) {
            item.handle().fail(new ExecutorDisposedException("Executor stopped before the work item could run"));
        }
        if (!remaining.isEmpty()) {
            log.info("{} pending work items failed on shutdown", remaining.size());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
