package com.ryuqq.affinity.adapter.worker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 다중 생산자 / 단일 소비자 FIFO 큐.
 *
 * <p>하나의 {@link ReentrantLock}과 wake 신호용 {@link Condition}으로 보호됩니다.
 * 락은 enqueue/dequeue bookkeeping 동안에만 잡히며, 작업 실행 중에는 잡히지 않습니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>offer: 락 획득 → 추가 → 길이가 정확히 1이 되었으면 소비자 깨움 → 락 해제</li>
 *   <li>take: 락 획득 → 비어 있고 닫히지 않았으면 {@code await} (락 해제와 대기가 원자적) → head 반환</li>
 *   <li>close: 닫힘 표시 → 대기 중인 소비자 깨움 → 남은 항목 반환</li>
 * </ul>
 *
 * <p>{@code await}는 while 루프 안에서 호출되므로 spurious wakeup에도 안전합니다.</p>
 *
 * @param <E> 항목 타입
 * @author Affinity Team
 * @since 1.0.0
 */
final class WorkQueue<E> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<E> items = new ArrayDeque<>();
    private boolean closed;

    /**
     * 항목 추가.
     *
     * @param item 추가할 항목
     * @return 추가된 경우 true, 큐가 이미 닫힌 경우 false
     * @throws IllegalArgumentException item이 null인 경우
     */
    boolean offer(E item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            items.addLast(item);
            if (items.size() == 1) {
                notEmpty.signal();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * head 항목을 꺼냄 (비어 있으면 대기).
     *
     * @return head 항목, 큐가 닫힌 경우 null
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    E take() throws InterruptedException {
        lock.lock();
        try {
            while (items.isEmpty() && !closed) {
                notEmpty.await();
            }
            if (closed) {
                return null;
            }
            return items.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 큐를 닫고 남은 항목을 비움.
     *
     * <p>두 번째 이후 호출은 빈 목록을 반환합니다.</p>
     *
     * @return 닫는 시점에 남아 있던 항목 (FIFO 순서)
     */
    List<E> close() {
        lock.lock();
        try {
            closed = true;
            List<E> remaining = new ArrayList<>(items);
            items.clear();
            notEmpty.signalAll();
            return remaining;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
