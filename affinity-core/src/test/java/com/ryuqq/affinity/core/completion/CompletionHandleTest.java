package com.ryuqq.affinity.core.completion;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CompletionHandle 유닛 테스트.
 *
 * @author Affinity Team
 * @since 1.0.0
 */
class CompletionHandleTest {

    @Test
    void 생성_직후_PENDING_상태() {
        // when
        CompletionHandle<String> handle = new CompletionHandle<>();

        // then
        assertThat(handle.state()).isEqualTo(CompletionState.PENDING);
        assertThat(handle.isTerminal()).isFalse();
        assertThat(handle.future()).isNotDone();
    }

    @Test
    void resolve_시_future가_값으로_완료됨() throws Exception {
        // given
        CompletionHandle<String> handle = new CompletionHandle<>();

        // when
        boolean won = handle.resolve("done");

        // then
        assertThat(won).isTrue();
        assertThat(handle.state()).isEqualTo(CompletionState.RESOLVED);
        assertThat(handle.future().get()).isEqualTo("done");
    }

    @Test
    void resolve_null_값_허용() {
        // given
        CompletionHandle<String> handle = new CompletionHandle<>();

        // when
        handle.resolve(null);

        // then
        assertThat(handle.state()).isEqualTo(CompletionState.RESOLVED);
        assertThat(handle.future().join()).isNull();
    }

    @Test
    void fail_시_원래_예외가_그대로_전파됨() {
        // given
        CompletionHandle<String> handle = new CompletionHandle<>();
        IllegalStateException boom = new IllegalStateException("boom");

        // when
        handle.fail(boom);

        // then
        assertThat(handle.state()).isEqualTo(CompletionState.FAILED);
        assertThatThrownBy(() -> handle.future().get())
            .isInstanceOf(ExecutionException.class)
            .hasCauseReference(boom);
    }

    @Test
    void cancel_시_future가_취소로_관찰됨() {
        // given
        CompletionHandle<String> handle = new CompletionHandle<>();
        WorkTimeoutException timeout = new WorkTimeoutException(Duration.ofMillis(100));

        // when
        handle.cancel(timeout);

        // then
        assertThat(handle.state()).isEqualTo(CompletionState.CANCELLED);
        assertThat(handle.future().isCancelled()).isTrue();
        assertThatThrownBy(() -> handle.future().get())
            .isSameAs(timeout);
        assertThatThrownBy(() -> handle.future().join())
            .isInstanceOf(CancellationException.class);
    }

    @Test
    void 첫_번째_전이만_성공하고_이후_전이는_무시됨() {
        // given
        CompletionHandle<String> handle = new CompletionHandle<>();

        // when
        boolean first = handle.cancel(new WorkTimeoutException(Duration.ZERO));
        boolean second = handle.resolve("late");
        boolean third = handle.fail(new RuntimeException("late"));

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(third).isFalse();
        assertThat(handle.state()).isEqualTo(CompletionState.CANCELLED);
        assertThat(handle.future().isCancelled()).isTrue();
    }

    @Test
    void resolve_이후_cancel은_무시됨() {
        // given
        CompletionHandle<Integer> handle = new CompletionHandle<>();
        handle.resolve(42);

        // when
        boolean cancelled = handle.cancel(new WorkTimeoutException(Duration.ofMillis(1)));

        // then
        assertThat(cancelled).isFalse();
        assertThat(handle.future().join()).isEqualTo(42);
    }

    @Test
    void 동시_전이_경쟁에서_정확히_하나만_성공함() throws Exception {
        // given
        int rounds = 200;
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            for (int round = 0; round < rounds; round++) {
                CompletionHandle<String> handle = new CompletionHandle<>();
                CountDownLatch start = new CountDownLatch(1);

                // when: 타이머와 워커가 동시에 전이 시도
                Future<Boolean> timer = pool.submit(() -> {
                    start.await();
                    return handle.cancel(new WorkTimeoutException(Duration.ZERO));
                });
                Future<Boolean> worker = pool.submit(() -> {
                    start.await();
                    return handle.resolve("value");
                });
                start.countDown();

                // then
                boolean timerWon = timer.get(5, TimeUnit.SECONDS);
                boolean workerWon = worker.get(5, TimeUnit.SECONDS);
                assertThat(timerWon ^ workerWon).isTrue();
                assertThat(handle.state())
                    .isEqualTo(timerWon ? CompletionState.CANCELLED : CompletionState.RESOLVED);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void future는_외부에서_완료할_수_없음() {
        // given
        CompletionHandle<String> handle = new CompletionHandle<>();
        CompletableFuture<String> view = handle.future();

        // when & then
        assertThatThrownBy(() -> view.complete("x")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> view.completeExceptionally(new RuntimeException()))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> view.cancel(true)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> view.obtrudeValue("x")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> view.orTimeout(1, TimeUnit.SECONDS))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(handle.state()).isEqualTo(CompletionState.PENDING);
    }

    @Test
    void future에서_파생된_stage는_일반_CompletableFuture임() {
        // given
        CompletionHandle<Integer> handle = new CompletionHandle<>();
        CompletableFuture<Integer> derived = handle.future().thenApply(value -> value * 2);

        // when
        handle.resolve(21);

        // then
        assertThat(derived.join()).isEqualTo(42);
        assertThat(derived.complete(0)).isFalse();
    }

    @Test
    void 완료_콜백은_정확히_한_번_호출됨() {
        // given
        CompletionHandle<String> handle = new CompletionHandle<>();
        List<String> observed = new ArrayList<>();
        handle.future().whenComplete((value, error) -> observed.add(value == null ? "error" : value));

        // when
        handle.resolve("first");
        handle.resolve("second");
        handle.fail(new RuntimeException());

        // then
        assertThat(observed).containsExactly("first");
    }

    @Test
    void fail_null_예외_시_예외_발생() {
        CompletionHandle<String> handle = new CompletionHandle<>();

        assertThatThrownBy(() -> handle.fail(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("error cannot be null");
    }

    @Test
    void cancel_null_사유_시_예외_발생() {
        CompletionHandle<String> handle = new CompletionHandle<>();

        assertThatThrownBy(() -> handle.cancel(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("reason cannot be null");
    }
}
