package com.ryuqq.affinity.testkit.contract;

import com.ryuqq.affinity.core.executor.AffinityExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for executor contract tests.
 *
 * <p>Each subclass supplies an {@link AffinityExecutor} implementation and inherits
 * the lifecycle handling and assertion helpers. A fresh executor is created before
 * each test and disposed after it, so no queued work leaks between tests.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractExecutorContractTest {
 *     {@literal @}Override
 *     protected AffinityExecutor createExecutor() {
 *         return new WorkerThreadExecutor(config, DebuggerProbe.never());
 *     }
 *
 *     {@literal @}Test
 *     void testScenario() {
 *         CompletableFuture&lt;Integer&gt; result = executor.execute(() -&gt; 1, DEFAULT_TIMEOUT);
 *         assertEquals(1, await(result));
 *     }
 * }
 * </pre>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public abstract class AbstractExecutorContractTest {

    /**
     * Timeout generous enough that well-behaved work items never hit it.
     */
    protected static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Upper bound for waiting on a single future inside a test.
     */
    protected static final long AWAIT_SECONDS = 5;

    protected AffinityExecutor executor;

    /**
     * Creates the executor under test.
     *
     * @return a new, not yet disposed executor
     */
    protected abstract AffinityExecutor createExecutor();

    @BeforeEach
    void setUpExecutor() {
        executor = createExecutor();
    }

    @AfterEach
    void tearDownExecutor() {
        if (executor != null) {
            executor.dispose(Duration.ofSeconds(2));
        }
    }

    /**
     * Waits for the future and returns its value, failing the test on any error.
     *
     * @param future the future to wait on
     * @param <T> result type
     * @return the resolved value
     */
    protected <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(AWAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for work item", e);
        } catch (ExecutionException e) {
            throw new AssertionError("Work item failed: " + e.getCause(), e.getCause());
        } catch (TimeoutException e) {
            throw new AssertionError("Work item did not complete within " + AWAIT_SECONDS + "s", e);
        }
    }

    /**
     * Asserts that the future fails with the given error instance.
     *
     * @param future the future expected to fail
     * @param expected the exact throwable the producer raised
     */
    protected void assertFailedWith(CompletableFuture<?> future, Throwable expected) {
        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> future.get(AWAIT_SECONDS, TimeUnit.SECONDS),
                "Expected work item to fail with " + expected);
        assertSame(expected, failure.getCause(),
                String.format("Expected cause %s but was %s", expected, failure.getCause()));
    }

    /**
     * Asserts that the future ends cancelled.
     *
     * @param future the future expected to be cancelled
     */
    protected void assertCancelled(CompletableFuture<?> future) {
        assertThrows(CancellationException.class,
                () -> future.get(AWAIT_SECONDS, TimeUnit.SECONDS),
                "Expected work item to be cancelled");
        assertTrue(future.isCancelled(), "Expected isCancelled() to be true");
    }

    /**
     * Sleeps for the specified duration. Used inside producers to occupy the worker.
     *
     * @param millis milliseconds to sleep
     */
    protected static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
