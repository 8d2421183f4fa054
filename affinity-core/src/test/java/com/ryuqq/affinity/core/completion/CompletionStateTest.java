package com.ryuqq.affinity.core.completion;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CompletionState 유닛 테스트.
 *
 * @author Affinity Team
 * @since 1.0.0
 */
class CompletionStateTest {

    @Test
    void PENDING만_종료_상태가_아님() {
        assertThat(CompletionState.PENDING.isTerminal()).isFalse();
        assertThat(CompletionState.RESOLVED.isTerminal()).isTrue();
        assertThat(CompletionState.FAILED.isTerminal()).isTrue();
        assertThat(CompletionState.CANCELLED.isTerminal()).isTrue();
    }

    @Test
    void WorkTimeoutException은_타임아웃_값을_보존함() {
        WorkTimeoutException exception = new WorkTimeoutException(java.time.Duration.ofMillis(250));

        assertThat(exception.getTimeout()).hasMillis(250);
        assertThat(exception).hasMessageContaining("250ms");
    }
}
