package com.ryuqq.affinity.adapter.worker;

import com.ryuqq.affinity.core.completion.CompletionState;
import com.ryuqq.affinity.core.completion.WorkTimeoutException;
import com.ryuqq.affinity.core.debug.DebuggerProbe;
import com.ryuqq.affinity.core.work.ValueWorkItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * TimeoutScheduler 유닛 테스트.
 *
 * @author Affinity Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TimeoutSchedulerTest {

    @Mock
    private DebuggerProbe debuggerProbe;

    private TimeoutScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TimeoutScheduler("test-timeout", debuggerProbe);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void 만료되면_handle이_WorkTimeoutException으로_취소됨() {
        // given
        when(debuggerProbe.isAttached()).thenReturn(false);
        ValueWorkItem<String> item = ValueWorkItem.of(() -> "value", Duration.ofMillis(20));

        // when
        scheduler.arm(item);

        // then
        assertThatThrownBy(() -> item.handle().future().get(2, TimeUnit.SECONDS))
            .isInstanceOf(WorkTimeoutException.class)
            .hasMessageContaining("20ms");
        assertThat(item.handle().state()).isEqualTo(CompletionState.CANCELLED);
    }

    @Test
    void 만료_전에_해제하면_취소되지_않음() throws Exception {
        // given
        when(debuggerProbe.isAttached()).thenReturn(false);
        ValueWorkItem<String> item = ValueWorkItem.of(() -> "value", Duration.ofMillis(100));

        // when
        TimeoutScheduler.Disarm timer = scheduler.arm(item);
        boolean disarmed = timer.disarm();
        Thread.sleep(200);

        // then
        assertThat(disarmed).isTrue();
        assertThat(item.handle().state()).isEqualTo(CompletionState.PENDING);
    }

    @Test
    void 이미_완료된_handle은_만료돼도_그대로임() throws Exception {
        // given
        when(debuggerProbe.isAttached()).thenReturn(false);
        ValueWorkItem<String> item = ValueWorkItem.of(() -> "value", Duration.ZERO);
        item.handle().resolve("done");

        // when
        scheduler.arm(item);
        Thread.sleep(50);

        // then
        assertThat(item.handle().state()).isEqualTo(CompletionState.RESOLVED);
        assertThat(item.handle().future().join()).isEqualTo("done");
    }

    @Test
    void 디버거가_연결되어_있으면_타이머를_걸지_않음() throws Exception {
        // given
        when(debuggerProbe.isAttached()).thenReturn(true);
        ValueWorkItem<String> item = ValueWorkItem.of(() -> "value", Duration.ZERO);

        // when
        TimeoutScheduler.Disarm timer = scheduler.arm(item);
        Thread.sleep(50);

        // then
        assertThat(timer.disarm()).isFalse();
        assertThat(item.handle().state()).isEqualTo(CompletionState.PENDING);
        verify(debuggerProbe, times(1)).isAttached();
    }

    @Test
    void 표현_불가능하게_긴_타임아웃도_예외없이_걸림() {
        // given
        when(debuggerProbe.isAttached()).thenReturn(false);
        ValueWorkItem<String> item = ValueWorkItem.of(() -> "value", ChronoUnit.FOREVER.getDuration());

        // when
        TimeoutScheduler.Disarm timer = scheduler.arm(item);

        // then
        assertThat(timer.disarm()).isTrue();
        assertThat(item.handle().state()).isEqualTo(CompletionState.PENDING);
    }

    @Test
    void null_probe로_생성_시_예외_발생() {
        assertThatThrownBy(() -> new TimeoutScheduler("bad", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("debuggerProbe");
    }
}
