package com.ryuqq.affinity.core.debug;

/**
 * 디버거 연결 여부 감지 SPI.
 *
 * <p>디버거가 연결된 상태에서는 사람이 실행을 멈춰둘 수 있으므로
 * 작업 타임아웃을 적용하지 않습니다. 이 인터페이스는 그 판단을 분리하여
 * 테스트에서 교체할 수 있게 합니다.</p>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DebuggerProbe {

    /**
     * 디버거/트레이서가 연결되어 있는지 확인.
     *
     * @return 연결된 경우 true
     */
    boolean isAttached();

    /**
     * 항상 연결되지 않은 것으로 판단하는 probe.
     *
     * @return DebuggerProbe
     */
    static DebuggerProbe never() {
        return () -> false;
    }

    /**
     * 항상 연결된 것으로 판단하는 probe.
     *
     * @return DebuggerProbe
     */
    static DebuggerProbe always() {
        return () -> true;
    }
}
