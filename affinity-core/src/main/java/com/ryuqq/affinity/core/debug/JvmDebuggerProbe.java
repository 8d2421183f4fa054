package com.ryuqq.affinity.core.debug;

import java.lang.management.ManagementFactory;
import java.util.List;

/**
 * JVM 시작 인자로 JDWP 에이전트 사용 여부를 판단하는 probe.
 *
 * <p>다음 인자 중 하나가 있으면 디버거가 연결된 것으로 간주합니다:</p>
 * <ul>
 *   <li>{@code -agentlib:jdwp}</li>
 *   <li>{@code -Xrunjdwp}</li>
 *   <li>{@code -Xdebug}</li>
 * </ul>
 *
 * <p>JVM 인자는 실행 중 바뀌지 않으므로 생성 시점에 한 번만 계산합니다.</p>
 *
 * <p><strong>근사 판정:</strong> JDWP 에이전트가 설정되어 있다는 것만 확인하며, 실제로
 * 디버거 클라이언트가 접속했는지는 알 수 없습니다. 예를 들어
 * {@code -agentlib:jdwp=...,server=y,suspend=n}으로 시작한 JVM은 디버거가 접속하지 않아도
 * 수명 내내 타임아웃이 꺼집니다. 이런 환경에서는 시스템 프로퍼티
 * {@value #DETECTION_PROPERTY}{@code =false}로 감지를 끌 수 있습니다.</p>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public final class JvmDebuggerProbe implements DebuggerProbe {

    /**
     * {@code false}이면 JVM 인자와 관계없이 디버거가 없는 것으로 판단.
     */
    public static final String DETECTION_PROPERTY = "affinity.debugger.detect";

    private static final List<String> DEBUG_ARGUMENT_PREFIXES = List.of(
        "-agentlib:jdwp",
        "-Xrunjdwp",
        "-Xdebug"
    );

    private final boolean attached;

    /**
     * 현재 JVM의 입력 인자와 {@value #DETECTION_PROPERTY} 프로퍼티로 생성.
     */
    public JvmDebuggerProbe() {
        this(
            ManagementFactory.getRuntimeMXBean().getInputArguments(),
            Boolean.parseBoolean(System.getProperty(DETECTION_PROPERTY, "true"))
        );
    }

    /**
     * 주어진 JVM 입력 인자로 생성 (감지 활성화).
     *
     * @param inputArguments JVM 입력 인자 목록
     * @throws IllegalArgumentException inputArguments가 null인 경우
     */
    public JvmDebuggerProbe(List<String> inputArguments) {
        this(inputArguments, true);
    }

    /**
     * 주어진 JVM 입력 인자와 감지 여부로 생성.
     *
     * @param inputArguments JVM 입력 인자 목록
     * @param detectionEnabled false이면 항상 디버거가 없는 것으로 판단
     * @throws IllegalArgumentException inputArguments가 null인 경우
     */
    public JvmDebuggerProbe(List<String> inputArguments, boolean detectionEnabled) {
        if (inputArguments == null) {
            throw new IllegalArgumentException("inputArguments cannot be null");
        }
        this.attached = detectionEnabled
            && inputArguments.stream().anyMatch(JvmDebuggerProbe::isDebugArgument);
    }

    private static boolean isDebugArgument(String argument) {
        if (argument == null) {
            return false;
        }
        for (String prefix : DEBUG_ARGUMENT_PREFIXES) {
            if (argument.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isAttached() {
        return attached;
    }
}
