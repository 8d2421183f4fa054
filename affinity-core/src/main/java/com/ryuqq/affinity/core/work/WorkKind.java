package com.ryuqq.affinity.core.work;

/**
 * 작업 제출 형태 태그.
 *
 * <p>제출 시점에 호출자가 선택한 오버로드로 결정되며, 실행 시점에 callable을
 * 검사해서 추론하지 않습니다.</p>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
public enum WorkKind {

    /**
     * 값을 직접 반환하는 producer.
     */
    VALUE,

    /**
     * 비동기 stage를 반환하고, 그 stage의 최종 값이 결과가 되는 producer.
     */
    SUSPENDING
}
