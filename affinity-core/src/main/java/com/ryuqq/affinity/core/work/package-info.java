/**
 * Work - 워커에게 전달되는 작업 단위.
 *
 * <p>{@link com.ryuqq.affinity.core.work.WorkItem}은 제출 형태(VALUE, SUSPENDING)를
 * 타입으로 고정한 sealed interface입니다.</p>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
package com.ryuqq.affinity.core.work;
