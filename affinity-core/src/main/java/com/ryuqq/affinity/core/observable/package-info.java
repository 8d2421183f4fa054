/**
 * Observable - 실행자 관측 데코레이터.
 *
 * <ul>
 *   <li>{@link com.ryuqq.affinity.core.observable.ObservableExecutor} - 제출 횟수 카운팅</li>
 *   <li>{@link com.ryuqq.affinity.core.observable.SubmissionCounter} - AtomicLong 기반 카운터</li>
 * </ul>
 *
 * @author Affinity Team
 * @since 1.0.0
 */
package com.ryuqq.affinity.core.observable;
