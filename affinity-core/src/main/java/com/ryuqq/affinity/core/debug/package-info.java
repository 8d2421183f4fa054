/**
 * Debug - 디버거 연결 감지 (타임아웃 억제 판단).
 *
 * @author Affinity Team
 * @since 1.0.0
 */
package com.ryuqq.affinity.core.debug;
