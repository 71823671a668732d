package com.ryuqq.promise.core.statemachine;

/**
 * Promise의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → RESOLVED (성공 값 확정)</li>
 *   <li>PENDING → REJECTED (실패 값 확정)</li>
 *   <li><strong>전이는 정확히 한 번 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► RESOLVED
 *    │
 *    └─► REJECTED
 *
 * 금지된 전이:
 * - RESOLVED → * ❌
 * - REJECTED → * ❌
 * - PENDING → PENDING ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum PromiseStatus {

    /**
     * 대기 중 (값 없음).
     */
    PENDING,

    /**
     * 성공 값으로 확정.
     */
    RESOLVED,

    /**
     * 실패 값으로 확정.
     */
    REJECTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return RESOLVED 또는 REJECTED인 경우 true
     */
    public boolean isTerminal() {
        return this != PENDING;
    }
}
