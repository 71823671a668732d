package com.ryuqq.promise.core.model;

import com.ryuqq.promise.core.statemachine.PromiseStatus;

/**
 * 다른 체인으로 공유되는 종료된 Promise의 스냅샷.
 *
 * @param id Promise 식별자
 * @param status 종료 상태 (RESOLVED 또는 REJECTED)
 * @param value 확정 값
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PromiseSnapshot(
    PromiseId id,
    PromiseStatus status,
    Payload value
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 status가 종료 상태가 아닌 경우
     */
    public PromiseSnapshot {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal (current: " + status + ")");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }
}
