package com.ryuqq.promise.core.statemachine;

import com.ryuqq.promise.core.error.PromiseException;

/**
 * Promise 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RESOLVED</li>
 *   <li>PENDING → REJECTED</li>
 * </ul>
 *
 * <p>종료 상태에서의 전이는 {@link PromiseException}(ALREADY_TERMINAL)로,
 * 그 외 잘못된 목표 상태는 {@link IllegalArgumentException}으로 거부합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusTransition {

    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null이거나 to가 PENDING인 경우
     * @throws PromiseException 이미 종료 상태인 경우 (ALREADY_TERMINAL)
     */
    public static void validate(PromiseStatus from, PromiseStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Statuses cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw PromiseException.alreadyTerminal(
                String.format("Cannot transition from terminal status: %s → %s", from, to));
        }
        if (!to.isTerminal()) {
            throw new IllegalArgumentException(
                String.format("Invalid status transition: %s → %s", from, to));
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static PromiseStatus transition(PromiseStatus current, PromiseStatus next) {
        validate(current, next);
        return next;
    }
}
