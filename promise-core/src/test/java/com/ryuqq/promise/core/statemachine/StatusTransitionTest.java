package com.ryuqq.promise.core.statemachine;

import com.ryuqq.promise.core.error.PromiseErrorCode;
import com.ryuqq.promise.core.error.PromiseException;
import org.junit.jupiter.api.Test;

import static com.ryuqq.promise.core.statemachine.PromiseStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusTransition 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StatusTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_PendingToResolved_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StatusTransition.validate(PENDING, RESOLVED));
    }

    @Test
    void validate_PendingToRejected_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StatusTransition.validate(PENDING, REJECTED));
    }

    @Test
    void transition_ReturnsNextStatus() {
        // When
        PromiseStatus status = StatusTransition.transition(PENDING, RESOLVED);

        // Then
        assertEquals(RESOLVED, status);
        assertTrue(status.isTerminal());
    }

    // ========== 금지된 전이 테스트 ==========

    @Test
    void validate_FromTerminal_ThrowsAlreadyTerminal() {
        for (PromiseStatus from : new PromiseStatus[] {RESOLVED, REJECTED}) {
            for (PromiseStatus to : PromiseStatus.values()) {
                PromiseException exception = assertThrows(
                    PromiseException.class,
                    () -> StatusTransition.validate(from, to)
                );
                assertEquals(PromiseErrorCode.ALREADY_TERMINAL, exception.getErrorCode());
            }
        }
    }

    @Test
    void validate_PendingToPending_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.validate(PENDING, PENDING));
    }

    @Test
    void validate_Null_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.validate(null, RESOLVED));
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.validate(PENDING, null));
    }
}
