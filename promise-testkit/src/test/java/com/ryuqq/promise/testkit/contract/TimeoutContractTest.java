package com.ryuqq.promise.testkit.contract;

import com.ryuqq.promise.core.error.PromiseErrorCode;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.statemachine.PromiseStatus;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract test for timeout promises against a manual clock.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TimeoutContractTest extends AbstractContractTest {

    @Test
    void testTimeout_ResolvableOnlyAfterDeadline() {
        // Given
        PromiseId timeout = chainA.engine().createTimeout(ALICE, 1_000L);
        clock.advanceMillis(999L);

        // When & Then
        assertPromiseError(PromiseErrorCode.NOT_READY, () -> chainA.engine().resolveTimeout(timeout));
        assertStatus(chainA, timeout, PromiseStatus.PENDING);

        clock.advanceMillis(1L);
        chainA.engine().resolveTimeout(timeout);

        assertStatus(chainA, timeout, PromiseStatus.RESOLVED);
        assertEquals(Payload.of(ByteBuffer.allocate(Long.BYTES).putLong(1_000L).array()),
            chainA.engine().value(timeout).orElseThrow());
    }

    @Test
    void testTimeout_AnyoneMayTrigger_OnlyOnce() {
        // Given
        PromiseId timeout = chainA.engine().createTimeout(ALICE, 10L);
        clock.advanceMillis(10L);
        chainA.engine().resolveTimeout(timeout);

        // When & Then
        assertPromiseError(PromiseErrorCode.ALREADY_TERMINAL, () -> chainA.engine().resolveTimeout(timeout));
    }

    @Test
    void testTimeout_CreatorMaySettleEarly() {
        // Given
        PromiseId timeout = chainA.engine().createTimeout(ALICE, 10_000L);

        // When
        chainA.engine().reject(ALICE, timeout, Payload.ofUtf8("cancelled"));

        // Then
        clock.advanceMillis(20_000L);
        assertPromiseError(PromiseErrorCode.ALREADY_TERMINAL, () -> chainA.engine().resolveTimeout(timeout));
    }

    @Test
    void testTimeout_RacesWorkInPromiseAll() {
        // Given: work vs deadline
        PromiseId work = chainA.engine().create(ALICE);
        PromiseId timeout = chainA.engine().createTimeout(ALICE, 500L);
        PromiseId all = chainA.engine().createAll(ALICE, List.of(work, timeout));

        // When
        clock.advanceMillis(500L);
        chainA.engine().resolveTimeout(timeout);

        // Then: still waiting for work
        assertFalse(chainA.engine().checkAll(all).ready());
        chainA.engine().resolve(ALICE, work, Uint256.of(1));
        assertTrue(chainA.engine().checkAll(all).ready());
    }

    @Test
    void testClock_CannotGoBackwards() {
        assertThrows(IllegalArgumentException.class, () -> clock.advanceMillis(-1L));
    }
}
