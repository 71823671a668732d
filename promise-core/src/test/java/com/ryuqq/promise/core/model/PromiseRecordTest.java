package com.ryuqq.promise.core.model;

import com.ryuqq.promise.core.error.PromiseErrorCode;
import com.ryuqq.promise.core.error.PromiseException;
import com.ryuqq.promise.core.statemachine.PromiseStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PromiseRecord 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PromiseRecordTest {

    private static final PromiseId ID = PromiseIds.forCreate(ChainId.of(1L), Address.of("alice"), 0);

    @Test
    void pending_HasNoValue() {
        // When
        PromiseRecord record = PromiseRecord.pending(ID, Address.of("alice"), LocalOrigin.instance());

        // Then
        assertTrue(record.isPending());
        assertTrue(record.valueIfSettled().isEmpty());
        assertTrue(record.deadline().isEmpty());
    }

    @Test
    void settle_FromPending_SetsStatusAndValue() {
        // Given
        PromiseRecord record = PromiseRecord.pending(ID, Address.of("alice"), LocalOrigin.instance());

        // When
        PromiseRecord settled = record.settle(PromiseStatus.RESOLVED, Payload.ofUtf8("ok"));

        // Then
        assertEquals(PromiseStatus.RESOLVED, settled.status());
        assertEquals(Payload.ofUtf8("ok"), settled.value());
        assertTrue(record.isPending(), "original record must stay unchanged");
    }

    @Test
    void settle_Twice_ThrowsAlreadyTerminal() {
        // Given
        PromiseRecord settled = PromiseRecord.pending(ID, Address.of("alice"), LocalOrigin.instance())
            .settle(PromiseStatus.REJECTED, Payload.ofUtf8("boom"));

        // When & Then
        PromiseException exception = assertThrows(
            PromiseException.class,
            () -> settled.settle(PromiseStatus.RESOLVED, Payload.ofUtf8("ok"))
        );
        assertEquals(PromiseErrorCode.ALREADY_TERMINAL, exception.getErrorCode());
    }

    @Test
    void constructor_ValueWhilePending_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new PromiseRecord(
            ID, PromiseStatus.PENDING, Payload.empty(), Address.of("alice"), LocalOrigin.instance(), 0L, null));
    }

    @Test
    void toSnapshot_Pending_ThrowsException() {
        // Given
        PromiseRecord record = PromiseRecord.pending(ID, Address.of("alice"), LocalOrigin.instance());

        // When & Then
        assertThrows(IllegalStateException.class, record::toSnapshot);
    }

    @Test
    void withNextNonce_KeepsOtherFields() {
        // Given
        PromiseRecord record = PromiseRecord.pendingWithDeadline(ID, Address.of("alice"), 500L);

        // When
        PromiseRecord updated = record.withNextNonce(3L);

        // Then
        assertEquals(3L, updated.nextNonce());
        assertEquals(500L, updated.deadline().orElseThrow());
        assertEquals(record.origin(), updated.origin());
    }

    @Test
    void origin_Tags_AreDistinguishable() {
        // Given
        PromiseOrigin proxy = new RemoteProxyOrigin(ChainId.of(2L), ID);
        PromiseOrigin mirror = new MirrorOrigin(ChainId.of(1L));

        // Then
        assertTrue(proxy.isRemoteProxy());
        assertFalse(proxy.isMirror());
        assertTrue(mirror.isMirror());
        assertFalse(LocalOrigin.instance().isRemoteProxy());
    }
}
