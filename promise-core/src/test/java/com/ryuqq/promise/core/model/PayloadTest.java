package com.ryuqq.promise.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payload 및 Payloads 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PayloadTest {

    @Test
    void ofUtf8_RoundTripsText() {
        // When
        Payload payload = Payload.ofUtf8("안녕 ok");

        // Then
        assertEquals("안녕 ok", payload.asUtf8());
        assertFalse(payload.isEmpty());
    }

    @Test
    void of_Null_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Payload.of(null));
        assertThrows(IllegalArgumentException.class, () -> Payload.ofUtf8(null));
    }

    @Test
    void toByteArray_ReturnsCopy() {
        // Given
        Payload payload = Payload.of(new byte[] {1, 2, 3});

        // When
        byte[] copy = payload.toByteArray();
        copy[0] = 9;

        // Then
        assertArrayEquals(new byte[] {1, 2, 3}, payload.toByteArray());
    }

    @Test
    void empty_HasZeroSize() {
        // Then
        assertTrue(Payload.empty().isEmpty());
        assertEquals(0, Payload.empty().size());
        assertEquals(Payload.of(new byte[0]), Payload.empty());
    }

    @Test
    void pack_PreservesOrderAndEmptyItems() {
        // Given
        List<Payload> items = List.of(Payload.ofUtf8("b"), Payload.empty(), Payload.ofUtf8("a"));

        // When
        List<Payload> unpacked = Payloads.unpack(Payloads.pack(items));

        // Then
        assertEquals(items, unpacked);
    }

    @Test
    void pack_EmptyList_IsFourBytes() {
        // When
        Payload packed = Payloads.pack(List.of());

        // Then
        assertEquals(4, packed.size());
        assertTrue(Payloads.unpack(packed).isEmpty());
    }

    @Test
    void unpack_Truncated_ThrowsException() {
        // Given
        byte[] bytes = Payloads.pack(List.of(Payload.ofUtf8("hello"))).toByteArray();
        byte[] truncated = java.util.Arrays.copyOf(bytes, bytes.length - 2);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Payloads.unpack(Payload.of(truncated)));
    }

    @Test
    void unpack_TrailingBytes_ThrowsException() {
        // Given
        byte[] bytes = Payloads.pack(List.of()).toByteArray();
        byte[] padded = java.util.Arrays.copyOf(bytes, bytes.length + 1);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Payloads.unpack(Payload.of(padded))
        );
        assertTrue(exception.getMessage().contains("trailing"));
    }
}
