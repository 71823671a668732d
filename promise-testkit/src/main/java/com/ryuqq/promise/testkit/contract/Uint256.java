package com.ryuqq.promise.testkit.contract;

import com.ryuqq.promise.core.model.Payload;

import java.math.BigInteger;

/**
 * 32-byte big-endian unsigned integer payloads.
 *
 * <p>Contract tests exchange numbers in this encoding so that values survive the
 * cross-chain codec unchanged and compare byte for byte.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Uint256 {

    static final int SIZE = 32;
    private static final BigInteger MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Uint256() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Encodes a non-negative number.
     *
     * @param value value in [0, 2^256)
     * @return 32-byte payload
     * @throws IllegalArgumentException if value is out of range
     */
    public static Payload of(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (value.signum() < 0 || value.compareTo(MAX) > 0) {
            throw new IllegalArgumentException("value out of uint256 range: " + value);
        }
        byte[] raw = value.toByteArray();
        byte[] word = new byte[SIZE];
        int length = Math.min(raw.length, SIZE);
        System.arraycopy(raw, raw.length - length, word, SIZE - length, length);
        return Payload.of(word);
    }

    public static Payload of(long value) {
        return of(BigInteger.valueOf(value));
    }

    /**
     * Decodes a 32-byte payload.
     *
     * @param payload payload produced by {@link #of(BigInteger)}
     * @return decoded value
     * @throws IllegalArgumentException if the payload is not exactly 32 bytes
     */
    public static BigInteger decode(Payload payload) {
        if (payload == null || payload.size() != SIZE) {
            throw new IllegalArgumentException("uint256 payload must be " + SIZE + " bytes (current: "
                + (payload == null ? "null" : payload.size()) + ")");
        }
        return new BigInteger(1, payload.toByteArray());
    }

    public static long decodeLong(Payload payload) {
        return decode(payload).longValueExact();
    }
}
