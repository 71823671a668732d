package com.ryuqq.promise.core.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Promise의 256비트 불투명 식별자.
 *
 * <p>PromiseId는 한 체인 안에서 Promise를 유일하게 식별하며,
 * 크로스체인 then 등록 시에는 원격 체인과 로컬 프록시가 동일한 값을 공유합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가 (내부 배열은 방어적 복사)</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 불가</li>
 *   <li>길이: 정확히 32바이트</li>
 *   <li>문자열 표현: 0x 접두사 + 64자리 16진수</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PromiseId {

    /**
     * 식별자 길이 (바이트).
     */
    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] value;

    private PromiseId(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("PromiseId cannot be null");
        }
        if (value.length != LENGTH) {
            throw new IllegalArgumentException(
                "PromiseId must be exactly " + LENGTH + " bytes (current: " + value.length + ")");
        }
        this.value = value.clone();
    }

    /**
     * 바이트 배열로 PromiseId 생성.
     *
     * @param value 32바이트 값
     * @return PromiseId 인스턴스
     * @throws IllegalArgumentException null이거나 길이가 32바이트가 아닌 경우
     */
    public static PromiseId of(byte[] value) {
        return new PromiseId(value);
    }

    /**
     * 16진수 문자열로 PromiseId 생성.
     *
     * @param hex 64자리 16진수 (0x 접두사 허용)
     * @return PromiseId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 16진수인 경우
     */
    public static PromiseId fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("PromiseId hex cannot be null or blank");
        }
        String digits = hex.startsWith("0x") ? hex.substring(2) : hex;
        if (digits.length() != LENGTH * 2) {
            throw new IllegalArgumentException(
                "PromiseId hex must have " + (LENGTH * 2) + " digits (current: " + digits.length() + ")");
        }
        try {
            return new PromiseId(HEX.parseHex(digits));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("PromiseId hex contains invalid characters: " + hex, e);
        }
    }

    /**
     * 식별자 바이트 조회 (복사본).
     *
     * @return 32바이트 배열
     */
    public byte[] toByteArray() {
        return value.clone();
    }

    /**
     * 0x 접두사가 붙은 16진수 표현.
     *
     * @return 16진수 문자열
     */
    public String toHex() {
        return "0x" + HEX.formatHex(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PromiseId other = (PromiseId) o;
        return Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "PromiseId{" + toHex().substring(0, 18) + "…}";
    }
}
