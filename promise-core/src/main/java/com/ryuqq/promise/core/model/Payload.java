package com.ryuqq.promise.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Promise 값, 콜백 입력/출력, 메시지 본문으로 쓰이는 불투명 바이너리 데이터.
 *
 * <p>엔진은 Payload의 내용을 해석하지 않습니다. 인코딩 형식은 사용자가 선택합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>UTF-8 문자열: Payload.ofUtf8("ok")</li>
 *   <li>임의 바이트: Payload.of(new byte[] {0x01, 0x02})</li>
 *   <li>빈 Payload: Payload.empty()</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 시와 조회 시 모두 방어적 복사</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(new byte[0]);

    private final byte[] value;

    private Payload(byte[] value) {
        this.value = value;
    }

    /**
     * Payload 생성.
     *
     * @param value 바이트 배열
     * @return Payload 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Payload of(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("Payload bytes cannot be null");
        }
        return new Payload(value.clone());
    }

    /**
     * UTF-8 문자열로 Payload 생성.
     *
     * @param text 문자열
     * @return Payload 인스턴스
     * @throws IllegalArgumentException text가 null인 경우
     */
    public static Payload ofUtf8(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Payload text cannot be null");
        }
        return new Payload(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 빈 Payload.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * 바이트 조회 (복사본).
     *
     * @return 바이트 배열
     */
    public byte[] toByteArray() {
        return value.clone();
    }

    /**
     * UTF-8 문자열로 해석.
     *
     * @return 문자열
     */
    public String asUtf8() {
        return new String(value, StandardCharsets.UTF_8);
    }

    /**
     * 바이트 길이.
     *
     * @return 길이
     */
    public int size() {
        return value.length;
    }

    /**
     * Payload가 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return value.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return Arrays.equals(value, payload.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "Payload{" + value.length + " bytes}";
    }
}
