package com.ryuqq.promise.core.model;

/**
 * 호출 주체(principal) 또는 콜백 대상 컴포넌트의 주소.
 *
 * <p>결정적 배포(deterministic deployment)를 전제로 하므로, 같은 논리 컴포넌트는
 * 모든 체인에서 같은 Address를 가집니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.), 콜론(:)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Address {

    private final String value;

    private Address(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Address cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("Address length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.:]+$")) {
            throw new IllegalArgumentException(
                "Address contains invalid characters. Only alphanumeric, hyphen, underscore, dot and colon are allowed");
        }
        this.value = value;
    }

    /**
     * Address 생성.
     *
     * @param value 주소 값
     * @return Address 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Address of(String value) {
        return new Address(value);
    }

    /**
     * 주소 값 조회.
     *
     * @return 주소 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Address address = (Address) o;
        return value.equals(address.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Address{" + value + '}';
    }
}
