package com.ryuqq.promise.core.model;

/**
 * 독립 실행 환경(체인)의 식별자.
 *
 * <p>각 체인은 자체 Promise 저장소를 가지며, 비동기 메시지로만 다른 체인과 통신합니다.</p>
 *
 * <p><strong>유효성 검증:</strong> 양수만 허용</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ChainId {

    private final long value;

    private ChainId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("ChainId must be positive (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * ChainId 생성.
     *
     * @param value 체인 번호
     * @return ChainId 인스턴스
     * @throws IllegalArgumentException 양수가 아닌 경우
     */
    public static ChainId of(long value) {
        return new ChainId(value);
    }

    /**
     * 체인 번호 조회.
     *
     * @return 체인 번호
     */
    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChainId chainId = (ChainId) o;
        return value == chainId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "ChainId{" + value + '}';
    }
}
