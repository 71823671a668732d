package com.ryuqq.promise.core.model;

/**
 * 메신저가 발급하는 크로스체인 메시지 식별자.
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MessageId {

    private final String value;

    private MessageId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MessageId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("MessageId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * MessageId 생성.
     *
     * @param value 식별자 값
     * @return MessageId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static MessageId of(String value) {
        return new MessageId(value);
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageId messageId = (MessageId) o;
        return value.equals(messageId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "MessageId{" + value + '}';
    }
}
