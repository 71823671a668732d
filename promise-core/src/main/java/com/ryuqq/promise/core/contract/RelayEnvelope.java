package com.ryuqq.promise.core.contract;

import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.MessageId;
import com.ryuqq.promise.core.model.Payload;

/**
 * 메시지 전송 계층이 운반하는 봉투.
 *
 * <p>body는 전송 계층 입장에서 불투명한 바이트이며, 엔진끼리 주고받는 경우
 * {@link CrossChainMessageCodec}으로 인코딩된 {@link CrossChainMessage}입니다.</p>
 *
 * @param messageId 전송 계층이 부여한 식별자
 * @param source 보낸 체인
 * @param destination 받는 체인
 * @param target 받는 체인에서 메시지를 받을 주소
 * @param body 메시지 본문
 * @param sentAt 전송 시각 (epoch millis)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RelayEnvelope(
    MessageId messageId,
    ChainId source,
    ChainId destination,
    Address target,
    Payload body,
    long sentAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 sentAt이 음수인 경우
     */
    public RelayEnvelope {
        if (messageId == null) {
            throw new IllegalArgumentException("messageId cannot be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (sentAt < 0) {
            throw new IllegalArgumentException("sentAt must be non-negative (current: " + sentAt + ")");
        }
    }
}
