package com.ryuqq.promise.core.callback;

import com.ryuqq.promise.core.model.Payload;

/**
 * 콜백이 지정한 payload로 실패했음을 알리는 예외.
 *
 * <p>엔진은 이 payload를 가공 없이 오류 핸들러 입력 또는 continuation의 reject 값으로 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CallbackRevertException extends RuntimeException {

    private final transient Payload payload;

    /**
     * 생성자.
     *
     * @param payload 실패 값
     * @throws IllegalArgumentException payload가 null인 경우
     */
    public CallbackRevertException(Payload payload) {
        super("Callback reverted with " + (payload == null ? "null" : payload.size() + " bytes"));
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        this.payload = payload;
    }

    /**
     * UTF-8 메시지로 생성.
     *
     * @param reason 실패 사유
     * @return CallbackRevertException
     */
    public static CallbackRevertException withReason(String reason) {
        return new CallbackRevertException(Payload.ofUtf8(reason));
    }

    public Payload getPayload() {
        return payload;
    }
}
