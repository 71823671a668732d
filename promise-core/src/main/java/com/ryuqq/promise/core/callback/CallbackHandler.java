package com.ryuqq.promise.core.callback;

import com.ryuqq.promise.core.model.Payload;

/**
 * selector 하나에 바인딩되는 콜백 함수.
 *
 * <p>정상 반환은 continuation을 resolve 하고, 예외는 콜백 실패로 처리됩니다.
 * 특정 payload로 reject 하려면 {@link CallbackRevertException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CallbackHandler {

    /**
     * 콜백 실행.
     *
     * @param value 부모 Promise 값
     * @param context 인증 컨텍스트
     * @return 결과
     */
    CallbackResult handle(Payload value, CallbackContext context);
}
