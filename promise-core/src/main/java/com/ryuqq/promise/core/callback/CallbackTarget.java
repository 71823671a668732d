package com.ryuqq.promise.core.callback;

import com.ryuqq.promise.core.model.Payload;

/**
 * 콜백을 받는 컴포넌트.
 *
 * <p>결정적 배포를 전제로 같은 Address에는 모든 체인에서 같은 컴포넌트가 배포됩니다.
 * 엔진은 {@link com.ryuqq.promise.core.spi.CallbackTargets}로 대상을 찾고
 * selector로 호출합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CallbackTarget {

    /**
     * selector에 해당하는 핸들러 호출.
     *
     * @param selector 핸들러 이름
     * @param value 입력 값
     * @param context 인증 컨텍스트
     * @return 결과
     * @throws CallbackRevertException 지정한 payload로 실패하는 경우
     * @throws IllegalArgumentException 알 수 없는 selector인 경우
     */
    CallbackResult invoke(String selector, Payload value, CallbackContext context);
}
