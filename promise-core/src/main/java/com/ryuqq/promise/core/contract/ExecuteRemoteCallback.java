package com.ryuqq.promise.core.contract;

import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.PromiseId;

/**
 * 미러 Promise를 resolve 하고 바인딩된 콜백을 실행하는 메시지.
 *
 * @param remotePromiseId 미러 식별자
 * @param value 출발지 부모 Promise의 resolve 값
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecuteRemoteCallback(
    PromiseId remotePromiseId,
    Payload value
) implements CrossChainMessage {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public ExecuteRemoteCallback {
        if (remotePromiseId == null) {
            throw new IllegalArgumentException("remotePromiseId cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }
}
