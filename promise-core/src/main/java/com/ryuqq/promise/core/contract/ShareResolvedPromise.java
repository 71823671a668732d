package com.ryuqq.promise.core.contract;

import com.ryuqq.promise.core.model.PromiseSnapshot;

/**
 * 종료된 Promise의 상태를 다른 체인으로 복사하는 메시지.
 *
 * @param snapshot 종료 상태 스냅샷
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ShareResolvedPromise(PromiseSnapshot snapshot) implements CrossChainMessage {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException snapshot이 null인 경우
     */
    public ShareResolvedPromise {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
    }
}
