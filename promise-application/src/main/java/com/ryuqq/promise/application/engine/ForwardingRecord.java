package com.ryuqq.promise.application.engine;

import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.PromiseId;

/**
 * 크로스체인 then 등록 한 건의 전달 기록.
 *
 * <p>로컬 프록시가 원격 결과로 settle 되면 비활성화됩니다.</p>
 *
 * @param sourcePromiseId 로컬 부모 Promise
 * @param destination 목적지 체인
 * @param remotePromiseId 목적지에서의 미러 식별자
 * @param localProxyId 결과를 받을 로컬 프록시
 * @param active 아직 결과를 기다리는지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ForwardingRecord(
    PromiseId sourcePromiseId,
    ChainId destination,
    PromiseId remotePromiseId,
    PromiseId localProxyId,
    boolean active
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public ForwardingRecord {
        if (sourcePromiseId == null) {
            throw new IllegalArgumentException("sourcePromiseId cannot be null");
        }
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
        if (remotePromiseId == null) {
            throw new IllegalArgumentException("remotePromiseId cannot be null");
        }
        if (localProxyId == null) {
            throw new IllegalArgumentException("localProxyId cannot be null");
        }
    }

    /**
     * 비활성화된 사본.
     *
     * @return active=false 인 ForwardingRecord
     */
    public ForwardingRecord deactivate() {
        return new ForwardingRecord(sourcePromiseId, destination, remotePromiseId, localProxyId, false);
    }
}
