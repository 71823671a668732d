package com.ryuqq.promise.core.contract;

import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.PromiseId;

/**
 * 목적지 체인에 미러 Promise를 만들고 콜백을 바인딩하는 메시지.
 *
 * @param remotePromiseId 목적지에서 만들 미러 식별자
 * @param localProxyId 결과를 돌려받을 출발지 프록시 식별자
 * @param target 목적지에서 호출할 대상
 * @param selector 호출할 핸들러 이름
 * @param registrant 출발지에서 콜백을 등록한 주소
 * @param sourceChain 출발지 체인
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SetupRemotePromise(
    PromiseId remotePromiseId,
    PromiseId localProxyId,
    Address target,
    String selector,
    Address registrant,
    ChainId sourceChain
) implements CrossChainMessage {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 selector가 빈 문자열인 경우
     */
    public SetupRemotePromise {
        if (remotePromiseId == null) {
            throw new IllegalArgumentException("remotePromiseId cannot be null");
        }
        if (localProxyId == null) {
            throw new IllegalArgumentException("localProxyId cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("selector cannot be null or blank");
        }
        if (registrant == null) {
            throw new IllegalArgumentException("registrant cannot be null");
        }
        if (sourceChain == null) {
            throw new IllegalArgumentException("sourceChain cannot be null");
        }
    }
}
