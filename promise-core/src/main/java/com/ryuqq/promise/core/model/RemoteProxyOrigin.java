package com.ryuqq.promise.core.model;

/**
 * 크로스체인 then 등록으로 만들어진 로컬 프록시.
 *
 * <p>원격 체인의 콜백이 끝나고 share 메시지가 돌아오면 settle 됩니다.</p>
 *
 * @param remoteChain 콜백이 실행될 목적지 체인
 * @param remoteId 목적지 체인에서의 Promise 식별자
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RemoteProxyOrigin(
    ChainId remoteChain,
    PromiseId remoteId
) implements PromiseOrigin {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public RemoteProxyOrigin {
        if (remoteChain == null) {
            throw new IllegalArgumentException("remoteChain cannot be null");
        }
        if (remoteId == null) {
            throw new IllegalArgumentException("remoteId cannot be null");
        }
    }
}
