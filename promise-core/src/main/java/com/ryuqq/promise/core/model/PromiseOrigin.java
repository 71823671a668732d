package com.ryuqq.promise.core.model;

/**
 * Promise가 어떤 경로로 이 체인에 존재하게 되었는지를 나타내는 태그.
 *
 * <ul>
 *   <li>{@link LocalOrigin}: 이 체인에서 create/then/createAll로 생성됨</li>
 *   <li>{@link RemoteProxyOrigin}: 크로스체인 then으로 만든 로컬 프록시 (원격 결과 대기)</li>
 *   <li>{@link MirrorOrigin}: 원격 체인의 setup 메시지로 만든 미러</li>
 * </ul>
 *
 * <p>프록시의 대기 여부는 레코드 부재로 추론하지 않고 이 태그와 상태로 판단합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface PromiseOrigin permits LocalOrigin, RemoteProxyOrigin, MirrorOrigin {

    /**
     * 원격 결과를 기다리는 프록시인지 확인.
     *
     * @return RemoteProxyOrigin인 경우 true
     */
    default boolean isRemoteProxy() {
        return this instanceof RemoteProxyOrigin;
    }

    /**
     * 원격 setup으로 만들어진 미러인지 확인.
     *
     * @return MirrorOrigin인 경우 true
     */
    default boolean isMirror() {
        return this instanceof MirrorOrigin;
    }
}
