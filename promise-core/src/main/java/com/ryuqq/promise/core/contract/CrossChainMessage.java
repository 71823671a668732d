package com.ryuqq.promise.core.contract;

/**
 * 체인 간에 교환되는 메시지.
 *
 * <ul>
 *   <li>{@link SetupRemotePromise}: 목적지에 미러 Promise와 콜백을 준비</li>
 *   <li>{@link ExecuteRemoteCallback}: 미러를 resolve 하고 콜백 실행</li>
 *   <li>{@link ShareResolvedPromise}: 종료된 Promise 상태를 복사</li>
 * </ul>
 *
 * <p>같은 (source, destination) 쌍에서 setup은 항상 execute보다 먼저 전송됩니다.
 * 바이트 표현은 {@link CrossChainMessageCodec}이 담당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface CrossChainMessage permits SetupRemotePromise, ExecuteRemoteCallback, ShareResolvedPromise {

    /**
     * 로그용 메시지 종류 이름.
     *
     * @return 종류 이름
     */
    default String kind() {
        return getClass().getSimpleName();
    }
}
