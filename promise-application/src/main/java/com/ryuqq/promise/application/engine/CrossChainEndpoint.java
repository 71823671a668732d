package com.ryuqq.promise.application.engine;

import com.ryuqq.promise.core.contract.ExecuteRemoteCallback;
import com.ryuqq.promise.core.contract.RelayEnvelope;
import com.ryuqq.promise.core.contract.SetupRemotePromise;
import com.ryuqq.promise.core.contract.ShareResolvedPromise;
import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;

/**
 * 메신저만 호출할 수 있는 엔진 진입점.
 *
 * <p>모든 메서드는 caller가 설정된 메신저 주소가 아니면
 * {@link com.ryuqq.promise.core.error.PromiseException}(UNAUTHORIZED)를 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CrossChainEndpoint {

    /**
     * 미러 Promise 생성 및 콜백 바인딩. 같은 미러에 대한 중복 setup은 무시됩니다.
     */
    void setupRemotePromise(Address caller, SetupRemotePromise message);

    /**
     * 미러 resolve 후 바인딩된 콜백 실행.
     *
     * @throws com.ryuqq.promise.core.error.PromiseException setup 전이면 UNORDERED
     */
    void executeRemoteCallback(Address caller, ExecuteRemoteCallback message);

    /**
     * 종료 스냅샷을 로컬 저장소에 반영.
     *
     * <p>처음 보는 id는 스냅샷 상태의 미러로 새로 기록합니다. 기존 레코드는 sourceChain을
     * 목적지로 둔 프록시일 때만 settle 합니다.</p>
     *
     * @param caller 메신저
     * @param sourceChain 스냅샷을 보낸 체인
     * @param message 공유 메시지
     * @throws com.ryuqq.promise.core.error.PromiseException 그 외 기존 레코드면 UNAUTHORIZED,
     *         대상이 이미 종료면 ALREADY_TERMINAL
     */
    void shareResolvedPromise(Address caller, ChainId sourceChain, ShareResolvedPromise message);

    /**
     * 봉투를 디코딩해 위 세 진입점 중 하나로 전달.
     *
     * @throws IllegalArgumentException 본문 형식이 잘못되었거나 목적지가 이 체인이 아닌 경우
     */
    void receive(Address caller, RelayEnvelope envelope);
}
