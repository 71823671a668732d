package com.ryuqq.promise.adapter.runner;

import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;

/**
 * Promise 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>chainId: 엔진이 배포된 체인</li>
 *   <li>engineAddress: 엔진 주소 (기본 "promise-engine"). 결정적 배포로 모든 체인에서 같아야 함</li>
 *   <li>messengerAddress: 메신저 전용 진입점을 호출할 수 있는 주소 (기본 "cross-chain-messenger")</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param chainId 체인 식별자
 * @param engineAddress 엔진 주소
 * @param messengerAddress 메신저 주소
 */
public record EngineConfig(ChainId chainId, Address engineAddress, Address messengerAddress) {

    public static final Address DEFAULT_ENGINE_ADDRESS = Address.of("promise-engine");
    public static final Address DEFAULT_MESSENGER_ADDRESS = Address.of("cross-chain-messenger");

    /**
     * 기본 주소를 사용하는 생성자.
     *
     * @param chainId 체인 식별자
     */
    public EngineConfig(ChainId chainId) {
        this(chainId, DEFAULT_ENGINE_ADDRESS, DEFAULT_MESSENGER_ADDRESS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineConfig {
        if (chainId == null) {
            throw new IllegalArgumentException("chainId cannot be null");
        }
        if (engineAddress == null) {
            throw new IllegalArgumentException("engineAddress cannot be null");
        }
        if (messengerAddress == null) {
            throw new IllegalArgumentException("messengerAddress cannot be null");
        }
        if (engineAddress.equals(messengerAddress)) {
            throw new IllegalArgumentException(
                "engineAddress and messengerAddress must differ (current: " + engineAddress.getValue() + ")"
            );
        }
    }

    /**
     * engineAddress만 변경한 새 인스턴스 생성.
     *
     * @param engineAddress 새로운 엔진 주소
     * @return 새 EngineConfig 인스턴스
     */
    public EngineConfig withEngineAddress(Address engineAddress) {
        return new EngineConfig(this.chainId, engineAddress, this.messengerAddress);
    }

    /**
     * messengerAddress만 변경한 새 인스턴스 생성.
     *
     * @param messengerAddress 새로운 메신저 주소
     * @return 새 EngineConfig 인스턴스
     */
    public EngineConfig withMessengerAddress(Address messengerAddress) {
        return new EngineConfig(this.chainId, this.engineAddress, messengerAddress);
    }
}
