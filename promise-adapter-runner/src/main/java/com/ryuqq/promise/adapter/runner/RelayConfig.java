package com.ryuqq.promise.adapter.runner;

import com.ryuqq.promise.core.model.Address;

/**
 * MessageRelayRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: pump() 한 번에 처리할 봉투 수 (기본 16)</li>
 *   <li>deadLetterEnabled: 전달 실패 봉투를 DLQ로 보낼지 여부 (기본 true, false면 폐기)</li>
 *   <li>messengerAddress: 목적지 엔진 호출 시 사용할 호출자 주소</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param deadLetterEnabled DLQ 사용 여부
 * @param messengerAddress 메신저 주소
 */
public record RelayConfig(int batchSize, boolean deadLetterEnabled, Address messengerAddress) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: batchSize=16, deadLetterEnabled=true, messengerAddress="cross-chain-messenger"</p>
     */
    public RelayConfig() {
        this(16, true, EngineConfig.DEFAULT_MESSENGER_ADDRESS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RelayConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (messengerAddress == null) {
            throw new IllegalArgumentException("messengerAddress cannot be null");
        }
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     *
     * @param batchSize 새로운 배치 크기
     * @return 새 RelayConfig 인스턴스
     */
    public RelayConfig withBatchSize(int batchSize) {
        return new RelayConfig(batchSize, this.deadLetterEnabled, this.messengerAddress);
    }

    public RelayConfig withDeadLetterEnabled(boolean deadLetterEnabled) {
        return new RelayConfig(this.batchSize, deadLetterEnabled, this.messengerAddress);
    }

    public RelayConfig withMessengerAddress(Address messengerAddress) {
        return new RelayConfig(this.batchSize, this.deadLetterEnabled, messengerAddress);
    }
}
