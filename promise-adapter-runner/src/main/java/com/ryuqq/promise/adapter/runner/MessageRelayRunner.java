package com.ryuqq.promise.adapter.runner;

import com.ryuqq.promise.application.engine.CrossChainEndpoint;
import com.ryuqq.promise.application.relay.MessageRelay;
import com.ryuqq.promise.core.contract.RelayEnvelope;
import com.ryuqq.promise.core.error.PromiseErrorCode;
import com.ryuqq.promise.core.error.PromiseException;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.spi.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 크로스체인 메시지 릴레이 구현체.
 *
 * <p>큐에서 봉투를 가져와 목적지 체인의 엔진에 메신저 자격으로 전달합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * dequeue(batchSize) → [Envelope1, Envelope2, ...]
 *   ↓
 * For each Envelope (순서대로):
 *   1. 목적지 엔드포인트 조회 (없으면 DLQ)
 *   2. endpoint.receive(messenger, envelope)
 *   3. 결과 분기:
 *      - 성공 → ack
 *      - UNORDERED → nack (setup 도착 후 재전달)
 *      - 그 외 → DLQ (비활성화 시 ack 후 로그)
 * </pre>
 *
 * <p>봉투는 하나씩 순차 처리합니다. 같은 (출발지, 목적지) 쌍의 전송 순서를 지키기 위해
 * 병렬 처리하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MessageRelayRunner implements MessageRelay {

    private static final Logger log = LoggerFactory.getLogger(MessageRelayRunner.class);

    private final MessageQueue queue;
    private final RelayConfig config;
    private final Map<ChainId, CrossChainEndpoint> endpoints = new ConcurrentHashMap<>();

    /**
     * 생성자 (기본 설정).
     *
     * @param queue 메시지 큐
     */
    public MessageRelayRunner(MessageQueue queue) {
        this(queue, new RelayConfig());
    }

    /**
     * 생성자.
     *
     * @param queue 메시지 큐
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MessageRelayRunner(MessageQueue queue, RelayConfig config) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.queue = queue;
        this.config = config;
    }

    /**
     * 체인의 수신 엔드포인트 등록.
     *
     * @param chainId 체인
     * @param endpoint 그 체인의 엔진
     * @throws IllegalStateException 이미 등록된 체인인 경우
     */
    public void register(ChainId chainId, CrossChainEndpoint endpoint) {
        if (chainId == null) {
            throw new IllegalArgumentException("chainId cannot be null");
        }
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (endpoints.putIfAbsent(chainId, endpoint) != null) {
            throw new IllegalStateException("Endpoint already registered for chain " + chainId.getValue());
        }
    }

    @Override
    public int pump() {
        List<RelayEnvelope> envelopes = queue.dequeue(config.batchSize());
        if (envelopes.isEmpty()) {
            return 0;
        }

        int acked = 0;
        int nacked = 0;
        int failed = 0;
        for (RelayEnvelope envelope : envelopes) {
            switch (deliver(envelope)) {
                case ACKED -> acked++;
                case NACKED -> nacked++;
                case FAILED -> failed++;
            }
        }
        log.info("Relayed batch of {} (acked: {}, nacked: {}, failed: {})",
            envelopes.size(), acked, nacked, failed);
        return acked;
    }

    private Delivery deliver(RelayEnvelope envelope) {
        CrossChainEndpoint endpoint = endpoints.get(envelope.destination());
        if (endpoint == null) {
            fail(envelope, "NO_ENDPOINT: chain " + envelope.destination().getValue());
            return Delivery.FAILED;
        }

        try {
            endpoint.receive(config.messengerAddress(), envelope);
            queue.ack(envelope);
            return Delivery.ACKED;
        } catch (PromiseException e) {
            if (e.getErrorCode() == PromiseErrorCode.UNORDERED) {
                log.debug("Envelope {} arrived out of order, requeueing", envelope.messageId().getValue());
                queue.nack(envelope);
                return Delivery.NACKED;
            }
            fail(envelope, e.getErrorCode().name() + ": " + e.getMessage());
            return Delivery.FAILED;
        } catch (RuntimeException e) {
            fail(envelope, e.getClass().getSimpleName() + ": " + e.getMessage());
            return Delivery.FAILED;
        }
    }

    private void fail(RelayEnvelope envelope, String reason) {
        if (config.deadLetterEnabled()) {
            queue.publishToDeadLetter(envelope, reason);
            return;
        }
        log.error("Dropping envelope {} to chain {}: {}",
            envelope.messageId().getValue(), envelope.destination().getValue(), reason);
        queue.ack(envelope);
    }

    private enum Delivery {
        ACKED,
        NACKED,
        FAILED
    }
}
