package com.ryuqq.promise.adapter.runner;

import com.ryuqq.promise.application.engine.ForwardingRecord;
import com.ryuqq.promise.core.callback.CallbackDescriptor;
import com.ryuqq.promise.core.contract.CrossChainMessage;
import com.ryuqq.promise.core.contract.CrossChainMessageCodec;
import com.ryuqq.promise.core.contract.ExecuteRemoteCallback;
import com.ryuqq.promise.core.contract.SetupRemotePromise;
import com.ryuqq.promise.core.contract.ShareResolvedPromise;
import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.MessageId;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.model.PromiseRecord;
import com.ryuqq.promise.core.model.PromiseSnapshot;
import com.ryuqq.promise.core.spi.Messenger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 크로스체인 then의 전송과 반환 경로 관리.
 *
 * <p><strong>출발지 체인:</strong></p>
 * <pre>
 * then(parent, dest, target, selector) → proxy (PENDING, ForwardingRecord active)
 * parent RESOLVED + executePromiseCallbacks(parent)
 *   → send SetupRemotePromise     (1)
 *   → send ExecuteRemoteCallback  (2)   같은 (source, dest) 쌍, 항상 이 순서
 * ShareResolvedPromise 수신 → proxy settle → ForwardingRecord 비활성화
 * </pre>
 *
 * <p><strong>목적지 체인:</strong></p>
 * <pre>
 * setup 수신 → mirror + continuation + 반환 경로(continuation → source, proxy)
 * continuation settle → send ShareResolvedPromise(proxy, status, value) 한 번
 * </pre>
 *
 * <p>수신 측 엔진 주소는 결정적 배포로 이 엔진의 주소와 같습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class CrossChainForwarder {

    private static final Logger log = LoggerFactory.getLogger(CrossChainForwarder.class);

    private final ChainId chainId;
    private final Address engineAddress;
    private final Messenger messenger;
    private final Map<PromiseId, ForwardingRecord> forwardings = new HashMap<>();
    private final Map<PromiseId, ReturnRoute> returnRoutes = new HashMap<>();

    CrossChainForwarder(ChainId chainId, Address engineAddress, Messenger messenger) {
        if (chainId == null) {
            throw new IllegalArgumentException("chainId cannot be null");
        }
        if (engineAddress == null) {
            throw new IllegalArgumentException("engineAddress cannot be null");
        }
        if (messenger == null) {
            throw new IllegalArgumentException("messenger cannot be null");
        }
        this.chainId = chainId;
        this.engineAddress = engineAddress;
        this.messenger = messenger;
    }

    /**
     * 크로스체인 then 등록 기록.
     */
    void track(ForwardingRecord record) {
        forwardings.put(record.localProxyId(), record);
    }

    Optional<ForwardingRecord> forwarding(PromiseId localProxyId) {
        return Optional.ofNullable(forwardings.get(localProxyId));
    }

    /**
     * resolve 된 부모 값을 목적지로 전달 (setup 후 execute).
     *
     * @param descriptor FORWARD 디스크립터
     * @param value 부모 값
     */
    void forward(CallbackDescriptor descriptor, Payload value) {
        ChainId destination = descriptor.destinationIfForward()
            .orElseThrow(() -> new IllegalArgumentException("Not a FORWARD descriptor: " + descriptor.kind()));
        PromiseId remoteId = descriptor.continuationId();

        SetupRemotePromise setup = new SetupRemotePromise(
            remoteId,
            descriptor.continuationId(),
            descriptor.target(),
            descriptor.successSelector(),
            descriptor.registrant(),
            descriptor.sourceChain());
        MessageId setupId = send(destination, setup);
        MessageId executeId = send(destination, new ExecuteRemoteCallback(remoteId, value));

        log.info("Forwarded {} to chain {} (setup {}, execute {})",
            remoteId, destination.getValue(), setupId, executeId);
    }

    /**
     * 종료된 Promise 스냅샷 전송.
     */
    MessageId share(PromiseSnapshot snapshot, ChainId destination) {
        MessageId messageId = send(destination, new ShareResolvedPromise(snapshot));
        log.info("Shared {} ({}) with chain {} as {}",
            snapshot.id(), snapshot.status(), destination.getValue(), messageId);
        return messageId;
    }

    /**
     * 미러 콜백의 continuation이 settle 되면 결과를 돌려보낼 경로 등록.
     */
    void addReturnRoute(PromiseId continuationId, ChainId sourceChain, PromiseId localProxyId) {
        returnRoutes.put(continuationId, new ReturnRoute(sourceChain, localProxyId));
    }

    /**
     * settle 알림.
     *
     * <ul>
     *   <li>로컬 프록시 → ForwardingRecord 비활성화</li>
     *   <li>미러 콜백 continuation → 출발지로 결과 공유 (한 번만)</li>
     * </ul>
     *
     * @param settled settle 된 레코드
     */
    void onSettled(PromiseRecord settled) {
        ForwardingRecord forwarding = forwardings.get(settled.id());
        if (forwarding != null && forwarding.active()) {
            forwardings.put(settled.id(), forwarding.deactivate());
            log.debug("Forwarding for proxy {} completed with {}", settled.id(), settled.status());
        }

        ReturnRoute route = returnRoutes.remove(settled.id());
        if (route != null) {
            share(new PromiseSnapshot(route.localProxyId(), settled.status(), settled.value()), route.sourceChain());
        }
    }

    private MessageId send(ChainId destination, CrossChainMessage message) {
        if (destination.equals(chainId)) {
            throw new IllegalArgumentException("Cannot send " + message.kind() + " to the local chain " + chainId.getValue());
        }
        return messenger.send(destination, engineAddress, CrossChainMessageCodec.encode(message));
    }

    private static final class ReturnRoute {
        private final ChainId sourceChain;
        private final PromiseId localProxyId;

        ReturnRoute(ChainId sourceChain, PromiseId localProxyId) {
            this.sourceChain = sourceChain;
            this.localProxyId = localProxyId;
        }

        ChainId sourceChain() {
            return sourceChain;
        }

        PromiseId localProxyId() {
            return localProxyId;
        }
    }
}
