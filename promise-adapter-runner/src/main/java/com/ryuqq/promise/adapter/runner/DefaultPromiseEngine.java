package com.ryuqq.promise.adapter.runner;

import com.ryuqq.promise.application.engine.AllStatus;
import com.ryuqq.promise.application.engine.AtomicState;
import com.ryuqq.promise.application.engine.CrossChainEndpoint;
import com.ryuqq.promise.application.engine.ForwardingRecord;
import com.ryuqq.promise.application.engine.PromiseEngine;
import com.ryuqq.promise.core.callback.CallbackContext;
import com.ryuqq.promise.core.callback.CallbackDescriptor;
import com.ryuqq.promise.core.contract.CrossChainMessage;
import com.ryuqq.promise.core.contract.CrossChainMessageCodec;
import com.ryuqq.promise.core.contract.ExecuteRemoteCallback;
import com.ryuqq.promise.core.contract.RelayEnvelope;
import com.ryuqq.promise.core.contract.SetupRemotePromise;
import com.ryuqq.promise.core.contract.ShareResolvedPromise;
import com.ryuqq.promise.core.error.PromiseException;
import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.LocalOrigin;
import com.ryuqq.promise.core.model.MessageId;
import com.ryuqq.promise.core.model.MirrorOrigin;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.model.PromiseIds;
import com.ryuqq.promise.core.model.PromiseRecord;
import com.ryuqq.promise.core.model.PromiseSnapshot;
import com.ryuqq.promise.core.model.RemoteProxyOrigin;
import com.ryuqq.promise.core.spi.CallbackRegistry;
import com.ryuqq.promise.core.spi.CallbackTargets;
import com.ryuqq.promise.core.spi.Messenger;
import com.ryuqq.promise.core.spi.MonotonicClock;
import com.ryuqq.promise.core.spi.PromiseStore;
import com.ryuqq.promise.core.statemachine.PromiseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;

/**
 * 체인 하나의 Promise 엔진 구현.
 *
 * <p>체인은 트랜잭션을 순차적으로 실행하므로 이 클래스는 스레드 안전하지 않습니다.
 * 하나의 엔진은 한 번에 하나의 호출자(테스트 하니스 또는 릴레이)가 구동합니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>{@link CallbackExecutor}: 디스크립터 실행 및 continuation settle</li>
 *   <li>{@link CrossChainForwarder}: setup/execute/share 전송 및 반환 경로</li>
 *   <li>{@link AtomicCoordinator}: 자식 Promise 대기</li>
 *   <li>{@link PromiseAllAggregator}: Promise.all</li>
 * </ul>
 *
 * <p>모든 상태 전이는 {@link #settle(PromiseId, PromiseStatus, Payload)}를 거치며,
 * 그 뒤에 전달자와 조정자에게 알립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefaultPromiseEngine implements PromiseEngine, CrossChainEndpoint {

    private static final Logger log = LoggerFactory.getLogger(DefaultPromiseEngine.class);

    private final EngineConfig config;
    private final PromiseStore store;
    private final CallbackRegistry registry;
    private final MonotonicClock clock;
    private final CallbackAuthContext authContext = new CallbackAuthContext();
    private final CrossChainForwarder forwarder;
    private final AtomicCoordinator coordinator;
    private final PromiseAllAggregator aggregator;
    private final CallbackExecutor executor;

    private long createNonce;
    private long allNonce;

    /**
     * 생성자.
     *
     * @param config 체인 및 주소 설정
     * @param store Promise 저장소
     * @param registry 콜백 레지스트리
     * @param targets 배포된 콜백 대상
     * @param messenger 이 체인의 크로스체인 메신저
     * @param clock 타임아웃 기준 시계
     */
    public DefaultPromiseEngine(
        EngineConfig config,
        PromiseStore store,
        CallbackRegistry registry,
        CallbackTargets targets,
        Messenger messenger,
        MonotonicClock clock
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (targets == null) {
            throw new IllegalArgumentException("targets cannot be null");
        }
        if (messenger == null) {
            throw new IllegalArgumentException("messenger cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.store = store;
        this.registry = registry;
        this.clock = clock;
        this.forwarder = new CrossChainForwarder(config.chainId(), config.engineAddress(), messenger);
        this.coordinator = new AtomicCoordinator(store, this::settle);
        this.aggregator = new PromiseAllAggregator(store, this::settle);
        this.executor = new CallbackExecutor(
            config.chainId(), registry, targets, authContext, coordinator, forwarder, this::settle);
    }

    @Override
    public ChainId chainId() {
        return config.chainId();
    }

    @Override
    public Address address() {
        return config.engineAddress();
    }

    // ========== 생성 및 전이 ==========

    @Override
    public PromiseId create(Address caller) {
        requireCaller(caller);
        PromiseId id = PromiseIds.forCreate(config.chainId(), caller, createNonce++);
        store.insert(PromiseRecord.pending(id, caller, LocalOrigin.instance()));
        log.debug("Created {} for {}", id, caller);
        return id;
    }

    @Override
    public PromiseId createTimeout(Address caller, long deadlineMillis) {
        requireCaller(caller);
        PromiseId id = PromiseIds.forCreate(config.chainId(), caller, createNonce++);
        store.insert(PromiseRecord.pendingWithDeadline(id, caller, deadlineMillis));
        log.debug("Created timeout {} for {} (deadline {})", id, caller, deadlineMillis);
        return id;
    }

    @Override
    public void resolve(Address caller, PromiseId id, Payload value) {
        settleAsCreator(caller, id, PromiseStatus.RESOLVED, value);
    }

    @Override
    public void reject(Address caller, PromiseId id, Payload value) {
        settleAsCreator(caller, id, PromiseStatus.REJECTED, value);
    }

    @Override
    public void resolveTimeout(PromiseId id) {
        PromiseRecord record = store.get(id);
        long deadline = record.deadline()
            .orElseThrow(() -> new IllegalArgumentException("Not a timeout promise: " + id));
        if (!record.isPending()) {
            throw PromiseException.alreadyTerminal("Timeout already settled: " + id);
        }
        long now = clock.nowMillis();
        if (now < deadline) {
            throw PromiseException.notReady("Deadline not reached (now: " + now + ", deadline: " + deadline + ")");
        }
        settle(id, PromiseStatus.RESOLVED, Payload.of(ByteBuffer.allocate(Long.BYTES).putLong(deadline).array()));
    }

    // ========== 조회 ==========

    @Override
    public PromiseStatus status(PromiseId id) {
        return store.get(id).status();
    }

    @Override
    public Optional<Payload> value(PromiseId id) {
        return store.get(id).valueIfSettled();
    }

    @Override
    public Optional<PromiseRecord> find(PromiseId id) {
        return store.find(id);
    }

    @Override
    public boolean exists(PromiseId id) {
        return store.exists(id);
    }

    @Override
    public boolean isProxyPending(PromiseId id) {
        return store.find(id)
            .map(record -> record.origin().isRemoteProxy() && record.isPending())
            .orElse(false);
    }

    // ========== 콜백 등록 ==========

    @Override
    public PromiseId then(Address caller, PromiseId parentId, Address target, String successSelector) {
        return then(caller, parentId, target, successSelector, null);
    }

    @Override
    public PromiseId then(Address caller, PromiseId parentId, Address target, String successSelector, String errorSelector) {
        requireCaller(caller);
        PromiseId continuationId =
            PromiseIds.forContinuation(config.chainId(), parentId, takeRegistrationNonce(parentId));
        CallbackDescriptor descriptor = CallbackDescriptor.then(
            parentId, continuationId, target, successSelector, errorSelector, caller, config.chainId());
        registerLocal(descriptor);
        return continuationId;
    }

    @Override
    public PromiseId then(Address caller, PromiseId parentId, ChainId destination, Address target, String successSelector) {
        requireCaller(caller);
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
        if (destination.equals(config.chainId())) {
            throw new IllegalArgumentException("Cross-chain then requires a remote destination: " + destination);
        }
        PromiseId remoteId = PromiseIds.forRemote(parentId, destination, takeRegistrationNonce(parentId));
        CallbackDescriptor descriptor = CallbackDescriptor.forward(
            parentId, remoteId, target, successSelector, caller, config.chainId(), destination);

        store.insert(PromiseRecord.pending(remoteId, config.engineAddress(), new RemoteProxyOrigin(destination, remoteId)));
        registry.register(descriptor);
        forwarder.track(new ForwardingRecord(parentId, destination, remoteId, remoteId, true));
        log.debug("Registered cross-chain then {} → {} on chain {}", parentId, remoteId, destination.getValue());
        return remoteId;
    }

    @Override
    public PromiseId onReject(Address caller, PromiseId parentId, Address target, String errorSelector) {
        requireCaller(caller);
        PromiseId continuationId =
            PromiseIds.forContinuation(config.chainId(), parentId, takeRegistrationNonce(parentId));
        CallbackDescriptor descriptor = CallbackDescriptor.onReject(
            parentId, continuationId, target, errorSelector, caller, config.chainId());
        registerLocal(descriptor);
        return continuationId;
    }

    // ========== 수동 실행 ==========

    @Override
    public int executePromiseCallbacks(PromiseId id) {
        authContext.guard("executePromiseCallbacks");
        PromiseRecord parent = store.get(id);
        if (parent.isPending()) {
            throw PromiseException.notReady("Promise is still pending: " + id);
        }
        return runPending(parent);
    }

    @Override
    public int flushChain(PromiseId startId, int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive (current: " + maxSteps + ")");
        }
        authContext.guard("flushChain");
        PromiseRecord current = store.get(startId);
        if (current.isPending()) {
            throw PromiseException.notReady("Promise is still pending: " + startId);
        }

        int steps = 0;
        while (steps < maxSteps && !current.isPending()) {
            List<CallbackDescriptor> descriptors = registry.descriptors(current.id());
            if (descriptors.isEmpty()) {
                break;
            }
            if (runPending(current) > 0) {
                steps++;
            }
            current = store.get(descriptors.get(0).continuationId());
        }
        log.debug("Flushed {} step(s) from {}", steps, startId);
        return steps;
    }

    // ========== Promise.all ==========

    @Override
    public PromiseId createAll(Address caller, List<PromiseId> memberIds) {
        requireCaller(caller);
        aggregator.validate(memberIds);
        PromiseId allId = PromiseIds.forAll(config.chainId(), caller, allNonce++);
        store.insert(PromiseRecord.pending(allId, config.engineAddress(), LocalOrigin.instance()));
        aggregator.track(allId, memberIds);
        log.debug("Created Promise.all {} over {} member(s)", allId, memberIds.size());
        return allId;
    }

    @Override
    public AllStatus checkAll(PromiseId allId) {
        return aggregator.check(allId);
    }

    @Override
    public void settleAll(PromiseId allId) {
        authContext.guard("settleAll");
        if (!store.get(allId).isPending()) {
            throw PromiseException.alreadyTerminal("Promise.all already settled: " + allId);
        }
        aggregator.settle(allId);
    }

    // ========== 크로스체인 ==========

    @Override
    public MessageId sharePromise(Address caller, PromiseId id, ChainId destination) {
        requireCaller(caller);
        PromiseRecord record = store.get(id);
        if (record.origin().isMirror()) {
            // 미러 id는 출발 체인의 프록시 id와 같다
            throw PromiseException.unauthorized("Mirrored promise can only be shared by its origin chain: " + id);
        }
        if (record.isPending()) {
            throw PromiseException.notReady("Cannot share a pending promise: " + id);
        }
        return forwarder.share(record.toSnapshot(), destination);
    }

    @Override
    public Optional<ForwardingRecord> forwarding(PromiseId localProxyId) {
        return forwarder.forwarding(localProxyId);
    }

    @Override
    public Optional<AtomicState> atomicState(PromiseId parentId) {
        return coordinator.state(parentId);
    }

    @Override
    public void setupRemotePromise(Address caller, SetupRemotePromise message) {
        requireMessenger(caller);
        PromiseId mirrorId = message.remotePromiseId();
        Optional<PromiseRecord> existing = store.find(mirrorId);
        if (existing.isPresent()) {
            if (!existing.get().origin().isMirror()) {
                throw new IllegalStateException("Setup collides with a non-mirror promise: " + mirrorId);
            }
            log.info("Ignoring duplicate setup for mirror {}", mirrorId);
            return;
        }

        store.insert(PromiseRecord.pending(mirrorId, config.engineAddress(), new MirrorOrigin(message.sourceChain()))
            .withNextNonce(1L));
        PromiseId continuationId = PromiseIds.forContinuation(config.chainId(), mirrorId, 0L);
        store.insert(PromiseRecord.pending(continuationId, config.engineAddress(), LocalOrigin.instance()));
        registry.register(CallbackDescriptor.then(
            mirrorId, continuationId, message.target(), message.selector(), null,
            message.registrant(), message.sourceChain()));
        forwarder.addReturnRoute(continuationId, message.sourceChain(), message.localProxyId());
        log.info("Set up mirror {} from chain {}", mirrorId, message.sourceChain().getValue());
    }

    @Override
    public void executeRemoteCallback(Address caller, ExecuteRemoteCallback message) {
        requireMessenger(caller);
        authContext.guard("executeRemoteCallback");
        PromiseId mirrorId = message.remotePromiseId();
        PromiseRecord mirror = store.find(mirrorId)
            .filter(record -> record.origin().isMirror())
            .orElseThrow(() -> PromiseException.unordered("No mirror set up for " + mirrorId));
        if (!mirror.isPending()) {
            throw PromiseException.alreadyTerminal("Mirror already executed: " + mirrorId);
        }
        settle(mirrorId, PromiseStatus.RESOLVED, message.value());
        runPending(store.get(mirrorId));
    }

    @Override
    public void shareResolvedPromise(Address caller, ChainId sourceChain, ShareResolvedPromise message) {
        requireMessenger(caller);
        PromiseSnapshot snapshot = message.snapshot();
        Optional<PromiseRecord> existing = store.find(snapshot.id());
        if (existing.isEmpty()) {
            store.insert(new PromiseRecord(snapshot.id(), snapshot.status(), snapshot.value(),
                config.engineAddress(), new MirrorOrigin(sourceChain), 0L, null));
            log.info("Mirrored shared promise {} ({}) from chain {}",
                snapshot.id(), snapshot.status(), sourceChain.getValue());
            return;
        }
        PromiseRecord record = existing.get();
        if (!sharedBy(record, sourceChain)) {
            throw PromiseException.unauthorized(
                "Chain " + sourceChain.getValue() + " cannot settle " + snapshot.id());
        }
        if (!record.isPending()) {
            throw PromiseException.alreadyTerminal("Shared promise already settled: " + snapshot.id());
        }
        settle(snapshot.id(), snapshot.status(), snapshot.value());
    }

    /**
     * 기존 레코드에 대한 share는 프록시의 목적지 체인 또는 미러의 출발 체인만 보낼 수 있습니다.
     */
    private static boolean sharedBy(PromiseRecord record, ChainId sourceChain) {
        if (record.origin() instanceof RemoteProxyOrigin proxy) {
            return proxy.remoteChain().equals(sourceChain);
        }
        if (record.origin() instanceof MirrorOrigin mirror) {
            return mirror.sourceChain().equals(sourceChain) && !record.isPending();
        }
        return false;
    }

    @Override
    public void receive(Address caller, RelayEnvelope envelope) {
        requireMessenger(caller);
        if (!envelope.destination().equals(config.chainId())) {
            throw new IllegalArgumentException("Envelope addressed to chain " + envelope.destination().getValue());
        }
        if (!envelope.target().equals(config.engineAddress())) {
            throw new IllegalArgumentException("Envelope addressed to " + envelope.target());
        }
        CrossChainMessage message = CrossChainMessageCodec.decode(envelope.body());
        log.debug("Received {} ({}) from chain {}",
            message.kind(), envelope.messageId().getValue(), envelope.source().getValue());
        if (message instanceof SetupRemotePromise setup) {
            setupRemotePromise(caller, setup);
        } else if (message instanceof ExecuteRemoteCallback execute) {
            executeRemoteCallback(caller, execute);
        } else if (message instanceof ShareResolvedPromise share) {
            shareResolvedPromise(caller, envelope.source(), share);
        } else {
            throw new IllegalArgumentException("Unsupported message: " + message.kind());
        }
    }

    // ========== 콜백 인증 컨텍스트 ==========

    @Override
    public Address callbackRegistrant() {
        return authContext.current().registrant();
    }

    @Override
    public ChainId callbackSourceChain() {
        return authContext.current().sourceChain();
    }

    @Override
    public CallbackContext callbackContext() {
        return authContext.current();
    }

    // ========== 내부 ==========

    /**
     * 단일 상태 전이 지점.
     */
    void settle(PromiseId id, PromiseStatus status, Payload value) {
        PromiseRecord settled = store.get(id).settle(status, value);
        store.update(settled);
        log.debug("Settled {} as {}", id, status);
        forwarder.onSettled(settled);
        coordinator.onSettled(settled);
    }

    private void settleAsCreator(Address caller, PromiseId id, PromiseStatus status, Payload value) {
        requireCaller(caller);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        PromiseRecord record = store.get(id);
        if (!record.creator().equals(caller)) {
            throw PromiseException.unauthorized(caller + " is not the creator of " + id);
        }
        settle(id, status, value);
    }

    private int runPending(PromiseRecord parent) {
        List<CallbackDescriptor> pending = registry.pending(parent.id());
        for (CallbackDescriptor descriptor : pending) {
            executor.execute(descriptor, parent);
        }
        return pending.size();
    }

    private long takeRegistrationNonce(PromiseId parentId) {
        if (parentId == null) {
            throw new IllegalArgumentException("parentId cannot be null");
        }
        PromiseRecord parent = store.get(parentId);
        store.update(parent.withNextNonce(parent.nextNonce() + 1));
        return parent.nextNonce();
    }

    private void registerLocal(CallbackDescriptor descriptor) {
        store.insert(PromiseRecord.pending(descriptor.continuationId(), config.engineAddress(), LocalOrigin.instance()));
        registry.register(descriptor);
        log.debug("Registered {} {} → {}", descriptor.kind(), descriptor.parentId(), descriptor.continuationId());
    }

    private void requireMessenger(Address caller) {
        if (!config.messengerAddress().equals(caller)) {
            throw PromiseException.unauthorized(caller + " is not the cross-chain messenger");
        }
    }

    private static void requireCaller(Address caller) {
        if (caller == null) {
            throw new IllegalArgumentException("caller cannot be null");
        }
    }
}
