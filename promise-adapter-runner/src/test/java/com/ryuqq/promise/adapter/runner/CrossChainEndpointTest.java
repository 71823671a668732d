package com.ryuqq.promise.adapter.runner;

import com.ryuqq.promise.adapter.inmemory.store.InMemoryCallbackRegistry;
import com.ryuqq.promise.adapter.inmemory.store.InMemoryCallbackTargets;
import com.ryuqq.promise.adapter.inmemory.store.InMemoryPromiseStore;
import com.ryuqq.promise.core.callback.CallbackResult;
import com.ryuqq.promise.core.callback.DispatchingCallbackTarget;
import com.ryuqq.promise.core.contract.CrossChainMessage;
import com.ryuqq.promise.core.contract.CrossChainMessageCodec;
import com.ryuqq.promise.core.contract.ExecuteRemoteCallback;
import com.ryuqq.promise.core.contract.RelayEnvelope;
import com.ryuqq.promise.core.contract.SetupRemotePromise;
import com.ryuqq.promise.core.contract.ShareResolvedPromise;
import com.ryuqq.promise.core.error.PromiseErrorCode;
import com.ryuqq.promise.core.error.PromiseException;
import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.MessageId;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.model.PromiseIds;
import com.ryuqq.promise.core.model.PromiseSnapshot;
import com.ryuqq.promise.core.spi.Messenger;
import com.ryuqq.promise.core.statemachine.PromiseStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * DefaultPromiseEngine의 크로스체인 진입점 테스트.
 *
 * <p>메신저는 Mock으로 두고 전송된 메시지를 디코딩해 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CrossChainEndpointTest {

    private static final ChainId LOCAL = ChainId.of(901);
    private static final ChainId REMOTE = ChainId.of(902);
    private static final Address ALICE = Address.of("alice");
    private static final Address CALC = Address.of("calculator");
    private static final EngineConfig CONFIG = new EngineConfig(LOCAL);
    private static final Address MESSENGER = CONFIG.messengerAddress();

    @Mock
    private Messenger messenger;

    private DefaultPromiseEngine engine;

    @BeforeEach
    void setUp() {
        lenient().when(messenger.send(any(), any(), any())).thenReturn(MessageId.of("msg-1"));
        InMemoryCallbackTargets targets = new InMemoryCallbackTargets();
        targets.deploy(CALC, DispatchingCallbackTarget.builder()
            .on("double", (value, ctx) ->
                CallbackResult.immediate(Payload.ofUtf8(Long.toString(Long.parseLong(value.asUtf8()) * 2))))
            .on("origin", (value, ctx) ->
                CallbackResult.immediate(Payload.ofUtf8(ctx.registrant().getValue() + "@" + ctx.sourceChain().getValue())))
            .build());
        engine = new DefaultPromiseEngine(
            CONFIG, new InMemoryPromiseStore(), new InMemoryCallbackRegistry(), targets, messenger, () -> 0L);
    }

    // ============================================================
    // 1. 출발지: setup → execute 순서
    // ============================================================

    @Test
    void forward_setup을_execute보다_먼저_전송() {
        // given
        PromiseId parent = engine.create(ALICE);
        PromiseId proxy = engine.then(ALICE, parent, REMOTE, CALC, "double");
        engine.resolve(ALICE, parent, Payload.ofUtf8("100"));

        // when
        engine.executePromiseCallbacks(parent);

        // then
        ArgumentCaptor<Payload> bodies = ArgumentCaptor.forClass(Payload.class);
        InOrder inOrder = inOrder(messenger);
        inOrder.verify(messenger, times(2)).send(eq(REMOTE), eq(CONFIG.engineAddress()), bodies.capture());

        List<Payload> sent = bodies.getAllValues();
        CrossChainMessage first = CrossChainMessageCodec.decode(sent.get(0));
        CrossChainMessage second = CrossChainMessageCodec.decode(sent.get(1));
        assertThat(first).isInstanceOf(SetupRemotePromise.class);
        assertThat(second).isInstanceOf(ExecuteRemoteCallback.class);

        SetupRemotePromise setup = (SetupRemotePromise) first;
        assertThat(setup.remotePromiseId()).isEqualTo(proxy);
        assertThat(setup.localProxyId()).isEqualTo(proxy);
        assertThat(setup.registrant()).isEqualTo(ALICE);
        assertThat(setup.sourceChain()).isEqualTo(LOCAL);
        assertThat(((ExecuteRemoteCallback) second).value()).isEqualTo(Payload.ofUtf8("100"));

        assertThat(engine.isProxyPending(proxy)).isTrue();
        assertThat(engine.forwarding(proxy)).get().extracting(f -> f.active()).isEqualTo(true);
    }

    @Test
    void shareResolvedPromise_프록시를_settle_하고_전달_기록을_비활성화() {
        // given
        PromiseId parent = engine.create(ALICE);
        PromiseId proxy = engine.then(ALICE, parent, REMOTE, CALC, "double");
        engine.resolve(ALICE, parent, Payload.ofUtf8("100"));
        engine.executePromiseCallbacks(parent);

        // when
        engine.shareResolvedPromise(MESSENGER, REMOTE,
            new ShareResolvedPromise(new PromiseSnapshot(proxy, PromiseStatus.RESOLVED, Payload.ofUtf8("200"))));

        // then
        assertThat(engine.status(proxy)).isEqualTo(PromiseStatus.RESOLVED);
        assertThat(engine.value(proxy)).contains(Payload.ofUtf8("200"));
        assertThat(engine.isProxyPending(proxy)).isFalse();
        assertThat(engine.forwarding(proxy)).get().extracting(f -> f.active()).isEqualTo(false);
    }

    @Test
    void shareResolvedPromise_처음_보는_id는_미러로_기록() {
        // given
        PromiseId foreign = PromiseIds.forCreate(REMOTE, ALICE, 0L);

        // when
        engine.shareResolvedPromise(MESSENGER, REMOTE,
            new ShareResolvedPromise(new PromiseSnapshot(foreign, PromiseStatus.REJECTED, Payload.ofUtf8("no"))));

        // then
        assertThat(engine.status(foreign)).isEqualTo(PromiseStatus.REJECTED);
        assertThat(engine.find(foreign)).get().extracting(r -> r.origin().isMirror()).isEqualTo(true);
    }

    @Test
    void shareResolvedPromise_이미_settle된_프록시는_ALREADY_TERMINAL() {
        // given
        PromiseId parent = engine.create(ALICE);
        PromiseId proxy = engine.then(ALICE, parent, REMOTE, CALC, "double");
        engine.resolve(ALICE, parent, Payload.ofUtf8("100"));
        engine.executePromiseCallbacks(parent);
        ShareResolvedPromise share =
            new ShareResolvedPromise(new PromiseSnapshot(proxy, PromiseStatus.RESOLVED, Payload.ofUtf8("200")));
        engine.shareResolvedPromise(MESSENGER, REMOTE, share);

        // when & then
        assertThatThrownBy(() -> engine.shareResolvedPromise(MESSENGER, REMOTE, share))
            .isInstanceOf(PromiseException.class)
            .hasFieldOrPropertyWithValue("errorCode", PromiseErrorCode.ALREADY_TERMINAL);
    }

    @Test
    void shareResolvedPromise_로컬_Promise는_UNAUTHORIZED() {
        // given
        PromiseId local = engine.create(ALICE);
        ShareResolvedPromise share =
            new ShareResolvedPromise(new PromiseSnapshot(local, PromiseStatus.RESOLVED, Payload.ofUtf8("2")));

        // when & then
        assertThatThrownBy(() -> engine.shareResolvedPromise(MESSENGER, REMOTE, share))
            .isInstanceOf(PromiseException.class)
            .hasFieldOrPropertyWithValue("errorCode", PromiseErrorCode.UNAUTHORIZED);
        assertThat(engine.status(local)).isEqualTo(PromiseStatus.PENDING);
    }

    @Test
    void shareResolvedPromise_다른_체인이_보낸_프록시_결과는_UNAUTHORIZED() {
        // given
        PromiseId parent = engine.create(ALICE);
        PromiseId proxy = engine.then(ALICE, parent, REMOTE, CALC, "double");
        ShareResolvedPromise share =
            new ShareResolvedPromise(new PromiseSnapshot(proxy, PromiseStatus.RESOLVED, Payload.ofUtf8("1")));

        // when & then
        assertThatThrownBy(() -> engine.shareResolvedPromise(MESSENGER, ChainId.of(903), share))
            .isInstanceOf(PromiseException.class)
            .hasFieldOrPropertyWithValue("errorCode", PromiseErrorCode.UNAUTHORIZED);
        assertThat(engine.isProxyPending(proxy)).isTrue();
    }

    @Test
    void sharePromise_미러는_UNAUTHORIZED() {
        // given
        PromiseId remoteId = PromiseIds.forRemote(PromiseIds.forCreate(REMOTE, ALICE, 0L), LOCAL, 0L);
        engine.setupRemotePromise(MESSENGER, new SetupRemotePromise(remoteId, remoteId, CALC, "double", ALICE, REMOTE));
        engine.executeRemoteCallback(MESSENGER, new ExecuteRemoteCallback(remoteId, Payload.ofUtf8("1")));

        // when & then
        assertThatThrownBy(() -> engine.sharePromise(ALICE, remoteId, REMOTE))
            .isInstanceOf(PromiseException.class)
            .hasFieldOrPropertyWithValue("errorCode", PromiseErrorCode.UNAUTHORIZED);
        verify(messenger, times(1)).send(any(), any(), any());
    }

    @Test
    void sharePromise_스냅샷을_목적지로_전송() {
        // given
        PromiseId id = engine.create(ALICE);
        engine.resolve(ALICE, id, Payload.ofUtf8("done"));

        // when
        MessageId messageId = engine.sharePromise(ALICE, id, REMOTE);

        // then
        ArgumentCaptor<Payload> body = ArgumentCaptor.forClass(Payload.class);
        verify(messenger).send(eq(REMOTE), eq(CONFIG.engineAddress()), body.capture());
        ShareResolvedPromise share = (ShareResolvedPromise) CrossChainMessageCodec.decode(body.getValue());
        assertThat(share.snapshot()).isEqualTo(new PromiseSnapshot(id, PromiseStatus.RESOLVED, Payload.ofUtf8("done")));
        assertThat(messageId).isEqualTo(MessageId.of("msg-1"));
    }

    // ============================================================
    // 2. 목적지: 미러 생성, 실행, 결과 반환
    // ============================================================

    @Test
    void setup_후_execute_시_콜백을_실행하고_결과를_출발지로_공유() {
        // given
        PromiseId remoteId = PromiseIds.forRemote(PromiseIds.forCreate(REMOTE, ALICE, 0L), LOCAL, 0L);
        engine.setupRemotePromise(MESSENGER, new SetupRemotePromise(remoteId, remoteId, CALC, "double", ALICE, REMOTE));

        assertThat(engine.status(remoteId)).isEqualTo(PromiseStatus.PENDING);
        verify(messenger, never()).send(any(), any(), any());

        // when
        engine.executeRemoteCallback(MESSENGER, new ExecuteRemoteCallback(remoteId, Payload.ofUtf8("21")));

        // then
        assertThat(engine.status(remoteId)).isEqualTo(PromiseStatus.RESOLVED);
        PromiseId continuation = PromiseIds.forContinuation(LOCAL, remoteId, 0L);
        assertThat(engine.value(continuation)).contains(Payload.ofUtf8("42"));

        ArgumentCaptor<Payload> body = ArgumentCaptor.forClass(Payload.class);
        verify(messenger).send(eq(REMOTE), eq(CONFIG.engineAddress()), body.capture());
        ShareResolvedPromise share = (ShareResolvedPromise) CrossChainMessageCodec.decode(body.getValue());
        assertThat(share.snapshot()).isEqualTo(new PromiseSnapshot(remoteId, PromiseStatus.RESOLVED, Payload.ofUtf8("42")));
    }

    @Test
    void 미러_콜백은_원래_등록자와_출발_체인을_본다() {
        // given
        PromiseId remoteId = PromiseIds.forRemote(PromiseIds.forCreate(REMOTE, ALICE, 0L), LOCAL, 0L);
        engine.setupRemotePromise(MESSENGER, new SetupRemotePromise(remoteId, remoteId, CALC, "origin", ALICE, REMOTE));

        // when
        engine.executeRemoteCallback(MESSENGER, new ExecuteRemoteCallback(remoteId, Payload.ofUtf8("x")));

        // then
        assertThat(engine.value(PromiseIds.forContinuation(LOCAL, remoteId, 0L))).contains(Payload.ofUtf8("alice@902"));
    }

    @Test
    void executeRemoteCallback_setup_전이면_UNORDERED() {
        PromiseId remoteId = PromiseIds.forRemote(PromiseIds.forCreate(REMOTE, ALICE, 0L), LOCAL, 0L);

        assertThatThrownBy(() -> engine.executeRemoteCallback(
            MESSENGER, new ExecuteRemoteCallback(remoteId, Payload.ofUtf8("1"))))
            .isInstanceOf(PromiseException.class)
            .hasFieldOrPropertyWithValue("errorCode", PromiseErrorCode.UNORDERED);
    }

    @Test
    void executeRemoteCallback_중복이면_ALREADY_TERMINAL() {
        // given
        PromiseId remoteId = PromiseIds.forRemote(PromiseIds.forCreate(REMOTE, ALICE, 0L), LOCAL, 0L);
        engine.setupRemotePromise(MESSENGER, new SetupRemotePromise(remoteId, remoteId, CALC, "double", ALICE, REMOTE));
        ExecuteRemoteCallback execute = new ExecuteRemoteCallback(remoteId, Payload.ofUtf8("1"));
        engine.executeRemoteCallback(MESSENGER, execute);

        // when & then
        assertThatThrownBy(() -> engine.executeRemoteCallback(MESSENGER, execute))
            .isInstanceOf(PromiseException.class)
            .hasFieldOrPropertyWithValue("errorCode", PromiseErrorCode.ALREADY_TERMINAL);
    }

    @Test
    void setupRemotePromise_중복_setup은_무시() {
        // given
        PromiseId remoteId = PromiseIds.forRemote(PromiseIds.forCreate(REMOTE, ALICE, 0L), LOCAL, 0L);
        SetupRemotePromise setup = new SetupRemotePromise(remoteId, remoteId, CALC, "double", ALICE, REMOTE);
        engine.setupRemotePromise(MESSENGER, setup);

        // when
        engine.setupRemotePromise(MESSENGER, setup);
        engine.executeRemoteCallback(MESSENGER, new ExecuteRemoteCallback(remoteId, Payload.ofUtf8("5")));

        // then
        assertThat(engine.value(PromiseIds.forContinuation(LOCAL, remoteId, 0L))).contains(Payload.ofUtf8("10"));
        verify(messenger, times(1)).send(any(), any(), any());
    }

    // ============================================================
    // 3. 메신저 권한 및 봉투 검증
    // ============================================================

    @Test
    void 메신저가_아닌_호출자는_UNAUTHORIZED() {
        PromiseId remoteId = PromiseIds.forRemote(PromiseIds.forCreate(REMOTE, ALICE, 0L), LOCAL, 0L);
        SetupRemotePromise setup = new SetupRemotePromise(remoteId, remoteId, CALC, "double", ALICE, REMOTE);

        assertThatThrownBy(() -> engine.setupRemotePromise(ALICE, setup))
            .isInstanceOf(PromiseException.class)
            .hasFieldOrPropertyWithValue("errorCode", PromiseErrorCode.UNAUTHORIZED);
        assertThat(engine.exists(remoteId)).isFalse();
    }

    @Test
    void receive_봉투를_디코딩해_진입점으로_분배() {
        // given
        PromiseId remoteId = PromiseIds.forRemote(PromiseIds.forCreate(REMOTE, ALICE, 0L), LOCAL, 0L);
        Payload body = CrossChainMessageCodec.encode(
            new SetupRemotePromise(remoteId, remoteId, CALC, "double", ALICE, REMOTE));
        RelayEnvelope envelope = new RelayEnvelope(
            MessageId.of("msg-7"), REMOTE, LOCAL, CONFIG.engineAddress(), body, 0L);

        // when
        engine.receive(MESSENGER, envelope);

        // then
        assertThat(engine.find(remoteId)).get().extracting(r -> r.origin().isMirror()).isEqualTo(true);
    }

    @Test
    void receive_다른_주소로_향한_봉투는_거부() {
        Payload body = CrossChainMessageCodec.encode(new ExecuteRemoteCallback(
            PromiseIds.forCreate(REMOTE, ALICE, 0L), Payload.ofUtf8("1")));
        RelayEnvelope envelope = new RelayEnvelope(
            MessageId.of("msg-8"), REMOTE, LOCAL, Address.of("someone-else"), body, 0L);

        assertThatThrownBy(() -> engine.receive(MESSENGER, envelope))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
