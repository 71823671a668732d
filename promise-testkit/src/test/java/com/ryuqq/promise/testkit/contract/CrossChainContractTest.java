package com.ryuqq.promise.testkit.contract;

import com.ryuqq.promise.application.engine.ForwardingRecord;
import com.ryuqq.promise.core.contract.CrossChainMessageCodec;
import com.ryuqq.promise.core.contract.ExecuteRemoteCallback;
import com.ryuqq.promise.core.contract.SetupRemotePromise;
import com.ryuqq.promise.core.contract.RelayEnvelope;
import com.ryuqq.promise.core.contract.ShareResolvedPromise;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.model.PromiseIds;
import com.ryuqq.promise.core.statemachine.PromiseStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract test for cross-chain then, the local proxy and result sharing.
 *
 * <p><strong>Message flow:</strong></p>
 * <pre>
 * chainA: then(p, CHAIN_B, calculator, "double") → proxy
 * chainA: resolve(p, 100) + executePromiseCallbacks(p)
 *   → SetupRemotePromise, ExecuteRemoteCallback   (A → B)
 * chainB: mirror(proxy) = 100, continuation = 200
 *   → ShareResolvedPromise(proxy, 200)             (B → A)
 * chainA: proxy = 200
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CrossChainContractTest extends AbstractContractTest {

    @Test
    void testRemoteId_DerivedDeterministically() {
        // Given
        PromiseId p = chainA.engine().create(ALICE);

        // When
        PromiseId first = chainA.engine().then(ALICE, p, CHAIN_B, CALCULATOR, "double");
        PromiseId second = chainA.engine().then(ALICE, p, CHAIN_B, CALCULATOR, "double");

        // Then: same inputs give the same id, the registration counter separates them
        assertEquals(PromiseIds.forRemote(p, CHAIN_B, 0L), first);
        assertEquals(PromiseIds.forRemote(p, CHAIN_B, 1L), second);
    }

    @Test
    void testCrossChainThen_ProxyResolvesWithRemoteResult() {
        // Given
        PromiseId p = chainA.engine().create(ALICE);
        PromiseId proxy = chainA.engine().then(ALICE, p, CHAIN_B, CALCULATOR, "double");
        assertTrue(chainA.engine().isProxyPending(proxy));

        // When
        chainA.engine().resolve(ALICE, p, Uint256.of(100));
        chainA.engine().executePromiseCallbacks(p);
        int delivered = relayAll();

        // Then: setup, execute and share were all delivered
        assertEquals(3, delivered);
        assertUint(chainB, proxy, 100);
        assertUint(chainB, PromiseIds.forContinuation(CHAIN_B, proxy, 0L), 200);
        assertUint(chainA, proxy, 200);
        assertFalse(chainA.engine().isProxyPending(proxy));

        ForwardingRecord forwarding = chainA.engine().forwarding(proxy).orElseThrow();
        assertEquals(p, forwarding.sourcePromiseId());
        assertEquals(CHAIN_B, forwarding.destination());
        assertFalse(forwarding.active());
        assertEquals(0, bus.deadLetterSize());
    }

    @Test
    void testSetupPrecedesExecute_OnTheWire() {
        // Given
        PromiseId p = chainA.engine().create(ALICE);
        chainA.engine().then(ALICE, p, CHAIN_B, CALCULATOR, "double");
        chainA.engine().resolve(ALICE, p, Uint256.of(1));

        // When
        chainA.engine().executePromiseCallbacks(p);

        // Then
        List<RelayEnvelope> sent = bus.sentEnvelopes();
        assertEquals(2, sent.size());
        assertInstanceOf(SetupRemotePromise.class, CrossChainMessageCodec.decode(sent.get(0).body()));
        assertInstanceOf(ExecuteRemoteCallback.class, CrossChainMessageCodec.decode(sent.get(1).body()));
        assertEquals(CHAIN_A, sent.get(0).source());
        assertEquals(CHAIN_B, sent.get(0).destination());
    }

    @Test
    void testRemoteCallbackFailure_RejectsProxy() {
        // Given
        PromiseId p = chainA.engine().create(ALICE);
        PromiseId proxy = chainA.engine().then(ALICE, p, CHAIN_B, CALCULATOR, "revert");
        chainA.engine().resolve(ALICE, p, Uint256.of(1));

        // When
        chainA.engine().executePromiseCallbacks(p);
        relayAll();

        // Then
        assertStatus(chainA, proxy, PromiseStatus.REJECTED);
        assertEquals("calculator reverted", chainA.engine().value(proxy).orElseThrow().asUtf8());
    }

    @Test
    void testRejectedParent_ProxyRejectedLocallyWithoutMessages() {
        // Given
        PromiseId p = chainA.engine().create(ALICE);
        PromiseId proxy = chainA.engine().then(ALICE, p, CHAIN_B, CALCULATOR, "double");
        chainA.engine().reject(ALICE, p, Uint256.of(7));

        // When
        chainA.engine().executePromiseCallbacks(p);

        // Then
        assertStatus(chainA, proxy, PromiseStatus.REJECTED);
        assertUint(chainA, proxy, 7);
        assertTrue(bus.sentEnvelopes().isEmpty());
        assertFalse(chainB.engine().exists(proxy));
    }

    @Test
    void testProxyChainsContinueLocally() {
        // Given: a local callback hangs off the proxy
        PromiseId p = chainA.engine().create(ALICE);
        PromiseId proxy = chainA.engine().then(ALICE, p, CHAIN_B, CALCULATOR, "double");
        PromiseId after = chainA.engine().then(ALICE, proxy, CALCULATOR, "addOne");
        chainA.engine().resolve(ALICE, p, Uint256.of(5));
        chainA.engine().executePromiseCallbacks(p);
        relayAll();

        // When
        chainA.engine().executePromiseCallbacks(proxy);

        // Then
        assertUint(chainA, after, 11);
    }

    @Test
    void testSharePromise_MirrorsSnapshotOnDestination() {
        // Given
        PromiseId p = chainA.engine().create(ALICE);
        chainA.engine().resolve(ALICE, p, Uint256.of(9));

        // When
        chainA.engine().sharePromise(ALICE, p, CHAIN_B);
        relayAll();

        // Then
        assertUint(chainB, p, 9);
        assertTrue(chainB.engine().find(p).orElseThrow().origin().isMirror());
        assertInstanceOf(ShareResolvedPromise.class,
            CrossChainMessageCodec.decode(bus.sentEnvelopes().get(0).body()));
    }

    @Test
    void testSharePromise_SecondShareIsDeadLettered() {
        // Given
        PromiseId p = chainA.engine().create(ALICE);
        chainA.engine().resolve(ALICE, p, Uint256.of(9));
        chainA.engine().sharePromise(ALICE, p, CHAIN_B);
        relayAll();

        // When
        chainA.engine().sharePromise(ALICE, p, CHAIN_B);
        relayAll();

        // Then
        assertEquals(1, bus.deadLetterSize());
        assertTrue(bus.getDeadLetters().get(0).getReason().startsWith("ALREADY_TERMINAL"));
        assertUint(chainB, p, 9);
    }
}
