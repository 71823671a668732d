package com.ryuqq.promise.testkit.contract;

import com.ryuqq.promise.core.error.PromiseErrorCode;
import com.ryuqq.promise.core.model.PromiseId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Contract test for the callback auth context.
 *
 * <p>A callback sees who registered it and on which chain, also when it runs on a
 * different chain. Outside a callback the context is unavailable.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AuthIsolationContractTest extends AbstractContractTest {

    @Test
    void testNoActiveCallback_BeforeAndAfter() {
        // Given
        PromiseId p = chainA.engine().create(BOB);
        PromiseId next = chainA.engine().then(ALICE, p, CALCULATOR, "whoami");
        chainA.engine().resolve(BOB, p, Uint256.of(1));

        assertPromiseError(PromiseErrorCode.NO_ACTIVE_CALLBACK, () -> chainA.engine().callbackRegistrant());

        // When
        chainA.engine().executePromiseCallbacks(p);

        // Then: registrant is the caller of then, not the creator of the parent
        assertEquals("alice@901", chainA.engine().value(next).orElseThrow().asUtf8());
        assertPromiseError(PromiseErrorCode.NO_ACTIVE_CALLBACK, () -> chainA.engine().callbackRegistrant());
        assertPromiseError(PromiseErrorCode.NO_ACTIVE_CALLBACK, () -> chainA.engine().callbackSourceChain());
    }

    @Test
    void testCrossChainCallback_SeesOriginalRegistrantAndSourceChain() {
        // Given
        PromiseId p = chainA.engine().create(ALICE);
        PromiseId proxy = chainA.engine().then(BOB, p, CHAIN_B, CALCULATOR, "whoami");
        chainA.engine().resolve(ALICE, p, Uint256.of(1));

        // When
        chainA.engine().executePromiseCallbacks(p);
        relayAll();

        // Then
        assertEquals("bob@901", chainA.engine().value(proxy).orElseThrow().asUtf8());
        assertPromiseError(PromiseErrorCode.NO_ACTIVE_CALLBACK, () -> chainB.engine().callbackRegistrant());
        assertPromiseError(PromiseErrorCode.NO_ACTIVE_CALLBACK, () -> chainB.engine().callbackContext());
    }

    @Test
    void testContextIsolatedBetweenChains() {
        // Given: two independent callbacks on two chains
        PromiseId onA = chainA.engine().create(ALICE);
        PromiseId nextA = chainA.engine().then(ALICE, onA, CALCULATOR, "whoami");
        PromiseId onB = chainB.engine().create(BOB);
        PromiseId nextB = chainB.engine().then(BOB, onB, CALCULATOR, "whoami");
        chainA.engine().resolve(ALICE, onA, Uint256.of(1));
        chainB.engine().resolve(BOB, onB, Uint256.of(1));

        // When
        chainA.engine().executePromiseCallbacks(onA);
        chainB.engine().executePromiseCallbacks(onB);

        // Then
        assertEquals("alice@901", chainA.engine().value(nextA).orElseThrow().asUtf8());
        assertEquals("bob@902", chainB.engine().value(nextB).orElseThrow().asUtf8());
    }
}
