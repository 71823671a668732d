package com.ryuqq.promise.testkit.contract;

import com.ryuqq.promise.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.promise.adapter.inmemory.store.InMemoryCallbackRegistry;
import com.ryuqq.promise.adapter.inmemory.store.InMemoryCallbackTargets;
import com.ryuqq.promise.adapter.inmemory.store.InMemoryPromiseStore;
import com.ryuqq.promise.adapter.runner.DefaultPromiseEngine;
import com.ryuqq.promise.adapter.runner.EngineConfig;
import com.ryuqq.promise.core.callback.CallbackTarget;
import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.spi.MonotonicClock;

/**
 * One simulated chain: an engine with its own store, registry and deployed components.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ChainNode {

    private final ChainId chainId;
    private final InMemoryPromiseStore store = new InMemoryPromiseStore();
    private final InMemoryCallbackTargets targets = new InMemoryCallbackTargets();
    private final DefaultPromiseEngine engine;

    /**
     * Creates a chain whose messenger publishes to the shared bus.
     *
     * @param chainId chain identifier
     * @param bus shared message bus
     * @param clock shared clock
     */
    public ChainNode(ChainId chainId, InMemoryMessageBus bus, MonotonicClock clock) {
        this.chainId = chainId;
        this.engine = new DefaultPromiseEngine(
            new EngineConfig(chainId),
            store,
            new InMemoryCallbackRegistry(),
            targets,
            bus.messengerFor(chainId),
            clock);
    }

    /**
     * Deploys a component at the given address on this chain.
     *
     * @param address component address
     * @param target component
     * @return this node
     */
    public ChainNode deploy(Address address, CallbackTarget target) {
        targets.deploy(address, target);
        return this;
    }

    public ChainId chainId() {
        return chainId;
    }

    public DefaultPromiseEngine engine() {
        return engine;
    }

    public InMemoryPromiseStore store() {
        return store;
    }

    @Override
    public String toString() {
        return "ChainNode{" + chainId.getValue() + '}';
    }
}
