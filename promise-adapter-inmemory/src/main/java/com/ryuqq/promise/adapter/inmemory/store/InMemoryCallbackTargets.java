package com.ryuqq.promise.adapter.inmemory.store;

import com.ryuqq.promise.core.callback.CallbackTarget;
import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.spi.CallbackTargets;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory component registry for one chain.
 *
 * <p>Tests emulate deterministic deployment by deploying the same component at the
 * same {@link Address} on every chain.</p>
 *
 * <pre>
 * InMemoryCallbackTargets targets = new InMemoryCallbackTargets();
 * targets.deploy(Address.of("doubler"), doubler);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCallbackTargets implements CallbackTargets {

    private final ConcurrentHashMap<Address, CallbackTarget> components = new ConcurrentHashMap<>();

    /**
     * Deploys a component at an address.
     *
     * @param address the address
     * @param target the component
     * @throws IllegalArgumentException if an argument is null
     * @throws IllegalStateException if the address is already taken
     */
    public void deploy(Address address, CallbackTarget target) {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (components.putIfAbsent(address, target) != null) {
            throw new IllegalStateException("Address already deployed: " + address.getValue());
        }
    }

    @Override
    public Optional<CallbackTarget> find(Address address) {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        return Optional.ofNullable(components.get(address));
    }
}
