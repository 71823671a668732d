package com.ryuqq.promise.core.spi;

import com.ryuqq.promise.core.callback.CallbackTarget;
import com.ryuqq.promise.core.model.Address;

import java.util.Optional;

/**
 * Resolves callback target addresses to deployed components on one chain.
 *
 * <p>Deterministic deployment is assumed: the same {@link Address} names the same
 * logical component on every chain.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CallbackTargets {

    /**
     * Finds the component deployed at an address.
     *
     * @param address the target address
     * @return the component, or empty if nothing is deployed there
     */
    Optional<CallbackTarget> find(Address address);
}
