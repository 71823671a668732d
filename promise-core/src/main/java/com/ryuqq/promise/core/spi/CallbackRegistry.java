package com.ryuqq.promise.core.spi;

import com.ryuqq.promise.core.callback.CallbackDescriptor;
import com.ryuqq.promise.core.model.PromiseId;

import java.util.List;

/**
 * Callback descriptor storage SPI.
 *
 * <p>Descriptors are kept per parent in registration order. A descriptor is identified
 * by its continuation id and is executed at most once.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CallbackRegistry {

    /**
     * Appends a descriptor to its parent's list.
     *
     * @param descriptor the descriptor
     * @throws IllegalArgumentException if descriptor is null
     * @throws IllegalStateException if a descriptor with the same continuation id exists
     */
    void register(CallbackDescriptor descriptor);

    /**
     * All descriptors registered on a parent, in registration order.
     *
     * @param parentId the parent promise id
     * @return descriptors (may be empty)
     */
    List<CallbackDescriptor> descriptors(PromiseId parentId);

    /**
     * Descriptors on a parent that have not been executed yet, in registration order.
     *
     * @param parentId the parent promise id
     * @return pending descriptors (may be empty)
     */
    List<CallbackDescriptor> pending(PromiseId parentId);

    /**
     * Marks the descriptor owning a continuation as executed.
     *
     * @param continuationId the continuation id
     * @throws IllegalStateException if unknown or already executed
     */
    void markExecuted(PromiseId continuationId);

    /**
     * Checks whether the descriptor owning a continuation has been executed.
     *
     * @param continuationId the continuation id
     * @return true if executed
     */
    boolean isExecuted(PromiseId continuationId);
}
