package com.ryuqq.promise.adapter.inmemory.store;

import com.ryuqq.promise.core.callback.CallbackDescriptor;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.spi.CallbackRegistry;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link CallbackRegistry} SPI.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>byParent:</strong> parent id → descriptors in registration order</li>
 *   <li><strong>byContinuation:</strong> continuation id → descriptor (uniqueness check)</li>
 *   <li><strong>executed:</strong> continuation ids whose descriptor already ran</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCallbackRegistry implements CallbackRegistry {

    private final ConcurrentHashMap<PromiseId, List<CallbackDescriptor>> byParent = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<PromiseId, CallbackDescriptor> byContinuation = new ConcurrentHashMap<>();
    private final Set<PromiseId> executed = ConcurrentHashMap.newKeySet();

    @Override
    public void register(CallbackDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (byContinuation.putIfAbsent(descriptor.continuationId(), descriptor) != null) {
            throw new IllegalStateException(
                "Continuation already registered: " + descriptor.continuationId().toHex());
        }
        byParent.computeIfAbsent(descriptor.parentId(), id -> new CopyOnWriteArrayList<>()).add(descriptor);
    }

    @Override
    public List<CallbackDescriptor> descriptors(PromiseId parentId) {
        if (parentId == null) {
            throw new IllegalArgumentException("parentId cannot be null");
        }
        return List.copyOf(byParent.getOrDefault(parentId, List.of()));
    }

    @Override
    public List<CallbackDescriptor> pending(PromiseId parentId) {
        return descriptors(parentId).stream()
            .filter(descriptor -> !executed.contains(descriptor.continuationId()))
            .collect(Collectors.toList());
    }

    @Override
    public void markExecuted(PromiseId continuationId) {
        if (continuationId == null) {
            throw new IllegalArgumentException("continuationId cannot be null");
        }
        if (!byContinuation.containsKey(continuationId)) {
            throw new IllegalStateException("Unknown continuation: " + continuationId.toHex());
        }
        if (!executed.add(continuationId)) {
            throw new IllegalStateException("Callback already executed: " + continuationId.toHex());
        }
    }

    @Override
    public boolean isExecuted(PromiseId continuationId) {
        if (continuationId == null) {
            throw new IllegalArgumentException("continuationId cannot be null");
        }
        return executed.contains(continuationId);
    }
}
