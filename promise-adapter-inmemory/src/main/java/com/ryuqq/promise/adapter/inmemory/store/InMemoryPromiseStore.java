package com.ryuqq.promise.adapter.inmemory.store;

import com.ryuqq.promise.core.error.PromiseException;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.model.PromiseRecord;
import com.ryuqq.promise.core.spi.PromiseStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link PromiseStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>records:</strong> ConcurrentHashMap&lt;PromiseId, PromiseRecord&gt; - O(1) access</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryPromiseStore implements PromiseStore {

    private final ConcurrentHashMap<PromiseId, PromiseRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<PromiseRecord> find(PromiseId id) {
        requireId(id);
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public PromiseRecord get(PromiseId id) {
        requireId(id);
        PromiseRecord record = records.get(id);
        if (record == null) {
            throw PromiseException.unknownPromise("Unknown promise: " + id.toHex());
        }
        return record;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Uses {@code putIfAbsent} so two inserts of the same id cannot both succeed.</p>
     */
    @Override
    public void insert(PromiseRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (records.putIfAbsent(record.id(), record) != null) {
            throw new IllegalStateException("Promise already exists: " + record.id().toHex());
        }
    }

    @Override
    public void update(PromiseRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (records.replace(record.id(), record) == null) {
            throw new IllegalStateException("Promise does not exist: " + record.id().toHex());
        }
    }

    @Override
    public boolean exists(PromiseId id) {
        requireId(id);
        return records.containsKey(id);
    }

    /**
     * Returns the number of stored records. Used for test assertions.
     *
     * @return record count
     */
    public int size() {
        return records.size();
    }

    private static void requireId(PromiseId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }
}
