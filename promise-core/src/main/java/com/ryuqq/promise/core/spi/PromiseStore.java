package com.ryuqq.promise.core.spi;

import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.model.PromiseRecord;

import java.util.Optional;

/**
 * Promise record storage SPI.
 *
 * <p>One store belongs to exactly one chain. The engine validates every status
 * transition before calling {@link #update(PromiseRecord)}; the store only persists.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Records are never deleted</li>
 *   <li>{@link #insert(PromiseRecord)} must refuse an id that already exists</li>
 *   <li>{@link #update(PromiseRecord)} must refuse an id that does not exist</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface PromiseStore {

    /**
     * Finds a record by id.
     *
     * @param id the promise id
     * @return the record, or empty if unknown
     * @throws IllegalArgumentException if id is null
     */
    Optional<PromiseRecord> find(PromiseId id);

    /**
     * Retrieves a record by id.
     *
     * @param id the promise id
     * @return the record
     * @throws IllegalArgumentException if id is null
     * @throws com.ryuqq.promise.core.error.PromiseException if id is unknown (UNKNOWN_PROMISE)
     */
    PromiseRecord get(PromiseId id);

    /**
     * Inserts a new record.
     *
     * @param record the record
     * @throws IllegalArgumentException if record is null
     * @throws IllegalStateException if a record with the same id already exists
     */
    void insert(PromiseRecord record);

    /**
     * Replaces an existing record.
     *
     * @param record the new version of the record
     * @throws IllegalArgumentException if record is null
     * @throws IllegalStateException if no record with this id exists
     */
    void update(PromiseRecord record);

    /**
     * Checks whether a record exists.
     *
     * @param id the promise id
     * @return true if present
     * @throws IllegalArgumentException if id is null
     */
    boolean exists(PromiseId id);
}
