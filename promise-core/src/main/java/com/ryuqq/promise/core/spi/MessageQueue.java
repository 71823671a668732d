package com.ryuqq.promise.core.spi;

import com.ryuqq.promise.core.contract.RelayEnvelope;

import java.util.List;

/**
 * Consumer side of the cross-chain transport, used by the message relay.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Dequeuing batches of envelopes in send order</li>
 *   <li>Acknowledging delivered envelopes</li>
 *   <li>Returning envelopes that could not be delivered yet</li>
 *   <li>Moving undeliverable envelopes to a dead letter store</li>
 * </ul>
 *
 * <p>Implementations must be thread-safe, since every chain's messenger publishes into
 * the same queue.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MessageQueue {

    /**
     * Dequeues up to {@code batchSize} envelopes, marking them in flight.
     *
     * @param batchSize maximum number of envelopes
     * @return envelopes (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<RelayEnvelope> dequeue(int batchSize);

    /**
     * Acknowledges successful delivery.
     *
     * <p>Idempotent: acknowledging an envelope that is no longer in flight is a no-op.</p>
     *
     * @param envelope the envelope
     * @throws IllegalArgumentException if envelope is null
     */
    void ack(RelayEnvelope envelope);

    /**
     * Returns an in-flight envelope to the queue for redelivery.
     *
     * @param envelope the envelope
     * @throws IllegalArgumentException if envelope is null
     */
    void nack(RelayEnvelope envelope);

    /**
     * Moves an envelope to the dead letter store.
     *
     * @param envelope the envelope
     * @param reason why delivery failed
     * @throws IllegalArgumentException if envelope or reason is null
     */
    void publishToDeadLetter(RelayEnvelope envelope, String reason);
}
