package com.ryuqq.promise.application.relay;

/**
 * Delivers queued cross-chain envelopes to their destination engines.
 *
 * <p>The relay stands in for the off-chain service that carries messages between
 * chains and pays for execution on the destination.</p>
 *
 * <p><strong>Relay Flow:</strong></p>
 * <pre>
 * pump()
 *   1. Dequeue a batch from the MessageQueue
 *   2. For each envelope:
 *      a. Look up the destination chain's endpoint
 *      b. receive(messenger, envelope)
 *      c. Success   → ack
 *         UNORDERED → nack (redelivered once setup has landed)
 *         Other     → dead letter
 * </pre>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * // Drain everything in flight between chains
 * while (relay.pump() &gt; 0) {
 *     // keep relaying
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MessageRelay {

    /**
     * Processes one batch.
     *
     * @return the number of envelopes acknowledged in this batch
     */
    int pump();
}
