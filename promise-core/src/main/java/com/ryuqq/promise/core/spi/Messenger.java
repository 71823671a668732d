package com.ryuqq.promise.core.spi;

import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.MessageId;
import com.ryuqq.promise.core.model.Payload;

/**
 * Point-to-point cross-chain transport SPI, bound to one source chain.
 *
 * <p><strong>Delivery Guarantees:</strong></p>
 * <ul>
 *   <li>At-least-once delivery</li>
 *   <li>No global ordering; send order is preserved per (source, destination) pair</li>
 *   <li>The destination sees the sending chain and the configured messenger as the caller</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Messenger {

    /**
     * Sends an opaque body to a target on another chain.
     *
     * @param destination the destination chain
     * @param target the receiving address on the destination chain
     * @param body the message body
     * @return the transport message id
     * @throws IllegalArgumentException if any argument is null
     */
    MessageId send(ChainId destination, Address target, Payload body);
}
