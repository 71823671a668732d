/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide storage, transport and time for the promise engine.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.core.spi.PromiseStore} - Promise record storage</li>
 *   <li>{@link com.ryuqq.promise.core.spi.CallbackRegistry} - Callback descriptors per parent</li>
 *   <li>{@link com.ryuqq.promise.core.spi.CallbackTargets} - Deployed callback components</li>
 *   <li>{@link com.ryuqq.promise.core.spi.Messenger} - Cross-chain send</li>
 *   <li>{@link com.ryuqq.promise.core.spi.MessageQueue} - Cross-chain delivery queue</li>
 *   <li>{@link com.ryuqq.promise.core.spi.MonotonicClock} - Time source</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., promise-adapter-inmemory) provide concrete implementations.
 * The core never depends on infrastructure.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.promise.core.spi;
