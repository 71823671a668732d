/**
 * Promise engine ports.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.application.engine.PromiseEngine} - Public API of one chain's engine</li>
 *   <li>{@link com.ryuqq.promise.application.engine.CrossChainEndpoint} - Messenger-only entrypoints</li>
 *   <li>{@link com.ryuqq.promise.application.engine.AllStatus} - Promise.all readiness</li>
 *   <li>{@link com.ryuqq.promise.application.engine.ForwardingRecord} - Cross-chain then bookkeeping</li>
 *   <li>{@link com.ryuqq.promise.application.engine.AtomicState} - Parent/children coordination</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.promise.application.engine;
