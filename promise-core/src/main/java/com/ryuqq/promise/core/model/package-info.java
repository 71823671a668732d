/**
 * Core domain model package containing value objects and promise records.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.core.model.PromiseId} - 256-bit promise identifier</li>
 *   <li>{@link com.ryuqq.promise.core.model.ChainId} - Execution environment identifier</li>
 *   <li>{@link com.ryuqq.promise.core.model.Address} - Principal or component address</li>
 *   <li>{@link com.ryuqq.promise.core.model.Payload} - Opaque binary value</li>
 *   <li>{@link com.ryuqq.promise.core.model.MessageId} - Transport message identifier</li>
 * </ul>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.core.model.PromiseRecord} - Stored promise state</li>
 *   <li>{@link com.ryuqq.promise.core.model.PromiseOrigin} - Local / remote proxy / mirror tag</li>
 *   <li>{@link com.ryuqq.promise.core.model.PromiseSnapshot} - Terminal state shared across chains</li>
 * </ul>
 *
 * <h2>Identity</h2>
 * <p>{@link com.ryuqq.promise.core.model.PromiseIds} derives identifiers deterministically,
 * so two chains computing the same inputs agree on the same id without coordination.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.promise.core.model;
