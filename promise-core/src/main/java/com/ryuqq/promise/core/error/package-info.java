/**
 * Error taxonomy of the promise engine.
 *
 * <p>{@link com.ryuqq.promise.core.error.PromiseException} is unchecked and carries a
 * {@link com.ryuqq.promise.core.error.PromiseErrorCode}. Argument validation failures use
 * {@link java.lang.IllegalArgumentException} instead.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.promise.core.error;
