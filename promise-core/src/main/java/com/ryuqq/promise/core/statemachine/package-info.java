/**
 * Promise state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.core.statemachine.PromiseStatus} - Promise lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.promise.core.statemachine.StatusTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → RESOLVED
 * PENDING → REJECTED
 *
 * Forbidden:
 * - RESOLVED → * (terminal state)
 * - REJECTED → * (terminal state)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * PromiseStatus status = PromiseStatus.PENDING;
 * status = StatusTransition.transition(status, PromiseStatus.RESOLVED);
 *
 * // This will throw PromiseException (ALREADY_TERMINAL)
 * StatusTransition.validate(status, PromiseStatus.REJECTED);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.promise.core.statemachine;
