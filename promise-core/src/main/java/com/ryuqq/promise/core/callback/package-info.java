/**
 * Callback model package.
 *
 * <p>Describes what runs when a promise settles: the registered
 * {@link com.ryuqq.promise.core.callback.CallbackDescriptor}, the
 * {@link com.ryuqq.promise.core.callback.CallbackTarget} it names, the tagged
 * {@link com.ryuqq.promise.core.callback.CallbackResult} a handler returns and the
 * {@link com.ryuqq.promise.core.callback.CallbackContext} passed to every invocation.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.promise.core.callback;
