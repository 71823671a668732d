/**
 * Message relay port.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.promise.application.relay;
