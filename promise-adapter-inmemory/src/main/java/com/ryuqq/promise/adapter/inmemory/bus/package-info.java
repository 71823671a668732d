/**
 * In-memory cross-chain transport: one shared bus, a messenger per chain.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.promise.adapter.inmemory.bus;
