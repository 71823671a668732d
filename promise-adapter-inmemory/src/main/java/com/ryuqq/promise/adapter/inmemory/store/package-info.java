/**
 * In-memory storage adapters: promise records, callback descriptors and deployed components.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.promise.adapter.inmemory.store;
