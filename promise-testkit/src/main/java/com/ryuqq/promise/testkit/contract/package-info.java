/**
 * Multi-chain contract test harness.
 *
 * <p>{@link com.ryuqq.promise.testkit.contract.AbstractContractTest} wires two
 * {@link com.ryuqq.promise.testkit.contract.ChainNode}s to one in-memory bus and relay.
 * Contract tests extend it to check engine behavior end to end.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.promise.testkit.contract;
