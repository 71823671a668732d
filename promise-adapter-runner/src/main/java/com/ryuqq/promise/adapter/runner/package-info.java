/**
 * Runner Adapter Layer - Promise 엔진과 메시지 릴레이 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.adapter.runner.DefaultPromiseEngine} - 체인 하나의 Promise 엔진</li>
 *   <li>{@link com.ryuqq.promise.adapter.runner.MessageRelayRunner} - 체인 간 봉투 전달</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultPromiseEngine, MessageRelayRunner)
 *   ↓ implements
 * application (PromiseEngine, CrossChainEndpoint, MessageRelay)
 *   ↓ depends on
 * core (PromiseId, PromiseRecord, CallbackDescriptor, CrossChainMessage)
 *   ↓ depends on
 * core/spi (PromiseStore, CallbackRegistry, Messenger, MessageQueue)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.promise.adapter.runner;
