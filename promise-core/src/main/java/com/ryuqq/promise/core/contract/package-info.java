/**
 * Cross-chain wire contract.
 *
 * <p>Defines the three messages engines exchange
 * ({@link com.ryuqq.promise.core.contract.SetupRemotePromise},
 * {@link com.ryuqq.promise.core.contract.ExecuteRemoteCallback},
 * {@link com.ryuqq.promise.core.contract.ShareResolvedPromise}),
 * their byte encoding and the {@link com.ryuqq.promise.core.contract.RelayEnvelope}
 * the transport carries them in.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.promise.core.contract;
