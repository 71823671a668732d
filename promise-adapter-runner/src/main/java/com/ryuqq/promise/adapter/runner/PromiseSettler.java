package com.ryuqq.promise.adapter.runner;

import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.statemachine.PromiseStatus;

/**
 * 엔진 내부의 단일 settle 경로.
 *
 * <p>구현은 상태 전이를 저장한 뒤 전달기와 조정자에 알립니다. 권한 검사는 하지 않으므로
 * 엔진 소유 Promise(continuation, 프록시, 미러, 집계)에만 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
interface PromiseSettler {

    void settle(PromiseId id, PromiseStatus status, Payload value);
}
