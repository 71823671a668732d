package com.ryuqq.promise.core.callback;

import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.PromiseId;

import java.util.List;

/**
 * 콜백 핸들러의 반환 값.
 *
 * <ul>
 *   <li>{@link Immediate}: continuation을 이 값으로 즉시 resolve</li>
 *   <li>{@link AwaitChildren}: 자식 Promise들이 모두 resolve 될 때까지 continuation 보류</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 엔진이 두 경우만 처리하면 됨을 보장합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface CallbackResult permits Immediate, AwaitChildren {

    /**
     * 즉시 값 반환.
     *
     * @param value 결과 값
     * @return Immediate
     */
    static CallbackResult immediate(Payload value) {
        return new Immediate(value);
    }

    /**
     * 자식 Promise 대기.
     *
     * @param children 자식 Promise 목록 (순서 유지)
     * @return AwaitChildren
     */
    static CallbackResult awaitChildren(List<PromiseId> children) {
        return new AwaitChildren(children);
    }

    default boolean isImmediate() {
        return this instanceof Immediate;
    }
}
