package com.ryuqq.promise.core.callback;

import com.ryuqq.promise.core.model.Payload;

/**
 * continuation을 즉시 resolve 하는 결과.
 *
 * @param value 결과 값
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Immediate(Payload value) implements CallbackResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Immediate {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }
}
