package com.ryuqq.promise.core.model;

/**
 * 원격 체인의 setup 메시지로 만들어진 미러 Promise.
 *
 * @param sourceChain setup을 보낸 체인
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MirrorOrigin(ChainId sourceChain) implements PromiseOrigin {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException sourceChain이 null인 경우
     */
    public MirrorOrigin {
        if (sourceChain == null) {
            throw new IllegalArgumentException("sourceChain cannot be null");
        }
    }
}
