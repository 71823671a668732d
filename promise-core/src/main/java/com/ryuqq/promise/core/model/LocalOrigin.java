package com.ryuqq.promise.core.model;

/**
 * 로컬에서 생성된 Promise.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LocalOrigin() implements PromiseOrigin {

    private static final LocalOrigin INSTANCE = new LocalOrigin();

    /**
     * 공유 인스턴스.
     *
     * @return LocalOrigin
     */
    public static LocalOrigin instance() {
        return INSTANCE;
    }
}
