package com.ryuqq.promise.adapter.runner;

import com.ryuqq.promise.core.callback.CallbackContext;
import com.ryuqq.promise.core.error.PromiseException;

/**
 * 콜백 실행 중에만 활성화되는 인증 컨텍스트와 재진입 가드.
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * enter(ctx)     → 활성 (재진입 플래그 set)
 *   target.invoke(...)
 * exit()         → finally 블록에서 무조건 해제, 기록된 재진입 위반 반환
 * </pre>
 *
 * <p>{@link #guard(String)}는 예외를 던지는 것과 별개로 위반을 기록합니다. 콜백이 예외를
 * 잡아 삼켜도 실행기는 {@link #exit()}의 반환값으로 바깥 continuation을 reject 합니다.</p>
 *
 * <p>엔진은 한 체인에서 단일 스레드로 동작하므로 스레드 동기화는 하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class CallbackAuthContext {

    private CallbackContext active;
    private PromiseException violation;

    /**
     * 컨텍스트 활성화.
     *
     * @param context 콜백 컨텍스트
     * @throws PromiseException 이미 활성 상태인 경우 (REENTRANT_CALL)
     */
    void enter(CallbackContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (active != null) {
            throw PromiseException.reentrantCall("A callback is already executing");
        }
        active = context;
        violation = null;
    }

    /**
     * 컨텍스트 해제.
     *
     * @return 활성 중 기록된 재진입 위반, 없으면 null
     */
    PromiseException exit() {
        PromiseException recorded = violation;
        active = null;
        violation = null;
        return recorded;
    }

    boolean isActive() {
        return active != null;
    }

    /**
     * 실행 진입점 재진입 검사.
     *
     * @param operation 호출된 진입점 이름
     * @throws PromiseException 콜백 실행 중인 경우 (REENTRANT_CALL)
     */
    void guard(String operation) {
        if (active != null) {
            PromiseException e = PromiseException.reentrantCall(
                operation + " cannot be called while a callback is executing");
            if (violation == null) {
                violation = e;
            }
            throw e;
        }
    }

    /**
     * 현재 컨텍스트 조회.
     *
     * @return 활성 컨텍스트
     * @throws PromiseException 콜백 실행 중이 아닌 경우 (NO_ACTIVE_CALLBACK)
     */
    CallbackContext current() {
        if (active == null) {
            throw PromiseException.noActiveCallback("No callback is executing");
        }
        return active;
    }
}
