package com.ryuqq.promise.core.error;

/**
 * 엔진이 즉시 표면화하는 오류 분류.
 *
 * <p>권한 및 상태 머신 위반은 일시적 조건이 아니라 프로그래머/공격자 오류를 뜻하므로
 * 재시도하거나 삼키지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum PromiseErrorCode {

    /**
     * 생성자가 아닌 호출자의 resolve/reject, 또는 메신저 전용 진입점에 대한 다른 호출자.
     */
    UNAUTHORIZED,

    /**
     * 이미 종료된 Promise에 대한 resolve/reject.
     */
    ALREADY_TERMINAL,

    /**
     * 종료되지 않은 Promise에 대한 콜백 실행 또는 체인 플러시.
     */
    NOT_READY,

    /**
     * 콜백 실행 중 실행 진입점 재호출.
     */
    REENTRANT_CALL,

    /**
     * 활성 콜백 밖에서의 인증 컨텍스트 조회.
     */
    NO_ACTIVE_CALLBACK,

    /**
     * setup 메시지보다 먼저 도착한 execute 메시지.
     */
    UNORDERED,

    /**
     * 저장소에 없는 Promise 식별자.
     */
    UNKNOWN_PROMISE
}
