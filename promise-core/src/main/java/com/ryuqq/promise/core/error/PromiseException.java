package com.ryuqq.promise.core.error;

/**
 * 엔진의 권한 및 상태 머신 위반.
 *
 * <p>{@link PromiseErrorCode}로 원인을 구분합니다. 콜백 내부에서 발생해 잡히지 않은 경우
 * 실행기가 continuation을 이 오류의 payload로 reject 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PromiseException extends RuntimeException {

    private final PromiseErrorCode errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @throws IllegalArgumentException errorCode가 null인 경우
     */
    public PromiseException(PromiseErrorCode errorCode, String message) {
        super(message);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    public static PromiseException unauthorized(String message) {
        return new PromiseException(PromiseErrorCode.UNAUTHORIZED, message);
    }

    public static PromiseException alreadyTerminal(String message) {
        return new PromiseException(PromiseErrorCode.ALREADY_TERMINAL, message);
    }

    public static PromiseException notReady(String message) {
        return new PromiseException(PromiseErrorCode.NOT_READY, message);
    }

    public static PromiseException reentrantCall(String message) {
        return new PromiseException(PromiseErrorCode.REENTRANT_CALL, message);
    }

    public static PromiseException noActiveCallback(String message) {
        return new PromiseException(PromiseErrorCode.NO_ACTIVE_CALLBACK, message);
    }

    public static PromiseException unordered(String message) {
        return new PromiseException(PromiseErrorCode.UNORDERED, message);
    }

    public static PromiseException unknownPromise(String message) {
        return new PromiseException(PromiseErrorCode.UNKNOWN_PROMISE, message);
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public PromiseErrorCode getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return "PromiseException{" + errorCode + ": " + getMessage() + '}';
    }
}
