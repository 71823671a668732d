package com.ryuqq.promise.core.callback;

/**
 * 콜백 등록 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CallbackKind {

    /**
     * then 등록. 부모가 RESOLVED면 성공 핸들러, REJECTED면 (있는 경우) 오류 핸들러.
     */
    THEN,

    /**
     * onReject 등록. 부모가 RESOLVED면 값을 그대로 continuation에 전달.
     */
    CATCH,

    /**
     * 크로스체인 then 등록. 부모 값을 목적지 체인으로 전달.
     */
    FORWARD
}
