package com.ryuqq.promise.core.callback;

import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.PromiseId;

/**
 * 콜백 호출 한 번 동안만 유효한 인증 컨텍스트.
 *
 * <p>registrant와 sourceChain은 콜백 등록 시점에 기록된 값이며,
 * 크로스체인 콜백의 경우 setup 메시지에 담겨 그대로 전달됩니다.
 * 대상 컴포넌트는 이 값으로 "누가, 어느 체인에서" 등록했는지 확인합니다.</p>
 *
 * @param registrant 콜백을 등록한 주소
 * @param sourceChain 콜백이 등록된 체인
 * @param executingChain 콜백이 실행되는 체인
 * @param parentId 부모 Promise
 * @param continuationId 콜백 결과로 settle 될 Promise
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CallbackContext(
    Address registrant,
    ChainId sourceChain,
    ChainId executingChain,
    PromiseId parentId,
    PromiseId continuationId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public CallbackContext {
        if (registrant == null) {
            throw new IllegalArgumentException("registrant cannot be null");
        }
        if (sourceChain == null) {
            throw new IllegalArgumentException("sourceChain cannot be null");
        }
        if (executingChain == null) {
            throw new IllegalArgumentException("executingChain cannot be null");
        }
        if (parentId == null) {
            throw new IllegalArgumentException("parentId cannot be null");
        }
        if (continuationId == null) {
            throw new IllegalArgumentException("continuationId cannot be null");
        }
    }

    /**
     * 다른 체인에서 등록된 콜백인지 확인.
     *
     * @return sourceChain과 executingChain이 다르면 true
     */
    public boolean isCrossChain() {
        return !sourceChain.equals(executingChain);
    }
}
