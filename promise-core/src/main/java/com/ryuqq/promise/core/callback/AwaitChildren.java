package com.ryuqq.promise.core.callback;

import com.ryuqq.promise.core.model.PromiseId;

import java.util.List;

/**
 * 자식 Promise들이 모두 resolve 된 뒤 continuation을 resolve 하는 결과 (atomic fan-out).
 *
 * <p>continuation 값은 자식 값들을 순서대로 묶은 것입니다
 * ({@link com.ryuqq.promise.core.model.Payloads#pack(List)}).</p>
 *
 * @param children 자식 Promise 목록 (순서 유지, 방어적 복사)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AwaitChildren(List<PromiseId> children) implements CallbackResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException children이 null이거나 null 요소를 포함하는 경우
     */
    public AwaitChildren {
        if (children == null) {
            throw new IllegalArgumentException("children cannot be null");
        }
        for (PromiseId child : children) {
            if (child == null) {
                throw new IllegalArgumentException("children cannot contain null");
            }
        }
        children = List.copyOf(children);
    }
}
