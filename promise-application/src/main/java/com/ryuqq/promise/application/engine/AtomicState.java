package com.ryuqq.promise.application.engine;

import com.ryuqq.promise.core.model.PromiseId;

import java.util.List;

/**
 * 부모 continuation과 자식 Promise들의 원자적 조정 상태.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>resolvedChildren ≤ totalChildren</li>
 *   <li>resolvedChildren == totalChildren 이 되는 순간 부모가 resolve 됨</li>
 * </ul>
 *
 * @param parentId 자식 결과를 기다리는 continuation
 * @param children 자식 Promise (순서 유지)
 * @param resolvedChildren resolve 된 자식 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AtomicState(
    PromiseId parentId,
    List<PromiseId> children,
    int resolvedChildren
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 카운터가 범위를 벗어난 경우
     */
    public AtomicState {
        if (parentId == null) {
            throw new IllegalArgumentException("parentId cannot be null");
        }
        if (children == null) {
            throw new IllegalArgumentException("children cannot be null");
        }
        children = List.copyOf(children);
        if (resolvedChildren < 0 || resolvedChildren > children.size()) {
            throw new IllegalArgumentException(
                "resolvedChildren must be between 0 and " + children.size() + " (current: " + resolvedChildren + ")");
        }
    }

    public int totalChildren() {
        return children.size();
    }

    public boolean isComplete() {
        return resolvedChildren == children.size();
    }

    /**
     * resolve 된 자식 하나 반영.
     *
     * @return 카운터가 1 증가한 AtomicState
     */
    public AtomicState withChildResolved() {
        return new AtomicState(parentId, children, resolvedChildren + 1);
    }
}
