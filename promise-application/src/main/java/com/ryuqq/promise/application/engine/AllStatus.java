package com.ryuqq.promise.application.engine;

import com.ryuqq.promise.core.model.Payload;

import java.util.List;
import java.util.Optional;

/**
 * Promise.all 집계 상태.
 *
 * <p><strong>불변식:</strong> ready ⇔ (모든 멤버가 종료) 또는 (하나라도 REJECTED).
 * failed ⇔ 하나라도 REJECTED. failed이면 ready입니다.</p>
 *
 * <p>results는 멤버 순서를 유지하며, 아직 PENDING인 멤버는 빈 값입니다.</p>
 *
 * @param ready 결과를 확정할 수 있는지 여부
 * @param failed 실패한 멤버가 있는지 여부
 * @param results 멤버별 값 (순서 유지)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AllStatus(
    boolean ready,
    boolean failed,
    List<Optional<Payload>> results
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException results가 null이거나 failed인데 ready가 아닌 경우
     */
    public AllStatus {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        if (failed && !ready) {
            throw new IllegalArgumentException("failed status must also be ready");
        }
        results = List.copyOf(results);
    }

    /**
     * 모든 멤버가 값을 가지는지 확인.
     *
     * @return 모든 results가 존재하면 true
     */
    public boolean allSettled() {
        return results.stream().allMatch(Optional::isPresent);
    }
}
