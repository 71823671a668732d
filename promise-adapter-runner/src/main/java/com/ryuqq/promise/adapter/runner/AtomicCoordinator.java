package com.ryuqq.promise.adapter.runner;

import com.ryuqq.promise.application.engine.AtomicState;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.Payloads;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.model.PromiseRecord;
import com.ryuqq.promise.core.spi.PromiseStore;
import com.ryuqq.promise.core.statemachine.PromiseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 콜백이 반환한 자식 Promise들과 부모 continuation의 원자적 조정.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>자식이 resolve 될 때마다 resolvedChildren 증가</li>
 *   <li>resolvedChildren == totalChildren → 부모를 자식 값 묶음으로 resolve</li>
 *   <li>자식 하나라도 reject → 부모를 그 값으로 즉시 reject (fail-fast)</li>
 *   <li>자식이 없거나 등록 시점에 모두 종료 → 즉시 settle</li>
 *   <li>fail-fast 후 남은 자식들의 대기 목록에서 부모를 제거</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class AtomicCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AtomicCoordinator.class);

    private final PromiseStore store;
    private final PromiseSettler settler;
    private final Map<PromiseId, AtomicState> states = new HashMap<>();
    private final Map<PromiseId, List<PromiseId>> waitingParents = new HashMap<>();

    AtomicCoordinator(PromiseStore store, PromiseSettler settler) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (settler == null) {
            throw new IllegalArgumentException("settler cannot be null");
        }
        this.store = store;
        this.settler = settler;
    }

    /**
     * 자식 목록 검증.
     *
     * @throws IllegalArgumentException 중복, 자기 참조, 로컬에 없는 자식이 있는 경우
     */
    void validate(PromiseId parentId, List<PromiseId> children) {
        Set<PromiseId> seen = new HashSet<>();
        for (PromiseId child : children) {
            if (child.equals(parentId)) {
                throw new IllegalArgumentException("A continuation cannot await itself: " + parentId);
            }
            if (!seen.add(child)) {
                throw new IllegalArgumentException("Duplicate child: " + child);
            }
            if (!store.exists(child)) {
                throw new IllegalArgumentException("Unknown child promise: " + child);
            }
        }
        if (states.containsKey(parentId)) {
            throw new IllegalArgumentException("Atomic state already registered for " + parentId);
        }
    }

    /**
     * 부모 continuation을 자식들에 묶음. {@link #validate(PromiseId, List)}를 먼저 통과해야 합니다.
     */
    void register(PromiseId parentId, List<PromiseId> children) {
        int resolved = 0;
        PromiseRecord firstRejected = null;
        for (PromiseId child : children) {
            PromiseRecord record = store.get(child);
            if (record.status() == PromiseStatus.RESOLVED) {
                resolved++;
            } else if (record.status() == PromiseStatus.REJECTED && firstRejected == null) {
                firstRejected = record;
            }
        }

        AtomicState state = new AtomicState(parentId, children, resolved);
        states.put(parentId, state);
        log.debug("Atomic state for {}: {}/{} children resolved", parentId, resolved, children.size());

        if (firstRejected != null) {
            settler.settle(parentId, PromiseStatus.REJECTED, firstRejected.value());
            return;
        }
        if (state.isComplete()) {
            settler.settle(parentId, PromiseStatus.RESOLVED, packValues(children));
            return;
        }
        for (PromiseId child : children) {
            if (store.get(child).isPending()) {
                waitingParents.computeIfAbsent(child, id -> new ArrayList<>()).add(parentId);
            }
        }
    }

    /**
     * 자식 settle 알림.
     */
    void onSettled(PromiseRecord child) {
        List<PromiseId> parents = waitingParents.remove(child.id());
        if (parents == null) {
            return;
        }
        for (PromiseId parentId : parents) {
            if (!store.get(parentId).isPending()) {
                continue;
            }
            if (child.status() == PromiseStatus.REJECTED) {
                log.debug("Child {} rejected, failing parent {}", child.id(), parentId);
                release(parentId);
                settler.settle(parentId, PromiseStatus.REJECTED, child.value());
                continue;
            }
            AtomicState next = states.get(parentId).withChildResolved();
            states.put(parentId, next);
            if (next.isComplete()) {
                log.debug("All {} children of {} resolved", next.totalChildren(), parentId);
                settler.settle(parentId, PromiseStatus.RESOLVED, packValues(next.children()));
            }
        }
    }

    private void release(PromiseId parentId) {
        for (PromiseId child : states.get(parentId).children()) {
            List<PromiseId> parents = waitingParents.get(child);
            if (parents == null) {
                continue;
            }
            parents.remove(parentId);
            if (parents.isEmpty()) {
                waitingParents.remove(child);
            }
        }
    }

    /**
     * 대기 중인 자식 수 (테스트 확인용).
     */
    int waitingChildCount() {
        return waitingParents.size();
    }

    Optional<AtomicState> state(PromiseId parentId) {
        return Optional.ofNullable(states.get(parentId));
    }

    private Payload packValues(List<PromiseId> children) {
        List<Payload> values = new ArrayList<>(children.size());
        for (PromiseId child : children) {
            values.add(store.get(child).value());
        }
        return Payloads.pack(values);
    }
}
