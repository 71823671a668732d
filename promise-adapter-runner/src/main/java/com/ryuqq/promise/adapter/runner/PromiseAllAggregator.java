package com.ryuqq.promise.adapter.runner;

import com.ryuqq.promise.application.engine.AllStatus;
import com.ryuqq.promise.core.error.PromiseException;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.Payloads;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.model.PromiseRecord;
import com.ryuqq.promise.core.spi.PromiseStore;
import com.ryuqq.promise.core.statemachine.PromiseStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Promise.all 집계.
 *
 * <p>멤버 집합은 생성 시점에 고정됩니다. 준비 여부는 조회할 때마다 멤버 상태로 계산하며,
 * 집계 Promise는 {@link #settle(PromiseId)} 호출로만 settle 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class PromiseAllAggregator {

    private final PromiseStore store;
    private final PromiseSettler settler;
    private final Map<PromiseId, List<PromiseId>> members = new HashMap<>();

    PromiseAllAggregator(PromiseStore store, PromiseSettler settler) {
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
     * 멤버 목록 검증.
     *
     * @throws IllegalArgumentException null 목록이나 null 요소가 있는 경우
     * @throws PromiseException 로컬에 없는 멤버가 있는 경우 (UNKNOWN_PROMISE)
     */
    void validate(List<PromiseId> memberIds) {
        if (memberIds == null) {
            throw new IllegalArgumentException("memberIds cannot be null");
        }
        for (PromiseId member : memberIds) {
            if (member == null) {
                throw new IllegalArgumentException("memberIds cannot contain null");
            }
            store.get(member);
        }
    }

    void track(PromiseId allId, List<PromiseId> memberIds) {
        members.put(allId, List.copyOf(memberIds));
    }

    AllStatus check(PromiseId allId) {
        List<PromiseId> memberIds = membersOf(allId);
        boolean allTerminal = true;
        boolean failed = false;
        List<Optional<Payload>> results = new ArrayList<>(memberIds.size());
        for (PromiseId member : memberIds) {
            PromiseRecord record = store.get(member);
            allTerminal &= !record.isPending();
            failed |= record.status() == PromiseStatus.REJECTED;
            results.add(record.valueIfSettled());
        }
        return new AllStatus(allTerminal || failed, failed, results);
    }

    /**
     * 준비된 집계 Promise를 settle.
     *
     * <ul>
     *   <li>failed → 첫 번째 REJECTED 멤버 값으로 reject</li>
     *   <li>모두 resolve → 멤버 값 묶음으로 resolve</li>
     * </ul>
     *
     * @throws PromiseException 준비되지 않은 경우 (NOT_READY)
     */
    void settle(PromiseId allId) {
        AllStatus status = check(allId);
        if (!status.ready()) {
            throw PromiseException.notReady("Promise.all " + allId + " has pending members");
        }
        if (status.failed()) {
            for (PromiseId member : membersOf(allId)) {
                PromiseRecord record = store.get(member);
                if (record.status() == PromiseStatus.REJECTED) {
                    settler.settle(allId, PromiseStatus.REJECTED, record.value());
                    return;
                }
            }
        }
        List<Payload> values = new ArrayList<>();
        for (Optional<Payload> result : status.results()) {
            values.add(result.orElseThrow());
        }
        settler.settle(allId, PromiseStatus.RESOLVED, Payloads.pack(values));
    }

    private List<PromiseId> membersOf(PromiseId allId) {
        List<PromiseId> memberIds = members.get(allId);
        if (memberIds == null) {
            store.get(allId);
            throw new IllegalArgumentException("Not a Promise.all promise: " + allId);
        }
        return memberIds;
    }
}
