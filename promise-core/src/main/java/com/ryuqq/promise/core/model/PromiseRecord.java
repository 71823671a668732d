package com.ryuqq.promise.core.model;

import com.ryuqq.promise.core.statemachine.PromiseStatus;
import com.ryuqq.promise.core.statemachine.StatusTransition;

import java.util.Optional;

/**
 * 저장소에 기록되는 Promise 한 건.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>value는 status가 PENDING일 때만 null</li>
 *   <li>status는 PENDING에서 정확히 한 번만 전이</li>
 *   <li>deadlineMillis는 타임아웃 Promise에만 존재 (그 외 null)</li>
 * </ul>
 *
 * <p>레코드는 불변이며 {@link #settle(PromiseStatus, Payload)}와
 * {@link #withNextNonce(long)}는 새 인스턴스를 반환합니다.</p>
 *
 * @param id Promise 식별자
 * @param status 현재 상태
 * @param value 확정 값 (PENDING이면 null)
 * @param creator resolve/reject 권한을 가진 주소
 * @param origin 생성 경로
 * @param nextNonce 다음 콜백 등록에 쓰일 순번
 * @param deadlineMillis 타임아웃 기한 (epoch millis, 선택)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PromiseRecord(
    PromiseId id,
    PromiseStatus status,
    Payload value,
    Address creator,
    PromiseOrigin origin,
    long nextNonce,
    Long deadlineMillis
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 value와 status가 어긋나는 경우
     */
    public PromiseRecord {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (creator == null) {
            throw new IllegalArgumentException("creator cannot be null");
        }
        if (origin == null) {
            throw new IllegalArgumentException("origin cannot be null");
        }
        if (status.isTerminal() == (value == null)) {
            throw new IllegalArgumentException(
                "value must be present iff status is terminal (status: " + status + ")");
        }
        if (nextNonce < 0) {
            throw new IllegalArgumentException("nextNonce must be non-negative (current: " + nextNonce + ")");
        }
    }

    /**
     * 대기 중인 Promise 생성.
     *
     * @param id 식별자
     * @param creator 생성자
     * @param origin 생성 경로
     * @return PENDING 레코드
     */
    public static PromiseRecord pending(PromiseId id, Address creator, PromiseOrigin origin) {
        return new PromiseRecord(id, PromiseStatus.PENDING, null, creator, origin, 0L, null);
    }

    /**
     * 기한이 있는 대기 중 Promise 생성.
     *
     * @param id 식별자
     * @param creator 생성자
     * @param deadlineMillis 기한 (epoch millis)
     * @return PENDING 레코드
     */
    public static PromiseRecord pendingWithDeadline(PromiseId id, Address creator, long deadlineMillis) {
        return new PromiseRecord(id, PromiseStatus.PENDING, null, creator, LocalOrigin.instance(), 0L, deadlineMillis);
    }

    /**
     * 상태 전이 (PENDING → RESOLVED/REJECTED).
     *
     * @param next 종료 상태
     * @param settledValue 확정 값
     * @return 전이된 레코드
     * @throws com.ryuqq.promise.core.error.PromiseException 이미 종료된 경우 (ALREADY_TERMINAL)
     */
    public PromiseRecord settle(PromiseStatus next, Payload settledValue) {
        StatusTransition.validate(status, next);
        if (settledValue == null) {
            throw new IllegalArgumentException("settledValue cannot be null");
        }
        return new PromiseRecord(id, next, settledValue, creator, origin, nextNonce, deadlineMillis);
    }

    /**
     * 등록 순번 갱신.
     *
     * @param nonce 새 순번
     * @return 갱신된 레코드
     */
    public PromiseRecord withNextNonce(long nonce) {
        return new PromiseRecord(id, status, value, creator, origin, nonce, deadlineMillis);
    }

    public boolean isPending() {
        return status == PromiseStatus.PENDING;
    }

    public Optional<Payload> valueIfSettled() {
        return Optional.ofNullable(value);
    }

    public Optional<Long> deadline() {
        return Optional.ofNullable(deadlineMillis);
    }

    /**
     * 공유용 스냅샷 생성.
     *
     * @return 스냅샷
     * @throws IllegalStateException 아직 PENDING인 경우
     */
    public PromiseSnapshot toSnapshot() {
        if (isPending()) {
            throw new IllegalStateException("Cannot snapshot a pending promise: " + id);
        }
        return new PromiseSnapshot(id, status, value);
    }
}
