package com.ryuqq.promise.application.engine;

import com.ryuqq.promise.core.callback.CallbackContext;
import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.MessageId;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.model.PromiseRecord;
import com.ryuqq.promise.core.statemachine.PromiseStatus;

import java.util.List;
import java.util.Optional;

/**
 * 체인 하나에 배포되는 Promise 엔진.
 *
 * <p>모든 상태 전이는 호출자가 명시적으로 일으킵니다. 콜백은 등록만으로 실행되지 않으며
 * {@link #executePromiseCallbacks(PromiseId)} 또는 {@link #flushChain(PromiseId, int)}
 * 호출이 있어야 실행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PromiseId p = engine.create(alice);
 * PromiseId next = engine.then(alice, p, doubler, "double");
 * engine.resolve(alice, p, Payload.ofUtf8("100"));
 * engine.executePromiseCallbacks(p);   // next → RESOLVED
 *
 * // 크로스체인: 목적지 체인에서 콜백 실행 후 proxy가 settle 됨
 * PromiseId proxy = engine.then(alice, p2, ChainId.of(902), doubler, "double");
 * </pre>
 *
 * <p><strong>오류:</strong> 권한 및 상태 머신 위반은
 * {@link com.ryuqq.promise.core.error.PromiseException}으로 즉시 표면화되며,
 * 인자 검증 실패는 {@link IllegalArgumentException}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface PromiseEngine {

    /**
     * 이 엔진이 배포된 체인.
     *
     * @return 체인 식별자
     */
    ChainId chainId();

    /**
     * 엔진 자신의 주소 (continuation과 프록시의 생성자).
     *
     * @return 엔진 주소
     */
    Address address();

    // ========== 생성 및 전이 ==========

    /**
     * 호출자가 소유하는 PENDING Promise 생성.
     *
     * @param caller 생성자
     * @return 새 Promise 식별자
     */
    PromiseId create(Address caller);

    /**
     * 기한이 있는 PENDING Promise 생성.
     *
     * @param caller 생성자
     * @param deadlineMillis 기한 ({@link com.ryuqq.promise.core.spi.MonotonicClock} 기준)
     * @return 새 Promise 식별자
     */
    PromiseId createTimeout(Address caller, long deadlineMillis);

    /**
     * Promise resolve.
     *
     * @param caller 호출자 (생성자여야 함)
     * @param id 대상
     * @param value 값
     * @throws com.ryuqq.promise.core.error.PromiseException UNAUTHORIZED, ALREADY_TERMINAL, UNKNOWN_PROMISE
     */
    void resolve(Address caller, PromiseId id, Payload value);

    /**
     * Promise reject.
     *
     * @param caller 호출자 (생성자여야 함)
     * @param id 대상
     * @param value 실패 값
     * @throws com.ryuqq.promise.core.error.PromiseException UNAUTHORIZED, ALREADY_TERMINAL, UNKNOWN_PROMISE
     */
    void reject(Address caller, PromiseId id, Payload value);

    /**
     * 기한이 지난 타임아웃 Promise를 기한 값(8바이트 big-endian)으로 resolve. 누구나 호출 가능.
     *
     * @param id 타임아웃 Promise
     * @throws com.ryuqq.promise.core.error.PromiseException 기한 전이면 NOT_READY, 이미 종료면 ALREADY_TERMINAL
     * @throws IllegalArgumentException 타임아웃 Promise가 아닌 경우
     */
    void resolveTimeout(PromiseId id);

    // ========== 조회 ==========

    /**
     * @throws com.ryuqq.promise.core.error.PromiseException 알 수 없는 id인 경우 (UNKNOWN_PROMISE)
     */
    PromiseStatus status(PromiseId id);

    /**
     * @return 확정 값, PENDING이면 빈 값
     * @throws com.ryuqq.promise.core.error.PromiseException 알 수 없는 id인 경우 (UNKNOWN_PROMISE)
     */
    Optional<Payload> value(PromiseId id);

    Optional<PromiseRecord> find(PromiseId id);

    boolean exists(PromiseId id);

    /**
     * 원격 결과를 기다리는 로컬 프록시인지 확인.
     *
     * @param id 대상
     * @return RemoteProxy 이면서 PENDING이면 true
     */
    boolean isProxyPending(PromiseId id);

    // ========== 콜백 등록 ==========

    /**
     * 성공 핸들러만 있는 then 등록.
     *
     * @return continuation 식별자
     * @throws com.ryuqq.promise.core.error.PromiseException 부모가 없는 경우 (UNKNOWN_PROMISE)
     */
    PromiseId then(Address caller, PromiseId parentId, Address target, String successSelector);

    /**
     * 성공/오류 핸들러가 있는 then 등록.
     *
     * @return continuation 식별자
     */
    PromiseId then(Address caller, PromiseId parentId, Address target, String successSelector, String errorSelector);

    /**
     * 크로스체인 then 등록. 콜백은 목적지 체인에서 실행되고 결과는 로컬 프록시로 돌아옵니다.
     *
     * @return 로컬 프록시 식별자 (목적지 미러와 같은 값)
     * @throws IllegalArgumentException destination이 이 체인인 경우
     */
    PromiseId then(Address caller, PromiseId parentId, ChainId destination, Address target, String successSelector);

    /**
     * 오류 핸들러만 있는 등록. 부모가 resolve 되면 값을 그대로 전달합니다.
     *
     * @return continuation 식별자
     */
    PromiseId onReject(Address caller, PromiseId parentId, Address target, String errorSelector);

    // ========== 수동 실행 ==========

    /**
     * 종료된 Promise의 실행되지 않은 콜백을 등록 순서대로 실행.
     *
     * @param id 부모 Promise
     * @return 이번 호출에서 실행된 콜백 수
     * @throws com.ryuqq.promise.core.error.PromiseException NOT_READY, REENTRANT_CALL, UNKNOWN_PROMISE
     */
    int executePromiseCallbacks(PromiseId id);

    /**
     * 첫 번째 continuation을 따라가며 콜백을 최대 maxSteps 단계 실행.
     *
     * @param startId 시작 Promise (종료 상태여야 함)
     * @param maxSteps 최대 단계 (양수)
     * @return 실제로 콜백을 실행한 단계 수
     */
    int flushChain(PromiseId startId, int maxSteps);

    // ========== Promise.all ==========

    /**
     * 멤버 집합을 고정한 집계 Promise 생성.
     *
     * @param caller 요청자
     * @param memberIds 로컬에 존재하는 멤버 (순서 유지)
     * @return 집계 Promise 식별자
     */
    PromiseId createAll(Address caller, List<PromiseId> memberIds);

    AllStatus checkAll(PromiseId allId);

    /**
     * 준비된 집계 Promise를 settle.
     *
     * @param allId 집계 Promise
     * @throws com.ryuqq.promise.core.error.PromiseException 준비 전이면 NOT_READY, 이미 종료면 ALREADY_TERMINAL
     */
    void settleAll(PromiseId allId);

    // ========== 크로스체인 ==========

    /**
     * 종료된 Promise의 스냅샷을 다른 체인으로 전송.
     *
     * @return 전송 메시지 식별자
     * @throws com.ryuqq.promise.core.error.PromiseException 미러면 UNAUTHORIZED, PENDING이면 NOT_READY
     */
    MessageId sharePromise(Address caller, PromiseId id, ChainId destination);

    Optional<ForwardingRecord> forwarding(PromiseId localProxyId);

    Optional<AtomicState> atomicState(PromiseId parentId);

    // ========== 콜백 인증 컨텍스트 ==========

    /**
     * 실행 중인 콜백의 등록자.
     *
     * @throws com.ryuqq.promise.core.error.PromiseException 콜백 실행 중이 아니면 NO_ACTIVE_CALLBACK
     */
    Address callbackRegistrant();

    /**
     * 실행 중인 콜백의 등록 체인.
     *
     * @throws com.ryuqq.promise.core.error.PromiseException 콜백 실행 중이 아니면 NO_ACTIVE_CALLBACK
     */
    ChainId callbackSourceChain();

    CallbackContext callbackContext();
}
