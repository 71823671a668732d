package com.ryuqq.promise.core.callback;

import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.PromiseId;

import java.util.Optional;

/**
 * 부모 Promise에 등록된 콜백 한 건.
 *
 * <p>부모 하나에 여러 디스크립터가 등록될 수 있으며 각 디스크립터는 정확히 하나의
 * continuation을 가집니다. registrant와 sourceChain은 등록 시점에 기록되어
 * 실행 시 인증 컨텍스트로 그대로 노출됩니다.</p>
 *
 * <p><strong>종류별 필드:</strong></p>
 * <ul>
 *   <li>THEN: successSelector 필수, errorSelector 선택</li>
 *   <li>CATCH: errorSelector 필수 (successSelector는 사용하지 않지만 errorSelector와 같은 값)</li>
 *   <li>FORWARD: destination 필수, target/successSelector는 목적지 체인에서 호출됨</li>
 * </ul>
 *
 * @param parentId 부모 Promise
 * @param continuationId 결과가 기록될 Promise (FORWARD의 경우 로컬 프록시)
 * @param target 콜백 대상 주소
 * @param successSelector 성공 핸들러 이름
 * @param errorSelector 오류 핸들러 이름 (선택, null 가능)
 * @param kind 등록 종류
 * @param registrant 등록자
 * @param sourceChain 등록 체인
 * @param destination 목적지 체인 (FORWARD 전용, 그 외 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CallbackDescriptor(
    PromiseId parentId,
    PromiseId continuationId,
    Address target,
    String successSelector,
    String errorSelector,
    CallbackKind kind,
    Address registrant,
    ChainId sourceChain,
    ChainId destination
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 없거나 종류와 필드 조합이 맞지 않는 경우
     */
    public CallbackDescriptor {
        if (parentId == null) {
            throw new IllegalArgumentException("parentId cannot be null");
        }
        if (continuationId == null) {
            throw new IllegalArgumentException("continuationId cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (successSelector == null || successSelector.isBlank()) {
            throw new IllegalArgumentException("successSelector cannot be null or blank");
        }
        if (errorSelector != null && errorSelector.isBlank()) {
            throw new IllegalArgumentException("errorSelector cannot be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (registrant == null) {
            throw new IllegalArgumentException("registrant cannot be null");
        }
        if (sourceChain == null) {
            throw new IllegalArgumentException("sourceChain cannot be null");
        }
        if (kind == CallbackKind.CATCH && errorSelector == null) {
            throw new IllegalArgumentException("CATCH descriptor requires errorSelector");
        }
        if ((kind == CallbackKind.FORWARD) != (destination != null)) {
            throw new IllegalArgumentException("destination must be present iff kind is FORWARD");
        }
    }

    /**
     * 로컬 then 디스크립터 생성.
     */
    public static CallbackDescriptor then(PromiseId parentId, PromiseId continuationId, Address target,
                                          String successSelector, String errorSelector,
                                          Address registrant, ChainId sourceChain) {
        return new CallbackDescriptor(parentId, continuationId, target, successSelector, errorSelector,
            CallbackKind.THEN, registrant, sourceChain, null);
    }

    /**
     * onReject 디스크립터 생성.
     */
    public static CallbackDescriptor onReject(PromiseId parentId, PromiseId continuationId, Address target,
                                              String errorSelector, Address registrant, ChainId sourceChain) {
        return new CallbackDescriptor(parentId, continuationId, target, errorSelector, errorSelector,
            CallbackKind.CATCH, registrant, sourceChain, null);
    }

    /**
     * 크로스체인 then 디스크립터 생성.
     */
    public static CallbackDescriptor forward(PromiseId parentId, PromiseId localProxyId, Address target,
                                             String successSelector, Address registrant,
                                             ChainId sourceChain, ChainId destination) {
        return new CallbackDescriptor(parentId, localProxyId, target, successSelector, null,
            CallbackKind.FORWARD, registrant, sourceChain, destination);
    }

    public Optional<String> errorSelectorIfPresent() {
        return Optional.ofNullable(errorSelector);
    }

    public Optional<ChainId> destinationIfForward() {
        return Optional.ofNullable(destination);
    }
}
