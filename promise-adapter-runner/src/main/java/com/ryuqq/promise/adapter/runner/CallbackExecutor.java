package com.ryuqq.promise.adapter.runner;

import com.ryuqq.promise.core.callback.AwaitChildren;
import com.ryuqq.promise.core.callback.CallbackContext;
import com.ryuqq.promise.core.callback.CallbackDescriptor;
import com.ryuqq.promise.core.callback.CallbackKind;
import com.ryuqq.promise.core.callback.CallbackResult;
import com.ryuqq.promise.core.callback.CallbackRevertException;
import com.ryuqq.promise.core.callback.CallbackTarget;
import com.ryuqq.promise.core.callback.Immediate;
import com.ryuqq.promise.core.error.PromiseException;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.PromiseRecord;
import com.ryuqq.promise.core.spi.CallbackRegistry;
import com.ryuqq.promise.core.spi.CallbackTargets;
import com.ryuqq.promise.core.statemachine.PromiseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * 콜백 디스크립터 하나를 실행하고 continuation을 settle.
 *
 * <p><strong>실행 규칙:</strong></p>
 * <pre>
 * kind     parent     동작
 * ──────── ────────── ─────────────────────────────────────────────
 * THEN     RESOLVED   success 실행 → 실패 시 error 있으면 error 실행, 없으면 reject
 * THEN     REJECTED   error 있으면 error 실행, 없으면 부모 값으로 reject
 * CATCH    RESOLVED   부모 값 그대로 resolve
 * CATCH    REJECTED   error 실행
 * FORWARD  RESOLVED   목적지 체인으로 setup → execute 전송
 * FORWARD  REJECTED   프록시를 부모 값으로 reject
 * </pre>
 *
 * <p>디스크립터는 대상 호출 전에 실행됨으로 표시되므로 같은 콜백이 두 번 실행되지 않습니다.
 * 콜백이 실패해도 콜백 안에서 일어난 다른 상태 변경은 되돌리지 않습니다.</p>
 *
 * <p>콜백이 실행 진입점을 재호출하면 그 예외를 잡았더라도 continuation은 REENTRANT_CALL
 * 값으로 reject 되고 error 핸들러로 넘어가지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class CallbackExecutor {

    private static final Logger log = LoggerFactory.getLogger(CallbackExecutor.class);

    static final String MDC_CHAIN_ID = "chainId";
    static final String MDC_PROMISE_ID = "promiseId";
    static final String MDC_REGISTRANT = "registrant";

    private final ChainId chainId;
    private final CallbackRegistry registry;
    private final CallbackTargets targets;
    private final CallbackAuthContext authContext;
    private final AtomicCoordinator coordinator;
    private final CrossChainForwarder forwarder;
    private final PromiseSettler settler;

    CallbackExecutor(
        ChainId chainId,
        CallbackRegistry registry,
        CallbackTargets targets,
        CallbackAuthContext authContext,
        AtomicCoordinator coordinator,
        CrossChainForwarder forwarder,
        PromiseSettler settler
    ) {
        this.chainId = chainId;
        this.registry = registry;
        this.targets = targets;
        this.authContext = authContext;
        this.coordinator = coordinator;
        this.forwarder = forwarder;
        this.settler = settler;
    }

    /**
     * 종료된 부모에 대해 디스크립터 실행.
     *
     * @param descriptor 실행할 디스크립터
     * @param parent 종료 상태의 부모 레코드
     */
    void execute(CallbackDescriptor descriptor, PromiseRecord parent) {
        if (parent.isPending()) {
            throw new IllegalStateException("Parent is still pending: " + parent.id());
        }
        registry.markExecuted(descriptor.continuationId());

        boolean resolved = parent.status() == PromiseStatus.RESOLVED;
        if (descriptor.kind() == CallbackKind.FORWARD) {
            if (resolved) {
                forwarder.forward(descriptor, parent.value());
            } else {
                settler.settle(descriptor.continuationId(), PromiseStatus.REJECTED, parent.value());
            }
            return;
        }

        if (descriptor.kind() == CallbackKind.CATCH) {
            if (resolved) {
                settler.settle(descriptor.continuationId(), PromiseStatus.RESOLVED, parent.value());
            } else {
                apply(descriptor, invoke(descriptor, descriptor.errorSelector(), parent.value()));
            }
            return;
        }

        if (!resolved) {
            if (descriptor.errorSelectorIfPresent().isPresent()) {
                apply(descriptor, invoke(descriptor, descriptor.errorSelector(), parent.value()));
            } else {
                settler.settle(descriptor.continuationId(), PromiseStatus.REJECTED, parent.value());
            }
            return;
        }

        Invocation success = invoke(descriptor, descriptor.successSelector(), parent.value());
        if (success.recoverable() && descriptor.errorSelectorIfPresent().isPresent()) {
            apply(descriptor, invoke(descriptor, descriptor.errorSelector(), success.failure()));
            return;
        }
        apply(descriptor, success);
    }

    private Invocation invoke(CallbackDescriptor descriptor, String selector, Payload value) {
        CallbackContext context = new CallbackContext(
            descriptor.registrant(),
            descriptor.sourceChain(),
            chainId,
            descriptor.parentId(),
            descriptor.continuationId());

        authContext.enter(context);
        String previousChainId = MDC.get(MDC_CHAIN_ID);
        String previousPromiseId = MDC.get(MDC_PROMISE_ID);
        String previousRegistrant = MDC.get(MDC_REGISTRANT);
        MDC.put(MDC_CHAIN_ID, String.valueOf(chainId.getValue()));
        MDC.put(MDC_PROMISE_ID, descriptor.continuationId().toHex());
        MDC.put(MDC_REGISTRANT, descriptor.registrant().getValue());
        Invocation invocation;
        PromiseException violation;
        try {
            CallbackTarget target = targets.find(descriptor.target())
                .orElseThrow(() -> new IllegalStateException("No component deployed at " + descriptor.target()));
            CallbackResult result = target.invoke(selector, value, context);
            if (result == null) {
                throw new IllegalStateException("Callback returned null: " + selector);
            }
            invocation = Invocation.success(result);
        } catch (CallbackRevertException e) {
            log.warn("Callback {} on {} reverted", selector, descriptor.target());
            invocation = Invocation.failure(e.getPayload());
        } catch (RuntimeException e) {
            log.warn("Callback {} on {} failed: {}", selector, descriptor.target(), e.toString());
            invocation = Invocation.failure(failurePayload(e));
        } finally {
            violation = authContext.exit();
            restore(MDC_CHAIN_ID, previousChainId);
            restore(MDC_PROMISE_ID, previousPromiseId);
            restore(MDC_REGISTRANT, previousRegistrant);
        }

        if (violation != null) {
            // 콜백이 REENTRANT_CALL을 잡았더라도 결과는 버린다
            log.warn("Callback {} on {} made a reentrant call: {}", selector, descriptor.target(), violation.getMessage());
            return Invocation.violation(failurePayload(violation));
        }
        return invocation;
    }

    private void apply(CallbackDescriptor descriptor, Invocation invocation) {
        if (invocation.failed()) {
            settler.settle(descriptor.continuationId(), PromiseStatus.REJECTED, invocation.failure());
            return;
        }
        CallbackResult result = invocation.result();
        if (result instanceof Immediate immediate) {
            settler.settle(descriptor.continuationId(), PromiseStatus.RESOLVED, immediate.value());
            return;
        }
        AwaitChildren awaitChildren = (AwaitChildren) result;
        try {
            coordinator.validate(descriptor.continuationId(), awaitChildren.children());
        } catch (IllegalArgumentException | PromiseException e) {
            log.warn("Invalid children from {}: {}", descriptor.target(), e.getMessage());
            settler.settle(descriptor.continuationId(), PromiseStatus.REJECTED, failurePayload(e));
            return;
        }
        coordinator.register(descriptor.continuationId(), awaitChildren.children());
    }

    /**
     * 잡힌 예외를 실패 값으로 변환: {@code "<code>: <message>"}.
     */
    static Payload failurePayload(RuntimeException e) {
        String code = e instanceof PromiseException promiseException
            ? promiseException.getErrorCode().name()
            : e.getClass().getSimpleName();
        String message = e.getMessage() == null ? "" : e.getMessage();
        return Payload.ofUtf8(code + ": " + message);
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    private static final class Invocation {
        private final CallbackResult result;
        private final Payload failure;
        private final boolean recoverable;

        private Invocation(CallbackResult result, Payload failure, boolean recoverable) {
            this.result = result;
            this.failure = failure;
            this.recoverable = recoverable;
        }

        static Invocation success(CallbackResult result) {
            return new Invocation(result, null, false);
        }

        static Invocation failure(Payload failure) {
            return new Invocation(null, failure, true);
        }

        /**
         * 에러 핸들러로 넘기지 않는 실패 (재진입 위반).
         */
        static Invocation violation(Payload failure) {
            return new Invocation(null, failure, false);
        }

        boolean failed() {
            return failure != null;
        }

        boolean recoverable() {
            return failed() && recoverable;
        }

        CallbackResult result() {
            return result;
        }

        Payload failure() {
            return failure;
        }
    }
}
