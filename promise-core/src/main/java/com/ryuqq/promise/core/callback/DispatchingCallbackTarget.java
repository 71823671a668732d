package com.ryuqq.promise.core.callback;

import com.ryuqq.promise.core.model.Payload;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * selector → {@link CallbackHandler} 매핑으로 동작하는 기본 CallbackTarget.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CallbackTarget doubler = DispatchingCallbackTarget.builder()
 *     .on("double", (value, ctx) -&gt; CallbackResult.immediate(twice(value)))
 *     .on("recover", (value, ctx) -&gt; CallbackResult.immediate(Payload.ofUtf8("fallback")))
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DispatchingCallbackTarget implements CallbackTarget {

    private final Map<String, CallbackHandler> handlers;

    private DispatchingCallbackTarget(Map<String, CallbackHandler> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CallbackResult invoke(String selector, Payload value, CallbackContext context) {
        CallbackHandler handler = handlers.get(selector);
        if (handler == null) {
            throw new IllegalArgumentException("Unknown selector: " + selector);
        }
        CallbackResult result = handler.handle(value, context);
        if (result == null) {
            throw new IllegalStateException("Handler for selector " + selector + " returned null");
        }
        return result;
    }

    /**
     * 등록된 selector 목록.
     *
     * @return selector 집합
     */
    public Set<String> selectors() {
        return handlers.keySet();
    }

    /**
     * DispatchingCallbackTarget 빌더.
     */
    public static final class Builder {

        private final Map<String, CallbackHandler> handlers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * selector에 핸들러 바인딩.
         *
         * @param selector 핸들러 이름
         * @param handler 핸들러
         * @return this
         * @throws IllegalArgumentException selector가 비었거나 이미 바인딩된 경우
         */
        public Builder on(String selector, CallbackHandler handler) {
            if (selector == null || selector.isBlank()) {
                throw new IllegalArgumentException("selector cannot be null or blank");
            }
            if (handler == null) {
                throw new IllegalArgumentException("handler cannot be null");
            }
            if (handlers.putIfAbsent(selector, handler) != null) {
                throw new IllegalArgumentException("Duplicate selector: " + selector);
            }
            return this;
        }

        public DispatchingCallbackTarget build() {
            return new DispatchingCallbackTarget(handlers);
        }
    }
}
