package com.ryuqq.promise.testkit.contract;

import com.ryuqq.promise.core.spi.MonotonicClock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic monotonic clock for contract tests.
 *
 * <ul>
 *   <li>Starts at 0</li>
 *   <li>Advances only when explicitly instructed</li>
 *   <li>Never goes backwards</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowMillis = new AtomicLong(0);

    @Override
    public long nowMillis() {
        return nowMillis.get();
    }

    /**
     * Advances the clock.
     *
     * @param deltaMillis milliseconds to advance, non-negative
     * @throws IllegalArgumentException if deltaMillis is negative
     */
    public void advanceMillis(long deltaMillis) {
        if (deltaMillis < 0) {
            throw new IllegalArgumentException("Cannot advance monotonic clock backwards");
        }
        nowMillis.addAndGet(deltaMillis);
    }
}
