package com.ryuqq.promise.core.spi;

/**
 * Time source for timeout promises.
 *
 * <p>Values never go backwards. Tests drive it manually; production can use the
 * chain's block timestamp or {@link System#currentTimeMillis()}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MonotonicClock {

    /**
     * Returns the current time in milliseconds.
     *
     * @return current time
     */
    long nowMillis();

    /**
     * Clock backed by {@link System#currentTimeMillis()}.
     *
     * @return system clock
     */
    static MonotonicClock system() {
        return System::currentTimeMillis;
    }
}
