package org.paycron.services;

import java.time.Duration;

/**
 * The scheduler's only suspension point.
 */
@FunctionalInterface
public interface Waiter {

    /**
     * Blocks for {@code duration}.
     *
     * @return true when the full duration elapsed, false when the wait was cancelled
     */
    boolean await(Duration duration) throws InterruptedException;
}
