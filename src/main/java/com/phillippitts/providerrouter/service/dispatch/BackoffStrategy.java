package com.phillippitts.providerrouter.service.dispatch;

import java.time.Duration;

/**
 * Delay between two attempts on the same candidate.
 */
@FunctionalInterface
public interface BackoffStrategy {

    /**
     * @param retry 1 for the first retry, 2 for the second, and so on
     * @return delay to wait before that retry, never negative
     */
    Duration delayBefore(int retry);

    BackoffStrategy NONE = retry -> Duration.ZERO;
}
