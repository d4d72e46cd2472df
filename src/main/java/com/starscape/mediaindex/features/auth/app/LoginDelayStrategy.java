package com.starscape.mediaindex.features.auth.app;

import java.time.Duration;

/**
 * Delay applied before checking a password, given the failed attempts so far.
 * Implementations must be pure functions of the attempt count.
 */
@FunctionalInterface
public interface LoginDelayStrategy {
    
    Duration delayFor(int failedAttempts);
}
