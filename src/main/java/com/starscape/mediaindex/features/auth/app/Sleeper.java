package com.starscape.mediaindex.features.auth.app;

import java.time.Duration;

/**
 * Blocks the calling thread. Replaced in tests so no real time passes.
 */
@FunctionalInterface
public interface Sleeper {
    
    void sleep(Duration duration) throws InterruptedException;
}
