package com.starscape.mediaindex.features.auth.app;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Grows linearly with failed attempts, capped at a maximum: {@code min(step * attempts, max)}.
 */
@Component
public class EscalatingLoginDelay implements LoginDelayStrategy {
    
    private final Duration step;
    private final Duration max;
    
    public EscalatingLoginDelay(
            @Value("${app.security.login.delay-step:5s}") Duration step,
            @Value("${app.security.login.max-delay:60s}") Duration max) {
        if (step.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("Login delay cannot be negative");
        }
        this.step = step;
        this.max = max;
    }
    
    @Override
    public Duration delayFor(int failedAttempts) {
        if (failedAttempts <= 0) {
            return Duration.ZERO;
        }
        
        long stepMillis = step.toMillis();
        if (stepMillis > 0 && failedAttempts > max.toMillis() / stepMillis) {
            return max;
        }
        Duration delay = Duration.ofMillis(stepMillis * failedAttempts);
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
