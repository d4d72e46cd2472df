package com.starscape.mediaindex.features.auth.app;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EscalatingLoginDelayTest {
    
    private final EscalatingLoginDelay delay = new EscalatingLoginDelay(Duration.ofSeconds(5), Duration.ofSeconds(60));
    
    @Test
    void noDelayWithoutFailures() {
        assertEquals(Duration.ZERO, delay.delayFor(0));
        assertEquals(Duration.ZERO, delay.delayFor(-1));
    }
    
    @Test
    void growsLinearlyWithFailures() {
        assertEquals(Duration.ofSeconds(5), delay.delayFor(1));
        assertEquals(Duration.ofSeconds(15), delay.delayFor(3));
        assertEquals(Duration.ofSeconds(60), delay.delayFor(12));
    }
    
    @Test
    void isCappedAtMaximum() {
        assertEquals(Duration.ofSeconds(60), delay.delayFor(13));
        assertEquals(Duration.ofSeconds(60), delay.delayFor(Integer.MAX_VALUE));
    }
    
    @Test
    void zeroStepDisablesDelay() {
        EscalatingLoginDelay none = new EscalatingLoginDelay(Duration.ZERO, Duration.ZERO);
        
        assertEquals(Duration.ZERO, none.delayFor(100));
    }
    
    @Test
    void negativeDurationsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new EscalatingLoginDelay(Duration.ofSeconds(-1), Duration.ofSeconds(60)));
    }
}
