package com.starscape.mediaindex.features.batch.domain;

/**
 * Thrown before any store access when a batch request names no targets.
 */
public class EmptySelectionException extends IllegalArgumentException {
    
    public EmptySelectionException(String message) {
        super(message);
    }
}
