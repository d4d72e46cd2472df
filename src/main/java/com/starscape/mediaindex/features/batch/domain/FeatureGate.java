package com.starscape.mediaindex.features.batch.domain;

public interface FeatureGate {
    
    /**
     * Whether permanent deletion is enabled and the library is writable.
     */
    boolean isDeleteAllowed();
}
