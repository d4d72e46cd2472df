package com.starscape.mediaindex.common.domain;

/**
 * Marker for immutable value types compared by their attributes.
 */
public interface ValueObject {
}
