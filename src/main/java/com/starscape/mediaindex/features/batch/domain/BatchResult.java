package com.starscape.mediaindex.features.batch.domain;

/**
 * Outcome of a batch operation that met its preconditions.
 *
 * @param count rows actually changed, which may be fewer than selected
 */
public record BatchResult(String message, int count) {
}
