package com.starscape.mediaindex.features.library.domain;

/**
 * Projection of a stored (root, name, modTime) triple, used to build index snapshots.
 */
public record IndexedPath(String fileRoot, String fileName, long modTime) {
}
