package com.starscape.mediaindex.features.indexing.domain;

/**
 * Advisory verdict for a file found on disk during a scan.
 */
public enum FileClassification {
    /** Indexed at this path with the same modification time. */
    UNCHANGED,
    /** Indexed at this path but modified since. */
    MODIFIED,
    /** Unknown path whose content hash is already indexed. */
    DUPLICATE,
    NEW
}
