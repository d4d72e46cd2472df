package com.starscape.mediaindex.common.events;

/**
 * Library-wide totals pushed to clients whenever batch operations change them.
 */
public record LibraryCounts(
    long photos,
    long archived,
    long privatePhotos,
    long review,
    long albums,
    long labels
) {
}
