package com.starscape.mediaindex.features.indexing.domain;

/**
 * Related rows to load together with a file. Loading the photo costs one more query.
 */
public enum Hydrate {
    NONE,
    PHOTO
}
