package com.starscape.mediaindex.features.library.domain;

/**
 * Which rows a query may see. Default paths use {@link #ACTIVE}; restoring and
 * permanent deletion need {@link #INCLUDE_ARCHIVED}.
 */
public enum Scope {
    ACTIVE,
    INCLUDE_ARCHIVED
}
