package com.starscape.mediaindex.common.security;

public enum Resource {
    PHOTOS,
    FILES,
    ALBUMS,
    LABELS
}
