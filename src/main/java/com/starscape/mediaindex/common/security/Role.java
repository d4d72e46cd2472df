package com.starscape.mediaindex.common.security;

public enum Role {
    ADMIN,
    USER,
    FAMILY,
    GUEST,
    ANONYMOUS
}
