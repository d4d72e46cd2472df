package com.starscape.mediaindex.common.security;

public enum Action {
    READ,
    UPDATE,
    DELETE,
    PRIVATE
}
