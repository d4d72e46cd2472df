package com.starscape.mediaindex.common.events;

public enum ChangeType {
    ARCHIVED,
    RESTORED,
    UPDATED,
    DELETED
}
