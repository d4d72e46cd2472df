package com.starscape.mediaindex.common.events;

public enum EntityKind {
    PHOTOS("photos"),
    FILES("files"),
    ALBUMS("albums"),
    LABELS("labels");
    
    private final String topic;
    
    EntityKind(String topic) {
        this.topic = topic;
    }
    
    public String topic() {
        return topic;
    }
}
