package com.starscape.mediaindex.features.indexing.domain;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IndexSnapshotTest {
    
    private final IndexSnapshot snapshot = new IndexSnapshot(
        Map.of("originals/2024/a.jpg", 100L),
        Set.of("hash-a", "hash-b"));
    
    @Test
    void classifiesKnownPathBySameModTimeAsUnchanged() {
        assertEquals(FileClassification.UNCHANGED, snapshot.classify("originals", "2024/a.jpg", 100L, "hash-a"));
    }
    
    @Test
    void classifiesKnownPathWithNewModTimeAsModified() {
        assertEquals(FileClassification.MODIFIED, snapshot.classify("originals", "2024/a.jpg", 150L, "hash-x"));
    }
    
    @Test
    void classifiesUnknownPathWithKnownHashAsDuplicate() {
        assertEquals(FileClassification.DUPLICATE, snapshot.classify("import", "copy.jpg", 1L, "hash-b"));
    }
    
    @Test
    void classifiesEverythingElseAsNew() {
        assertEquals(FileClassification.NEW, snapshot.classify("import", "new.jpg", 1L, "hash-z"));
        assertEquals(FileClassification.NEW, snapshot.classify("import", "new.jpg", 1L, null));
    }
    
    @Test
    void snapshotIsACopy() {
        Map<String, Long> source = new HashMap<>(Map.of("A/b.jpg", 1L));
        IndexSnapshot copy = new IndexSnapshot(source, Set.of());
        
        source.put("A/c.jpg", 2L);
        
        assertEquals(1, copy.pathCount());
        assertThrows(UnsupportedOperationException.class, () -> copy.modTimes().put("x", 3L));
    }
}
