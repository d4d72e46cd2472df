package com.starscape.mediaindex.features.indexing.app;

import com.starscape.mediaindex.features.indexing.domain.IndexSnapshot;
import com.starscape.mediaindex.features.library.domain.DuplicateRepository;
import com.starscape.mediaindex.features.library.domain.IndexedPath;
import com.starscape.mediaindex.features.library.domain.PhotoFileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IndexSnapshotBuilderTest {
    
    private PhotoFileRepository photoFileRepository;
    private DuplicateRepository duplicateRepository;
    private IndexSnapshotBuilder builder;
    
    @BeforeEach
    void setUp() {
        photoFileRepository = mock(PhotoFileRepository.class);
        duplicateRepository = mock(DuplicateRepository.class);
        builder = new IndexSnapshotBuilder(photoFileRepository, duplicateRepository);
    }
    
    @Test
    void indexedFileSupersedesLedgerEntryForSamePath() {
        when(duplicateRepository.findLedgerPaths()).thenReturn(List.of(new IndexedPath("A", "b.jpg", 100L)));
        when(photoFileRepository.findIndexedPaths()).thenReturn(List.of(new IndexedPath("A", "b.jpg", 200L)));
        
        Map<String, Long> files = builder.indexedFiles();
        
        assertEquals(Map.of("A/b.jpg", 200L), files);
    }
    
    @Test
    void ledgerOnlyPathsAreKept() {
        when(duplicateRepository.findLedgerPaths()).thenReturn(List.of(
            new IndexedPath("import", "dup.jpg", 10L),
            new IndexedPath("A", "b.jpg", 100L)));
        when(photoFileRepository.findIndexedPaths()).thenReturn(List.of(new IndexedPath("A", "b.jpg", 200L)));
        
        Map<String, Long> files = builder.indexedFiles();
        
        assertEquals(2, files.size());
        assertEquals(10L, files.get("import/dup.jpg"));
    }
    
    @Test
    void buildCombinesPathsAndHashes() {
        when(duplicateRepository.findLedgerPaths()).thenReturn(List.of());
        when(photoFileRepository.findIndexedPaths()).thenReturn(List.of(new IndexedPath("originals", "x.jpg", 5L)));
        when(photoFileRepository.findIndexedHashes()).thenReturn(List.of("h1", "h2", "h1"));
        
        IndexSnapshot snapshot = builder.build();
        
        assertEquals(OptionalLong.of(5L), snapshot.modTime("originals", "x.jpg"));
        assertEquals(2, snapshot.hashCount());
        assertTrue(snapshot.isKnownHash("h2"));
        assertFalse(snapshot.isIndexed("originals", "y.jpg"));
    }
}
