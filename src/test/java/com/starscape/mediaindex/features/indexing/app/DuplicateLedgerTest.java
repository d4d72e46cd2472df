package com.starscape.mediaindex.features.indexing.app;

import com.starscape.mediaindex.features.library.domain.Duplicate;
import com.starscape.mediaindex.features.library.domain.DuplicateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DuplicateLedgerTest {
    
    private DuplicateRepository duplicateRepository;
    private DuplicateLedger ledger;
    
    @BeforeEach
    void setUp() {
        duplicateRepository = mock(DuplicateRepository.class);
        when(duplicateRepository.save(any(Duplicate.class))).thenAnswer(inv -> inv.getArgument(0));
        ledger = new DuplicateLedger(duplicateRepository);
    }
    
    @Test
    void recordInsertsNewEntry() {
        when(duplicateRepository.findByFileRootAndFileName("import", "a.jpg")).thenReturn(Optional.empty());
        
        Duplicate saved = ledger.record("import", "a.jpg", "hash", 42L, 100L);
        
        assertEquals("hash", saved.getFileHash());
        assertEquals(100L, saved.getModTime());
        verify(duplicateRepository).save(saved);
    }
    
    @Test
    void recordUpdatesExistingEntry() {
        Duplicate existing = new Duplicate("import", "a.jpg", "old", 1L, 1L);
        when(duplicateRepository.findByFileRootAndFileName("import", "a.jpg")).thenReturn(Optional.of(existing));
        
        Duplicate saved = ledger.record("import", "a.jpg", "new", 2L, 200L);
        
        assertSame(existing, saved);
        assertEquals("new", saved.getFileHash());
        assertEquals(2L, saved.getFileSize());
        assertEquals(200L, saved.getModTime());
    }
    
    @Test
    void blankHashLookupReturnsNothing() {
        assertEquals(List.of(), ledger.findByHash(" "));
        verify(duplicateRepository, never()).findByFileHash(any());
    }
}
