package com.starscape.mediaindex.features.indexing.app;

import com.starscape.mediaindex.features.indexing.domain.FileView;
import com.starscape.mediaindex.features.indexing.domain.Hydrate;
import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoFile;
import com.starscape.mediaindex.features.library.domain.PhotoFileRepository;
import com.starscape.mediaindex.features.library.domain.PhotoRepository;
import com.starscape.mediaindex.features.library.domain.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageRequest;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class FileIndexServiceTest {
    
    private PhotoFileRepository photoFileRepository;
    private PhotoRepository photoRepository;
    private FileIndexService service;
    
    private final Photo photo = new Photo("p000000000000001", "2024", "a.jpg");
    private PhotoFile file;
    
    @BeforeEach
    void setUp() {
        photoFileRepository = mock(PhotoFileRepository.class);
        photoRepository = mock(PhotoRepository.class);
        service = new FileIndexService(photoFileRepository, photoRepository);
        file = new PhotoFile("f000000000000001", photo, "originals", "2024/a.jpg", "hash-a", "jpg", 800, 100L);
    }
    
    @Test
    void lookupWithoutHydrationDoesNotLoadPhoto() {
        when(photoFileRepository.findByFileUid("f000000000000001")).thenReturn(Optional.of(file));
        
        Optional<FileView> view = service.fileByUid("f000000000000001", Hydrate.NONE);
        
        assertTrue(view.isPresent());
        assertNull(view.get().photo());
        verifyNoInteractions(photoRepository);
    }
    
    @Test
    void lookupWithPhotoHydrationLoadsOwner() {
        when(photoFileRepository.findFirstByFileHashOrderByRowIdAsc("hash-a")).thenReturn(Optional.of(file));
        when(photoRepository.findByUid("p000000000000001", Scope.INCLUDE_ARCHIVED)).thenReturn(Optional.of(photo));
        
        FileView view = service.fileByHash("hash-a", Hydrate.PHOTO).orElseThrow();
        
        assertSame(photo, view.photo());
    }
    
    @Test
    void absentRowsYieldEmptyResults() {
        when(photoFileRepository.findByFileUid(anyString())).thenReturn(Optional.empty());
        when(photoFileRepository.findFirstByFileHashOrderByRowIdAsc(anyString())).thenReturn(Optional.empty());
        
        assertTrue(service.fileByUid("f000000000000404", Hydrate.PHOTO).isEmpty());
        assertTrue(service.fileByHash("nope", Hydrate.NONE).isEmpty());
        assertTrue(service.fileByHash("", Hydrate.NONE).isEmpty());
        assertTrue(service.primaryFile(null, Hydrate.NONE).isEmpty());
    }
    
    @Test
    void filesBuildsPrefixPatternWithoutLeadingSlash() {
        service.files("/2024/05", false, 0, 50);
        service.files("", true, 1, 50);
        
        verify(photoFileRepository).findByNamePrefix("2024/05/%", false, PageRequest.of(0, 50));
        verify(photoFileRepository).findByNamePrefix("%", true, PageRequest.of(1, 50));
    }
    
    @Test
    void filesEscapesLikeWildcards() {
        service.files("100%_done", false, 0, 10);
        
        verify(photoFileRepository).findByNamePrefix("100\\%\\_done/%", false, PageRequest.of(0, 10));
    }
    
    @Test
    void emptySelectionReturnsNoFiles() {
        assertEquals(List.of(), service.filesBySelection(List.of(), 0, 10));
        verifyNoInteractions(photoFileRepository);
    }
    
    @Test
    void renameRequiresAllArguments() {
        assertThrows(IllegalArgumentException.class, () -> service.renameFile("originals", "a.jpg", "", "b.jpg"));
        verify(photoFileRepository, never()).rename(any(), any(), any(), any());
    }
    
    @Test
    void renameMovesFile() {
        when(photoFileRepository.rename("originals", "a.jpg", "originals", "b.jpg")).thenReturn(1);
        
        assertEquals(1, service.renameFile("originals", "a.jpg", "originals", "b.jpg"));
    }
    
    @Test
    void setFileErrorLogsStoreFailures() {
        when(photoFileRepository.updateFileError("f000000000000001", "broken"))
            .thenThrow(new DataAccessResourceFailureException("down"));
        
        assertDoesNotThrow(() -> service.setFileError("f000000000000001", "broken"));
    }
}
