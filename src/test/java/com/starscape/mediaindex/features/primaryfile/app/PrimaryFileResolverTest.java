package com.starscape.mediaindex.features.primaryfile.app;

import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoFile;
import com.starscape.mediaindex.features.library.domain.PhotoFileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PrimaryFileResolverTest {
    
    private static final String PHOTO_UID = "p000000000000001";
    
    private final Photo photo = new Photo(PHOTO_UID, "2024", "IMG_1.jpg");
    private final List<PhotoFile> files = new ArrayList<>();
    
    private PhotoFileRepository repository;
    private PrimaryFileResolver resolver;
    
    @BeforeEach
    void setUp() {
        repository = mock(PhotoFileRepository.class);
        resolver = new PrimaryFileResolver(repository);
        
        // Answers mirror the repository queries against the in-memory file list
        when(repository.findPrimaryCandidates(anyString())).thenAnswer(inv -> files.stream()
            .filter(f -> f.getPhotoUid().equals(inv.getArgument(0)))
            .filter(f -> !f.isFileMissing() && f.isJpeg())
            .sorted(Comparator.comparingInt(PhotoFile::getFileWidth).reversed())
            .map(PhotoFile::getFileUid)
            .toList());
        when(repository.findByFileUid(anyString())).thenAnswer(inv -> files.stream()
            .filter(f -> f.getFileUid().equals(inv.getArgument(0)))
            .findFirst());
        when(repository.clearPrimaryExcept(anyString(), anyString())).thenAnswer(inv -> {
            int n = 0;
            for (PhotoFile f : files) {
                if (f.getPhotoUid().equals(inv.getArgument(0)) && !f.getFileUid().equals(inv.getArgument(1))) {
                    f.setFilePrimary(false);
                    n++;
                }
            }
            return n;
        });
        when(repository.markPrimary(anyString(), anyString())).thenAnswer(inv -> {
            int n = 0;
            for (PhotoFile f : files) {
                if (f.getPhotoUid().equals(inv.getArgument(0)) && f.getFileUid().equals(inv.getArgument(1))) {
                    f.setFilePrimary(true);
                    n++;
                }
            }
            return n;
        });
    }
    
    private PhotoFile add(String fileUid, String type, int width) {
        PhotoFile file = new PhotoFile(fileUid, photo, "originals", fileUid + "." + type, "h-" + fileUid, type, width, 1L);
        files.add(file);
        return file;
    }
    
    private List<PhotoFile> primaries() {
        return files.stream().filter(PhotoFile::isFilePrimary).toList();
    }
    
    @Test
    void widestPresentJpegBecomesTheOnlyPrimary() {
        PhotoFile small = add("f000000000000001", "jpg", 640);
        add("f000000000000002", "jpg", 1920);
        PhotoFile raw = add("f000000000000003", "heic", 4000);
        PhotoFile missing = add("f000000000000004", "jpg", 8000);
        missing.markMissing();
        small.setFilePrimary(true);
        raw.setFilePrimary(true);
        
        String chosen = resolver.resolve(PHOTO_UID, null);
        
        assertEquals("f000000000000002", chosen);
        assertEquals(1, primaries().size());
        assertEquals("f000000000000002", primaries().get(0).getFileUid());
    }
    
    @Test
    void tieKeepsFirstInDescendingWidthOrder() {
        add("f000000000000001", "jpg", 1024);
        add("f000000000000002", "jpg", 1024);
        
        assertEquals("f000000000000001", resolver.resolve(PHOTO_UID, ""));
    }
    
    @Test
    void clearsOthersBeforeSettingChosen() {
        add("f000000000000001", "jpg", 100);
        
        resolver.resolve(PHOTO_UID, null);
        
        InOrder order = inOrder(repository);
        order.verify(repository).clearPrimaryExcept(PHOTO_UID, "f000000000000001");
        order.verify(repository).markPrimary(PHOTO_UID, "f000000000000001");
    }
    
    @Test
    void explicitChoiceWins() {
        add("f000000000000001", "jpg", 4000);
        add("f000000000000002", "png", 10);
        
        assertEquals("f000000000000002", resolver.resolve(PHOTO_UID, "f000000000000002"));
        assertEquals("f000000000000002", primaries().get(0).getFileUid());
    }
    
    @Test
    void noEligibleFileChangesNothing() {
        PhotoFile video = add("f000000000000001", "mp4", 1920);
        video.setFilePrimary(true);
        
        assertThrows(NoEligibleFileException.class, () -> resolver.resolve(PHOTO_UID, null));
        
        verify(repository, never()).clearPrimaryExcept(anyString(), anyString());
        verify(repository, never()).markPrimary(anyString(), anyString());
        assertTrue(video.isFilePrimary());
    }
    
    @Test
    void explicitFileOfAnotherPhotoIsRejected() {
        when(repository.findByFileUid("f000000000000009")).thenReturn(Optional.empty());
        
        assertThrows(NoEligibleFileException.class, () -> resolver.resolve(PHOTO_UID, "f000000000000009"));
        verify(repository, never()).markPrimary(anyString(), anyString());
    }
    
    @Test
    void blankPhotoUidIsBadRequest() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(" ", null));
        verifyNoInteractions(repository);
    }
}
