package com.starscape.mediaindex.features.batch.app;

import com.starscape.mediaindex.common.events.ChangeNotifier;
import com.starscape.mediaindex.common.events.EntityKind;
import com.starscape.mediaindex.common.exception.NotFoundException;
import com.starscape.mediaindex.common.security.Role;
import com.starscape.mediaindex.common.security.RoleAccessControl;
import com.starscape.mediaindex.common.security.UserPrincipal;
import com.starscape.mediaindex.features.batch.domain.BatchResult;
import com.starscape.mediaindex.features.batch.domain.Selection;
import com.starscape.mediaindex.features.library.app.PhotoCountsUpdater;
import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoRepository;
import com.starscape.mediaindex.features.library.domain.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ApprovePhotosHandlerTest {
    
    private static final UserPrincipal FAMILY = new UserPrincipal("u000000000000020", "kid", Role.FAMILY);
    
    private PhotoRepository photoRepository;
    private PhotoCountsUpdater countsUpdater;
    private ChangeNotifier notifier;
    private ApprovePhotosHandler handler;
    
    @BeforeEach
    void setUp() {
        photoRepository = mock(PhotoRepository.class);
        countsUpdater = mock(PhotoCountsUpdater.class);
        notifier = mock(ChangeNotifier.class);
        handler = new ApprovePhotosHandler(new RoleAccessControl(), photoRepository, countsUpdater, notifier);
    }
    
    private static Photo inReview(String uid) {
        Photo photo = new Photo(uid, "2024", uid + ".jpg");
        photo.setPhotoQuality(1);
        return photo;
    }
    
    @Test
    void approvesPhotosInReview() {
        Photo photo = inReview("p000000000000001");
        when(photoRepository.findByUids(anyCollection(), eq(Scope.ACTIVE))).thenReturn(List.of(photo));
        
        BatchResult result = handler.handle(FAMILY, Selection.ofPhotos(List.of("p000000000000001")));
        
        assertEquals(1, result.count());
        assertFalse(photo.isInReview());
        assertNotNull(photo.getEditedAt());
        verify(photoRepository).save(photo);
        verify(countsUpdater).publish();
        verify(notifier).entitiesUpdated(EntityKind.PHOTOS, List.of("p000000000000001"));
    }
    
    @Test
    void failedSaveSkipsOnlyThatPhoto() {
        Photo first = inReview("p000000000000001");
        Photo broken = inReview("p000000000000002");
        Photo third = inReview("p000000000000003");
        when(photoRepository.findByUids(anyCollection(), eq(Scope.ACTIVE))).thenReturn(List.of(first, broken, third));
        when(photoRepository.save(any(Photo.class))).thenAnswer(inv -> inv.getArgument(0));
        when(photoRepository.save(broken)).thenThrow(new DataIntegrityViolationException("constraint"));
        
        BatchResult result = handler.handle(FAMILY,
            Selection.ofPhotos(List.of("p000000000000001", "p000000000000002", "p000000000000003")));
        
        assertEquals(2, result.count());
        verify(notifier).entitiesUpdated(EntityKind.PHOTOS, List.of("p000000000000001", "p000000000000003"));
    }
    
    @Test
    void alreadyApprovedPhotosAreNotSavedAgain() {
        Photo photo = new Photo("p000000000000001", "2024", "a.jpg");
        photo.setPhotoQuality(Photo.APPROVED_QUALITY);
        when(photoRepository.findByUids(anyCollection(), eq(Scope.ACTIVE))).thenReturn(List.of(photo));
        
        BatchResult result = handler.handle(FAMILY, Selection.ofPhotos(List.of("p000000000000001")));
        
        assertEquals(0, result.count());
        verify(photoRepository, never()).save(any());
        verifyNoInteractions(countsUpdater, notifier);
    }
    
    @Test
    void onlyPhotosLeavingReviewAreAnnounced() {
        Photo pending = inReview("p000000000000001");
        Photo done = new Photo("p000000000000002", "2024", "b.jpg");
        done.setPhotoQuality(Photo.APPROVED_QUALITY);
        when(photoRepository.findByUids(anyCollection(), eq(Scope.ACTIVE))).thenReturn(List.of(pending, done));
        
        BatchResult result = handler.handle(FAMILY,
            Selection.ofPhotos(List.of("p000000000000001", "p000000000000002")));
        
        assertEquals(1, result.count());
        verify(notifier).entitiesUpdated(EntityKind.PHOTOS, List.of("p000000000000001"));
    }
    
    @Test
    void noActivePhotosIsNotFound() {
        when(photoRepository.findByUids(anyCollection(), eq(Scope.ACTIVE))).thenReturn(List.of());
        
        assertThrows(NotFoundException.class,
            () -> handler.handle(FAMILY, Selection.ofPhotos(List.of("p000000000000001"))));
        verifyNoInteractions(countsUpdater, notifier);
    }
}
