package com.starscape.mediaindex.features.batch.app;

import com.starscape.mediaindex.common.events.ChangeNotifier;
import com.starscape.mediaindex.common.events.EntityKind;
import com.starscape.mediaindex.common.exception.NotFoundException;
import com.starscape.mediaindex.common.exception.UnauthorizedException;
import com.starscape.mediaindex.common.security.Role;
import com.starscape.mediaindex.common.security.RoleAccessControl;
import com.starscape.mediaindex.common.security.UserPrincipal;
import com.starscape.mediaindex.features.batch.domain.Selection;
import com.starscape.mediaindex.features.library.app.PhotoCountsUpdater;
import com.starscape.mediaindex.features.library.domain.Photo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TogglePrivateHandlerTest {
    
    private static final UserPrincipal USER = new UserPrincipal("u000000000000010", "jane", Role.USER);
    
    private InMemoryLibrary library;
    private ChangeNotifier notifier;
    private PhotoCountsUpdater countsUpdater;
    private TogglePrivateHandler handler;
    
    @BeforeEach
    void setUp() {
        library = new InMemoryLibrary();
        notifier = mock(ChangeNotifier.class);
        countsUpdater = mock(PhotoCountsUpdater.class);
        handler = new TogglePrivateHandler(new RoleAccessControl(), library.photos, countsUpdater, notifier);
        
        Photo shared = new Photo("p000000000000001", "2024", "a.jpg");
        Photo hidden = new Photo("p000000000000002", "2024", "b.jpg");
        hidden.setPhotoPrivate(true);
        library.photos.save(shared);
        library.photos.save(hidden);
    }
    
    @Test
    void togglingTwiceRestoresOriginalFlags() {
        Selection selection = Selection.ofPhotos(List.of("p000000000000001", "p000000000000002"));
        
        handler.handle(USER, selection);
        assertTrue(library.photos.rows.get(0).isPhotoPrivate());
        assertFalse(library.photos.rows.get(1).isPhotoPrivate());
        
        handler.handle(USER, selection);
        assertFalse(library.photos.rows.get(0).isPhotoPrivate());
        assertTrue(library.photos.rows.get(1).isPhotoPrivate());
        
        verify(countsUpdater, times(2)).refresh();
        verify(notifier, times(2)).entitiesUpdated(EntityKind.PHOTOS, List.of("p000000000000001", "p000000000000002"));
    }
    
    @Test
    void archivedPhotosAreNotToggledOrAnnounced() {
        library.photos.rows.get(1).archive(Instant.now());
        
        handler.handle(USER, Selection.ofPhotos(List.of("p000000000000001", "p000000000000002")));
        
        assertTrue(library.photos.rows.get(1).isPhotoPrivate());
        verify(notifier).entitiesUpdated(EntityKind.PHOTOS, List.of("p000000000000001"));
    }
    
    @Test
    void onlyArchivedSelectionIsNotFound() {
        library.photos.rows.forEach(p -> p.archive(Instant.now()));
        
        assertThrows(NotFoundException.class,
            () -> handler.handle(USER, Selection.ofPhotos(List.of("p000000000000001"))));
    }
    
    @Test
    void familyMayNotChangePrivacy() {
        UserPrincipal family = new UserPrincipal("u000000000000011", "kid", Role.FAMILY);
        
        assertThrows(UnauthorizedException.class,
            () -> handler.handle(family, Selection.ofPhotos(List.of("p000000000000001"))));
        assertFalse(library.photos.rows.get(0).isPhotoPrivate());
    }
}
