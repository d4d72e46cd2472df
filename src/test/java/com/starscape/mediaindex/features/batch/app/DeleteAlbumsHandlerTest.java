package com.starscape.mediaindex.features.batch.app;

import com.starscape.mediaindex.common.events.ChangeNotifier;
import com.starscape.mediaindex.common.events.EntityKind;
import com.starscape.mediaindex.common.exception.NotFoundException;
import com.starscape.mediaindex.common.exception.SaveFailedException;
import com.starscape.mediaindex.common.security.Role;
import com.starscape.mediaindex.common.security.RoleAccessControl;
import com.starscape.mediaindex.common.security.UserPrincipal;
import com.starscape.mediaindex.features.batch.domain.BatchResult;
import com.starscape.mediaindex.features.batch.domain.Selection;
import com.starscape.mediaindex.features.library.app.PhotoCountsUpdater;
import com.starscape.mediaindex.features.library.domain.Album;
import com.starscape.mediaindex.features.library.domain.AlbumRepository;
import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoAlbum;
import com.starscape.mediaindex.features.library.domain.PhotoAlbumRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DeleteAlbumsHandlerTest {
    
    private static final UserPrincipal USER = new UserPrincipal("u000000000000010", "jane", Role.USER);
    
    private InMemoryLibrary library;
    private PhotoCountsUpdater countsUpdater;
    private ChangeNotifier notifier;
    private PlatformTransactionManager transactionManager;
    private DeleteAlbumsHandler handler;
    
    @BeforeEach
    void setUp() {
        library = new InMemoryLibrary();
        countsUpdater = mock(PhotoCountsUpdater.class);
        notifier = mock(ChangeNotifier.class);
        transactionManager = mock(PlatformTransactionManager.class);
        handler = new DeleteAlbumsHandler(new RoleAccessControl(), library.albums, library.memberships,
            countsUpdater, notifier, transactionManager);
        
        library.albums.save(new Album("a000000000000001", "Holiday"));
        library.albums.save(new Album("a000000000000002", "Family"));
        library.photos.save(new Photo("p000000000000001", "2024", "a.jpg"));
        library.memberships.save(new PhotoAlbum("p000000000000001", "a000000000000001"));
        library.memberships.save(new PhotoAlbum("p000000000000001", "a000000000000002"));
    }
    
    @Test
    void deletesAlbumsAndTheirMembershipsOnly() {
        BatchResult result = handler.handle(USER, Selection.ofAlbums(List.of("a000000000000001")));
        
        assertEquals(1, result.count());
        assertEquals(1, library.albums.rows.size());
        assertEquals("a000000000000002", library.albums.rows.get(0).getAlbumUid());
        assertTrue(library.memberships.findByAlbumUid("a000000000000001").isEmpty());
        assertEquals(1, library.memberships.findByAlbumUid("a000000000000002").size());
        assertEquals(1, library.photos.rows.size());
        
        verify(countsUpdater).publish();
        verify(notifier).entitiesDeleted(EntityKind.ALBUMS, List.of("a000000000000001"));
    }
    
    @Test
    void unknownAlbumsAreNotFound() {
        assertThrows(NotFoundException.class,
            () -> handler.handle(USER, Selection.ofAlbums(List.of("a999999999999999"))));
        assertEquals(2, library.memberships.rows.size());
    }
    
    @Test
    void storeFailureIsSaveFailure() {
        AlbumRepository albums = mock(AlbumRepository.class);
        PhotoAlbumRepository memberships = mock(PhotoAlbumRepository.class);
        when(albums.findByAlbumUidIn(anyCollection())).thenReturn(List.of(new Album("a000000000000001", "Holiday")));
        when(memberships.deleteByAlbumUids(anyCollection())).thenThrow(new QueryTimeoutException("timeout"));
        DeleteAlbumsHandler failing = new DeleteAlbumsHandler(new RoleAccessControl(), albums, memberships,
            countsUpdater, notifier, transactionManager);
        
        assertThrows(SaveFailedException.class,
            () -> failing.handle(USER, Selection.ofAlbums(List.of("a000000000000001"))));
        verify(albums, never()).deleteByAlbumUids(anyCollection());
        verifyNoInteractions(notifier);
    }
    
    @Test
    void failedAlbumDeleteRollsBackMembershipDelete() {
        AlbumRepository albums = mock(AlbumRepository.class);
        PhotoAlbumRepository memberships = mock(PhotoAlbumRepository.class);
        TransactionStatus status = mock(TransactionStatus.class);
        when(transactionManager.getTransaction(any())).thenReturn(status);
        when(albums.findByAlbumUidIn(anyCollection())).thenReturn(List.of(new Album("a000000000000001", "Holiday")));
        when(memberships.deleteByAlbumUids(anyCollection())).thenReturn(2);
        when(albums.deleteByAlbumUids(anyCollection())).thenThrow(new QueryTimeoutException("timeout"));
        DeleteAlbumsHandler failing = new DeleteAlbumsHandler(new RoleAccessControl(), albums, memberships,
            countsUpdater, notifier, transactionManager);
        
        assertThrows(SaveFailedException.class,
            () -> failing.handle(USER, Selection.ofAlbums(List.of("a000000000000001"))));
        
        var order = inOrder(transactionManager, memberships, albums);
        order.verify(transactionManager).getTransaction(any());
        order.verify(memberships).deleteByAlbumUids(anyCollection());
        order.verify(albums).deleteByAlbumUids(anyCollection());
        order.verify(transactionManager).rollback(status);
        verify(transactionManager, never()).commit(any());
        verifyNoInteractions(countsUpdater, notifier);
    }
    
    @Test
    void bothDeletesShareOneCommittedTransaction() {
        TransactionStatus status = mock(TransactionStatus.class);
        when(transactionManager.getTransaction(any())).thenReturn(status);
        
        handler.handle(USER, Selection.ofAlbums(List.of("a000000000000001")));
        
        verify(transactionManager, times(1)).getTransaction(any());
        verify(transactionManager).commit(status);
    }
}
