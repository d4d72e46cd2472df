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
import com.starscape.mediaindex.features.library.domain.Label;
import com.starscape.mediaindex.features.library.domain.LabelRepository;
import com.starscape.mediaindex.features.library.domain.PhotoLabelRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DeleteLabelsHandlerTest {
    
    private static final UserPrincipal ADMIN = new UserPrincipal("u000000000000001", "admin", Role.ADMIN);
    
    private LabelRepository labelRepository;
    private PhotoLabelRepository photoLabelRepository;
    private PhotoCountsUpdater countsUpdater;
    private ChangeNotifier notifier;
    private DeleteLabelsHandler handler;
    
    @BeforeEach
    void setUp() {
        labelRepository = mock(LabelRepository.class);
        photoLabelRepository = mock(PhotoLabelRepository.class);
        countsUpdater = mock(PhotoCountsUpdater.class);
        notifier = mock(ChangeNotifier.class);
        handler = new DeleteLabelsHandler(new RoleAccessControl(), labelRepository, photoLabelRepository,
            countsUpdater, notifier);
    }
    
    @Test
    void removesLinksThenSoftDeletesLabel() {
        Label label = new Label("l000000000000001", "Beach");
        when(labelRepository.findActiveByUids(anyCollection())).thenReturn(List.of(label));
        
        BatchResult result = handler.handle(ADMIN, Selection.ofLabels(List.of("l000000000000001")));
        
        assertEquals(1, result.count());
        assertTrue(label.isDeleted());
        var order = inOrder(photoLabelRepository, labelRepository);
        order.verify(photoLabelRepository).deleteByLabelUid("l000000000000001");
        order.verify(labelRepository).save(label);
        verify(countsUpdater).refresh();
        verify(notifier).entitiesDeleted(EntityKind.LABELS, List.of("l000000000000001"));
    }
    
    @Test
    void failedLabelIsSkipped() {
        Label beach = new Label("l000000000000001", "Beach");
        Label cats = new Label("l000000000000002", "Cats");
        when(labelRepository.findActiveByUids(anyCollection())).thenReturn(List.of(beach, cats));
        when(photoLabelRepository.deleteByLabelUid("l000000000000001"))
            .thenThrow(new CannotAcquireLockException("locked"));
        
        BatchResult result = handler.handle(ADMIN,
            Selection.ofLabels(List.of("l000000000000001", "l000000000000002")));
        
        assertEquals(1, result.count());
        assertFalse(beach.isDeleted());
        verify(notifier).entitiesDeleted(EntityKind.LABELS, List.of("l000000000000002"));
    }
    
    @Test
    void deletedOrUnknownLabelsAreNotFound() {
        when(labelRepository.findActiveByUids(anyCollection())).thenReturn(List.of());
        
        assertThrows(NotFoundException.class,
            () -> handler.handle(ADMIN, Selection.ofLabels(List.of("l000000000000009"))));
        verifyNoInteractions(photoLabelRepository, countsUpdater, notifier);
    }
}
