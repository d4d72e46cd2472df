package com.starscape.mediaindex.features.batch.app;

import com.starscape.mediaindex.common.events.ChangeNotifier;
import com.starscape.mediaindex.common.events.EntityKind;
import com.starscape.mediaindex.common.exception.NotFoundException;
import com.starscape.mediaindex.common.exception.SaveFailedException;
import com.starscape.mediaindex.common.security.AccessControl;
import com.starscape.mediaindex.common.security.Action;
import com.starscape.mediaindex.common.security.Resource;
import com.starscape.mediaindex.common.security.UserPrincipal;
import com.starscape.mediaindex.features.batch.domain.BatchResult;
import com.starscape.mediaindex.features.batch.domain.Selection;
import com.starscape.mediaindex.features.library.app.PhotoCountsUpdater;
import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoRepository;
import com.starscape.mediaindex.features.library.domain.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.util.List;

/**
 * Handler for inverting the private flag of each selected photo.
 * This is a toggle, not a set: mixed selections stay mixed.
 */
@Service
public class TogglePrivateHandler {
    
    private static final Logger log = LoggerFactory.getLogger(TogglePrivateHandler.class);
    
    private final AccessControl accessControl;
    private final PhotoRepository photoRepository;
    private final PhotoCountsUpdater countsUpdater;
    private final ChangeNotifier notifier;
    
    public TogglePrivateHandler(
            AccessControl accessControl,
            PhotoRepository photoRepository,
            PhotoCountsUpdater countsUpdater,
            ChangeNotifier notifier) {
        this.accessControl = accessControl;
        this.photoRepository = photoRepository;
        this.countsUpdater = countsUpdater;
        this.notifier = notifier;
    }
    
    public BatchResult handle(UserPrincipal caller, Selection selection) {
        accessControl.check(caller, Resource.PHOTOS, Action.PRIVATE);
        List<String> uids = selection.requirePhotos();
        
        log.info("Toggling private flag of {} photos for {}", uids.size(), caller);
        
        if (photoRepository.countByUids(uids, Scope.ACTIVE) == 0) {
            throw new NotFoundException("No photos found for selection");
        }
        
        int toggled;
        try {
            toggled = photoRepository.togglePrivateByUids(uids, Instant.now());
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to toggle private flag: {}", e.getMessage(), e);
            throw new SaveFailedException("Failed to change private flag", e);
        }
        
        countsUpdater.refresh();
        
        List<String> changed = photoRepository.findByUids(uids, Scope.ACTIVE).stream()
            .map(Photo::getPhotoUid)
            .toList();
        if (!changed.isEmpty()) {
            notifier.entitiesUpdated(EntityKind.PHOTOS, changed);
        }
        
        return new BatchResult("Selection marked as private", toggled);
    }
}
