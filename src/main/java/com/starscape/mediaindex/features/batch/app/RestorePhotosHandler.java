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
 * Handler for restoring archived photos.
 * Album memberships stay hidden: the flag also records manual removal from an album.
 */
@Service
public class RestorePhotosHandler {
    
    private static final Logger log = LoggerFactory.getLogger(RestorePhotosHandler.class);
    
    private final AccessControl accessControl;
    private final PhotoRepository photoRepository;
    private final PhotoCountsUpdater countsUpdater;
    private final ChangeNotifier notifier;
    
    public RestorePhotosHandler(
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
        accessControl.check(caller, Resource.PHOTOS, Action.DELETE);
        List<String> uids = selection.requirePhotos();
        
        log.info("Restoring {} photos for {}", uids.size(), caller);
        
        if (photoRepository.countByUids(uids, Scope.INCLUDE_ARCHIVED) == 0) {
            throw new NotFoundException("No photos found for selection");
        }
        
        int restored;
        try {
            restored = photoRepository.restoreByUids(uids, Instant.now());
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to restore photos: {}", e.getMessage(), e);
            throw new SaveFailedException("Failed to restore photos", e);
        }
        
        countsUpdater.refresh();
        notifier.entitiesRestored(EntityKind.PHOTOS, uids);
        
        log.info("Restored {} of {} selected photos", restored, uids.size());
        return new BatchResult("Selection restored", restored);
    }
}
