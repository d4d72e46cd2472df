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
import com.starscape.mediaindex.features.library.domain.PhotoAlbumRepository;
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
 * Handler for archiving (soft-deleting) a selection of photos.
 * Album memberships of archived photos are hidden, albums themselves are kept.
 */
@Service
public class ArchivePhotosHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ArchivePhotosHandler.class);
    
    private final AccessControl accessControl;
    private final PhotoRepository photoRepository;
    private final PhotoAlbumRepository photoAlbumRepository;
    private final PhotoCountsUpdater countsUpdater;
    private final ChangeNotifier notifier;
    
    public ArchivePhotosHandler(
            AccessControl accessControl,
            PhotoRepository photoRepository,
            PhotoAlbumRepository photoAlbumRepository,
            PhotoCountsUpdater countsUpdater,
            ChangeNotifier notifier) {
        this.accessControl = accessControl;
        this.photoRepository = photoRepository;
        this.photoAlbumRepository = photoAlbumRepository;
        this.countsUpdater = countsUpdater;
        this.notifier = notifier;
    }
    
    public BatchResult handle(UserPrincipal caller, Selection selection) {
        accessControl.check(caller, Resource.PHOTOS, Action.DELETE);
        List<String> uids = selection.requirePhotos();
        
        log.info("Archiving {} photos for {}", uids.size(), caller);
        
        if (photoRepository.countByUids(uids, Scope.INCLUDE_ARCHIVED) == 0) {
            throw new NotFoundException("No photos found for selection");
        }
        
        int archived;
        try {
            archived = photoRepository.archiveByUids(uids, Instant.now());
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to archive photos: {}", e.getMessage(), e);
            throw new SaveFailedException("Failed to archive photos", e);
        }
        
        try {
            photoAlbumRepository.hideByPhotoUids(uids);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to hide album memberships of archived photos: {}", e.getMessage());
        }
        
        countsUpdater.refresh();
        notifier.entitiesArchived(EntityKind.PHOTOS, uids);
        
        log.info("Archived {} of {} selected photos", archived, uids.size());
        return new BatchResult("Selection archived", archived);
    }
}
