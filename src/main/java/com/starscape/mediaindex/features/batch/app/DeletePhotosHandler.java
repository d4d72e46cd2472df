package com.starscape.mediaindex.features.batch.app;

import com.starscape.mediaindex.common.events.ChangeNotifier;
import com.starscape.mediaindex.common.events.EntityKind;
import com.starscape.mediaindex.common.exception.FeatureDisabledException;
import com.starscape.mediaindex.common.exception.NotFoundException;
import com.starscape.mediaindex.common.security.AccessControl;
import com.starscape.mediaindex.common.security.Action;
import com.starscape.mediaindex.common.security.Resource;
import com.starscape.mediaindex.common.security.UserPrincipal;
import com.starscape.mediaindex.features.batch.domain.BatchResult;
import com.starscape.mediaindex.features.batch.domain.FeatureGate;
import com.starscape.mediaindex.features.batch.domain.PhotoRemover;
import com.starscape.mediaindex.features.batch.domain.Selection;
import com.starscape.mediaindex.features.library.app.PhotoCountsUpdater;
import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoRepository;
import com.starscape.mediaindex.features.library.domain.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for permanently deleting photos and their files on disk.
 * Only photos the remover reports as gone are counted and announced.
 */
@Service
public class DeletePhotosHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeletePhotosHandler.class);
    
    private final AccessControl accessControl;
    private final FeatureGate featureGate;
    private final PhotoRepository photoRepository;
    private final PhotoRemover photoRemover;
    private final PhotoCountsUpdater countsUpdater;
    private final ChangeNotifier notifier;
    
    public DeletePhotosHandler(
            AccessControl accessControl,
            FeatureGate featureGate,
            PhotoRepository photoRepository,
            PhotoRemover photoRemover,
            PhotoCountsUpdater countsUpdater,
            ChangeNotifier notifier) {
        this.accessControl = accessControl;
        this.featureGate = featureGate;
        this.photoRepository = photoRepository;
        this.photoRemover = photoRemover;
        this.countsUpdater = countsUpdater;
        this.notifier = notifier;
    }
    
    public BatchResult handle(UserPrincipal caller, Selection selection) {
        accessControl.check(caller, Resource.PHOTOS, Action.DELETE);
        
        if (!featureGate.isDeleteAllowed()) {
            throw new FeatureDisabledException("Permanent deletion is disabled");
        }
        
        List<String> uids = selection.requirePhotos();
        log.info("Permanently deleting {} photos for {}", uids.size(), caller);
        
        List<Photo> photos = photoRepository.findByUids(uids, Scope.INCLUDE_ARCHIVED);
        if (photos.isEmpty()) {
            throw new NotFoundException("No photos found for selection");
        }
        
        List<String> deleted = new ArrayList<>();
        for (Photo photo : photos) {
            try {
                if (photoRemover.remove(photo)) {
                    deleted.add(photo.getPhotoUid());
                } else {
                    log.warn("Photo {} was not deleted", photo.getPhotoUid());
                }
            } catch (RuntimeException e) {
                log.error("Failed to delete photo {}: {}", photo.getPhotoUid(), e.getMessage(), e);
            }
        }
        
        if (!deleted.isEmpty()) {
            countsUpdater.refresh();
            notifier.entitiesDeleted(EntityKind.PHOTOS, deleted);
        }
        
        log.info("Permanently deleted {} of {} selected photos", deleted.size(), uids.size());
        return new BatchResult("Permanently deleted", deleted.size());
    }
}
