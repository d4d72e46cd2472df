package com.starscape.mediaindex.features.batch.app;

import com.starscape.mediaindex.common.events.ChangeNotifier;
import com.starscape.mediaindex.common.events.EntityKind;
import com.starscape.mediaindex.common.exception.NotFoundException;
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

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for approving photos pending review.
 * Each photo is saved on its own; a failed photo is logged and skipped.
 * Only photos that left review are counted and announced.
 */
@Service
public class ApprovePhotosHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ApprovePhotosHandler.class);
    
    private final AccessControl accessControl;
    private final PhotoRepository photoRepository;
    private final PhotoCountsUpdater countsUpdater;
    private final ChangeNotifier notifier;
    
    public ApprovePhotosHandler(
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
        accessControl.check(caller, Resource.PHOTOS, Action.UPDATE);
        List<String> uids = selection.requirePhotos();
        
        log.info("Approving {} photos for {}", uids.size(), caller);
        
        List<Photo> photos = photoRepository.findByUids(uids, Scope.ACTIVE);
        if (photos.isEmpty()) {
            throw new NotFoundException("No photos found for selection");
        }
        
        List<String> approved = new ArrayList<>();
        for (Photo photo : photos) {
            try {
                if (photo.approve()) {
                    photoRepository.save(photo);
                    approved.add(photo.getPhotoUid());
                }
            } catch (IllegalStateException | DataAccessException | TransactionException e) {
                log.error("Failed to approve photo {}: {}", photo.getPhotoUid(), e.getMessage());
            }
        }
        
        if (!approved.isEmpty()) {
            countsUpdater.publish();
            notifier.entitiesUpdated(EntityKind.PHOTOS, approved);
        }
        
        log.info("Approved {} of {} selected photos", approved.size(), uids.size());
        return new BatchResult("Selection approved", approved.size());
    }
}
