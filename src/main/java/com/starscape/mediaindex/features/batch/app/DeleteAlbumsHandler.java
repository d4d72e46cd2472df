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
import com.starscape.mediaindex.features.library.domain.Album;
import com.starscape.mediaindex.features.library.domain.AlbumRepository;
import com.starscape.mediaindex.features.library.domain.PhotoAlbumRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Handler for hard-deleting albums. Memberships and albums are removed in one
 * transaction, memberships first so no join row outlives its album. Photos are
 * never touched.
 */
@Service
public class DeleteAlbumsHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeleteAlbumsHandler.class);
    
    private final AccessControl accessControl;
    private final AlbumRepository albumRepository;
    private final PhotoAlbumRepository photoAlbumRepository;
    private final PhotoCountsUpdater countsUpdater;
    private final ChangeNotifier notifier;
    private final TransactionTemplate transactionTemplate;
    
    public DeleteAlbumsHandler(
            AccessControl accessControl,
            AlbumRepository albumRepository,
            PhotoAlbumRepository photoAlbumRepository,
            PhotoCountsUpdater countsUpdater,
            ChangeNotifier notifier,
            PlatformTransactionManager transactionManager) {
        this.accessControl = accessControl;
        this.albumRepository = albumRepository;
        this.photoAlbumRepository = photoAlbumRepository;
        this.countsUpdater = countsUpdater;
        this.notifier = notifier;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }
    
    public BatchResult handle(UserPrincipal caller, Selection selection) {
        accessControl.check(caller, Resource.ALBUMS, Action.DELETE);
        List<String> uids = selection.requireAlbums();
        
        log.info("Deleting {} albums for {}", uids.size(), caller);
        
        List<Album> albums = albumRepository.findByAlbumUidIn(uids);
        if (albums.isEmpty()) {
            throw new NotFoundException("No albums found for selection");
        }
        
        int deleted;
        try {
            // Both statements commit together or not at all
            deleted = transactionTemplate.execute(status -> {
                int memberships = photoAlbumRepository.deleteByAlbumUids(uids);
                log.debug("Removed {} album memberships", memberships);
                return albumRepository.deleteByAlbumUids(uids);
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to delete albums: {}", e.getMessage(), e);
            throw new SaveFailedException("Failed to delete albums", e);
        }
        
        countsUpdater.publish();
        notifier.entitiesDeleted(EntityKind.ALBUMS, uids);
        
        log.info("Deleted {} of {} selected albums", deleted, uids.size());
        return new BatchResult("Albums deleted", deleted);
    }
}
