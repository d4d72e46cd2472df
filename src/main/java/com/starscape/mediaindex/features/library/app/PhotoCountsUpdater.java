package com.starscape.mediaindex.features.library.app;

import com.starscape.mediaindex.common.events.ChangeNotifier;
import com.starscape.mediaindex.common.events.LibraryCounts;
import com.starscape.mediaindex.features.library.domain.AlbumRepository;
import com.starscape.mediaindex.features.library.domain.LabelRepository;
import com.starscape.mediaindex.features.library.domain.PhotoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Recomputes denormalized photo counts on albums, labels and photos, then pushes
 * library totals to clients. Failures are logged and never surface to the
 * batch operation that triggered them.
 */
@Service
public class PhotoCountsUpdater {
    
    private static final Logger log = LoggerFactory.getLogger(PhotoCountsUpdater.class);
    
    private final PhotoRepository photoRepository;
    private final AlbumRepository albumRepository;
    private final LabelRepository labelRepository;
    private final ChangeNotifier notifier;
    private final TransactionTemplate transactionTemplate;
    
    public PhotoCountsUpdater(
            PhotoRepository photoRepository,
            AlbumRepository albumRepository,
            LabelRepository labelRepository,
            ChangeNotifier notifier,
            PlatformTransactionManager transactionManager) {
        this.photoRepository = photoRepository;
        this.albumRepository = albumRepository;
        this.labelRepository = labelRepository;
        this.notifier = notifier;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }
    
    /**
     * Recompute counts and publish the new totals.
     */
    public void refresh() {
        try {
            LibraryCounts counts = transactionTemplate.execute(status -> {
                int photos = photoRepository.updateFileCounts();
                int albums = albumRepository.updatePhotoCounts();
                int labels = labelRepository.updatePhotoCounts();
                log.debug("Updated counts: photos={}, albums={}, labels={}", photos, albums, labels);
                return currentCounts();
            });
            if (counts != null) {
                notifier.countsChanged(counts);
            }
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to update photo counts: {}", e.getMessage(), e);
        }
    }
    
    /**
     * Publish totals without recomputing stored counts, for changes that only
     * affect the review or privacy totals.
     */
    public void publish() {
        try {
            notifier.countsChanged(currentCounts());
        } catch (DataAccessException e) {
            log.error("Failed to read library counts: {}", e.getMessage(), e);
        }
    }
    
    LibraryCounts currentCounts() {
        return new LibraryCounts(
            photoRepository.countActive(),
            photoRepository.countArchived(),
            photoRepository.countPrivate(),
            photoRepository.countInReview(),
            albumRepository.count(),
            labelRepository.countActive()
        );
    }
}
