package com.starscape.mediaindex.features.batch.infra;

import com.starscape.mediaindex.common.config.MediaProperties;
import com.starscape.mediaindex.features.batch.domain.PhotoRemover;
import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoAlbumRepository;
import com.starscape.mediaindex.features.library.domain.PhotoFile;
import com.starscape.mediaindex.features.library.domain.PhotoFileRepository;
import com.starscape.mediaindex.features.library.domain.PhotoLabelRepository;
import com.starscape.mediaindex.features.library.domain.PhotoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deletes a photo's files from the originals and sidecar folders, then its rows.
 * <p>
 * Disk content goes first: if any file cannot be deleted the rows are kept so
 * the photo stays visible and the delete can be retried. Files already removed
 * by then are marked missing. Only the two configured roots are ever touched.
 * Row deletion runs in its own transaction so one failed photo never rolls back
 * another.
 */
@Service
public class OriginalsPhotoRemover implements PhotoRemover {
    
    private static final Logger log = LoggerFactory.getLogger(OriginalsPhotoRemover.class);
    
    static final String ROOT_ORIGINALS = "originals";
    static final String ROOT_SIDECAR = "sidecar";
    
    private final PhotoRepository photoRepository;
    private final PhotoFileRepository photoFileRepository;
    private final PhotoAlbumRepository photoAlbumRepository;
    private final PhotoLabelRepository photoLabelRepository;
    private final MediaProperties mediaProperties;
    private final TransactionTemplate transactionTemplate;
    
    public OriginalsPhotoRemover(
            PhotoRepository photoRepository,
            PhotoFileRepository photoFileRepository,
            PhotoAlbumRepository photoAlbumRepository,
            PhotoLabelRepository photoLabelRepository,
            MediaProperties mediaProperties,
            PlatformTransactionManager transactionManager) {
        this.photoRepository = photoRepository;
        this.photoFileRepository = photoFileRepository;
        this.photoAlbumRepository = photoAlbumRepository;
        this.photoLabelRepository = photoLabelRepository;
        this.mediaProperties = mediaProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }
    
    @Override
    public boolean remove(Photo photo) {
        String photoUid = photo.getPhotoUid();
        List<PhotoFile> files = photoFileRepository.findByPhotoUidOrderByRowIdAsc(photoUid);
        
        List<String> removed = new ArrayList<>();
        for (PhotoFile file : files) {
            if (file.isFileMissing()) {
                continue;
            }
            if (!deleteFromDisk(file)) {
                log.warn("Keeping photo {}: file {} could not be removed", photoUid, file.getRelativePath());
                markMissing(photoUid, removed);
                return false;
            }
            removed.add(file.getFileUid());
        }
        
        try {
            transactionTemplate.executeWithoutResult(status -> {
                photoFileRepository.deleteByPhotoUid(photoUid);
                photoAlbumRepository.deleteByPhotoUid(photoUid);
                photoLabelRepository.deleteByPhotoUid(photoUid);
                photoRepository.deleteByPhotoUid(photoUid);
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to delete rows of photo {}: {}", photoUid, e.getMessage());
            markMissing(photoUid, removed);
            return false;
        }
        
        log.info("Permanently deleted photo {} with {} files", photoUid, files.size());
        return true;
    }
    
    /**
     * Kept rows of files already gone from disk must not claim the content still exists.
     */
    private void markMissing(String photoUid, List<String> fileUids) {
        if (fileUids.isEmpty()) {
            return;
        }
        try {
            transactionTemplate.executeWithoutResult(status ->
                photoFileRepository.markMissing(fileUids, Instant.now()));
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to mark {} deleted files of photo {} as missing: {}",
                fileUids.size(), photoUid, e.getMessage());
        }
    }
    
    /**
     * @return true if the file is gone, including when it was already absent
     */
    boolean deleteFromDisk(PhotoFile file) {
        Optional<Path> configured = baseDirectory(file.getFileRoot());
        if (configured.isEmpty()) {
            log.error("Refusing to delete {}: unknown file root {}", file.getFileName(), file.getFileRoot());
            return false;
        }
        Path base = configured.get();
        Path path = base.resolve(file.getFileName()).normalize();
        
        if (!path.startsWith(base)) {
            log.error("Refusing to delete {}: outside of {}", path, base);
            return false;
        }
        
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("Deleted {}", path);
            } else {
                log.debug("File {} does not exist (already deleted?)", path);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to delete {}: {}", path, e.getMessage());
            return false;
        }
    }
    
    private Optional<Path> baseDirectory(String fileRoot) {
        String dir;
        if (ROOT_ORIGINALS.equals(fileRoot)) {
            dir = mediaProperties.getOriginalsPath();
        } else if (ROOT_SIDECAR.equals(fileRoot)) {
            dir = mediaProperties.getSidecarPath();
        } else {
            return Optional.empty();
        }
        return Optional.of(Paths.get(dir).toAbsolutePath().normalize());
    }
}
