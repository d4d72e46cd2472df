package com.starscape.mediaindex.features.indexing.app;

import com.starscape.mediaindex.features.indexing.domain.FileView;
import com.starscape.mediaindex.features.indexing.domain.Hydrate;
import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoFile;
import com.starscape.mediaindex.features.library.domain.PhotoFileRepository;
import com.starscape.mediaindex.features.library.domain.PhotoRepository;
import com.starscape.mediaindex.features.library.domain.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read and maintenance operations on indexed files. Lookups return empty
 * results for absent rows and never throw for them.
 */
@Service
public class FileIndexService {
    
    private static final Logger log = LoggerFactory.getLogger(FileIndexService.class);
    
    private final PhotoFileRepository photoFileRepository;
    private final PhotoRepository photoRepository;
    
    public FileIndexService(PhotoFileRepository photoFileRepository, PhotoRepository photoRepository) {
        this.photoFileRepository = photoFileRepository;
        this.photoRepository = photoRepository;
    }
    
    /**
     * Present files of active photos stored in one folder, ordered by name.
     */
    @Transactional(readOnly = true)
    public List<PhotoFile> filesByPath(String fileRoot, String photoPath, int page, int size) {
        return photoFileRepository.findByPath(fileRoot, photoPath, PageRequest.of(page, size));
    }
    
    /**
     * Files below a path prefix in insertion order. A blank prefix matches all files.
     */
    @Transactional(readOnly = true)
    public List<PhotoFile> files(String pathPrefix, boolean includeMissing, int page, int size) {
        String pattern = "%";
        if (pathPrefix != null) {
            String trimmed = pathPrefix.startsWith("/") ? pathPrefix.substring(1) : pathPrefix;
            if (!trimmed.isEmpty()) {
                pattern = escapeLike(trimmed) + "/%";
            }
        }
        return photoFileRepository.findByNamePrefix(pattern, includeMissing, PageRequest.of(page, size));
    }
    
    /**
     * Primary files of the given photo UIDs plus files named directly by file UID.
     */
    @Transactional(readOnly = true)
    public List<PhotoFile> filesBySelection(Collection<String> uids, int page, int size) {
        if (uids == null || uids.isEmpty()) {
            return List.of();
        }
        return photoFileRepository.findBySelection(uids, PageRequest.of(page, size));
    }
    
    @Transactional(readOnly = true)
    public Optional<FileView> fileByUid(String fileUid, Hydrate hydrate) {
        if (fileUid == null || fileUid.isBlank()) {
            return Optional.empty();
        }
        return photoFileRepository.findByFileUid(fileUid).map(file -> view(file, hydrate));
    }
    
    @Transactional(readOnly = true)
    public Optional<FileView> fileByHash(String fileHash, Hydrate hydrate) {
        if (fileHash == null || fileHash.isBlank()) {
            return Optional.empty();
        }
        return photoFileRepository.findFirstByFileHashOrderByRowIdAsc(fileHash).map(file -> view(file, hydrate));
    }
    
    @Transactional(readOnly = true)
    public Optional<FileView> fileByPath(String fileRoot, String fileName, Hydrate hydrate) {
        if (fileRoot == null || fileName == null || fileName.isBlank()) {
            return Optional.empty();
        }
        return photoFileRepository.findFirstByFileRootAndFileNameOrderByRowIdAsc(fileRoot, fileName)
            .map(file -> view(file, hydrate));
    }
    
    @Transactional(readOnly = true)
    public Optional<FileView> primaryFile(String photoUid, Hydrate hydrate) {
        if (photoUid == null || photoUid.isBlank()) {
            return Optional.empty();
        }
        return photoFileRepository.findFirstByPhotoUidAndFilePrimaryTrueOrderByRowIdAsc(photoUid)
            .map(file -> view(file, hydrate));
    }
    
    @Transactional(readOnly = true)
    public Optional<FileView> videoFile(String photoUid, Hydrate hydrate) {
        if (photoUid == null || photoUid.isBlank()) {
            return Optional.empty();
        }
        return photoFileRepository.findFirstByPhotoUidAndFileVideoTrueOrderByRowIdAsc(photoUid)
            .map(file -> view(file, hydrate));
    }
    
    /**
     * Point an indexed file at a new location and mark it present again.
     *
     * @return number of rows moved
     */
    @Transactional
    public int renameFile(String srcRoot, String srcName, String destRoot, String destName) {
        if (isBlank(srcRoot) || isBlank(srcName) || isBlank(destRoot) || isBlank(destName)) {
            throw new IllegalArgumentException("Cannot rename file: source and destination are required");
        }
        
        int moved = photoFileRepository.rename(srcRoot, srcName, destRoot, destName);
        log.info("Renamed {}/{} to {}/{} ({} rows)", srcRoot, srcName, destRoot, destName, moved);
        return moved;
    }
    
    /**
     * Store a processing error on a file. Store failures are logged, not raised.
     */
    public void setFileError(String fileUid, String fileError) {
        if (isBlank(fileUid)) {
            return;
        }
        
        try {
            photoFileRepository.updateFileError(fileUid, fileError);
        } catch (DataAccessException e) {
            log.error("Failed to set error on file {}: {}", fileUid, e.getMessage());
        }
    }
    
    private FileView view(PhotoFile file, Hydrate hydrate) {
        if (hydrate != Hydrate.PHOTO) {
            return new FileView(file, null);
        }
        Photo photo = photoRepository.findByUid(file.getPhotoUid(), Scope.INCLUDE_ARCHIVED).orElse(null);
        return new FileView(file, photo);
    }
    
    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
    
    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
