package com.starscape.mediaindex.features.primaryfile.app;

import com.starscape.mediaindex.features.library.domain.PhotoFile;
import com.starscape.mediaindex.features.library.domain.PhotoFileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Keeps exactly one primary file per photo.
 * <p>
 * Without an explicit choice the widest present JPEG wins. Other files are
 * cleared before the chosen one is set. Concurrent calls for the same photo
 * must be serialized by the caller.
 */
@Service
public class PrimaryFileResolver {
    
    private static final Logger log = LoggerFactory.getLogger(PrimaryFileResolver.class);
    
    private final PhotoFileRepository photoFileRepository;
    
    public PrimaryFileResolver(PhotoFileRepository photoFileRepository) {
        this.photoFileRepository = photoFileRepository;
    }
    
    /**
     * @param photoUid photo whose primary file is resolved
     * @param fileUid  explicit choice, or null to pick the widest JPEG
     * @return UID of the file now marked primary
     * @throws NoEligibleFileException if no file qualifies
     */
    @Transactional
    public String resolve(String photoUid, String fileUid) {
        if (photoUid == null || photoUid.isBlank()) {
            throw new IllegalArgumentException("Photo UID is required");
        }
        
        String chosen = (fileUid == null || fileUid.isBlank())
            ? widestJpeg(photoUid)
            : verifiedChoice(photoUid, fileUid);
        
        int cleared = photoFileRepository.clearPrimaryExcept(photoUid, chosen);
        photoFileRepository.markPrimary(photoUid, chosen);
        
        log.info("Primary file of photo {} is now {} ({} others cleared)", photoUid, chosen, cleared);
        return chosen;
    }
    
    private String widestJpeg(String photoUid) {
        List<String> candidates = photoFileRepository.findPrimaryCandidates(photoUid);
        if (candidates.isEmpty()) {
            throw new NoEligibleFileException("No eligible primary file for photo " + photoUid);
        }
        return candidates.get(0);
    }
    
    private String verifiedChoice(String photoUid, String fileUid) {
        PhotoFile file = photoFileRepository.findByFileUid(fileUid)
            .filter(f -> photoUid.equals(f.getPhotoUid()))
            .orElseThrow(() -> new NoEligibleFileException(
                "File " + fileUid + " does not belong to photo " + photoUid));
        
        if (file.isFileMissing()) {
            throw new NoEligibleFileException("File " + fileUid + " is missing");
        }
        return file.getFileUid();
    }
}
