package com.starscape.mediaindex.features.library.domain;

import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for indexed files. Lookups by non-unique columns return
 * the first match in insertion order.
 */
public interface PhotoFileRepository {
    PhotoFile save(PhotoFile file);
    Optional<PhotoFile> findByFileUid(String fileUid);
    Optional<PhotoFile> findFirstByFileHashOrderByRowIdAsc(String fileHash);
    Optional<PhotoFile> findFirstByFileRootAndFileNameOrderByRowIdAsc(String fileRoot, String fileName);
    Optional<PhotoFile> findFirstByPhotoUidAndFilePrimaryTrueOrderByRowIdAsc(String photoUid);
    Optional<PhotoFile> findFirstByPhotoUidAndFileVideoTrueOrderByRowIdAsc(String photoUid);
    List<PhotoFile> findByPhotoUidOrderByRowIdAsc(String photoUid);
    
    List<String> findPrimaryCandidates(String photoUid);
    List<PhotoFile> findByPath(String fileRoot, String photoPath, Pageable pageable);
    List<PhotoFile> findByNamePrefix(String namePattern, boolean includeMissing, Pageable pageable);
    List<PhotoFile> findBySelection(Collection<String> uids, Pageable pageable);
    
    List<IndexedPath> findIndexedPaths();
    List<String> findIndexedHashes();
    
    int clearPrimaryExcept(String photoUid, String fileUid);
    int markPrimary(String photoUid, String fileUid);
    int rename(String srcRoot, String srcName, String destRoot, String destName);
    int updateFileError(String fileUid, String fileError);
    int markMissing(Collection<String> fileUids, Instant at);
    int deleteByPhotoUid(String photoUid);
}
