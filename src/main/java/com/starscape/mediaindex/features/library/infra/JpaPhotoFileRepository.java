package com.starscape.mediaindex.features.library.infra;

import com.starscape.mediaindex.features.library.domain.IndexedPath;
import com.starscape.mediaindex.features.library.domain.PhotoFile;
import com.starscape.mediaindex.features.library.domain.PhotoFileRepository;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface JpaPhotoFileRepository extends JpaRepository<PhotoFile, Long>, PhotoFileRepository {
    
    @Override
    Optional<PhotoFile> findByFileUid(String fileUid);
    
    @Override
    Optional<PhotoFile> findFirstByFileHashOrderByRowIdAsc(String fileHash);
    
    @Override
    Optional<PhotoFile> findFirstByFileRootAndFileNameOrderByRowIdAsc(String fileRoot, String fileName);
    
    @Override
    Optional<PhotoFile> findFirstByPhotoUidAndFilePrimaryTrueOrderByRowIdAsc(String photoUid);
    
    @Override
    Optional<PhotoFile> findFirstByPhotoUidAndFileVideoTrueOrderByRowIdAsc(String photoUid);
    
    @Override
    List<PhotoFile> findByPhotoUidOrderByRowIdAsc(String photoUid);
    
    /**
     * Present JPEG files of a photo, widest first.
     */
    @Override
    @Query("SELECT f.fileUid FROM PhotoFile f WHERE f.photoUid = :photoUid AND f.fileMissing = false " +
           "AND f.fileType = 'jpg' ORDER BY f.fileWidth DESC, f.rowId ASC")
    List<String> findPrimaryCandidates(@Param("photoUid") String photoUid);
    
    @Override
    @Query("SELECT f FROM PhotoFile f, Photo p WHERE p.photoUid = f.photoUid AND p.deletedAt IS NULL " +
           "AND f.fileMissing = false AND f.fileRoot = :root AND p.photoPath = :path ORDER BY f.fileName")
    List<PhotoFile> findByPath(@Param("root") String fileRoot, @Param("path") String photoPath, Pageable pageable);
    
    @Override
    @Query("SELECT f FROM PhotoFile f WHERE (:includeMissing = true OR f.fileMissing = false) " +
           "AND f.fileName LIKE :pattern ESCAPE '\\' ORDER BY f.rowId")
    List<PhotoFile> findByNamePrefix(@Param("pattern") String namePattern,
                                     @Param("includeMissing") boolean includeMissing,
                                     Pageable pageable);
    
    @Override
    @Query("SELECT f FROM PhotoFile f WHERE (f.photoUid IN :uids AND f.filePrimary = true) " +
           "OR f.fileUid IN :uids ORDER BY f.rowId")
    List<PhotoFile> findBySelection(@Param("uids") Collection<String> uids, Pageable pageable);
    
    @Override
    @Query("SELECT new com.starscape.mediaindex.features.library.domain.IndexedPath(f.fileRoot, f.fileName, f.modTime) " +
           "FROM PhotoFile f WHERE f.fileMissing = false AND f.deletedAt IS NULL")
    List<IndexedPath> findIndexedPaths();
    
    @Override
    @Query("SELECT f.fileHash FROM PhotoFile f WHERE f.fileMissing = false AND f.deletedAt IS NULL " +
           "AND f.fileHash IS NOT NULL")
    List<String> findIndexedHashes();
    
    @Override
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE PhotoFile f SET f.filePrimary = false WHERE f.photoUid = :photoUid AND f.fileUid <> :fileUid")
    int clearPrimaryExcept(@Param("photoUid") String photoUid, @Param("fileUid") String fileUid);
    
    @Override
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE PhotoFile f SET f.filePrimary = true WHERE f.photoUid = :photoUid AND f.fileUid = :fileUid")
    int markPrimary(@Param("photoUid") String photoUid, @Param("fileUid") String fileUid);
    
    @Override
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE PhotoFile f SET f.fileRoot = :destRoot, f.fileName = :destName, f.fileMissing = false, " +
           "f.deletedAt = NULL WHERE f.fileRoot = :srcRoot AND f.fileName = :srcName")
    int rename(@Param("srcRoot") String srcRoot, @Param("srcName") String srcName,
               @Param("destRoot") String destRoot, @Param("destName") String destName);
    
    @Override
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE PhotoFile f SET f.fileError = :error WHERE f.fileUid = :fileUid")
    int updateFileError(@Param("fileUid") String fileUid, @Param("error") String fileError);
    
    @Override
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE PhotoFile f SET f.fileMissing = true, f.filePrimary = false, f.updatedAt = :at " +
           "WHERE f.fileUid IN :fileUids")
    int markMissing(@Param("fileUids") Collection<String> fileUids, @Param("at") Instant at);
    
    @Override
    @Modifying
    @Transactional
    @Query("DELETE FROM PhotoFile f WHERE f.photoUid = :photoUid")
    int deleteByPhotoUid(@Param("photoUid") String photoUid);
}
