package com.starscape.mediaindex.features.library.infra;

import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoRepository;
import com.starscape.mediaindex.features.library.domain.Scope;
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

/**
 * Bulk updates are single statements, so concurrent readers never see a batch half applied.
 */
@Repository
public interface JpaPhotoRepository extends JpaRepository<Photo, Long>, PhotoRepository {
    
    @Query("SELECT p FROM Photo p WHERE p.photoUid = :uid AND p.deletedAt IS NULL")
    Optional<Photo> findActiveByPhotoUid(@Param("uid") String photoUid);
    
    @Query("SELECT p FROM Photo p WHERE p.photoUid = :uid")
    Optional<Photo> findAnyByPhotoUid(@Param("uid") String photoUid);
    
    @Query("SELECT p FROM Photo p WHERE p.photoUid IN :uids AND p.deletedAt IS NULL ORDER BY p.rowId")
    List<Photo> findActiveByPhotoUids(@Param("uids") Collection<String> photoUids);
    
    @Query("SELECT p FROM Photo p WHERE p.photoUid IN :uids ORDER BY p.rowId")
    List<Photo> findAnyByPhotoUids(@Param("uids") Collection<String> photoUids);
    
    @Query("SELECT COUNT(p) FROM Photo p WHERE p.photoUid IN :uids AND p.deletedAt IS NULL")
    long countActiveByPhotoUids(@Param("uids") Collection<String> photoUids);
    
    @Query("SELECT COUNT(p) FROM Photo p WHERE p.photoUid IN :uids")
    long countAnyByPhotoUids(@Param("uids") Collection<String> photoUids);
    
    @Override
    default Optional<Photo> findByUid(String photoUid, Scope scope) {
        return scope == Scope.ACTIVE ? findActiveByPhotoUid(photoUid) : findAnyByPhotoUid(photoUid);
    }
    
    @Override
    default List<Photo> findByUids(Collection<String> photoUids, Scope scope) {
        return scope == Scope.ACTIVE ? findActiveByPhotoUids(photoUids) : findAnyByPhotoUids(photoUids);
    }
    
    @Override
    default long countByUids(Collection<String> photoUids, Scope scope) {
        return scope == Scope.ACTIVE ? countActiveByPhotoUids(photoUids) : countAnyByPhotoUids(photoUids);
    }
    
    @Override
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Photo p SET p.deletedAt = :at, p.updatedAt = :at WHERE p.photoUid IN :uids AND p.deletedAt IS NULL")
    int archiveByUids(@Param("uids") Collection<String> photoUids, @Param("at") Instant at);
    
    @Override
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Photo p SET p.deletedAt = NULL, p.updatedAt = :at WHERE p.photoUid IN :uids AND p.deletedAt IS NOT NULL")
    int restoreByUids(@Param("uids") Collection<String> photoUids, @Param("at") Instant at);
    
    @Override
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Photo p SET p.photoPrivate = CASE WHEN p.photoPrivate = true THEN false ELSE true END, " +
           "p.updatedAt = :at WHERE p.photoUid IN :uids AND p.deletedAt IS NULL")
    int togglePrivateByUids(@Param("uids") Collection<String> photoUids, @Param("at") Instant at);
    
    @Override
    @Modifying
    @Transactional
    @Query("DELETE FROM Photo p WHERE p.photoUid = :uid")
    int deleteByPhotoUid(@Param("uid") String photoUid);
    
    @Override
    @Modifying
    @Transactional
    @Query(value = "UPDATE photos SET file_count = (SELECT COUNT(*) FROM files f " +
                   "WHERE f.photo_uid = photos.photo_uid AND f.file_missing = false AND f.deleted_at IS NULL)",
           nativeQuery = true)
    int updateFileCounts();
    
    @Override
    @Query("SELECT COUNT(p) FROM Photo p WHERE p.deletedAt IS NULL")
    long countActive();
    
    @Override
    @Query("SELECT COUNT(p) FROM Photo p WHERE p.deletedAt IS NOT NULL")
    long countArchived();
    
    @Override
    @Query("SELECT COUNT(p) FROM Photo p WHERE p.deletedAt IS NULL AND p.photoPrivate = true")
    long countPrivate();
    
    @Override
    @Query("SELECT COUNT(p) FROM Photo p WHERE p.deletedAt IS NULL AND p.photoQuality < 3")
    long countInReview();
}
