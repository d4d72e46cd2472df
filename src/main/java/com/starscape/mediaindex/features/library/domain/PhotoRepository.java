package com.starscape.mediaindex.features.library.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PhotoRepository {
    Photo save(Photo photo);
    Optional<Photo> findByUid(String photoUid, Scope scope);
    List<Photo> findByUids(Collection<String> photoUids, Scope scope);
    long countByUids(Collection<String> photoUids, Scope scope);
    
    int archiveByUids(Collection<String> photoUids, Instant at);
    int restoreByUids(Collection<String> photoUids, Instant at);
    int togglePrivateByUids(Collection<String> photoUids, Instant at);
    int deleteByPhotoUid(String photoUid);
    
    int updateFileCounts();
    long countActive();
    long countArchived();
    long countPrivate();
    long countInReview();
}
