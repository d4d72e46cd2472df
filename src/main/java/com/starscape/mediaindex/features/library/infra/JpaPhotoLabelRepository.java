package com.starscape.mediaindex.features.library.infra;

import com.starscape.mediaindex.features.library.domain.PhotoLabel;
import com.starscape.mediaindex.features.library.domain.PhotoLabelId;
import com.starscape.mediaindex.features.library.domain.PhotoLabelRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface JpaPhotoLabelRepository extends JpaRepository<PhotoLabel, PhotoLabelId>, PhotoLabelRepository {
    
    @Override
    List<PhotoLabel> findByLabelUid(String labelUid);
    
    @Override
    @Modifying
    @Transactional
    @Query("DELETE FROM PhotoLabel pl WHERE pl.labelUid = :labelUid")
    int deleteByLabelUid(@Param("labelUid") String labelUid);
    
    @Override
    @Modifying
    @Transactional
    @Query("DELETE FROM PhotoLabel pl WHERE pl.photoUid = :photoUid")
    int deleteByPhotoUid(@Param("photoUid") String photoUid);
}
