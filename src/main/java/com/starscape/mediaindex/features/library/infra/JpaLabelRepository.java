package com.starscape.mediaindex.features.library.infra;

import com.starscape.mediaindex.features.library.domain.Label;
import com.starscape.mediaindex.features.library.domain.LabelRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface JpaLabelRepository extends JpaRepository<Label, Long>, LabelRepository {
    
    @Override
    @Query("SELECT l FROM Label l WHERE l.labelUid IN :uids AND l.deletedAt IS NULL ORDER BY l.rowId")
    List<Label> findActiveByUids(@Param("uids") Collection<String> labelUids);
    
    @Override
    @Modifying
    @Transactional
    @Query(value = "UPDATE labels SET photo_count = (SELECT COUNT(*) FROM photos_labels pl " +
                   "JOIN photos p ON p.photo_uid = pl.photo_uid WHERE pl.label_uid = labels.label_uid " +
                   "AND p.deleted_at IS NULL AND p.photo_private = false)",
           nativeQuery = true)
    int updatePhotoCounts();
    
    @Override
    @Query("SELECT COUNT(l) FROM Label l WHERE l.deletedAt IS NULL")
    long countActive();
}
