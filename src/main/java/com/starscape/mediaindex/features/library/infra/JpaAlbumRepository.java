package com.starscape.mediaindex.features.library.infra;

import com.starscape.mediaindex.features.library.domain.Album;
import com.starscape.mediaindex.features.library.domain.AlbumRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface JpaAlbumRepository extends JpaRepository<Album, Long>, AlbumRepository {
    
    @Override
    List<Album> findByAlbumUidIn(Collection<String> albumUids);
    
    @Override
    @Modifying
    @Transactional
    @Query("DELETE FROM Album a WHERE a.albumUid IN :uids")
    int deleteByAlbumUids(@Param("uids") Collection<String> albumUids);
    
    /**
     * Counts visible members: not hidden, not archived, not private.
     */
    @Override
    @Modifying
    @Transactional
    @Query(value = "UPDATE albums SET photo_count = (SELECT COUNT(*) FROM photos_albums pa " +
                   "JOIN photos p ON p.photo_uid = pa.photo_uid WHERE pa.album_uid = albums.album_uid " +
                   "AND pa.hidden = false AND p.deleted_at IS NULL AND p.photo_private = false)",
           nativeQuery = true)
    int updatePhotoCounts();
}
