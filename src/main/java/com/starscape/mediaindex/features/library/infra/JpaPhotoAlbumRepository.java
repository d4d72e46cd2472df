package com.starscape.mediaindex.features.library.infra;

import com.starscape.mediaindex.features.library.domain.PhotoAlbum;
import com.starscape.mediaindex.features.library.domain.PhotoAlbumId;
import com.starscape.mediaindex.features.library.domain.PhotoAlbumRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface JpaPhotoAlbumRepository extends JpaRepository<PhotoAlbum, PhotoAlbumId>, PhotoAlbumRepository {
    
    @Override
    List<PhotoAlbum> findByPhotoUid(String photoUid);
    
    @Override
    List<PhotoAlbum> findByAlbumUid(String albumUid);
    
    @Override
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE PhotoAlbum pa SET pa.hidden = true WHERE pa.photoUid IN :uids")
    int hideByPhotoUids(@Param("uids") Collection<String> photoUids);
    
    @Override
    @Modifying
    @Transactional
    @Query("DELETE FROM PhotoAlbum pa WHERE pa.albumUid IN :uids")
    int deleteByAlbumUids(@Param("uids") Collection<String> albumUids);
    
    @Override
    @Modifying
    @Transactional
    @Query("DELETE FROM PhotoAlbum pa WHERE pa.photoUid = :photoUid")
    int deleteByPhotoUid(@Param("photoUid") String photoUid);
}
