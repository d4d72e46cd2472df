package com.starscape.mediaindex.features.library.domain;

import java.util.Collection;
import java.util.List;

public interface PhotoAlbumRepository {
    PhotoAlbum save(PhotoAlbum photoAlbum);
    List<PhotoAlbum> findByPhotoUid(String photoUid);
    List<PhotoAlbum> findByAlbumUid(String albumUid);
    int hideByPhotoUids(Collection<String> photoUids);
    int deleteByAlbumUids(Collection<String> albumUids);
    int deleteByPhotoUid(String photoUid);
}
