package com.starscape.mediaindex.features.library.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite key for PhotoAlbum entity.
 */
public class PhotoAlbumId implements Serializable {
    
    private String photoUid;
    private String albumUid;
    
    public PhotoAlbumId() {
        // JPA constructor
    }
    
    public PhotoAlbumId(String photoUid, String albumUid) {
        this.photoUid = photoUid;
        this.albumUid = albumUid;
    }
    
    public String getPhotoUid() { return photoUid; }
    public void setPhotoUid(String photoUid) { this.photoUid = photoUid; }
    
    public String getAlbumUid() { return albumUid; }
    public void setAlbumUid(String albumUid) { this.albumUid = albumUid; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PhotoAlbumId that = (PhotoAlbumId) o;
        return Objects.equals(photoUid, that.photoUid) && Objects.equals(albumUid, that.albumUid);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(photoUid, albumUid);
    }
}
