package com.starscape.mediaindex.features.library.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Album membership. A hidden membership is kept but not shown in the album,
 * either because the photo was archived or because it was removed by hand.
 */
@Entity
@Table(name = "photos_albums", indexes = @Index(name = "idx_photos_albums_album", columnList = "album_uid"))
@IdClass(PhotoAlbumId.class)
public class PhotoAlbum {
    
    @Id
    @Column(name = "photo_uid", nullable = false, length = 42)
    private String photoUid;
    
    @Id
    @Column(name = "album_uid", nullable = false, length = 42)
    private String albumUid;
    
    @Column(name = "hidden", nullable = false)
    private boolean hidden;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected PhotoAlbum() {
        // JPA constructor
    }
    
    public PhotoAlbum(String photoUid, String albumUid) {
        if (photoUid == null || photoUid.isBlank()) {
            throw new IllegalArgumentException("Photo UID cannot be blank");
        }
        if (albumUid == null || albumUid.isBlank()) {
            throw new IllegalArgumentException("Album UID cannot be blank");
        }
        
        this.photoUid = photoUid;
        this.albumUid = albumUid;
        this.createdAt = Instant.now();
    }
    
    public void hide() {
        this.hidden = true;
    }
    
    // Getters
    public String getPhotoUid() { return photoUid; }
    public String getAlbumUid() { return albumUid; }
    public boolean isHidden() { return hidden; }
    public Instant getCreatedAt() { return createdAt; }
}
