package com.starscape.mediaindex.features.library.domain;

import com.starscape.mediaindex.common.domain.Uid;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "albums")
public class Album extends com.starscape.mediaindex.common.domain.Entity<String> {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long rowId;
    
    @Column(name = "album_uid", nullable = false, unique = true, updatable = false, length = 42)
    private String albumUid;
    
    @Column(name = "album_title", nullable = false)
    private String albumTitle;
    
    @Column(name = "photo_count", nullable = false)
    private int photoCount;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected Album() {
        // JPA constructor
    }
    
    public Album(String albumUid, String albumTitle) {
        if (albumTitle == null || albumTitle.isBlank()) {
            throw new IllegalArgumentException("Album title cannot be blank");
        }
        
        this.albumUid = albumUid;
        this.albumTitle = albumTitle.trim();
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }
    
    @PrePersist
    protected void onCreate() {
        this.albumUid = Uid.ensure(albumUid, Uid.ALBUM);
        this.updatedAt = Instant.now();
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
    
    @Override
    public String getId() {
        return albumUid;
    }
    
    // Getters
    public Long getRowId() { return rowId; }
    public String getAlbumUid() { return albumUid; }
    public String getAlbumTitle() { return albumTitle; }
    public int getPhotoCount() { return photoCount; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
