package com.starscape.mediaindex.features.library.domain;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "photos_labels", indexes = @Index(name = "idx_photos_labels_label", columnList = "label_uid"))
@IdClass(PhotoLabelId.class)
public class PhotoLabel {
    
    @Id
    @Column(name = "photo_uid", nullable = false, length = 42)
    private String photoUid;
    
    @Id
    @Column(name = "label_uid", nullable = false, length = 42)
    private String labelUid;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected PhotoLabel() {
        // JPA constructor
    }
    
    public PhotoLabel(String photoUid, String labelUid) {
        if (photoUid == null || photoUid.isBlank()) {
            throw new IllegalArgumentException("Photo UID cannot be blank");
        }
        if (labelUid == null || labelUid.isBlank()) {
            throw new IllegalArgumentException("Label UID cannot be blank");
        }
        
        this.photoUid = photoUid;
        this.labelUid = labelUid;
        this.createdAt = Instant.now();
    }
    
    // Getters
    public String getPhotoUid() { return photoUid; }
    public String getLabelUid() { return labelUid; }
    public Instant getCreatedAt() { return createdAt; }
}
