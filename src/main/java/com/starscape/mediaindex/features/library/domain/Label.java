package com.starscape.mediaindex.features.library.domain;

import com.starscape.mediaindex.common.domain.Uid;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "labels")
public class Label extends com.starscape.mediaindex.common.domain.Entity<String> {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long rowId;
    
    @Column(name = "label_uid", nullable = false, unique = true, updatable = false, length = 42)
    private String labelUid;
    
    @Column(name = "label_name", nullable = false)
    private String labelName;
    
    @Column(name = "photo_count", nullable = false)
    private int photoCount;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @Column(name = "deleted_at")
    private Instant deletedAt;
    
    protected Label() {
        // JPA constructor
    }
    
    public Label(String labelUid, String labelName) {
        if (labelName == null || labelName.isBlank()) {
            throw new IllegalArgumentException("Label name cannot be blank");
        }
        
        this.labelUid = labelUid;
        this.labelName = labelName.trim();
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }
    
    @PrePersist
    protected void onCreate() {
        this.labelUid = Uid.ensure(labelUid, Uid.LABEL);
        this.updatedAt = Instant.now();
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
    
    @Override
    public String getId() {
        return labelUid;
    }
    
    public void markDeleted(Instant at) {
        if (deletedAt == null) {
            this.deletedAt = at;
        }
    }
    
    public boolean isDeleted() {
        return deletedAt != null;
    }
    
    public ArchiveState getArchiveState() {
        return ArchiveState.of(deletedAt);
    }
    
    // Getters
    public Long getRowId() { return rowId; }
    public String getLabelUid() { return labelUid; }
    public String getLabelName() { return labelName; }
    public int getPhotoCount() { return photoCount; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getDeletedAt() { return deletedAt; }
}
