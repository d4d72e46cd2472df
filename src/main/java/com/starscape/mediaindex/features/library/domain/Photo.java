package com.starscape.mediaindex.features.library.domain;

import com.starscape.mediaindex.common.domain.Uid;
import jakarta.persistence.*;
import java.time.Instant;

/**
 * A logical media item. Its files (original, converted, sidecar video) are
 * {@link PhotoFile} rows linked by {@code photoUid}.
 */
@Entity
@Table(name = "photos", indexes = {
    @Index(name = "idx_photos_deleted_at", columnList = "deleted_at"),
    @Index(name = "idx_photos_path", columnList = "photo_path")
})
public class Photo extends com.starscape.mediaindex.common.domain.Entity<String> {
    
    /** Quality below this value means the photo waits for review. */
    public static final int APPROVED_QUALITY = 3;
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long rowId;
    
    @Column(name = "photo_uid", nullable = false, unique = true, updatable = false, length = 42)
    private String photoUid;
    
    @Column(name = "photo_path", nullable = false, length = 500)
    private String photoPath;
    
    @Column(name = "photo_name", nullable = false)
    private String photoName;
    
    @Column(name = "photo_title")
    private String photoTitle;
    
    @Column(name = "photo_private", nullable = false)
    private boolean photoPrivate;
    
    @Column(name = "photo_quality", nullable = false)
    private int photoQuality;
    
    @Column(name = "file_count", nullable = false)
    private int fileCount;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @Column(name = "edited_at")
    private Instant editedAt;
    
    @Column(name = "deleted_at")
    private Instant deletedAt;
    
    protected Photo() {
        // JPA constructor
    }
    
    /**
     * @param photoUid an existing UID to keep, or null to generate one at first save
     */
    public Photo(String photoUid, String photoPath, String photoName) {
        if (photoPath == null) {
            throw new IllegalArgumentException("Photo path cannot be null");
        }
        if (photoName == null || photoName.isBlank()) {
            throw new IllegalArgumentException("Photo name cannot be blank");
        }
        
        this.photoUid = photoUid;
        this.photoPath = photoPath;
        this.photoName = photoName;
        this.photoTitle = photoName;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }
    
    @PrePersist
    protected void onCreate() {
        this.photoUid = Uid.ensure(photoUid, Uid.PHOTO);
        if (createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = Instant.now();
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
    
    @Override
    public String getId() {
        return photoUid;
    }
    
    // Getters
    public Long getRowId() { return rowId; }
    public String getPhotoUid() { return photoUid; }
    public String getPhotoPath() { return photoPath; }
    public String getPhotoName() { return photoName; }
    public String getPhotoTitle() { return photoTitle; }
    public boolean isPhotoPrivate() { return photoPrivate; }
    public int getPhotoQuality() { return photoQuality; }
    public int getFileCount() { return fileCount; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getEditedAt() { return editedAt; }
    public Instant getDeletedAt() { return deletedAt; }
    
    public ArchiveState getArchiveState() {
        return ArchiveState.of(deletedAt);
    }
    
    public boolean isArchived() {
        return deletedAt != null;
    }
    
    public boolean isInReview() {
        return photoQuality < APPROVED_QUALITY;
    }
    
    public void setPhotoTitle(String photoTitle) {
        this.photoTitle = photoTitle;
    }
    
    public void setPhotoQuality(int photoQuality) {
        this.photoQuality = photoQuality;
    }
    
    public void setPhotoPrivate(boolean photoPrivate) {
        this.photoPrivate = photoPrivate;
    }
    
    public void togglePrivate() {
        this.photoPrivate = !photoPrivate;
    }
    
    /**
     * Soft-delete the photo. Archiving an archived photo keeps the original time.
     */
    public void archive(Instant at) {
        if (this.deletedAt == null) {
            this.deletedAt = at;
            this.updatedAt = Instant.now();
        }
    }
    
    public void restore() {
        if (this.deletedAt != null) {
            this.deletedAt = null;
            this.updatedAt = Instant.now();
        }
    }
    
    /**
     * Clear the pending review state.
     *
     * @return true if the photo changed, false if it was already approved
     * @throws IllegalStateException if the photo is archived
     */
    public boolean approve() {
        if (isArchived()) {
            throw new IllegalStateException("Archived photo " + photoUid + " cannot be approved");
        }
        if (!isInReview()) {
            return false;
        }
        
        this.photoQuality = APPROVED_QUALITY;
        this.editedAt = Instant.now();
        this.updatedAt = editedAt;
        return true;
    }
    
    @Override
    public String toString() {
        return photoUid != null ? photoUid : photoPath + "/" + photoName;
    }
}
