package com.starscape.mediaindex.features.library.domain;

import com.starscape.mediaindex.common.domain.Uid;
import jakarta.persistence.*;
import java.time.Instant;

/**
 * One physical representation of a photo on disk. The owning photo is referenced
 * by UID only and never loaded implicitly.
 */
@Entity
@Table(name = "files", indexes = {
    @Index(name = "idx_files_photo_uid", columnList = "photo_uid"),
    @Index(name = "idx_files_hash", columnList = "file_hash"),
    @Index(name = "idx_files_root_name", columnList = "file_root, file_name")
})
public class PhotoFile extends com.starscape.mediaindex.common.domain.Entity<String> {
    
    public static final String TYPE_JPEG = "jpg";
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long rowId;
    
    @Column(name = "file_uid", nullable = false, unique = true, updatable = false, length = 42)
    private String fileUid;
    
    @Column(name = "photo_id")
    private Long photoId;
    
    @Column(name = "photo_uid", nullable = false, length = 42)
    private String photoUid;
    
    @Column(name = "file_root", nullable = false, length = 16)
    private String fileRoot;
    
    @Column(name = "file_name", nullable = false, length = 755)
    private String fileName;
    
    @Column(name = "file_hash", length = 128)
    private String fileHash;
    
    @Column(name = "file_size", nullable = false)
    private long fileSize;
    
    @Column(name = "file_type", length = 16)
    private String fileType;
    
    @Column(name = "file_width", nullable = false)
    private int fileWidth;
    
    @Column(name = "file_height", nullable = false)
    private int fileHeight;
    
    @Column(name = "file_video", nullable = false)
    private boolean fileVideo;
    
    @Column(name = "file_missing", nullable = false)
    private boolean fileMissing;
    
    @Column(name = "file_primary", nullable = false)
    private boolean filePrimary;
    
    @Column(name = "file_error", length = 512)
    private String fileError;
    
    /** Last known modification time on disk, unix seconds. */
    @Column(name = "mod_time", nullable = false)
    private long modTime;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @Column(name = "deleted_at")
    private Instant deletedAt;
    
    protected PhotoFile() {
        // JPA constructor
    }
    
    public PhotoFile(String fileUid, Photo photo, String fileRoot, String fileName,
                     String fileHash, String fileType, int fileWidth, long modTime) {
        if (photo == null || photo.getPhotoUid() == null) {
            throw new IllegalArgumentException("File must belong to a saved photo");
        }
        if (fileRoot == null || fileRoot.isBlank()) {
            throw new IllegalArgumentException("File root cannot be blank");
        }
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("File name cannot be blank");
        }
        if (fileWidth < 0) {
            throw new IllegalArgumentException("File width cannot be negative");
        }
        
        this.fileUid = fileUid;
        this.photoId = photo.getRowId();
        this.photoUid = photo.getPhotoUid();
        this.fileRoot = fileRoot;
        this.fileName = fileName;
        this.fileHash = fileHash;
        this.fileType = fileType != null ? fileType.toLowerCase() : null;
        this.fileWidth = fileWidth;
        this.modTime = modTime;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }
    
    @PrePersist
    protected void onCreate() {
        this.fileUid = Uid.ensure(fileUid, Uid.FILE);
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
        return fileUid;
    }
    
    // Getters
    public Long getRowId() { return rowId; }
    public String getFileUid() { return fileUid; }
    public Long getPhotoId() { return photoId; }
    public String getPhotoUid() { return photoUid; }
    public String getFileRoot() { return fileRoot; }
    public String getFileName() { return fileName; }
    public String getFileHash() { return fileHash; }
    public long getFileSize() { return fileSize; }
    public String getFileType() { return fileType; }
    public int getFileWidth() { return fileWidth; }
    public int getFileHeight() { return fileHeight; }
    public boolean isFileVideo() { return fileVideo; }
    public boolean isFileMissing() { return fileMissing; }
    public boolean isFilePrimary() { return filePrimary; }
    public String getFileError() { return fileError; }
    public long getModTime() { return modTime; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getDeletedAt() { return deletedAt; }
    
    public boolean isJpeg() {
        return TYPE_JPEG.equals(fileType);
    }
    
    public void setFileSize(long fileSize) {
        this.fileSize = fileSize;
    }
    
    public void setFileHeight(int fileHeight) {
        this.fileHeight = fileHeight;
    }
    
    public void setFileVideo(boolean fileVideo) {
        this.fileVideo = fileVideo;
    }
    
    public void setFilePrimary(boolean filePrimary) {
        this.filePrimary = filePrimary;
    }
    
    public void setFileError(String fileError) {
        this.fileError = fileError;
    }
    
    public void setModTime(long modTime) {
        this.modTime = modTime;
    }
    
    /**
     * The file vanished from disk. The row is kept so the photo keeps its history.
     */
    public void markMissing() {
        this.fileMissing = true;
        this.filePrimary = false;
    }
    
    public void markFound() {
        this.fileMissing = false;
        this.deletedAt = null;
    }
    
    public String getRelativePath() {
        return fileRoot + "/" + fileName;
    }
    
    @Override
    public String toString() {
        return fileUid != null ? fileUid : getRelativePath();
    }
}
