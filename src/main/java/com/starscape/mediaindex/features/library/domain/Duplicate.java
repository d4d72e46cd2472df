package com.starscape.mediaindex.features.library.domain;

import jakarta.persistence.*;

/**
 * A file seen on disk whose content hash already belongs to an indexed file.
 * Ledger rows are never removed automatically.
 */
@Entity
@Table(name = "duplicates", indexes = @Index(name = "idx_duplicates_hash", columnList = "file_hash"))
@IdClass(DuplicateId.class)
public class Duplicate {
    
    @Id
    @Column(name = "file_root", nullable = false, length = 16)
    private String fileRoot;
    
    @Id
    @Column(name = "file_name", nullable = false, length = 755)
    private String fileName;
    
    @Column(name = "file_hash", nullable = false, length = 128)
    private String fileHash;
    
    @Column(name = "file_size", nullable = false)
    private long fileSize;
    
    @Column(name = "mod_time", nullable = false)
    private long modTime;
    
    protected Duplicate() {
        // JPA constructor
    }
    
    public Duplicate(String fileRoot, String fileName, String fileHash, long fileSize, long modTime) {
        if (fileRoot == null || fileRoot.isBlank()) {
            throw new IllegalArgumentException("File root cannot be blank");
        }
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("File name cannot be blank");
        }
        if (fileHash == null || fileHash.isBlank()) {
            throw new IllegalArgumentException("File hash cannot be blank");
        }
        
        this.fileRoot = fileRoot;
        this.fileName = fileName;
        this.fileHash = fileHash;
        this.fileSize = fileSize;
        this.modTime = modTime;
    }
    
    public void update(String fileHash, long fileSize, long modTime) {
        if (fileHash == null || fileHash.isBlank()) {
            throw new IllegalArgumentException("File hash cannot be blank");
        }
        this.fileHash = fileHash;
        this.fileSize = fileSize;
        this.modTime = modTime;
    }
    
    // Getters
    public String getFileRoot() { return fileRoot; }
    public String getFileName() { return fileName; }
    public String getFileHash() { return fileHash; }
    public long getFileSize() { return fileSize; }
    public long getModTime() { return modTime; }
}
