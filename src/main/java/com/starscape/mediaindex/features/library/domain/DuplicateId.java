package com.starscape.mediaindex.features.library.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite key for Duplicate entity.
 */
public class DuplicateId implements Serializable {
    
    private String fileRoot;
    private String fileName;
    
    public DuplicateId() {
        // JPA constructor
    }
    
    public DuplicateId(String fileRoot, String fileName) {
        this.fileRoot = fileRoot;
        this.fileName = fileName;
    }
    
    public String getFileRoot() { return fileRoot; }
    public void setFileRoot(String fileRoot) { this.fileRoot = fileRoot; }
    
    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DuplicateId that = (DuplicateId) o;
        return Objects.equals(fileRoot, that.fileRoot) && Objects.equals(fileName, that.fileName);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(fileRoot, fileName);
    }
}
