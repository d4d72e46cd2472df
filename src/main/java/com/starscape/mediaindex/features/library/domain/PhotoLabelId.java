package com.starscape.mediaindex.features.library.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite key for PhotoLabel entity.
 */
public class PhotoLabelId implements Serializable {
    
    private String photoUid;
    private String labelUid;
    
    public PhotoLabelId() {
        // JPA constructor
    }
    
    public PhotoLabelId(String photoUid, String labelUid) {
        this.photoUid = photoUid;
        this.labelUid = labelUid;
    }
    
    public String getPhotoUid() { return photoUid; }
    public void setPhotoUid(String photoUid) { this.photoUid = photoUid; }
    
    public String getLabelUid() { return labelUid; }
    public void setLabelUid(String labelUid) { this.labelUid = labelUid; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PhotoLabelId that = (PhotoLabelId) o;
        return Objects.equals(photoUid, that.photoUid) && Objects.equals(labelUid, that.labelUid);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(photoUid, labelUid);
    }
}
