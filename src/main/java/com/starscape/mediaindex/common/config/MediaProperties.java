package com.starscape.mediaindex.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the media library.
 * Binds to app.media.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.media")
public class MediaProperties {
    
    /** Directory that file roots named {@code originals} resolve against. */
    private String originalsPath = "storage/originals";
    
    /** Directory that file roots named {@code sidecar} resolve against. */
    private String sidecarPath = "storage/sidecar";
    
    private boolean readOnly;
    
    private Features features = new Features();
    
    public String getOriginalsPath() {
        return originalsPath;
    }
    
    public void setOriginalsPath(String originalsPath) {
        this.originalsPath = originalsPath;
    }
    
    public String getSidecarPath() {
        return sidecarPath;
    }
    
    public void setSidecarPath(String sidecarPath) {
        this.sidecarPath = sidecarPath;
    }
    
    public boolean isReadOnly() {
        return readOnly;
    }
    
    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }
    
    public Features getFeatures() {
        return features;
    }
    
    public void setFeatures(Features features) {
        this.features = features;
    }
    
    public static class Features {
        
        private boolean delete = true;
        
        public boolean isDelete() {
            return delete;
        }
        
        public void setDelete(boolean delete) {
            this.delete = delete;
        }
    }
}
