package com.starscape.mediaindex.features.batch.infra;

import com.starscape.mediaindex.common.config.MediaProperties;
import com.starscape.mediaindex.features.batch.domain.FeatureGate;
import org.springframework.stereotype.Component;

/**
 * Reads the delete feature flag and read-only mode from app.media.* on every call.
 */
@Component
public class ConfigFeatureGate implements FeatureGate {
    
    private final MediaProperties mediaProperties;
    
    public ConfigFeatureGate(MediaProperties mediaProperties) {
        this.mediaProperties = mediaProperties;
    }
    
    @Override
    public boolean isDeleteAllowed() {
        return !mediaProperties.isReadOnly() && mediaProperties.getFeatures().isDelete();
    }
}
