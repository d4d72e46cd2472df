package com.starscape.mediaindex.features.batch.domain;

import com.starscape.mediaindex.features.library.domain.Photo;

/**
 * Removes a photo together with its files on disk.
 */
public interface PhotoRemover {
    
    /**
     * @return true if the photo and its rows are gone, false if it was kept
     */
    boolean remove(Photo photo);
}
