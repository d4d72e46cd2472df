package com.starscape.mediaindex.features.indexing.domain;

import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoFile;

import java.util.Optional;

/**
 * A file plus its owning photo when requested with {@link Hydrate#PHOTO}.
 */
public record FileView(PhotoFile file, Photo photo) {
    
    public FileView {
        if (file == null) {
            throw new IllegalArgumentException("File cannot be null");
        }
    }
    
    public Optional<Photo> optionalPhoto() {
        return Optional.ofNullable(photo);
    }
}
