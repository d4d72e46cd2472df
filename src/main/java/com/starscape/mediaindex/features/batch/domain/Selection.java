package com.starscape.mediaindex.features.batch.domain;

import com.starscape.mediaindex.common.domain.ValueObject;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * UIDs named by one batch request, grouped by entity kind. Blank and repeated
 * entries are dropped; the first occurrence keeps its position.
 */
public record Selection(List<String> photos, List<String> albums, List<String> labels) implements ValueObject {
    
    public Selection {
        photos = clean(photos);
        albums = clean(albums);
        labels = clean(labels);
    }
    
    public static Selection ofPhotos(List<String> photos) {
        return new Selection(photos, List.of(), List.of());
    }
    
    public static Selection ofAlbums(List<String> albums) {
        return new Selection(List.of(), albums, List.of());
    }
    
    public static Selection ofLabels(List<String> labels) {
        return new Selection(List.of(), List.of(), labels);
    }
    
    public boolean isEmpty() {
        return photos.isEmpty() && albums.isEmpty() && labels.isEmpty();
    }
    
    public List<String> requirePhotos() {
        if (photos.isEmpty()) {
            throw new EmptySelectionException("No photos selected");
        }
        return photos;
    }
    
    public List<String> requireAlbums() {
        if (albums.isEmpty()) {
            throw new EmptySelectionException("No albums selected");
        }
        return albums;
    }
    
    public List<String> requireLabels() {
        if (labels.isEmpty()) {
            throw new EmptySelectionException("No labels selected");
        }
        return labels;
    }
    
    private static List<String> clean(List<String> uids) {
        if (uids == null || uids.isEmpty()) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String uid : uids) {
            if (uid != null && !uid.isBlank()) {
                unique.add(uid.trim());
            }
        }
        return List.copyOf(unique);
    }
    
    @Override
    public String toString() {
        return "photos=" + photos.size() + ", albums=" + albums.size() + ", labels=" + labels.size();
    }
}
