package com.starscape.mediaindex.features.batch.app;

import com.starscape.mediaindex.features.library.domain.Album;
import com.starscape.mediaindex.features.library.domain.AlbumRepository;
import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoAlbum;
import com.starscape.mediaindex.features.library.domain.PhotoAlbumRepository;
import com.starscape.mediaindex.features.library.domain.PhotoRepository;
import com.starscape.mediaindex.features.library.domain.Scope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Map-backed stand-ins for the library repositories, for handler tests that
 * check state after several operations.
 */
class InMemoryLibrary {
    
    final Photos photos = new Photos();
    final Albums albums = new Albums();
    final Memberships memberships = new Memberships();
    
    static class Photos implements PhotoRepository {
        
        final List<Photo> rows = new ArrayList<>();
        
        private List<Photo> matching(Collection<String> uids, Scope scope) {
            return rows.stream()
                .filter(p -> uids.contains(p.getPhotoUid()))
                .filter(p -> scope == Scope.INCLUDE_ARCHIVED || !p.isArchived())
                .toList();
        }
        
        @Override
        public Photo save(Photo photo) {
            if (!rows.contains(photo)) {
                rows.add(photo);
            }
            return photo;
        }
        
        @Override
        public Optional<Photo> findByUid(String photoUid, Scope scope) {
            return matching(List.of(photoUid), scope).stream().findFirst();
        }
        
        @Override
        public List<Photo> findByUids(Collection<String> photoUids, Scope scope) {
            return matching(photoUids, scope);
        }
        
        @Override
        public long countByUids(Collection<String> photoUids, Scope scope) {
            return matching(photoUids, scope).size();
        }
        
        @Override
        public int archiveByUids(Collection<String> photoUids, Instant at) {
            List<Photo> active = matching(photoUids, Scope.ACTIVE);
            active.forEach(p -> p.archive(at));
            return active.size();
        }
        
        @Override
        public int restoreByUids(Collection<String> photoUids, Instant at) {
            List<Photo> archived = matching(photoUids, Scope.INCLUDE_ARCHIVED).stream()
                .filter(Photo::isArchived)
                .toList();
            archived.forEach(Photo::restore);
            return archived.size();
        }
        
        @Override
        public int togglePrivateByUids(Collection<String> photoUids, Instant at) {
            List<Photo> active = matching(photoUids, Scope.ACTIVE);
            active.forEach(Photo::togglePrivate);
            return active.size();
        }
        
        @Override
        public int deleteByPhotoUid(String photoUid) {
            int before = rows.size();
            rows.removeIf(p -> p.getPhotoUid().equals(photoUid));
            return before - rows.size();
        }
        
        @Override
        public int updateFileCounts() {
            return rows.size();
        }
        
        @Override
        public long countActive() {
            return rows.stream().filter(p -> !p.isArchived()).count();
        }
        
        @Override
        public long countArchived() {
            return rows.stream().filter(Photo::isArchived).count();
        }
        
        @Override
        public long countPrivate() {
            return rows.stream().filter(p -> !p.isArchived() && p.isPhotoPrivate()).count();
        }
        
        @Override
        public long countInReview() {
            return rows.stream().filter(p -> !p.isArchived() && p.isInReview()).count();
        }
    }
    
    static class Albums implements AlbumRepository {
        
        final List<Album> rows = new ArrayList<>();
        
        @Override
        public Album save(Album album) {
            rows.add(album);
            return album;
        }
        
        @Override
        public List<Album> findByAlbumUidIn(Collection<String> albumUids) {
            return rows.stream().filter(a -> albumUids.contains(a.getAlbumUid())).toList();
        }
        
        @Override
        public int deleteByAlbumUids(Collection<String> albumUids) {
            int before = rows.size();
            rows.removeIf(a -> albumUids.contains(a.getAlbumUid()));
            return before - rows.size();
        }
        
        @Override
        public int updatePhotoCounts() {
            return rows.size();
        }
        
        @Override
        public long count() {
            return rows.size();
        }
    }
    
    static class Memberships implements PhotoAlbumRepository {
        
        final List<PhotoAlbum> rows = new ArrayList<>();
        
        @Override
        public PhotoAlbum save(PhotoAlbum photoAlbum) {
            rows.add(photoAlbum);
            return photoAlbum;
        }
        
        @Override
        public List<PhotoAlbum> findByPhotoUid(String photoUid) {
            return rows.stream().filter(pa -> pa.getPhotoUid().equals(photoUid)).toList();
        }
        
        @Override
        public List<PhotoAlbum> findByAlbumUid(String albumUid) {
            return rows.stream().filter(pa -> pa.getAlbumUid().equals(albumUid)).toList();
        }
        
        @Override
        public int hideByPhotoUids(Collection<String> photoUids) {
            List<PhotoAlbum> matching = rows.stream().filter(pa -> photoUids.contains(pa.getPhotoUid())).toList();
            matching.forEach(PhotoAlbum::hide);
            return matching.size();
        }
        
        @Override
        public int deleteByAlbumUids(Collection<String> albumUids) {
            int before = rows.size();
            rows.removeIf(pa -> albumUids.contains(pa.getAlbumUid()));
            return before - rows.size();
        }
        
        @Override
        public int deleteByPhotoUid(String photoUid) {
            int before = rows.size();
            rows.removeIf(pa -> pa.getPhotoUid().equals(photoUid));
            return before - rows.size();
        }
    }
}
