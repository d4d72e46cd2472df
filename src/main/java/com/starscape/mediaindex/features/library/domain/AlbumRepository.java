package com.starscape.mediaindex.features.library.domain;

import java.util.Collection;
import java.util.List;

public interface AlbumRepository {
    Album save(Album album);
    List<Album> findByAlbumUidIn(Collection<String> albumUids);
    int deleteByAlbumUids(Collection<String> albumUids);
    int updatePhotoCounts();
    long count();
}
