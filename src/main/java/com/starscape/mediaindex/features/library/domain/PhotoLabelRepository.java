package com.starscape.mediaindex.features.library.domain;

import java.util.List;

public interface PhotoLabelRepository {
    PhotoLabel save(PhotoLabel photoLabel);
    List<PhotoLabel> findByLabelUid(String labelUid);
    int deleteByLabelUid(String labelUid);
    int deleteByPhotoUid(String photoUid);
}
