package com.starscape.mediaindex.features.library.domain;

import java.util.Collection;
import java.util.List;

public interface LabelRepository {
    Label save(Label label);
    List<Label> findActiveByUids(Collection<String> labelUids);
    int updatePhotoCounts();
    long countActive();
}
