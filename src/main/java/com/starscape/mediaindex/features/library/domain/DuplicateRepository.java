package com.starscape.mediaindex.features.library.domain;

import java.util.List;
import java.util.Optional;

public interface DuplicateRepository {
    Duplicate save(Duplicate duplicate);
    Optional<Duplicate> findByFileRootAndFileName(String fileRoot, String fileName);
    List<Duplicate> findByFileHash(String fileHash);
    List<IndexedPath> findLedgerPaths();
}
