package com.starscape.mediaindex.features.library.infra;

import com.starscape.mediaindex.features.library.domain.Duplicate;
import com.starscape.mediaindex.features.library.domain.DuplicateId;
import com.starscape.mediaindex.features.library.domain.DuplicateRepository;
import com.starscape.mediaindex.features.library.domain.IndexedPath;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaDuplicateRepository extends JpaRepository<Duplicate, DuplicateId>, DuplicateRepository {
    
    @Override
    Optional<Duplicate> findByFileRootAndFileName(String fileRoot, String fileName);
    
    @Override
    List<Duplicate> findByFileHash(String fileHash);
    
    @Override
    @Query("SELECT new com.starscape.mediaindex.features.library.domain.IndexedPath(d.fileRoot, d.fileName, d.modTime) " +
           "FROM Duplicate d")
    List<IndexedPath> findLedgerPaths();
}
