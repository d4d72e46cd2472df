package com.starscape.mediaindex.features.indexing.app;

import com.starscape.mediaindex.features.indexing.domain.IndexPaths;
import com.starscape.mediaindex.features.indexing.domain.IndexSnapshot;
import com.starscape.mediaindex.features.library.domain.DuplicateRepository;
import com.starscape.mediaindex.features.library.domain.IndexedPath;
import com.starscape.mediaindex.features.library.domain.PhotoFileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the path and hash snapshots consulted by the ingestion pipeline.
 * Indexed files supersede duplicate ledger rows for the same path.
 */
@Service
public class IndexSnapshotBuilder {
    
    private static final Logger log = LoggerFactory.getLogger(IndexSnapshotBuilder.class);
    
    private final PhotoFileRepository photoFileRepository;
    private final DuplicateRepository duplicateRepository;
    
    public IndexSnapshotBuilder(PhotoFileRepository photoFileRepository, DuplicateRepository duplicateRepository) {
        this.photoFileRepository = photoFileRepository;
        this.duplicateRepository = duplicateRepository;
    }
    
    @Transactional(readOnly = true)
    public IndexSnapshot build() {
        IndexSnapshot snapshot = new IndexSnapshot(indexedFiles(), fileHashes());
        log.info("Built index snapshot: {} paths, {} hashes", snapshot.pathCount(), snapshot.hashCount());
        return snapshot;
    }
    
    /**
     * Path to last seen modification time for ledger rows and present files.
     */
    @Transactional(readOnly = true)
    public Map<String, Long> indexedFiles() {
        Map<String, Long> result = new HashMap<>();
        
        List<IndexedPath> ledger = duplicateRepository.findLedgerPaths();
        for (IndexedPath entry : ledger) {
            result.put(IndexPaths.join(entry.fileRoot(), entry.fileName()), entry.modTime());
        }
        
        // Loaded second so a live file overwrites a stale ledger entry
        List<IndexedPath> files = photoFileRepository.findIndexedPaths();
        for (IndexedPath entry : files) {
            result.put(IndexPaths.join(entry.fileRoot(), entry.fileName()), entry.modTime());
        }
        
        log.debug("Loaded {} ledger rows and {} indexed files", ledger.size(), files.size());
        return result;
    }
    
    @Transactional(readOnly = true)
    public Set<String> fileHashes() {
        return new HashSet<>(photoFileRepository.findIndexedHashes());
    }
}
