package com.starscape.mediaindex.features.indexing.app;

import com.starscape.mediaindex.features.library.domain.Duplicate;
import com.starscape.mediaindex.features.library.domain.DuplicateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Remembers files that turned out to be content duplicates so later scans can skip them.
 */
@Service
public class DuplicateLedger {
    
    private static final Logger log = LoggerFactory.getLogger(DuplicateLedger.class);
    
    private final DuplicateRepository duplicateRepository;
    
    public DuplicateLedger(DuplicateRepository duplicateRepository) {
        this.duplicateRepository = duplicateRepository;
    }
    
    /**
     * Insert or update the ledger row for (root, name).
     */
    @Transactional
    public Duplicate record(String fileRoot, String fileName, String fileHash, long fileSize, long modTime) {
        Optional<Duplicate> existing = duplicateRepository.findByFileRootAndFileName(fileRoot, fileName);
        
        Duplicate duplicate;
        if (existing.isPresent()) {
            duplicate = existing.get();
            duplicate.update(fileHash, fileSize, modTime);
        } else {
            duplicate = new Duplicate(fileRoot, fileName, fileHash, fileSize, modTime);
        }
        
        Duplicate saved = duplicateRepository.save(duplicate);
        log.debug("Recorded duplicate {}/{} with hash {}", fileRoot, fileName, fileHash);
        return saved;
    }
    
    @Transactional(readOnly = true)
    public Optional<Duplicate> find(String fileRoot, String fileName) {
        return duplicateRepository.findByFileRootAndFileName(fileRoot, fileName);
    }
    
    @Transactional(readOnly = true)
    public List<Duplicate> findByHash(String fileHash) {
        if (fileHash == null || fileHash.isBlank()) {
            return List.of();
        }
        return duplicateRepository.findByFileHash(fileHash);
    }
}
