package com.starscape.mediaindex.features.indexing.domain;

import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Point-in-time view of the index. It may be stale as soon as another writer
 * commits, so answers are hints and never proof of absence.
 */
public final class IndexSnapshot {
    
    private final Map<String, Long> modTimes;
    private final Set<String> hashes;
    
    public IndexSnapshot(Map<String, Long> modTimes, Set<String> hashes) {
        this.modTimes = Map.copyOf(modTimes);
        this.hashes = Set.copyOf(hashes);
    }
    
    public static IndexSnapshot empty() {
        return new IndexSnapshot(Map.of(), Set.of());
    }
    
    /**
     * Last seen modification time, keyed by {@link IndexPaths#join(String, String)}.
     */
    public OptionalLong modTime(String root, String name) {
        Long value = modTimes.get(IndexPaths.join(root, name));
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }
    
    public boolean isIndexed(String root, String name) {
        return modTimes.containsKey(IndexPaths.join(root, name));
    }
    
    public boolean isKnownHash(String hash) {
        return hash != null && hashes.contains(hash);
    }
    
    public FileClassification classify(String root, String name, long modTime, String hash) {
        OptionalLong known = modTime(root, name);
        if (known.isPresent()) {
            return known.getAsLong() == modTime ? FileClassification.UNCHANGED : FileClassification.MODIFIED;
        }
        return isKnownHash(hash) ? FileClassification.DUPLICATE : FileClassification.NEW;
    }
    
    public Map<String, Long> modTimes() {
        return modTimes;
    }
    
    public Set<String> hashes() {
        return hashes;
    }
    
    public int pathCount() {
        return modTimes.size();
    }
    
    public int hashCount() {
        return hashes.size();
    }
}
