package com.starscape.mediaindex.common.events;

import java.util.List;

/**
 * Receives change events after successful batch operations.
 * Fire-and-forget: implementations must not throw back into the caller.
 */
public interface ChangeNotifier {
    
    void entitiesArchived(EntityKind kind, List<String> uids);
    
    void entitiesRestored(EntityKind kind, List<String> uids);
    
    void entitiesUpdated(EntityKind kind, List<String> uids);
    
    void entitiesDeleted(EntityKind kind, List<String> uids);
    
    void countsChanged(LibraryCounts counts);
}
