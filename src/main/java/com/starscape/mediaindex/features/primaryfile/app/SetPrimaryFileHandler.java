package com.starscape.mediaindex.features.primaryfile.app;

import com.starscape.mediaindex.common.events.ChangeNotifier;
import com.starscape.mediaindex.common.events.EntityKind;
import com.starscape.mediaindex.common.security.AccessControl;
import com.starscape.mediaindex.common.security.Action;
import com.starscape.mediaindex.common.security.Resource;
import com.starscape.mediaindex.common.security.UserPrincipal;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Handler for choosing the primary file of a photo on user request.
 */
@Service
public class SetPrimaryFileHandler {
    
    private final AccessControl accessControl;
    private final PrimaryFileResolver resolver;
    private final ChangeNotifier notifier;
    
    public SetPrimaryFileHandler(AccessControl accessControl, PrimaryFileResolver resolver, ChangeNotifier notifier) {
        this.accessControl = accessControl;
        this.resolver = resolver;
        this.notifier = notifier;
    }
    
    public String handle(UserPrincipal caller, String photoUid, String fileUid) {
        accessControl.check(caller, Resource.PHOTOS, Action.UPDATE);
        
        String primary = resolver.resolve(photoUid, fileUid);
        notifier.entitiesUpdated(EntityKind.PHOTOS, List.of(photoUid));
        return primary;
    }
}
