package com.starscape.mediaindex.common.security;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Static role to action matrix. Resources are treated alike; what differs is
 * the set of actions a role may perform.
 */
@Component
public class RoleAccessControl implements AccessControl {
    
    private final Map<Role, Set<Action>> grants = new EnumMap<>(Role.class);
    
    public RoleAccessControl() {
        grants.put(Role.ADMIN, EnumSet.allOf(Action.class));
        grants.put(Role.USER, EnumSet.allOf(Action.class));
        grants.put(Role.FAMILY, EnumSet.of(Action.READ, Action.UPDATE));
        grants.put(Role.GUEST, EnumSet.of(Action.READ));
        grants.put(Role.ANONYMOUS, EnumSet.noneOf(Action.class));
    }
    
    @Override
    public boolean isAllowed(UserPrincipal caller, Resource resource, Action action) {
        if (caller == null || resource == null || action == null) {
            return false;
        }
        return grants.getOrDefault(caller.getRole(), Set.of()).contains(action);
    }
}
