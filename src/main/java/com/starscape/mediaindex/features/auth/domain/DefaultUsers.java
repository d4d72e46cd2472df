package com.starscape.mediaindex.features.auth.domain;

import com.starscape.mediaindex.common.security.Role;

/**
 * Well-known accounts seeded at startup. They are looked up by UID, never cached.
 */
public final class DefaultUsers {
    
    public static final String ADMIN_UID = "u000000000000001";
    public static final String ANONYMOUS_UID = "u000000000000002";
    public static final String GUEST_UID = "u000000000000003";
    
    public static final String ADMIN_NAME = "admin";
    
    private DefaultUsers() {
    }
    
    public static User admin() {
        return new User(ADMIN_UID, ADMIN_NAME, "Admin", Role.ADMIN);
    }
    
    public static User anonymous() {
        User user = new User(ANONYMOUS_UID, null, "Anonymous", Role.ANONYMOUS);
        user.setDisabled(true);
        return user;
    }
    
    public static User guest() {
        User user = new User(GUEST_UID, null, "Guest", Role.GUEST);
        user.setDisabled(true);
        return user;
    }
}
