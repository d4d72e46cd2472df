package com.starscape.mediaindex.common.security;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.List;

public class UserPrincipal implements UserDetails {
    
    private final String userUid;
    private final String userName;
    private final Role role;
    
    public UserPrincipal(String userUid, String userName, Role role) {
        this.userUid = userUid;
        this.userName = userName;
        this.role = role != null ? role : Role.ANONYMOUS;
    }
    
    public String getUserUid() {
        return userUid;
    }
    
    public Role getRole() {
        return role;
    }
    
    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of(new SimpleGrantedAuthority("ROLE_" + role.name()));
    }
    
    @Override
    public String getPassword() {
        return null; // Not used with JWT
    }
    
    @Override
    public String getUsername() {
        return userName;
    }
    
    @Override
    public boolean isAccountNonExpired() {
        return true;
    }
    
    @Override
    public boolean isAccountNonLocked() {
        return true;
    }
    
    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }
    
    @Override
    public boolean isEnabled() {
        return true;
    }
    
    @Override
    public String toString() {
        return userName != null && !userName.isBlank() ? userName : userUid;
    }
}
