package com.starscape.mediaindex.features.auth.domain;

import com.starscape.mediaindex.common.domain.Uid;
import com.starscape.mediaindex.common.security.Role;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "users")
public class User extends com.starscape.mediaindex.common.domain.Entity<String> {
    
    public static final int PASSWORD_MIN_LENGTH = 4;
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long rowId;
    
    @Column(name = "user_uid", nullable = false, unique = true, updatable = false, length = 42)
    private String userUid;
    
    /** Null for placeholder accounts that cannot sign in. */
    @Column(name = "user_name", unique = true)
    private String userName;
    
    @Column(name = "full_name")
    private String fullName;
    
    @Column(name = "email")
    private String email;
    
    @Column(name = "password_hash")
    private String passwordHash;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private Role role;
    
    @Column(name = "disabled", nullable = false)
    private boolean disabled;
    
    @Column(name = "login_attempts", nullable = false)
    private int loginAttempts;
    
    @Column(name = "login_at")
    private Instant loginAt;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected User() {
        // JPA constructor
    }
    
    public User(String userUid, String userName, String fullName, Role role) {
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        
        this.userUid = userUid;
        this.userName = userName != null && !userName.isBlank() ? userName.trim().toLowerCase() : null;
        this.fullName = fullName;
        this.role = role;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }
    
    @PrePersist
    protected void onCreate() {
        this.userUid = Uid.ensure(userUid, Uid.USER);
        this.updatedAt = Instant.now();
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
    
    @Override
    public String getId() {
        return userUid;
    }
    
    // Getters
    public Long getRowId() { return rowId; }
    public String getUserUid() { return userUid; }
    public String getUserName() { return userName; }
    public String getFullName() { return fullName; }
    public String getEmail() { return email; }
    public String getPasswordHash() { return passwordHash; }
    public Role getRole() { return role; }
    public boolean isDisabled() { return disabled; }
    public int getLoginAttempts() { return loginAttempts; }
    public Instant getLoginAt() { return loginAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    
    /**
     * A registered user has a valid UID and a user name.
     */
    public boolean isRegistered() {
        return userName != null && Uid.isValid(userUid, Uid.USER) && !isAnonymous();
    }
    
    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
    
    public boolean isAnonymous() {
        return !Uid.isValid(userUid, Uid.USER) || DefaultUsers.ANONYMOUS_UID.equals(userUid);
    }
    
    public boolean isGuest() {
        return role == Role.GUEST;
    }
    
    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isBlank();
    }
    
    public boolean canSignIn() {
        return isRegistered() && !disabled && hasPassword();
    }
    
    public void setEmail(String email) {
        this.email = email;
    }
    
    public void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }
    
    /**
     * @param passwordHash already encoded password
     */
    public void changePassword(String passwordHash) {
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("Password hash cannot be blank");
        }
        this.passwordHash = passwordHash;
    }
    
    @Override
    public String toString() {
        return userName != null ? userName : String.valueOf(userUid);
    }
}
