package com.starscape.mediaindex.features.auth.app;

import com.starscape.mediaindex.features.auth.domain.DefaultUsers;
import com.starscape.mediaindex.features.auth.domain.User;
import com.starscape.mediaindex.features.auth.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Seeds the admin, anonymous and guest accounts under their fixed UIDs.
 * Existing rows are left alone, except that an admin without a password
 * receives the configured one.
 */
@Component
public class DefaultUsersBootstrap implements ApplicationRunner {
    
    private static final Logger log = LoggerFactory.getLogger(DefaultUsersBootstrap.class);
    
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final String adminPassword;
    
    public DefaultUsersBootstrap(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            @Value("${app.security.admin-password:}") String adminPassword) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.adminPassword = adminPassword;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        User admin = firstOrCreate(DefaultUsers.ADMIN_UID, DefaultUsers::admin);
        firstOrCreate(DefaultUsers.ANONYMOUS_UID, DefaultUsers::anonymous);
        firstOrCreate(DefaultUsers.GUEST_UID, DefaultUsers::guest);
        
        initAdminPassword(admin);
    }
    
    User firstOrCreate(String userUid, Supplier<User> factory) {
        return userRepository.findByUserUid(userUid).orElseGet(() -> {
            try {
                User created = userRepository.save(factory.get());
                log.info("Created default user {} ({})", created, userUid);
                return created;
            } catch (DataIntegrityViolationException e) {
                // Another instance created it first
                log.debug("Default user {} already exists: {}", userUid, e.getMessage());
                return userRepository.findByUserUid(userUid).orElseThrow(() -> e);
            }
        });
    }
    
    private void initAdminPassword(User admin) {
        if (admin.hasPassword()) {
            return;
        }
        if (adminPassword == null || adminPassword.length() < User.PASSWORD_MIN_LENGTH) {
            log.warn("Admin has no password; set app.security.admin-password to enable sign in");
            return;
        }
        
        admin.changePassword(passwordEncoder.encode(adminPassword));
        userRepository.save(admin);
        log.info("Initialized admin password");
    }
}
