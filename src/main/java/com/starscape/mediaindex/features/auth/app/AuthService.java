package com.starscape.mediaindex.features.auth.app;

import com.starscape.mediaindex.common.exception.UnauthorizedException;
import com.starscape.mediaindex.common.security.JwtTokenProvider;
import com.starscape.mediaindex.common.security.Role;
import com.starscape.mediaindex.common.security.UserPrincipal;
import com.starscape.mediaindex.features.auth.api.dto.LoginRequest;
import com.starscape.mediaindex.features.auth.api.dto.LoginResponse;
import com.starscape.mediaindex.features.auth.api.dto.RegisterRequest;
import com.starscape.mediaindex.features.auth.domain.User;
import com.starscape.mediaindex.features.auth.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

@Service
public class AuthService {
    
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final String INVALID_CREDENTIALS = "Invalid credentials";
    
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider tokenProvider;
    private final LoginDelayStrategy delayStrategy;
    private final Sleeper sleeper;
    private final long tokenExpirationMs;
    
    public AuthService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenProvider tokenProvider,
            LoginDelayStrategy delayStrategy,
            Sleeper sleeper,
            @Value("${app.security.jwt.expiration-ms}") long tokenExpirationMs) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenProvider = tokenProvider;
        this.delayStrategy = delayStrategy;
        this.sleeper = sleeper;
        this.tokenExpirationMs = tokenExpirationMs;
    }
    
    @Transactional
    public LoginResponse register(RegisterRequest request) {
        String userName = normalize(request.userName());
        if (userName == null) {
            throw new IllegalArgumentException("User name is required");
        }
        if (request.password() == null || request.password().length() < User.PASSWORD_MIN_LENGTH) {
            throw new IllegalArgumentException(
                "Password must have at least " + User.PASSWORD_MIN_LENGTH + " characters");
        }
        if (userRepository.existsByUserName(userName)) {
            throw new IllegalArgumentException("User name already taken");
        }
        
        User user = new User(null, userName, request.fullName(), Role.USER);
        user.setEmail(request.email());
        user.changePassword(passwordEncoder.encode(request.password()));
        User saved = userRepository.save(user);
        
        log.info("Registered user {} ({})", saved.getUserName(), saved.getUserUid());
        return issueToken(saved);
    }
    
    /**
     * Checks credentials after a delay that grows with earlier failures. The
     * attempt counter is written outside any surrounding transaction so a
     * failed login is always counted.
     */
    public LoginResponse login(LoginRequest request) {
        String userName = normalize(request.userName());
        User user = (userName == null ? null : userRepository.findByUserName(userName).orElse(null));
        
        if (user == null || !user.canSignIn()) {
            log.warn("Login rejected for unknown or disabled user {}", request.userName());
            throw new UnauthorizedException(INVALID_CREDENTIALS);
        }
        
        throttle(user);
        
        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            try {
                userRepository.incrementLoginAttempts(user.getUserUid());
            } catch (DataAccessException e) {
                log.error("Failed to count login attempt of {}: {}", user, e.getMessage());
            }
            log.warn("Invalid password for user {} ({} earlier failures)", user, user.getLoginAttempts());
            throw new UnauthorizedException(INVALID_CREDENTIALS);
        }
        
        try {
            userRepository.resetLoginAttempts(user.getUserUid(), Instant.now());
        } catch (DataAccessException e) {
            log.error("Failed to reset login attempts of {}: {}", user, e.getMessage());
        }
        
        log.info("User {} signed in", user);
        return issueToken(user);
    }
    
    /**
     * Loads the signed-in account. Tokens of deleted or disabled users are refused.
     */
    @Transactional(readOnly = true)
    public User currentUser(UserPrincipal principal) {
        if (principal == null || principal.getUserUid() == null) {
            throw new UnauthorizedException("Not signed in");
        }
        return userRepository.findByUserUid(principal.getUserUid())
            .filter(user -> !user.isDisabled())
            .orElseThrow(() -> new UnauthorizedException("Account is not available"));
    }
    
    private void throttle(User user) {
        Duration delay = delayStrategy.delayFor(user.getLoginAttempts());
        if (delay.isZero()) {
            return;
        }
        
        log.debug("Delaying login of {} by {} ms", user, delay.toMillis());
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnauthorizedException("Login interrupted");
        }
    }
    
    private LoginResponse issueToken(User user) {
        String token = tokenProvider.generateToken(user.getUserUid(), user.getUserName(), user.getRole());
        return LoginResponse.of(user.getUserUid(), user.getUserName(), user.getRole().name(), token, tokenExpirationMs);
    }
    
    private static String normalize(String userName) {
        if (userName == null || userName.isBlank()) {
            return null;
        }
        return userName.trim().toLowerCase();
    }
}
