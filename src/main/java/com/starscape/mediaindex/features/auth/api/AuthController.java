package com.starscape.mediaindex.features.auth.api;

import com.starscape.mediaindex.common.security.UserPrincipal;
import com.starscape.mediaindex.features.auth.api.dto.LoginRequest;
import com.starscape.mediaindex.features.auth.api.dto.LoginResponse;
import com.starscape.mediaindex.features.auth.api.dto.RegisterRequest;
import com.starscape.mediaindex.features.auth.api.dto.SessionResponse;
import com.starscape.mediaindex.features.auth.app.AuthService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Accounts and sessions. Login is throttled per user name; see {@link AuthService#login}.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {
    
    private final AuthService authService;
    
    public AuthController(AuthService authService) {
        this.authService = authService;
    }
    
    /**
     * POST /api/auth/register
     * New accounts always get the USER role.
     */
    @PostMapping("/register")
    public ResponseEntity<LoginResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }
    
    /**
     * POST /api/auth/login
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }
    
    /**
     * GET /api/auth/session
     * The account behind the bearer token, re-read so a disabled user loses access.
     */
    @GetMapping("/session")
    public ResponseEntity<SessionResponse> session(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(SessionResponse.from(authService.currentUser(principal)));
    }
}
