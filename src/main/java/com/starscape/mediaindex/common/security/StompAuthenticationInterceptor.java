package com.starscape.mediaindex.common.security;

import io.jsonwebtoken.Claims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Authenticates STOMP CONNECT frames so change notifications only reach logged-in clients.
 * The client sends {@code Authorization: Bearer <token>} as a native CONNECT header.
 */
@Component
public class StompAuthenticationInterceptor implements ChannelInterceptor {
    
    private static final Logger log = LoggerFactory.getLogger(StompAuthenticationInterceptor.class);
    
    private final JwtTokenProvider tokenProvider;
    
    public StompAuthenticationInterceptor(JwtTokenProvider tokenProvider) {
        this.tokenProvider = tokenProvider;
    }
    
    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }
        
        List<String> authHeaders = accessor.getNativeHeader("Authorization");
        if (authHeaders == null || authHeaders.isEmpty()) {
            log.debug("No Authorization header found in STOMP CONNECT frame");
            return message;
        }
        
        String authHeader = authHeaders.get(0);
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            log.debug("No Bearer token found in STOMP CONNECT headers");
            return message;
        }
        
        String token = authHeader.substring(7);
        if (!tokenProvider.isTokenValid(token)) {
            log.warn("Invalid JWT token in STOMP CONNECT frame");
            return message;
        }
        
        Claims claims = tokenProvider.validateToken(token);
        UserPrincipal principal = tokenProvider.toPrincipal(claims);
        Authentication authentication =
            new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities());
        accessor.setUser(authentication);
        
        log.debug("Authenticated WebSocket connection for user: {}", principal.getUserUid());
        return message;
    }
}
