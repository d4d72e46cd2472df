package com.starscape.mediaindex.common.exception;

/**
 * Missing or insufficient credentials. Always reported as 401, never as not-found.
 */
public class UnauthorizedException extends RuntimeException {
    
    public UnauthorizedException(String message) {
        super(message);
    }
}
