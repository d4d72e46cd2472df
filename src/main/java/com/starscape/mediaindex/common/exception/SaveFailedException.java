package com.starscape.mediaindex.common.exception;

/**
 * A store write failed. The cause carries the underlying data access error.
 */
public class SaveFailedException extends RuntimeException {
    
    public SaveFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
